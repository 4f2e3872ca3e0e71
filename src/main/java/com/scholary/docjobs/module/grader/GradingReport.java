package com.scholary.docjobs.module.grader;

import java.util.List;

/**
 * Aggregate grading result.
 *
 * @param iqmScore interquartile mean of the weighted run scores
 * @param perLevel mean of each level over the runs kept by the interquartile mean
 * @param attempts LLM calls made across all runs
 */
public record GradingReport(
    double iqmScore,
    List<Double> perLevel,
    int validRuns,
    int keptRuns,
    int attempts,
    String justification,
    String decisionReason) {}
