package com.scholary.docjobs.module.grader;

/** One valid grading answer: six normalized level scores and the model's optional remark. */
public record GradingRun(double[] levels, String justification) {}
