package com.scholary.docjobs.module.grader;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Score aggregation for grading runs. */
public final class GradingMath {

  public static final int LEVELS = 6;

  private static final double[] WEIGHTS = {4, 2, 1, 1, 1, 1};

  private GradingMath() {}

  /** Clamps every level into [0, 100]; non-finite values become 0. */
  public static double[] normalize(double[] levels) {
    double[] normalized = new double[levels.length];
    for (int i = 0; i < levels.length; i++) {
      double value = levels[i];
      if (!Double.isFinite(value) || value < 0) {
        normalized[i] = 0;
      } else {
        normalized[i] = Math.min(value, 100);
      }
    }
    return normalized;
  }

  /** True if no level is lower than the more prestigious level before it. */
  public static boolean isNonDecreasing(double[] levels) {
    for (int i = 1; i < levels.length; i++) {
      if (levels[i - 1] > levels[i] + Math.ulp(1.0)) {
        return false;
      }
    }
    return true;
  }

  public static double weightedMean(double[] levels) {
    double numerator = 0;
    double denominator = 0;
    for (int i = 0; i < LEVELS; i++) {
      numerator += levels[i] * WEIGHTS[i];
      denominator += WEIGHTS[i];
    }
    return numerator / denominator;
  }

  /**
   * Mean of the middle values.
   *
   * <p>With {@code n} values, {@code k = (n + 3) / 4} values are dropped from each end when {@code
   * n > 2k}; otherwise all values are kept.
   *
   * @return the mean and the indices (into {@code values}) of the values it was taken over, in
   *     ascending order of value
   */
  public static Iqm interquartileMean(List<Double> values) {
    if (values.isEmpty()) {
      return new Iqm(0, List.of());
    }
    List<Integer> sorted =
        IntStream.range(0, values.size())
            .boxed()
            .sorted(Comparator.comparingDouble(values::get))
            .collect(Collectors.toCollection(ArrayList::new));
    int n = values.size();
    int k = (n + 3) / 4;
    List<Integer> kept = n > 2 * k ? sorted.subList(k, n - k) : sorted;
    double sum = 0;
    for (int index : kept) {
      sum += values.get(index);
    }
    return new Iqm(sum / kept.size(), kept);
  }

  public record Iqm(double mean, List<Integer> keptIndices) {

    public Iqm {
      keptIndices = List.copyOf(keptIndices);
    }
  }
}
