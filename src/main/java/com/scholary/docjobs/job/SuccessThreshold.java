package com.scholary.docjobs.job;

import java.util.Locale;

/**
 * Minimum share of a round's items that must succeed for the round to count as successful.
 *
 * <p>Textual forms: {@code all}, {@code none}, an integer minimum count ({@code 4}) or a percentage
 * ({@code 75%}). A minimum count larger than the number of items is capped at the item count.
 */
public record SuccessThreshold(Kind kind, int value) {

  public enum Kind {
    ALL,
    NONE,
    AT_LEAST,
    PERCENTAGE
  }

  public SuccessThreshold {
    if (kind == Kind.AT_LEAST && value < 0) {
      throw new IllegalArgumentException("Minimum success count must be >= 0: " + value);
    }
    if (kind == Kind.PERCENTAGE && (value < 0 || value > 100)) {
      throw new IllegalArgumentException("Percentage must be within 0..100: " + value);
    }
  }

  public static SuccessThreshold all() {
    return new SuccessThreshold(Kind.ALL, 0);
  }

  public static SuccessThreshold none() {
    return new SuccessThreshold(Kind.NONE, 0);
  }

  public static SuccessThreshold atLeast(int count) {
    return new SuccessThreshold(Kind.AT_LEAST, count);
  }

  public static SuccessThreshold percentage(int percent) {
    return new SuccessThreshold(Kind.PERCENTAGE, percent);
  }

  public static SuccessThreshold parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Success threshold must not be blank");
    }
    String t = text.trim().toLowerCase(Locale.ROOT);
    if (t.equals("all")) {
      return all();
    }
    if (t.equals("none")) {
      return none();
    }
    try {
      if (t.endsWith("%")) {
        return percentage(Integer.parseInt(t.substring(0, t.length() - 1).trim()));
      }
      return atLeast(Integer.parseInt(t));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid success threshold: " + text, e);
    }
  }

  /** Whether {@code succeeded} out of {@code total} items satisfies this threshold. */
  public boolean isMet(int succeeded, int total) {
    switch (kind) {
      case ALL:
        return succeeded >= total;
      case NONE:
        return true;
      case AT_LEAST:
        return succeeded >= Math.min(value, total);
      case PERCENTAGE:
        return (long) succeeded * 100 >= (long) value * total;
      default:
        throw new IllegalStateException("Unknown threshold kind: " + kind);
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case ALL:
        return "all";
      case NONE:
        return "none";
      case PERCENTAGE:
        return value + "%";
      default:
        return String.valueOf(value);
    }
  }
}
