package com.scholary.docjobs.job;

/** Helpers for error text stored on jobs and items. */
public final class ErrorMessages {

  public static final int MAX_LENGTH = 2000;

  private ErrorMessages() {}

  /** Trims to the column limit; null stays null. */
  public static String trim(String message) {
    if (message == null) {
      return null;
    }
    String m = message.trim();
    if (m.length() <= MAX_LENGTH) {
      return m;
    }
    return m.substring(0, MAX_LENGTH - 3) + "...";
  }

  /** Message of the throwable, falling back to its class name when it has none. */
  public static String describe(Throwable error) {
    if (error == null) {
      return "Unknown error";
    }
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    return message;
  }
}
