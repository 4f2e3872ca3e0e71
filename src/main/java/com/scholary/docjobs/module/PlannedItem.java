package com.scholary.docjobs.module;

import com.scholary.docjobs.llm.LlmParseException;
import com.scholary.docjobs.llm.LlmRequest;
import com.scholary.docjobs.llm.LlmResponse;

/**
 * One item a processor wants run: the request to send and how to read the answer.
 *
 * @param units billable units charged when the item succeeds
 * @param outputName file name under which the item's output is stored
 */
public record PlannedItem(
    String label,
    LlmRequest request,
    long units,
    String outputName,
    String contentType,
    ResponseInterpreter interpreter) {

  /** Labels are stored in a 255 character column. */
  public static final int MAX_LABEL_LENGTH = 255;

  public PlannedItem {
    label = abbreviate(label);
  }

  static String abbreviate(String label) {
    if (label == null || label.length() <= MAX_LABEL_LENGTH) {
      return label;
    }
    int end = MAX_LABEL_LENGTH - 3;
    if (Character.isHighSurrogate(label.charAt(end - 1))) {
      end--;
    }
    return label.substring(0, end) + "...";
  }

  /** Turns a provider response into the item's output text. */
  @FunctionalInterface
  public interface ResponseInterpreter {
    String interpret(LlmResponse response) throws LlmParseException;
  }

  /** Accepts any non-blank completion as plain text. */
  public static final ResponseInterpreter PLAIN_TEXT =
      response -> {
        String text = response.text() == null ? "" : response.text().trim();
        if (text.isEmpty()) {
          throw new LlmParseException("Model returned an empty response");
        }
        return text;
      };

  public static PlannedItem text(
      String label, LlmRequest request, long units, String outputName) {
    return new PlannedItem(
        label, request, units, outputName, "text/plain; charset=utf-8", PLAIN_TEXT);
  }
}
