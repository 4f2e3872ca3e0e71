package com.scholary.docjobs.llm;

/**
 * Thrown when a response cannot be used: malformed provider JSON, an empty completion, or model
 * output that does not match the shape a module asked for.
 */
public class LlmParseException extends LlmException {

  public LlmParseException(String message) {
    super(message);
  }

  public LlmParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
