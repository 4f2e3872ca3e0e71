package com.scholary.docjobs.llm;

/** Thrown when the provider could not be reached or answered with a non-2xx status. */
public class LlmProviderException extends LlmException {

  private final int statusCode;

  public LlmProviderException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public LlmProviderException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /** HTTP status of the failed call, or -1 for transport failures. */
  public int getStatusCode() {
    return statusCode;
  }
}
