package com.scholary.docjobs.llm;

/**
 * Base class for failures of a single LLM call.
 *
 * <p>Both subclasses are considered transient by the worker's retry policy.
 */
public abstract class LlmException extends RuntimeException {

  protected LlmException(String message) {
    super(message);
  }

  protected LlmException(String message, Throwable cause) {
    super(message, cause);
  }
}
