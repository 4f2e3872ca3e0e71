package com.scholary.docjobs.llm;

/**
 * The single outbound capability of the job engine: send one chat request to an LLM provider.
 *
 * <p>Implementations do not retry. Retrying is owned by the worker so every module shares one
 * bounded policy.
 */
public interface LlmService {

  /**
   * Execute a chat request.
   *
   * @param request the model, messages and attachments to send
   * @return the response text with token accounting
   * @throws LlmProviderException on transport failure or a non-2xx answer
   * @throws LlmParseException if the provider answered with something we cannot read
   */
  LlmResponse execute(LlmRequest request);
}
