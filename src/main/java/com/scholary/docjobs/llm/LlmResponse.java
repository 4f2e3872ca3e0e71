package com.scholary.docjobs.llm;

/**
 * Response from an LLM provider.
 *
 * <p>{@code raw} is the provider's body as received; the engine never interprets it beyond token
 * accounting.
 */
public record LlmResponse(String text, long tokensUsed, String raw) {}
