package com.scholary.docjobs.llm;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the LLM provider.
 *
 * <p>Any OpenAI-compatible chat-completions endpoint works (OpenRouter, a local gateway, a mock).
 */
@ConfigurationProperties(prefix = "llm")
@Validated
public record LlmProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
