package com.scholary.docjobs.config;

import com.scholary.docjobs.llm.LlmProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LLM client.
 *
 * <p>Enables the LlmProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmConfig {}
