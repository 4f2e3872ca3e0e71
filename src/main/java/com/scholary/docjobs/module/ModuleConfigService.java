package com.scholary.docjobs.module;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Effective model and prompt selection per module: the module defaults with the admin overrides
 * from {@code module_configs} merged on top. Read when a job starts, cached briefly.
 */
@Service
public class ModuleConfigService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModuleConfigService.class);
  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

  private final ModuleConfigRepository repository;
  private final ModuleRegistry registry;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Cache<String, ModuleSettings> cache;

  public ModuleConfigService(
      ModuleConfigRepository repository,
      ModuleRegistry registry,
      ObjectMapper objectMapper,
      Clock clock) {
    this.repository = repository;
    this.registry = registry;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder().maximumSize(64).expireAfterWrite(Duration.ofMinutes(5)).build();
  }

  public ModuleSettings settingsFor(String moduleKey) {
    return cache.get(moduleKey, this::load);
  }

  /** Replaces the stored overrides of a module. Null maps clear that part. */
  @Transactional
  public ModuleSettings updateOverrides(
      String moduleKey, Map<String, String> models, Map<String, String> prompts) {
    registry.require(moduleKey);
    ModuleConfig config =
        repository.findById(moduleKey).orElseGet(() -> new ModuleConfig(moduleKey));
    config.setModelsJson(write(models));
    config.setPromptsJson(write(prompts));
    config.setUpdatedAt(clock.instant());
    repository.save(config);
    cache.invalidate(moduleKey);
    LOGGER.info("Updated module configuration: module={}", moduleKey);
    return settingsFor(moduleKey);
  }

  private ModuleSettings load(String moduleKey) {
    ModuleSettings defaults = registry.require(moduleKey).processor().defaultSettings();
    return repository
        .findById(moduleKey)
        .map(
            config ->
                defaults.withOverrides(
                    read(config.getModelsJson()), read(config.getPromptsJson())))
        .orElse(defaults);
  }

  private Map<String, String> read(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, STRING_MAP);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored module configuration is not a JSON object", e);
    }
  }

  private String write(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(values);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize module configuration", e);
    }
  }
}
