package com.scholary.docjobs.module;

import com.scholary.docjobs.config.JobsProperties.ModuleOverrides;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The modules this instance serves, in registration order.
 *
 * <p>Built once at startup from an explicit processor list; policy overrides from configuration
 * are applied on top of each module's defaults.
 */
public class ModuleRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModuleRegistry.class);

  private final Map<String, ModuleDefinition> modules;

  public ModuleRegistry(
      List<? extends ModuleProcessor<?>> processors, Map<String, ModuleOverrides> overrides) {
    Map<String, ModuleDefinition> byKey = new LinkedHashMap<>();
    for (ModuleProcessor<?> processor : processors) {
      ModulePolicy policy = processor.defaultPolicy().withOverrides(overrides.get(processor.key()));
      if (byKey.putIfAbsent(processor.key(), new ModuleDefinition(processor, policy)) != null) {
        throw new IllegalStateException("Duplicate module key: " + processor.key());
      }
      LOGGER.info("Registered module: key={}, policy={}", processor.key(), policy);
    }
    for (String key : overrides.keySet()) {
      if (!byKey.containsKey(key)) {
        throw new IllegalStateException("Policy configured for unknown module: " + key);
      }
    }
    this.modules = byKey;
  }

  public Optional<ModuleDefinition> find(String key) {
    return Optional.ofNullable(modules.get(key));
  }

  public ModuleDefinition require(String key) {
    ModuleDefinition definition = modules.get(key);
    if (definition == null) {
      throw new UnknownModuleException(key);
    }
    return definition;
  }

  public List<ModuleDefinition> all() {
    return new ArrayList<>(modules.values());
  }
}
