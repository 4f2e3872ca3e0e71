package com.scholary.docjobs.module;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model and prompt selection of a module, keyed by role (e.g. {@code summary}, {@code
 * translation}).
 *
 * <p>Admin overrides are merged on top of the module defaults key by key.
 */
public record ModuleSettings(Map<String, String> models, Map<String, String> prompts) {

  public ModuleSettings {
    models = models == null ? Map.of() : Map.copyOf(models);
    prompts = prompts == null ? Map.of() : Map.copyOf(prompts);
  }

  public String model(String role) {
    String model = models.get(role);
    if (model == null || model.isBlank()) {
      throw new IllegalStateException("No model configured for role: " + role);
    }
    return model;
  }

  /** A comma separated model list, e.g. one model per review slot. */
  public List<String> modelList(String role) {
    return Arrays.stream(model(role).split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  public String prompt(String name) {
    String prompt = prompts.get(name);
    if (prompt == null) {
      throw new IllegalStateException("No prompt configured: " + name);
    }
    return prompt;
  }

  public ModuleSettings withOverrides(
      Map<String, String> modelOverrides, Map<String, String> promptOverrides) {
    Map<String, String> mergedModels = new LinkedHashMap<>(models);
    if (modelOverrides != null) {
      modelOverrides.forEach(
          (role, model) -> {
            if (model != null && !model.isBlank()) {
              mergedModels.put(role, model.trim());
            }
          });
    }
    Map<String, String> mergedPrompts = new LinkedHashMap<>(prompts);
    if (promptOverrides != null) {
      promptOverrides.forEach(
          (name, prompt) -> {
            if (prompt != null && !prompt.isBlank()) {
              mergedPrompts.put(name, prompt);
            }
          });
    }
    return new ModuleSettings(mergedModels, mergedPrompts);
  }
}
