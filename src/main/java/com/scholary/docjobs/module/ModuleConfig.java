package com.scholary.docjobs.module;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Admin overrides of a module's model and prompt selection, stored as JSON maps. */
@Entity
@Table(name = "module_configs")
public class ModuleConfig {

  @Id
  @Column(name = "module_key", nullable = false, length = 64)
  private String moduleKey;

  @Column(name = "models_json", columnDefinition = "text")
  private String modelsJson;

  @Column(name = "prompts_json", columnDefinition = "text")
  private String promptsJson;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ModuleConfig() {}

  public ModuleConfig(String moduleKey) {
    this.moduleKey = moduleKey;
  }

  public String getModuleKey() {
    return moduleKey;
  }

  public String getModelsJson() {
    return modelsJson;
  }

  public void setModelsJson(String modelsJson) {
    this.modelsJson = modelsJson;
  }

  public String getPromptsJson() {
    return promptsJson;
  }

  public void setPromptsJson(String promptsJson) {
    this.promptsJson = promptsJson;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
