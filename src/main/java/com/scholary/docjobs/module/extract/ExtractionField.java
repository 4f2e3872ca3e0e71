package com.scholary.docjobs.module.extract;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * A column to extract.
 *
 * <p>A field needs a description, examples or allowed values; examples and allowed values are
 * mutually exclusive.
 */
public record ExtractionField(
    @NotBlank String name,
    String description,
    List<String> examples,
    List<String> allowedValues) {

  public ExtractionField {
    name = name == null ? null : name.trim();
    description = description == null || description.isBlank() ? null : description.trim();
    examples = clean(examples);
    allowedValues = clean(allowedValues);
  }

  private static List<String> clean(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream()
        .filter(v -> v != null && !v.isBlank())
        .map(String::trim)
        .toList();
  }
}
