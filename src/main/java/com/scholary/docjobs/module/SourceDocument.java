package com.scholary.docjobs.module;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** An uploaded document after text extraction. */
public record SourceDocument(@NotBlank @Size(max = 255) String filename, @NotBlank String text) {

  /** File name without directory and extension, safe for output names. */
  public String stem() {
    String name = filename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    if (dot > 0) {
      name = name.substring(0, dot);
    }
    return name.isBlank() ? "document" : name;
  }
}
