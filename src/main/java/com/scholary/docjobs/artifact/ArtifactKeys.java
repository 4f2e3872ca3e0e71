package com.scholary.docjobs.artifact;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/** Naming of stored outputs: {@code <jobId>/<sanitized name>}. */
public final class ArtifactKeys {

  /** Longest stored name in UTF-8 bytes; file systems reject names over 255 bytes. */
  static final int MAX_NAME_BYTES = 200;

  private static final int MAX_EXTENSION_LENGTH = 16;

  private ArtifactKeys() {}

  public static String jobPrefix(UUID jobId) {
    return jobId + "/";
  }

  public static String key(UUID jobId, String name) {
    return jobPrefix(jobId) + sanitize(name);
  }

  /**
   * Keeps letters, digits, dot, dash and underscore; never yields an empty or dot-only name.
   * Names longer than {@link #MAX_NAME_BYTES} in UTF-8 are shortened, keeping the extension.
   */
  static String sanitize(String name) {
    if (name == null) {
      return "output";
    }
    StringBuilder safe = new StringBuilder(name.length());
    name.codePoints()
        .forEach(
            cp -> {
              if (Character.isLetterOrDigit(cp) || cp == '.' || cp == '-' || cp == '_') {
                safe.appendCodePoint(cp);
              } else {
                safe.append('_');
              }
            });
    String result = safe.toString();
    if (result.isEmpty() || result.chars().allMatch(c -> c == '.')) {
      return "output";
    }
    return truncate(result);
  }

  private static String truncate(String name) {
    if (utf8Length(name) <= MAX_NAME_BYTES) {
      return name;
    }
    String extension = "";
    int dot = name.lastIndexOf('.');
    if (dot > 0 && name.length() - dot <= MAX_EXTENSION_LENGTH) {
      extension = name.substring(dot);
    }
    int budget = MAX_NAME_BYTES - utf8Length(extension);
    StringBuilder stem = new StringBuilder();
    int used = 0;
    int i = 0;
    while (i < name.length() - extension.length()) {
      int cp = name.codePointAt(i);
      int bytes = utf8Length(new String(Character.toChars(cp)));
      if (used + bytes > budget) {
        break;
      }
      stem.appendCodePoint(cp);
      used += bytes;
      i += Character.charCount(cp);
    }
    return stem + extension;
  }

  private static int utf8Length(String value) {
    return value.getBytes(StandardCharsets.UTF_8).length;
  }
}
