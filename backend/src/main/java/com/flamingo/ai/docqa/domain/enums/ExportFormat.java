package com.flamingo.ai.docqa.domain.enums;

import java.util.Locale;

/** Serialization formats supported for conversation export. */
public enum ExportFormat {
  JSON("application/json", "json"),
  TEXT("text/plain", "txt"),
  MARKDOWN("text/markdown", "md");

  private final String contentType;
  private final String fileExtension;

  ExportFormat(String contentType, String fileExtension) {
    this.contentType = contentType;
    this.fileExtension = fileExtension;
  }

  public String getContentType() {
    return contentType;
  }

  public String getFileExtension() {
    return fileExtension;
  }

  /** Parses a user supplied format name such as {@code "json"} or {@code "md"}. */
  public static ExportFormat fromName(String name) {
    if (name == null || name.isBlank()) {
      return JSON;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (ExportFormat format : values()) {
      if (format.name().toLowerCase(Locale.ROOT).equals(normalized)
          || format.fileExtension.equals(normalized)
          || ("plain".equals(normalized) && format == TEXT)) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unsupported export format: " + name);
  }
}
