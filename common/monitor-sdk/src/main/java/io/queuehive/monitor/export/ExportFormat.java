package io.queuehive.monitor.export;

import java.util.Locale;

public enum ExportFormat {
  JSON("application/json"),
  CSV("text/csv");

  private final String contentType;

  ExportFormat(String contentType) {
    this.contentType = contentType;
  }

  public String contentType() {
    return contentType;
  }

  /**
   * Case-insensitive lookup; blank means {@link #JSON}.
   */
  public static ExportFormat fromName(String name) {
    if (name == null || name.isBlank()) {
      return JSON;
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported export format '" + name + "' (expected json or csv)", ex);
    }
  }
}
