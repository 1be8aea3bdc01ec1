package io.queuehive.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AlertSeverity {
  WARNING,
  CRITICAL;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static AlertSeverity fromWireName(String value) {
    return AlertSeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
