package io.queuehive.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Health of a monitored queue, ordered by severity: {@code CRITICAL > WARNING > HEALTHY > UNKNOWN}.
 */
public enum HealthStatus {
  UNKNOWN(0),
  HEALTHY(1),
  WARNING(2),
  CRITICAL(3);

  private final int code;

  HealthStatus(int code) {
    this.code = code;
  }

  /**
   * Numeric encoding exported as the {@code queuehive_queue_health_status} gauge.
   */
  public int code() {
    return code;
  }

  public boolean isWorseThan(HealthStatus other) {
    return other == null || code > other.code;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static HealthStatus fromWireName(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    return HealthStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
