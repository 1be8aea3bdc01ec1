package io.queuehive.monitor.model;

import java.util.Objects;

/**
 * Threshold rule evaluated for every monitored queue. Only {@code enabled} changes at runtime.
 */
public record AlertRule(String id, String name, MetricKey metric, Threshold threshold, boolean enabled) {

  public AlertRule {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(threshold, "threshold");
  }

  public AlertRule withEnabled(boolean value) {
    return value == enabled ? this : new AlertRule(id, name, metric, threshold, value);
  }
}
