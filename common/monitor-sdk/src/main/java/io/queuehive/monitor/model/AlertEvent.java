package io.queuehive.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Objects;

/**
 * A threshold breach for one (queue, metric) pair. Copies are swapped in under the owning
 * queue's lock; {@code resolvedAt} is set exactly once.
 */
public record AlertEvent(
    String id,
    String ruleId,
    String queueName,
    MetricKey metric,
    AlertSeverity severity,
    double triggeredValue,
    double currentValue,
    double threshold,
    Instant timestamp,
    boolean acknowledged,
    Instant resolvedAt) {

  public AlertEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ruleId, "ruleId");
    Objects.requireNonNull(queueName, "queueName");
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  @JsonIgnore
  public boolean isActive() {
    return resolvedAt == null;
  }

  public AlertEvent withSeverity(AlertSeverity newSeverity, double value, double newThreshold) {
    return new AlertEvent(id, ruleId, queueName, metric, newSeverity, value, value, newThreshold,
        timestamp, acknowledged, resolvedAt);
  }

  public AlertEvent withCurrentValue(double value) {
    return new AlertEvent(id, ruleId, queueName, metric, severity, triggeredValue, value, threshold,
        timestamp, acknowledged, resolvedAt);
  }

  public AlertEvent acknowledge() {
    if (acknowledged) {
      return this;
    }
    return new AlertEvent(id, ruleId, queueName, metric, severity, triggeredValue, currentValue,
        threshold, timestamp, true, resolvedAt);
  }

  public AlertEvent resolve(Instant at) {
    if (resolvedAt != null) {
      return this;
    }
    return new AlertEvent(id, ruleId, queueName, metric, severity, triggeredValue, currentValue,
        threshold, timestamp, acknowledged, Objects.requireNonNull(at, "at"));
  }
}
