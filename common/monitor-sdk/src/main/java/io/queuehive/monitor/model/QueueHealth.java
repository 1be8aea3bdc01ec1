package io.queuehive.monitor.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Current health of one monitored queue. Instances are immutable and replaced wholesale on
 * every successful tick.
 */
public record QueueHealth(
    String queueName,
    HealthStatus status,
    QueueMetrics metrics,
    WorkerMetrics workers,
    Instant lastUpdated,
    List<AlertEvent> activeAlerts) {

  public QueueHealth {
    Objects.requireNonNull(queueName, "queueName");
    status = status == null ? HealthStatus.UNKNOWN : status;
    Objects.requireNonNull(lastUpdated, "lastUpdated");
    metrics = metrics == null ? QueueMetrics.empty(lastUpdated) : metrics;
    workers = workers == null ? WorkerMetrics.NONE : workers;
    activeAlerts = activeAlerts == null ? List.of() : List.copyOf(activeAlerts);
  }

  public static QueueHealth unknown(String queueName, Instant registeredAt) {
    return new QueueHealth(queueName, HealthStatus.UNKNOWN, QueueMetrics.empty(registeredAt),
        WorkerMetrics.NONE, registeredAt, List.of());
  }

  public QueueHealth withActiveAlerts(List<AlertEvent> alerts) {
    return new QueueHealth(queueName, status, metrics, workers, lastUpdated, alerts);
  }
}
