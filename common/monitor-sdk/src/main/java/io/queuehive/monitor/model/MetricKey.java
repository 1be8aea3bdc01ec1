package io.queuehive.monitor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Metric categories that carry thresholds. Queue metrics resolve their current value from a tick's
 * metrics and worker snapshot; system metrics from the monitor's own {@link SystemMetrics}.
 */
public enum MetricKey {
  QUEUE_DEPTH("queueDepth"),
  ERROR_RATE("errorRate"),
  PROCESSING_TIME("processingTime"),
  LAG("lag"),
  WORKER_UTILIZATION("workerUtilization"),
  MEMORY_USAGE("memoryUsage"),
  STORE_LATENCY("storeLatency");

  private final String key;

  MetricKey(String key) {
    this.key = key;
  }

  @JsonValue
  public String key() {
    return key;
  }

  public double valueOf(QueueMetrics metrics, WorkerMetrics workers) {
    SampleMetrics sample = metrics == null ? null : metrics.sample();
    DerivedMetrics derived = metrics == null ? DerivedMetrics.ZERO : metrics.derived();
    return switch (this) {
      case QUEUE_DEPTH -> sample == null ? 0d : sample.waiting();
      case ERROR_RATE -> derived.errorRatePct();
      case PROCESSING_TIME -> derived.averageProcessingTimeMs();
      case LAG -> derived.lagMs();
      case WORKER_UTILIZATION -> workers == null ? 0d : workers.utilizationPct();
      case MEMORY_USAGE, STORE_LATENCY -> 0d;
    };
  }

  public double valueOf(SystemMetrics system) {
    if (system == null) {
      return 0d;
    }
    return switch (this) {
      case MEMORY_USAGE -> system.memoryUsagePct();
      case STORE_LATENCY -> system.storeLatencyMs();
      default -> 0d;
    };
  }

  public boolean isSystemMetric() {
    return this == MEMORY_USAGE || this == STORE_LATENCY;
  }

  @JsonCreator
  public static MetricKey fromKey(String key) {
    for (MetricKey metric : values()) {
      if (metric.key.equals(key) || metric.name().equalsIgnoreCase(key)) {
        return metric;
      }
    }
    throw new IllegalArgumentException("Unknown metric key: " + key);
  }
}
