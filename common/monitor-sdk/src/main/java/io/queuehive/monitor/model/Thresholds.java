package io.queuehive.monitor.model;

import java.util.Objects;

/**
 * Thresholds for every metric the classifier and alert engine look at.
 *
 * @param queueDepth        waiting jobs
 * @param errorRate         failed share of finished jobs, in percent
 * @param processingTime    average processing time, in milliseconds
 * @param lag               estimated wait for a newly enqueued job, in milliseconds
 * @param workerUtilization busy share of workers, in percent
 */
public record Thresholds(
    Threshold queueDepth,
    Threshold errorRate,
    Threshold processingTime,
    Threshold lag,
    Threshold workerUtilization) {

  public Thresholds {
    Objects.requireNonNull(queueDepth, "queueDepth");
    Objects.requireNonNull(errorRate, "errorRate");
    Objects.requireNonNull(processingTime, "processingTime");
    Objects.requireNonNull(lag, "lag");
    Objects.requireNonNull(workerUtilization, "workerUtilization");
  }

  public static Thresholds defaults() {
    return new Thresholds(
        new Threshold(1_000, 5_000),
        new Threshold(5, 10),
        new Threshold(30_000, 60_000),
        new Threshold(60_000, 300_000),
        new Threshold(80, 95));
  }

  public Threshold forMetric(MetricKey metric) {
    return switch (Objects.requireNonNull(metric, "metric")) {
      case QUEUE_DEPTH -> queueDepth;
      case ERROR_RATE -> errorRate;
      case PROCESSING_TIME -> processingTime;
      case LAG -> lag;
      case WORKER_UTILIZATION -> workerUtilization;
      case MEMORY_USAGE, STORE_LATENCY ->
          throw new IllegalArgumentException("Metric " + metric.key() + " is not a queue metric");
    };
  }
}
