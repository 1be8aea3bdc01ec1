package io.queuehive.monitor.model;

import java.time.Instant;

/**
 * Fleet-wide view folded from every queue's current health. Recomputed wholesale after each pass.
 */
public record GlobalSummary(
    int totalQueues,
    long totalJobs,
    long totalWorkers,
    double globalThroughput,
    double globalErrorRate,
    double averageQueueDepth,
    int healthyQueues,
    int unhealthyQueues,
    Instant generatedAt) {

  public static GlobalSummary empty(Instant at) {
    return new GlobalSummary(0, 0L, 0L, 0d, 0d, 0d, 0, 0, at);
  }
}
