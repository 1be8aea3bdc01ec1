package io.queuehive.monitor.model;

/**
 * Worker population serving a queue, as reported by the worker registry.
 */
public record WorkerMetrics(int total, int active, int idle, double utilizationPct) {

  public static final WorkerMetrics NONE = new WorkerMetrics(0, 0, 0, 0d);

  public static WorkerMetrics of(int total, int active) {
    int safeTotal = Math.max(0, total);
    int safeActive = Math.max(0, Math.min(active, safeTotal));
    double utilization = safeTotal > 0 ? (safeActive * 100.0) / safeTotal : 0d;
    return new WorkerMetrics(safeTotal, safeActive, safeTotal - safeActive, utilization);
  }
}
