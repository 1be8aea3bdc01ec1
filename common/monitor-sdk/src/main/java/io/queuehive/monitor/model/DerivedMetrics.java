package io.queuehive.monitor.model;

/**
 * Rate, latency and error figures computed from a rolling window of samples.
 */
public record DerivedMetrics(
    double processingRatePerMin,
    double averageProcessingTimeMs,
    double errorRatePct,
    double throughputPerSec,
    double lagMs) {

  public static final DerivedMetrics ZERO = new DerivedMetrics(0d, 0d, 0d, 0d, 0d);
}
