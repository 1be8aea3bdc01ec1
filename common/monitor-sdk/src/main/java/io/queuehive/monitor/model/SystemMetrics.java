package io.queuehive.monitor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Health of the monitor process itself, sampled once per pass.
 *
 * @param heapUsedBytes       JVM heap in use
 * @param heapMaxBytes        heap limit, or the committed heap when the JVM reports no limit
 * @param memoryUsagePct      heap in use as a share of the limit, in percent
 * @param nonHeapUsedBytes    metaspace, code cache and other non-heap pools in use
 * @param availableProcessors processors visible to the JVM
 * @param uptimeMs            JVM uptime
 * @param storeReachable      false when the state store ping failed
 * @param storeLatencyMs      round trip of the state store ping, failed pings included
 */
public record SystemMetrics(
    long heapUsedBytes,
    long heapMaxBytes,
    double memoryUsagePct,
    long nonHeapUsedBytes,
    int availableProcessors,
    long uptimeMs,
    boolean storeReachable,
    double storeLatencyMs,
    Instant timestamp) {

  public SystemMetrics {
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Placeholder served before the first sample.
   */
  public static SystemMetrics unknown(Instant at) {
    return new SystemMetrics(0, 0, 0d, 0, 0, 0, false, 0d, at);
  }
}
