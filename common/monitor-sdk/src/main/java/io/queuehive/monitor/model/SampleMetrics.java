package io.queuehive.monitor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Raw counts read from a queue in one sampling tick.
 */
public record SampleMetrics(
    long waiting,
    long active,
    long completed,
    long failed,
    long delayed,
    boolean paused,
    Instant timestamp) {

  public SampleMetrics {
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public static SampleMetrics empty(Instant timestamp) {
    return new SampleMetrics(0L, 0L, 0L, 0L, 0L, false, timestamp);
  }

  public long totalJobs() {
    return waiting + active + completed + failed + delayed;
  }
}
