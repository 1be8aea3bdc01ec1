package io.queuehive.monitor.model;

import java.util.Objects;

/**
 * @param memoryUsage  heap usage, in percent
 * @param storeLatency state store round trip, in milliseconds
 */
public record SystemThresholds(Threshold memoryUsage, Threshold storeLatency) {

  public SystemThresholds {
    Objects.requireNonNull(memoryUsage, "memoryUsage");
    Objects.requireNonNull(storeLatency, "storeLatency");
  }

  /**
   * Memory goes critical at 1.2 times its warning bound.
   */
  public static SystemThresholds defaults() {
    return new SystemThresholds(new Threshold(80, 96), new Threshold(100, 500));
  }
}
