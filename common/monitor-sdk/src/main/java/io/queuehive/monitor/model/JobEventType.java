package io.queuehive.monitor.model;

import java.util.Locale;

/**
 * Job lifecycle events forwarded from a monitored queue.
 */
public enum JobEventType {
  WAITING,
  ACTIVE,
  COMPLETED,
  FAILED,
  STALLED,
  PROGRESS;

  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
