package io.queuehive.monitor.ports;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.GlobalSummary;
import io.queuehive.monitor.model.JobEventType;

/**
 * Domain events published by the monitor. All methods default to no-ops so listeners implement
 * only what they need. Callbacks run on monitor threads and must return quickly.
 */
public interface MonitorEventListener {

  default void onJobEvent(String queueName, JobEventType type, String jobId) {
  }

  default void onAlertTriggered(AlertEvent alert) {
  }

  default void onAlertSeverityChanged(AlertEvent previous, AlertEvent current) {
  }

  default void onAlertResolved(AlertEvent alert) {
  }

  default void onAlertAcknowledged(AlertEvent alert) {
  }

  default void onPassCompleted(GlobalSummary summary) {
  }
}
