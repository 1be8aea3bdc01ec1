package io.queuehive.monitor.ports;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.GlobalSummary;
import io.queuehive.monitor.model.JobEventType;
import io.queuehive.monitor.model.QueueHealth;
import io.queuehive.monitor.model.SystemMetrics;
import java.time.Duration;

/**
 * Metrics sink mirroring the monitor's state. Implementations own their meter registry.
 */
public interface MonitorMetrics {

  void queueUpdated(QueueHealth health);

  void queueRemoved(String queueName);

  void jobEvent(String queueName, JobEventType type);

  void alertTriggered(AlertEvent alert);

  void alertResolved(AlertEvent alert);

  void passCompleted(Duration duration, GlobalSummary summary);

  void passFailed();

  void systemUpdated(SystemMetrics system);

  static MonitorMetrics noop() {
    return new MonitorMetrics() {
      @Override
      public void queueUpdated(QueueHealth health) {
      }

      @Override
      public void queueRemoved(String queueName) {
      }

      @Override
      public void jobEvent(String queueName, JobEventType type) {
      }

      @Override
      public void alertTriggered(AlertEvent alert) {
      }

      @Override
      public void alertResolved(AlertEvent alert) {
      }

      @Override
      public void passCompleted(Duration duration, GlobalSummary summary) {
      }

      @Override
      public void passFailed() {
      }

      @Override
      public void systemUpdated(SystemMetrics system) {
      }
    };
  }
}
