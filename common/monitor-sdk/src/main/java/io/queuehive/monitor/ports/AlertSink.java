package io.queuehive.monitor.ports;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.AlertRule;

/**
 * Outbound notification channel for newly triggered alerts. Delivery is best-effort and must not
 * block the caller.
 */
public interface AlertSink {

  void deliver(AlertRule rule, AlertEvent alert);

  static AlertSink none() {
    return (rule, alert) -> { };
  }
}
