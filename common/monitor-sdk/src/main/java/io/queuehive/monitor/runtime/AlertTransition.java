package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.AlertRule;

/**
 * A change in an alert's lifecycle produced while holding a queue's lock and published after it
 * is released.
 */
record AlertTransition(Kind kind, AlertRule rule, AlertEvent previous, AlertEvent current) {

  enum Kind {
    TRIGGERED,
    SEVERITY_CHANGED,
    RESOLVED
  }

  static AlertTransition triggered(AlertRule rule, AlertEvent alert) {
    return new AlertTransition(Kind.TRIGGERED, rule, null, alert);
  }

  static AlertTransition severityChanged(AlertRule rule, AlertEvent previous, AlertEvent current) {
    return new AlertTransition(Kind.SEVERITY_CHANGED, rule, previous, current);
  }

  static AlertTransition resolved(AlertRule rule, AlertEvent alert) {
    return new AlertTransition(Kind.RESOLVED, rule, null, alert);
  }
}
