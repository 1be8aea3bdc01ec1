package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.GlobalSummary;
import io.queuehive.monitor.model.JobEventType;
import io.queuehive.monitor.ports.AlertSink;
import io.queuehive.monitor.ports.MonitorEventListener;
import io.queuehive.monitor.ports.MonitorMetrics;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans monitor events out to listeners, the metrics sink and the alert sink. A failing listener
 * is logged and skipped.
 */
final class EventDispatcher {

  private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

  private final List<MonitorEventListener> listeners = new CopyOnWriteArrayList<>();
  private final MonitorMetrics metrics;
  private final AlertSink alertSink;

  EventDispatcher(MonitorMetrics metrics, AlertSink alertSink) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.alertSink = Objects.requireNonNull(alertSink, "alertSink");
  }

  void addListener(MonitorEventListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  void removeListener(MonitorEventListener listener) {
    listeners.remove(listener);
  }

  void jobEvent(String queueName, JobEventType type, String jobId) {
    metrics.jobEvent(queueName, type);
    notifyListeners(listener -> listener.onJobEvent(queueName, type, jobId));
  }

  void alertTransitions(List<AlertTransition> transitions) {
    for (AlertTransition transition : transitions) {
      AlertEvent current = transition.current();
      switch (transition.kind()) {
        case TRIGGERED -> {
          metrics.alertTriggered(current);
          notifyListeners(listener -> listener.onAlertTriggered(current));
          if (transition.rule() != null) {
            deliver(transition);
          }
        }
        case SEVERITY_CHANGED ->
            notifyListeners(listener -> listener.onAlertSeverityChanged(transition.previous(), current));
        case RESOLVED -> {
          metrics.alertResolved(current);
          notifyListeners(listener -> listener.onAlertResolved(current));
        }
      }
    }
  }

  void alertAcknowledged(AlertEvent alert) {
    notifyListeners(listener -> listener.onAlertAcknowledged(alert));
  }

  void passCompleted(GlobalSummary summary) {
    notifyListeners(listener -> listener.onPassCompleted(summary));
  }

  private void deliver(AlertTransition transition) {
    try {
      alertSink.deliver(transition.rule(), transition.current());
    } catch (RuntimeException ex) {
      log.warn("Alert sink rejected alert {} for queue {}: {}",
          transition.current().id(), transition.current().queueName(), ex.getMessage());
    }
  }

  private void notifyListeners(Consumer<MonitorEventListener> action) {
    for (MonitorEventListener listener : listeners) {
      try {
        action.accept(listener);
      } catch (RuntimeException ex) {
        log.warn("Monitor event listener {} failed", listener.getClass().getName(), ex);
      }
    }
  }
}
