package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.AlertRule;
import io.queuehive.monitor.model.AlertSeverity;
import io.queuehive.monitor.model.MetricKey;
import io.queuehive.monitor.model.QueueMetrics;
import io.queuehive.monitor.model.Thresholds;
import io.queuehive.monitor.model.WorkerMetrics;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates alert rules against a queue's metrics and drives the alert lifecycle.
 * <p>
 * There is at most one active alert per (queue, metric). A breach opens an alert at the highest
 * severity crossed; a move between warning and critical updates that alert in place; the alert
 * only resolves once the value drops below the warning bound. Every method expects the caller to
 * hold the queue record's lock, which is also what serialises acknowledgements against a pass.
 */
public final class AlertEngine {

  private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

  private final HistoryStore history;
  private final boolean alertingEnabled;
  private final Supplier<String> idGenerator;
  private volatile List<AlertRule> rules;

  AlertEngine(List<AlertRule> rules, HistoryStore history, boolean alertingEnabled) {
    this(rules, history, alertingEnabled, () -> UUID.randomUUID().toString());
  }

  AlertEngine(List<AlertRule> rules, HistoryStore history, boolean alertingEnabled, Supplier<String> idGenerator) {
    this.rules = validate(rules);
    this.history = Objects.requireNonNull(history, "history");
    this.alertingEnabled = alertingEnabled;
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  /**
   * One rule per metric category, named after the metric and bounded by the configured thresholds.
   */
  public static List<AlertRule> defaultRules(Thresholds thresholds) {
    Objects.requireNonNull(thresholds, "thresholds");
    return List.of(
        new AlertRule("queue-depth", "Queue depth", MetricKey.QUEUE_DEPTH, thresholds.queueDepth(), true),
        new AlertRule("error-rate", "Error rate", MetricKey.ERROR_RATE, thresholds.errorRate(), true),
        new AlertRule("processing-time", "Processing time", MetricKey.PROCESSING_TIME,
            thresholds.processingTime(), true),
        new AlertRule("lag", "Queue lag", MetricKey.LAG, thresholds.lag(), true),
        new AlertRule("worker-utilization", "Worker utilization", MetricKey.WORKER_UTILIZATION,
            thresholds.workerUtilization(), true));
  }

  public List<AlertRule> rules() {
    return rules;
  }

  public boolean isAlertingEnabled() {
    return alertingEnabled;
  }

  synchronized boolean setRuleEnabled(String ruleId, boolean enabled) {
    List<AlertRule> updated = new ArrayList<>(rules.size());
    boolean found = false;
    for (AlertRule rule : rules) {
      if (rule.id().equals(ruleId)) {
        updated.add(rule.withEnabled(enabled));
        found = true;
      } else {
        updated.add(rule);
      }
    }
    if (found) {
      rules = List.copyOf(updated);
      log.info("Alert rule {} {}", ruleId, enabled ? "enabled" : "disabled");
    }
    return found;
  }

  Outcome evaluate(QueueRecord record, QueueMetrics metrics, WorkerMetrics workers, Instant now) {
    AlertBook book = record.alerts();
    if (!alertingEnabled) {
      return new Outcome(book.activeAlerts(), List.of());
    }
    List<AlertTransition> transitions = new ArrayList<>();
    for (AlertRule rule : rules) {
      double value = rule.metric().valueOf(metrics, workers);
      AlertTransition transition = applyRule(record.name(), book, rule, value, now,
          resolved -> history.recordResolved(record, resolved));
      if (transition != null) {
        transitions.add(transition);
      }
    }
    return new Outcome(book.activeAlerts(), List.copyOf(transitions));
  }

  /**
   * Mark an active or resolved alert as acknowledged. Repeated calls leave it unchanged.
   *
   * @return empty when no alert has that id
   */
  Optional<Acknowledgement> acknowledge(QueueRecord record, String alertId) {
    return acknowledge(record.alerts(), alertId);
  }

  static Optional<Acknowledgement> acknowledge(AlertBook book, String alertId) {
    Optional<AlertEvent> active = book.findActive(alertId);
    if (active.isPresent()) {
      AlertEvent acked = active.get().acknowledge();
      book.putActive(acked);
      return Optional.of(new Acknowledgement(acked, !active.get().acknowledged()));
    }
    Optional<AlertEvent> resolved = book.findResolved(alertId);
    if (resolved.isPresent()) {
      AlertEvent acked = resolved.get().acknowledge();
      book.replaceResolved(acked);
      return Optional.of(new Acknowledgement(acked, !resolved.get().acknowledged()));
    }
    return Optional.empty();
  }

  /**
   * Resolve an alert by hand. An alert that is already resolved is left as is.
   *
   * @return empty when no alert has that id
   */
  Optional<List<AlertTransition>> resolveManually(QueueRecord record, String alertId, Instant now) {
    AlertBook book = record.alerts();
    Optional<AlertEvent> active = book.findActive(alertId);
    if (active.isPresent()) {
      AlertRule rule = ruleFor(active.get().metric());
      return Optional.of(List.of(resolve(record, rule, active.get(), now)));
    }
    if (book.findResolved(alertId).isPresent()) {
      return Optional.of(List.of());
    }
    return Optional.empty();
  }

  /**
   * One lifecycle step of {@code rule} for the alerts in {@code book}, owned by {@code scope}
   * (a queue name, or the system scope).
   *
   * @param onResolved receives the alert once it has left the active set
   * @return the change to publish, or {@code null} when there is none
   */
  AlertTransition applyRule(String scope, AlertBook book, AlertRule rule, double rawValue, Instant now,
      Consumer<AlertEvent> onResolved) {
    AlertEvent active = book.active(rule.metric());
    double value = sanitize(rawValue);
    if (!rule.enabled()) {
      return active == null ? null : resolve(scope, book, rule, active.withCurrentValue(value), now, onResolved);
    }
    AlertSeverity severity = rule.threshold().severityFor(value);
    if (active == null) {
      if (severity == null) {
        return null;
      }
      AlertEvent created = new AlertEvent(idGenerator.get(), rule.id(), scope, rule.metric(), severity,
          value, value, rule.threshold().boundFor(severity), now, false, null);
      book.putActive(created);
      log.warn("Alert triggered [{}] queue={} metric={} value={} threshold={}",
          severity.wireName(), scope, rule.metric().key(), value, created.threshold());
      return AlertTransition.triggered(rule, created);
    }
    if (severity == null) {
      return resolve(scope, book, rule, active.withCurrentValue(value), now, onResolved);
    }
    if (severity != active.severity()) {
      AlertEvent changed = active.withSeverity(severity, value, rule.threshold().boundFor(severity));
      book.putActive(changed);
      log.warn("Alert {} severity {} -> {} queue={} metric={} value={}",
          active.id(), active.severity().wireName(), severity.wireName(), scope, rule.metric().key(), value);
      return AlertTransition.severityChanged(rule, active, changed);
    }
    book.putActive(active.withCurrentValue(value));
    return null;
  }

  private AlertTransition resolve(QueueRecord record, AlertRule rule, AlertEvent active, Instant now) {
    return resolve(record.name(), record.alerts(), rule, active, now,
        resolved -> history.recordResolved(record, resolved));
  }

  AlertTransition resolve(String scope, AlertBook book, AlertRule rule, AlertEvent active, Instant now,
      Consumer<AlertEvent> onResolved) {
    AlertEvent resolved = active.resolve(now);
    book.removeActive(active.metric());
    onResolved.accept(resolved);
    log.info("Alert resolved queue={} metric={} id={} value={}",
        scope, active.metric().key(), active.id(), active.currentValue());
    return AlertTransition.resolved(rule, resolved);
  }

  private AlertRule ruleFor(MetricKey metric) {
    for (AlertRule rule : rules) {
      if (rule.metric() == metric) {
        return rule;
      }
    }
    return null;
  }

  private static double sanitize(double value) {
    return Double.isFinite(value) ? value : 0d;
  }

  private static List<AlertRule> validate(List<AlertRule> rules) {
    Objects.requireNonNull(rules, "rules");
    Set<MetricKey> seen = EnumSet.noneOf(MetricKey.class);
    Set<String> ids = new HashSet<>();
    for (AlertRule rule : rules) {
      Objects.requireNonNull(rule, "rule");
      if (rule.metric().isSystemMetric()) {
        throw new IllegalArgumentException("Metric " + rule.metric().key() + " is not a queue metric");
      }
      if (!seen.add(rule.metric())) {
        throw new IllegalArgumentException("More than one alert rule for metric " + rule.metric().key());
      }
      if (!ids.add(rule.id())) {
        throw new IllegalArgumentException("Duplicate alert rule id " + rule.id());
      }
    }
    return List.copyOf(rules);
  }

  /**
   * Active alerts after evaluation plus the lifecycle changes to publish.
   */
  record Outcome(List<AlertEvent> active, List<AlertTransition> transitions) {
  }

  /**
   * @param firstTime false when the alert had already been acknowledged
   */
  record Acknowledgement(AlertEvent alert, boolean firstTime) {
  }
}
