package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.AlertRule;
import io.queuehive.monitor.model.MetricKey;
import io.queuehive.monitor.model.SystemMetrics;
import io.queuehive.monitor.model.SystemThresholds;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Latest {@link SystemMetrics} of the monitor process and the alerts raised on them. System
 * alerts carry {@link #SCOPE} as their queue name and live only in memory.
 */
final class SystemMonitor {

  static final String SCOPE = "system";

  private static final Logger log = LoggerFactory.getLogger(SystemMonitor.class);

  private final SystemSampler sampler;
  private final AlertEngine alerts;
  private final AlertBook book;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile List<AlertRule> rules;
  private volatile SystemMetrics latest;

  SystemMonitor(SystemSampler sampler, AlertEngine alerts, List<AlertRule> rules, int maxResolvedAlerts,
                Instant startedAt) {
    this.sampler = Objects.requireNonNull(sampler, "sampler");
    this.alerts = Objects.requireNonNull(alerts, "alerts");
    this.rules = validate(rules);
    this.book = new AlertBook(maxResolvedAlerts);
    this.latest = SystemMetrics.unknown(startedAt);
  }

  static List<AlertRule> defaultRules(SystemThresholds thresholds) {
    Objects.requireNonNull(thresholds, "thresholds");
    return List.of(
        new AlertRule("memory-usage", "Memory usage", MetricKey.MEMORY_USAGE, thresholds.memoryUsage(), true),
        new AlertRule("store-latency", "State store latency", MetricKey.STORE_LATENCY, thresholds.storeLatency(),
            true));
  }

  /**
   * Take a sample and evaluate the system rules against it.
   *
   * @return alert changes to publish
   */
  List<AlertTransition> sample() {
    SystemMetrics current = sampler.sample();
    List<AlertTransition> transitions = new ArrayList<>();
    lock.lock();
    try {
      latest = current;
      if (alerts.isAlertingEnabled()) {
        for (AlertRule rule : rules) {
          AlertTransition transition = alerts.applyRule(SCOPE, book, rule, rule.metric().valueOf(current),
              current.timestamp(), book::addResolved);
          if (transition != null) {
            transitions.add(transition);
          }
        }
      }
    } finally {
      lock.unlock();
    }
    if (log.isDebugEnabled()) {
      log.debug("System sample: heap {}% store reachable={} latency={}ms",
          Math.round(current.memoryUsagePct()), current.storeReachable(), current.storeLatencyMs());
    }
    return transitions;
  }

  SystemMetrics latest() {
    return latest;
  }

  List<AlertRule> rules() {
    return rules;
  }

  List<AlertEvent> activeAlerts() {
    lock.lock();
    try {
      return book.activeAlerts();
    } finally {
      lock.unlock();
    }
  }

  List<AlertEvent> resolvedAlerts() {
    lock.lock();
    try {
      return book.resolvedAlerts();
    } finally {
      lock.unlock();
    }
  }

  Optional<AlertEngine.Acknowledgement> acknowledge(String alertId) {
    lock.lock();
    try {
      return AlertEngine.acknowledge(book, alertId);
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return false when no system rule has that id
   */
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
      log.info("System alert rule {} {}", ruleId, enabled ? "enabled" : "disabled");
    }
    return found;
  }

  /**
   * @return number of resolved system alerts dropped
   */
  int sweep(Instant alertsCutoff) {
    lock.lock();
    try {
      int before = book.resolvedAlerts().size();
      return before - book.removeResolvedOlderThan(alertsCutoff);
    } finally {
      lock.unlock();
    }
  }

  private static List<AlertRule> validate(List<AlertRule> rules) {
    Objects.requireNonNull(rules, "rules");
    for (AlertRule rule : rules) {
      if (!rule.metric().isSystemMetric()) {
        throw new IllegalArgumentException("Metric " + rule.metric().key() + " is not a system metric");
      }
    }
    return List.copyOf(rules);
  }
}
