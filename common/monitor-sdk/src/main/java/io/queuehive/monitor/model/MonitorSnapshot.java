package io.queuehive.monitor.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time view of everything the monitor exposes: per-queue health, the fleet summary,
 * configured rules, active alerts, capacity insights and the monitor's own system metrics.
 */
public record MonitorSnapshot(
    Instant generatedAt,
    boolean running,
    Map<String, QueueHealth> queues,
    GlobalSummary summary,
    List<AlertRule> rules,
    List<AlertEvent> activeAlerts,
    List<TrendInsight> insights,
    SystemMetrics system) {

  public MonitorSnapshot {
    queues = queues == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(queues));
    rules = rules == null ? List.of() : List.copyOf(rules);
    activeAlerts = activeAlerts == null ? List.of() : List.copyOf(activeAlerts);
    insights = insights == null ? List.of() : List.copyOf(insights);
    system = system == null ? SystemMetrics.unknown(generatedAt) : system;
  }
}
