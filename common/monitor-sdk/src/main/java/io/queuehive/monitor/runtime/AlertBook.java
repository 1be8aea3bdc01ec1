package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.MetricKey;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Optional;

/**
 * Active alerts (one per metric) and the bounded most-recent-first log of resolved alerts for a
 * single queue. Guarded by the owning {@link QueueRecord}'s lock.
 */
final class AlertBook {

  private final int maxResolved;
  private final Map<MetricKey, AlertEvent> active = new EnumMap<>(MetricKey.class);
  private final ArrayDeque<AlertEvent> resolved = new ArrayDeque<>();

  AlertBook(int maxResolved) {
    this.maxResolved = Math.max(1, maxResolved);
  }

  AlertEvent active(MetricKey metric) {
    return active.get(metric);
  }

  void putActive(AlertEvent alert) {
    active.put(alert.metric(), alert);
  }

  void removeActive(MetricKey metric) {
    active.remove(metric);
  }

  List<AlertEvent> activeAlerts() {
    return List.copyOf(active.values());
  }

  void addResolved(AlertEvent alert) {
    resolved.addFirst(alert);
    while (resolved.size() > maxResolved) {
      resolved.removeLast();
    }
  }

  List<AlertEvent> resolvedAlerts() {
    return List.copyOf(resolved);
  }

  Optional<AlertEvent> findActive(String alertId) {
    return active.values().stream().filter(alert -> alert.id().equals(alertId)).findFirst();
  }

  Optional<AlertEvent> findResolved(String alertId) {
    return resolved.stream().filter(alert -> alert.id().equals(alertId)).findFirst();
  }

  void replaceResolved(AlertEvent updated) {
    List<AlertEvent> copy = new ArrayList<>(resolved);
    ListIterator<AlertEvent> iterator = copy.listIterator();
    while (iterator.hasNext()) {
      if (iterator.next().id().equals(updated.id())) {
        iterator.set(updated);
      }
    }
    resolved.clear();
    resolved.addAll(copy);
  }

  /**
   * @return number of resolved alerts kept
   */
  int removeResolvedOlderThan(Instant cutoff) {
    Iterator<AlertEvent> iterator = resolved.iterator();
    while (iterator.hasNext()) {
      AlertEvent alert = iterator.next();
      Instant resolvedAt = alert.resolvedAt() != null ? alert.resolvedAt() : alert.timestamp();
      if (!resolvedAt.isAfter(cutoff)) {
        iterator.remove();
      }
    }
    return resolved.size();
  }

  void loadResolved(List<AlertEvent> newestFirst) {
    resolved.clear();
    for (AlertEvent alert : newestFirst) {
      if (resolved.size() >= maxResolved) {
        break;
      }
      resolved.addLast(alert);
    }
  }

  void clear() {
    active.clear();
    resolved.clear();
  }
}
