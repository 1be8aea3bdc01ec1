package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.QueueMetrics;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Most-recent-first bounded log of history rows for one queue. Not thread-safe; guarded by the
 * owning {@link QueueRecord}'s lock.
 */
final class SampleHistory {

  private final int maxSamples;
  private final ArrayDeque<QueueMetrics> rows = new ArrayDeque<>();

  SampleHistory(int maxSamples) {
    this.maxSamples = Math.max(1, maxSamples);
  }

  void add(QueueMetrics row) {
    rows.addFirst(row);
    while (rows.size() > maxSamples) {
      rows.removeLast();
    }
  }

  List<QueueMetrics> recent(int limit) {
    if (limit <= 0 || rows.isEmpty()) {
      return List.of();
    }
    List<QueueMetrics> result = new ArrayList<>(Math.min(limit, rows.size()));
    Iterator<QueueMetrics> iterator = rows.iterator();
    while (iterator.hasNext() && result.size() < limit) {
      result.add(iterator.next());
    }
    return result;
  }

  List<QueueMetrics> since(Instant cutoff) {
    List<QueueMetrics> result = new ArrayList<>();
    for (QueueMetrics row : rows) {
      if (!row.timestamp().isAfter(cutoff)) {
        break;
      }
      result.add(row);
    }
    return result;
  }

  /**
   * Drop rows at or before {@code cutoff}.
   *
   * @return number of rows kept
   */
  int removeOlderThan(Instant cutoff) {
    while (!rows.isEmpty() && !rows.peekLast().timestamp().isAfter(cutoff)) {
      rows.removeLast();
    }
    return rows.size();
  }

  /**
   * Replace the content with rows loaded from the state store (most-recent-first).
   */
  void load(List<QueueMetrics> newestFirst) {
    rows.clear();
    for (QueueMetrics row : newestFirst) {
      if (rows.size() >= maxSamples) {
        break;
      }
      rows.addLast(row);
    }
  }

  int size() {
    return rows.size();
  }

  void clear() {
    rows.clear();
  }
}
