package io.queuehive.monitor.runtime;

import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Measures job processing time from the active/completed event pair. Durations observed since the
 * last tick are drained into that tick's history row.
 */
final class JobTimings {

  static final int MAX_IN_FLIGHT = 10_000;

  private final ConcurrentMap<String, Long> startedAt = new ConcurrentHashMap<>();
  private long totalMillis;
  private long count;

  void started(String jobId, long nowMillis) {
    if (jobId == null || startedAt.size() >= MAX_IN_FLIGHT) {
      return;
    }
    startedAt.put(jobId, nowMillis);
  }

  void completed(String jobId, long nowMillis) {
    if (jobId == null) {
      return;
    }
    Long start = startedAt.remove(jobId);
    if (start == null) {
      return;
    }
    long duration = Math.max(0L, nowMillis - start);
    synchronized (this) {
      totalMillis += duration;
      count++;
    }
  }

  void abandoned(String jobId) {
    if (jobId != null) {
      startedAt.remove(jobId);
    }
  }

  synchronized OptionalDouble drainAverage() {
    if (count == 0) {
      return OptionalDouble.empty();
    }
    double average = (double) totalMillis / count;
    totalMillis = 0L;
    count = 0L;
    return OptionalDouble.of(average);
  }

  void clear() {
    startedAt.clear();
    synchronized (this) {
      totalMillis = 0L;
      count = 0L;
    }
  }
}
