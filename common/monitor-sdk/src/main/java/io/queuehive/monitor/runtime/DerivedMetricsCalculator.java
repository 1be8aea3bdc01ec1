package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.DerivedMetrics;
import io.queuehive.monitor.model.QueueMetrics;
import io.queuehive.monitor.model.SampleMetrics;
import java.time.Duration;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Computes {@link DerivedMetrics} for the current sample from the preceding history rows
 * (most-recent-first). Completed and failed counts are treated as cumulative counters; the window
 * spans from the oldest previous row to the current sample.
 */
final class DerivedMetricsCalculator {

  private DerivedMetricsCalculator() {
  }

  static DerivedMetrics derive(SampleMetrics current, List<QueueMetrics> previous, OptionalDouble observedProcessingMs) {
    if (current == null || previous == null || previous.isEmpty()) {
      return DerivedMetrics.ZERO;
    }
    SampleMetrics oldest = previous.get(previous.size() - 1).sample();
    double windowSeconds = Duration.between(oldest.timestamp(), current.timestamp()).toMillis() / 1000.0;

    long completedInWindow = Math.max(0L, current.completed() - oldest.completed());
    long failedInWindow = Math.max(0L, current.failed() - oldest.failed());
    long totalInWindow = completedInWindow + failedInWindow;

    double throughputPerSec = windowSeconds > 0 ? completedInWindow / windowSeconds : 0d;
    double processingRatePerMin = throughputPerSec * 60.0;
    double errorRatePct = totalInWindow > 0 ? (failedInWindow * 100.0) / totalInWindow : 0d;
    double averageProcessingTimeMs = smoothedProcessingTime(previous, observedProcessingMs);
    double lagMs = current.active() > 0
        ? ((double) current.waiting() / current.active()) * averageProcessingTimeMs
        : 0d;

    return new DerivedMetrics(
        finite(processingRatePerMin),
        finite(averageProcessingTimeMs),
        finite(errorRatePct),
        finite(throughputPerSec),
        finite(lagMs));
  }

  private static double smoothedProcessingTime(List<QueueMetrics> previous, OptionalDouble observed) {
    double total = 0d;
    int count = 0;
    for (QueueMetrics row : previous) {
      double value = row.derived().averageProcessingTimeMs();
      if (value > 0 && Double.isFinite(value)) {
        total += value;
        count++;
      }
    }
    if (observed != null && observed.isPresent() && observed.getAsDouble() > 0) {
      total += observed.getAsDouble();
      count++;
    }
    return count == 0 ? 0d : total / count;
  }

  private static double finite(double value) {
    return Double.isFinite(value) ? value : 0d;
  }
}
