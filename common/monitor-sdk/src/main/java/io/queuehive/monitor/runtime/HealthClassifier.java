package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.DerivedMetrics;
import io.queuehive.monitor.model.HealthStatus;
import io.queuehive.monitor.model.SampleMetrics;
import io.queuehive.monitor.model.Threshold;
import io.queuehive.monitor.model.Thresholds;
import io.queuehive.monitor.model.WorkerMetrics;
import java.util.Objects;

/**
 * Maps one tick's metrics onto a {@link HealthStatus}. Stateless; the same inputs always yield
 * the same status.
 */
public final class HealthClassifier {

  public HealthStatus classify(SampleMetrics sample,
                               DerivedMetrics derived,
                               WorkerMetrics workers,
                               Thresholds thresholds) {
    Objects.requireNonNull(thresholds, "thresholds");
    if (sample != null && sample.paused()) {
      // paused queues are reported as warning even when a metric is past its critical bound
      return HealthStatus.WARNING;
    }
    DerivedMetrics d = derived == null ? DerivedMetrics.ZERO : derived;
    double depth = sample == null ? 0d : sample.waiting();
    double utilization = workers == null ? 0d : workers.utilizationPct();

    if (depth >= thresholds.queueDepth().critical()
        || d.errorRatePct() >= thresholds.errorRate().critical()
        || d.averageProcessingTimeMs() >= thresholds.processingTime().critical()
        || d.lagMs() >= thresholds.lag().critical()
        || utilization >= thresholds.workerUtilization().critical()) {
      return HealthStatus.CRITICAL;
    }
    if (breachesWarning(thresholds.queueDepth(), depth)
        || breachesWarning(thresholds.errorRate(), d.errorRatePct())
        || breachesWarning(thresholds.processingTime(), d.averageProcessingTimeMs())
        || breachesWarning(thresholds.lag(), d.lagMs())
        || breachesWarning(thresholds.workerUtilization(), utilization)) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.HEALTHY;
  }

  private static boolean breachesWarning(Threshold threshold, double value) {
    return value >= threshold.warning();
  }
}
