package io.queuehive.monitor.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import io.queuehive.monitor.model.DerivedMetrics;
import io.queuehive.monitor.model.HealthStatus;
import io.queuehive.monitor.model.SampleMetrics;
import io.queuehive.monitor.model.Thresholds;
import io.queuehive.monitor.model.WorkerMetrics;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class HealthClassifierTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final HealthClassifier classifier = new HealthClassifier();
  private final Thresholds thresholds = Thresholds.defaults();

  private static SampleMetrics waiting(long waiting) {
    return new SampleMetrics(waiting, 0, 0, 0, 0, false, NOW);
  }

  private static DerivedMetrics derived(double avgMs, double errorPct, double lagMs) {
    return new DerivedMetrics(0d, avgMs, errorPct, 0d, lagMs);
  }

  @Test
  void quietQueueIsHealthy() {
    assertThat(classifier.classify(waiting(10), DerivedMetrics.ZERO, WorkerMetrics.of(4, 1), thresholds))
        .isEqualTo(HealthStatus.HEALTHY);
  }

  @Test
  void boundsAreInclusive() {
    assertThat(classifier.classify(waiting(1000), DerivedMetrics.ZERO, WorkerMetrics.NONE, thresholds))
        .isEqualTo(HealthStatus.WARNING);
    assertThat(classifier.classify(waiting(999), DerivedMetrics.ZERO, WorkerMetrics.NONE, thresholds))
        .isEqualTo(HealthStatus.HEALTHY);
    assertThat(classifier.classify(waiting(5000), DerivedMetrics.ZERO, WorkerMetrics.NONE, thresholds))
        .isEqualTo(HealthStatus.CRITICAL);
  }

  @Test
  void anySingleCriticalBreachWins() {
    assertThat(classifier.classify(waiting(1500), derived(0, 12, 0), WorkerMetrics.NONE, thresholds))
        .isEqualTo(HealthStatus.CRITICAL);
    assertThat(classifier.classify(waiting(0), derived(60_000, 0, 0), WorkerMetrics.NONE, thresholds))
        .isEqualTo(HealthStatus.CRITICAL);
    assertThat(classifier.classify(waiting(0), derived(0, 0, 300_000), WorkerMetrics.NONE, thresholds))
        .isEqualTo(HealthStatus.CRITICAL);
    assertThat(classifier.classify(waiting(0), DerivedMetrics.ZERO, WorkerMetrics.of(20, 19), thresholds))
        .isEqualTo(HealthStatus.CRITICAL);
  }

  @Test
  void warningBreachesOnDerivedMetrics() {
    assertThat(classifier.classify(waiting(0), derived(0, 5, 0), WorkerMetrics.NONE, thresholds))
        .isEqualTo(HealthStatus.WARNING);
    assertThat(classifier.classify(waiting(0), derived(0, 0, 60_000), WorkerMetrics.NONE, thresholds))
        .isEqualTo(HealthStatus.WARNING);
    assertThat(classifier.classify(waiting(0), DerivedMetrics.ZERO, WorkerMetrics.of(10, 8), thresholds))
        .isEqualTo(HealthStatus.WARNING);
  }

  @Test
  void pausedQueueIsWarningEvenWhenCritical() {
    SampleMetrics paused = new SampleMetrics(10_000, 0, 0, 0, 0, true, NOW);

    assertThat(classifier.classify(paused, DerivedMetrics.ZERO, WorkerMetrics.NONE, thresholds))
        .isEqualTo(HealthStatus.WARNING);
  }

  @Test
  void missingInputsCountAsZero() {
    assertThat(classifier.classify(null, null, null, thresholds)).isEqualTo(HealthStatus.HEALTHY);
  }
}
