package io.queuehive.monitor.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.AlertRule;
import io.queuehive.monitor.model.AlertSeverity;
import io.queuehive.monitor.model.DerivedMetrics;
import io.queuehive.monitor.model.MetricKey;
import io.queuehive.monitor.model.QueueMetrics;
import io.queuehive.monitor.model.SampleMetrics;
import io.queuehive.monitor.model.Threshold;
import io.queuehive.monitor.model.Thresholds;
import io.queuehive.monitor.model.WorkerMetrics;
import io.queuehive.monitor.store.InMemoryStateStore;
import io.queuehive.monitor.testing.FakeQueue;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlertEngineTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private InMemoryStateStore store;
  private HistoryStore history;
  private QueueRecord record;
  private AlertEngine engine;

  @BeforeEach
  void setUp() {
    store = new InMemoryStateStore();
    history = new HistoryStore(store, new JsonCodec(), 100, 10);
    record = new QueueRecord("orders", new FakeQueue(), NOW, 100, 10);
    AtomicInteger ids = new AtomicInteger();
    engine = new AlertEngine(AlertEngine.defaultRules(Thresholds.defaults()), history, true,
        () -> "alert-" + ids.incrementAndGet());
  }

  private static QueueMetrics depth(long waiting) {
    return new QueueMetrics(new SampleMetrics(waiting, 0, 0, 0, 0, false, NOW), DerivedMetrics.ZERO);
  }

  private AlertEngine.Outcome evaluate(long waiting) {
    record.lock();
    try {
      return engine.evaluate(record, depth(waiting), WorkerMetrics.NONE, NOW);
    } finally {
      record.unlock();
    }
  }

  @Test
  void defaultRulesCoverEveryQueueMetric() {
    assertThat(engine.rules()).extracting(AlertRule::metric).containsExactlyInAnyOrder(
        MetricKey.QUEUE_DEPTH, MetricKey.ERROR_RATE, MetricKey.PROCESSING_TIME, MetricKey.LAG,
        MetricKey.WORKER_UTILIZATION);
    assertThat(engine.rules()).allMatch(AlertRule::enabled);
  }

  @Test
  void rejectsTwoRulesForTheSameMetric() {
    List<AlertRule> rules = List.of(
        new AlertRule("a", "A", MetricKey.LAG, new Threshold(1, 2), true),
        new AlertRule("b", "B", MetricKey.LAG, new Threshold(3, 4), true));

    assertThatThrownBy(() -> new AlertEngine(rules, history, true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("lag");
  }

  @Test
  void rejectsDuplicateRuleIds() {
    List<AlertRule> rules = List.of(
        new AlertRule("same", "A", MetricKey.LAG, new Threshold(1, 2), true),
        new AlertRule("same", "B", MetricKey.ERROR_RATE, new Threshold(3, 4), true));

    assertThatThrownBy(() -> new AlertEngine(rules, history, true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("same");
  }

  @Test
  void rejectsSystemMetricInQueueRules() {
    List<AlertRule> rules = List.of(
        new AlertRule("memory", "Memory", MetricKey.MEMORY_USAGE, new Threshold(80, 96), true));

    assertThatThrownBy(() -> new AlertEngine(rules, history, true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("memoryUsage");
  }

  @Test
  void valueAtWarningBoundOpensWarningAlert() {
    AlertEngine.Outcome outcome = evaluate(1000);

    assertThat(outcome.transitions()).singleElement().satisfies(transition -> {
      assertThat(transition.kind()).isEqualTo(AlertTransition.Kind.TRIGGERED);
      assertThat(transition.current().id()).isEqualTo("alert-1");
      assertThat(transition.current().severity()).isEqualTo(AlertSeverity.WARNING);
      assertThat(transition.current().threshold()).isEqualTo(1000d);
    });
    assertThat(outcome.active()).hasSize(1);
  }

  @Test
  void sameSeverityOnlyRefreshesCurrentValue() {
    evaluate(1200);
    AlertEngine.Outcome outcome = evaluate(1300);

    assertThat(outcome.transitions()).isEmpty();
    assertThat(outcome.active()).singleElement().satisfies(alert -> {
      assertThat(alert.triggeredValue()).isEqualTo(1200d);
      assertThat(alert.currentValue()).isEqualTo(1300d);
    });
  }

  @Test
  void resolutionIsPersistedToAlertLog() {
    evaluate(6000);
    AlertEngine.Outcome outcome = evaluate(10);

    assertThat(outcome.transitions()).singleElement()
        .satisfies(transition -> assertThat(transition.kind()).isEqualTo(AlertTransition.Kind.RESOLVED));
    assertThat(outcome.active()).isEmpty();
    assertThat(record.alerts().resolvedAlerts()).singleElement()
        .satisfies(alert -> assertThat(alert.resolvedAt()).isEqualTo(NOW));
    assertThat(store.range(StateKeys.resolvedAlerts("orders"), 10)).hasSize(1);
  }

  @Test
  void utilizationRuleReadsWorkerMetrics() {
    record.lock();
    try {
      AlertEngine.Outcome outcome = engine.evaluate(record, depth(0), WorkerMetrics.of(10, 9), NOW);

      assertThat(outcome.active()).singleElement().satisfies(alert -> {
        assertThat(alert.metric()).isEqualTo(MetricKey.WORKER_UTILIZATION);
        assertThat(alert.currentValue()).isEqualTo(90d);
      });
    } finally {
      record.unlock();
    }
  }

  @Test
  void disabledAlertingLeavesAlertsUntouched() {
    AlertEngine disabled = new AlertEngine(AlertEngine.defaultRules(Thresholds.defaults()), history, false);
    record.lock();
    try {
      AlertEngine.Outcome outcome = disabled.evaluate(record, depth(9000), WorkerMetrics.NONE, NOW);

      assertThat(outcome.transitions()).isEmpty();
      assertThat(outcome.active()).isEmpty();
    } finally {
      record.unlock();
    }
  }

  @Test
  void acknowledgeReportsFirstTimeOnce() {
    evaluate(6000);
    record.lock();
    try {
      assertThat(engine.acknowledge(record, "alert-1"))
          .hasValueSatisfying(ack -> assertThat(ack.firstTime()).isTrue());
      assertThat(engine.acknowledge(record, "alert-1"))
          .hasValueSatisfying(ack -> {
            assertThat(ack.firstTime()).isFalse();
            assertThat(ack.alert().acknowledged()).isTrue();
          });
      assertThat(engine.acknowledge(record, "alert-99")).isEmpty();
    } finally {
      record.unlock();
    }
  }

  @Test
  void ruleToggleIsVisibleInRules() {
    assertThat(engine.setRuleEnabled("lag", false)).isTrue();

    assertThat(engine.rules())
        .filteredOn(rule -> rule.metric() == MetricKey.LAG)
        .extracting(AlertRule::enabled)
        .containsExactly(false);
  }

  @Test
  void manualResolveOfUnknownAlertIsEmpty() {
    record.lock();
    try {
      assertThat(engine.resolveManually(record, "nope", NOW)).isEmpty();
    } finally {
      record.unlock();
    }
  }

  @Test
  void alertIsActiveUntilResolved() {
    evaluate(6000);
    AlertEvent active = record.alerts().activeAlerts().get(0);

    assertThat(active.isActive()).isTrue();
    assertThat(active.resolve(NOW).isActive()).isFalse();
    assertThat(active.resolve(NOW).resolve(NOW.plusSeconds(5)).resolvedAt()).isEqualTo(NOW);
  }
}
