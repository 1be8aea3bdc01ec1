package io.queuehive.monitor.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.queuehive.monitor.export.ExportFormat;
import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.AlertRule;
import io.queuehive.monitor.model.AlertSeverity;
import io.queuehive.monitor.model.GlobalSummary;
import io.queuehive.monitor.model.HealthStatus;
import io.queuehive.monitor.model.JobEventType;
import io.queuehive.monitor.model.MetricKey;
import io.queuehive.monitor.model.QueueHealth;
import io.queuehive.monitor.model.QueueMetrics;
import io.queuehive.monitor.model.SystemThresholds;
import io.queuehive.monitor.model.Threshold;
import io.queuehive.monitor.ports.AlertSink;
import io.queuehive.monitor.ports.MonitorEventListener;
import io.queuehive.monitor.ports.MonitorMetrics;
import io.queuehive.monitor.ports.WorkerRegistry;
import io.queuehive.monitor.store.InMemoryStateStore;
import io.queuehive.monitor.testing.FakeQueue;
import io.queuehive.monitor.testing.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueueMonitorTest {

  private static final Duration TICK = Duration.ofSeconds(30);
  private static final SystemThresholds QUIET_SYSTEM =
      new SystemThresholds(new Threshold(1_000, 1_000), new Threshold(600_000, 600_000));

  private MutableClock clock;
  private InMemoryStateStore store;
  private AlertSink sink;
  private RecordingListener events;
  private QueueMonitor monitor;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-05-01T10:00:00Z");
    store = new InMemoryStateStore(clock);
    sink = mock(AlertSink.class);
    events = new RecordingListener();
    monitor = newMonitor(MonitorSettings.builder().fetchTimeout(Duration.ofSeconds(2)).build());
  }

  @AfterEach
  void tearDown() {
    monitor.stop();
  }

  private QueueMonitor newMonitor(MonitorSettings settings) {
    return newMonitor(settings, MonitorMetrics.noop());
  }

  private QueueMonitor newMonitor(MonitorSettings settings, MonitorMetrics metrics) {
    if (settings.systemThresholds().equals(SystemThresholds.defaults())) {
      // the test JVM's own heap and store timings stay out of alert assertions
      settings = settings.toBuilder().systemThresholds(QUIET_SYSTEM).build();
    }
    QueueMonitor created = new QueueMonitor(settings, WorkerRegistry.none(), store, sink, metrics, clock);
    created.addListener(events);
    return created;
  }

  private void tick() {
    clock.advance(TICK);
    monitor.collectNow();
  }

  @Test
  void newQueueIsUnknownUntilFirstPass() {
    monitor.addQueue("orders", new FakeQueue().counts(10, 2, 100, 0));

    assertThat(monitor.health("orders")).map(QueueHealth::status).contains(HealthStatus.UNKNOWN);

    tick();

    QueueHealth health = monitor.health("orders").orElseThrow();
    assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
    assertThat(health.metrics().sample().waiting()).isEqualTo(10);
    assertThat(health.lastUpdated()).isEqualTo(clock.now());
  }

  @Test
  void depthBreachRaisesCriticalAlertAndRecoveryResolvesIt() {
    FakeQueue queue = new FakeQueue().waiting(6000);
    monitor.addQueue("orders", queue);

    tick();

    QueueHealth critical = monitor.health("orders").orElseThrow();
    assertThat(critical.status()).isEqualTo(HealthStatus.CRITICAL);
    assertThat(critical.activeAlerts()).singleElement().satisfies(alert -> {
      assertThat(alert.metric()).isEqualTo(MetricKey.QUEUE_DEPTH);
      assertThat(alert.severity()).isEqualTo(AlertSeverity.CRITICAL);
      assertThat(alert.triggeredValue()).isEqualTo(6000d);
      assertThat(alert.threshold()).isEqualTo(5000d);
    });
    assertThat(events.triggered).hasSize(1);
    verify(sink).deliver(argThat((AlertRule rule) -> rule.id().equals("queue-depth")),
        argThat((AlertEvent alert) -> alert.queueName().equals("orders")));

    queue.waiting(400);
    tick();

    assertThat(monitor.health("orders")).map(QueueHealth::status).contains(HealthStatus.HEALTHY);
    assertThat(monitor.activeAlerts("orders")).hasValueSatisfying(active -> assertThat(active).isEmpty());
    assertThat(monitor.resolvedAlerts("orders")).hasValueSatisfying(resolved -> {
      assertThat(resolved).singleElement().satisfies(alert -> {
        assertThat(alert.resolvedAt()).isEqualTo(clock.now());
        assertThat(alert.currentValue()).isEqualTo(400d);
      });
    });
    assertThat(events.resolved).hasSize(1);
    verify(sink, times(1)).deliver(any(), any());
  }

  @Test
  void severityMovesInPlaceWithoutNewAlerts() {
    FakeQueue queue = new FakeQueue().waiting(1500);
    monitor.addQueue("orders", queue);

    tick();
    AlertEvent first = monitor.activeAlerts("orders").orElseThrow().get(0);
    assertThat(first.severity()).isEqualTo(AlertSeverity.WARNING);

    queue.waiting(6000);
    tick();
    AlertEvent escalated = monitor.activeAlerts("orders").orElseThrow().get(0);
    assertThat(escalated.id()).isEqualTo(first.id());
    assertThat(escalated.severity()).isEqualTo(AlertSeverity.CRITICAL);
    assertThat(escalated.threshold()).isEqualTo(5000d);

    queue.waiting(1200);
    tick();
    AlertEvent deescalated = monitor.activeAlerts("orders").orElseThrow().get(0);
    assertThat(deescalated.id()).isEqualTo(first.id());
    assertThat(deescalated.severity()).isEqualTo(AlertSeverity.WARNING);

    queue.waiting(100);
    tick();

    assertThat(monitor.activeAlerts("orders").orElseThrow()).isEmpty();
    assertThat(events.triggered).hasSize(1);
    assertThat(events.severityChanges).hasSize(2);
    assertThat(events.resolved).hasSize(1);
  }

  @Test
  void errorRateAlertIsUpgradedInPlaceAndResolvedOnce() {
    FakeQueue queue = new FakeQueue().counts(0, 0, 0, 0);
    monitor.addQueue("orders", queue);
    tick();

    queue.counts(0, 0, 92, 8);
    tick();
    List<AlertEvent> warning = monitor.activeAlerts("orders").orElseThrow();
    assertThat(warning).singleElement().satisfies(alert -> {
      assertThat(alert.metric()).isEqualTo(MetricKey.ERROR_RATE);
      assertThat(alert.severity()).isEqualTo(AlertSeverity.WARNING);
    });
    String alertId = warning.get(0).id();

    queue.counts(0, 0, 150, 50);
    tick();
    assertThat(monitor.activeAlerts("orders").orElseThrow()).singleElement().satisfies(alert -> {
      assertThat(alert.id()).isEqualTo(alertId);
      assertThat(alert.severity()).isEqualTo(AlertSeverity.CRITICAL);
      assertThat(alert.currentValue()).isEqualTo(25d);
    });

    queue.counts(0, 0, 1950, 50);
    tick();
    assertThat(monitor.activeAlerts("orders").orElseThrow()).isEmpty();
    assertThat(events.triggered).extracting(AlertEvent::id).containsExactly(alertId);
    assertThat(events.resolved).extracting(AlertEvent::id).containsExactly(alertId);
    assertThat(monitor.resolvedAlerts("orders").orElseThrow()).singleElement()
        .satisfies(alert -> assertThat(alert.metric()).isEqualTo(MetricKey.ERROR_RATE));
  }

  @Test
  void failingCommitDoesNotSwallowAlertsOfOtherQueues() {
    MonitorMetrics metrics = mock(MonitorMetrics.class);
    doThrow(new IllegalStateException("gauge registration failed"))
        .when(metrics).queueUpdated(argThat(health -> health != null && health.queueName().equals("broken")));
    monitor.stop();
    monitor = newMonitor(MonitorSettings.builder().fetchTimeout(Duration.ofSeconds(2)).build(), metrics);
    monitor.addQueue("broken", new FakeQueue().waiting(1));
    monitor.addQueue("orders", new FakeQueue().waiting(6000));

    tick();
    tick();

    assertThat(monitor.activeAlerts("orders").orElseThrow()).hasSize(1);
    assertThat(events.triggered).singleElement()
        .satisfies(alert -> assertThat(alert.queueName()).isEqualTo("orders"));
    verify(sink, times(1)).deliver(any(), argThat((AlertEvent alert) -> alert.queueName().equals("orders")));
    assertThat(monitor.health("orders")).map(QueueHealth::status).contains(HealthStatus.CRITICAL);
    assertThat(events.passes).hasSize(2);
    verify(metrics, never()).passFailed();
  }

  @Test
  void failedPassIsCountedAndNextPassStillCommits() {
    MonitorMetrics metrics = mock(MonitorMetrics.class);
    doThrow(new IllegalStateException("timer closed"))
        .doNothing()
        .when(metrics).passCompleted(any(), any());
    monitor.stop();
    monitor = newMonitor(MonitorSettings.builder().fetchTimeout(Duration.ofSeconds(2)).build(), metrics);
    FakeQueue queue = new FakeQueue().waiting(10);
    monitor.addQueue("orders", queue);

    tick();
    verify(metrics, times(1)).passFailed();
    assertThat(events.passes).isEmpty();

    queue.waiting(20);
    tick();

    verify(metrics, times(1)).passFailed();
    assertThat(events.passes).hasSize(1);
    assertThat(monitor.health("orders")).map(health -> health.metrics().sample().waiting()).contains(20L);
  }

  @Test
  void scheduledPassesContinueAfterAFailure() {
    MonitorMetrics metrics = mock(MonitorMetrics.class);
    doThrow(new IllegalStateException("timer closed"))
        .doNothing()
        .when(metrics).passCompleted(any(), any());
    monitor.stop();
    monitor = newMonitor(MonitorSettings.builder()
        .metricsInterval(Duration.ofMillis(50))
        .fetchTimeout(Duration.ofSeconds(2))
        .build(), metrics);

    monitor.start();

    verify(metrics, timeout(5_000)).passFailed();
    verify(metrics, timeout(5_000).atLeast(3)).passCompleted(any(), any());
    assertThat(monitor.isRunning()).isTrue();
  }

  @Test
  void fetchFailureKeepsPreviousHealth() {
    FakeQueue queue = new FakeQueue().counts(5, 1, 10, 0);
    monitor.addQueue("orders", queue);
    tick();
    QueueHealth before = monitor.health("orders").orElseThrow();

    queue.failWith(new IOException("connection reset"));
    tick();

    assertThat(monitor.health("orders")).contains(before);
    assertThat(monitor.recentSamples("orders", 10)).hasSize(1);
  }

  @Test
  void failingQueueDoesNotAffectOthers() {
    monitor.addQueue("broken", new FakeQueue().failWith(new IOException("down")));
    monitor.addQueue("orders", new FakeQueue().counts(5, 1, 10, 0));

    tick();

    assertThat(monitor.health("broken")).map(QueueHealth::status).contains(HealthStatus.UNKNOWN);
    assertThat(monitor.health("orders")).map(QueueHealth::status).contains(HealthStatus.HEALTHY);
  }

  @Test
  void slowFetchTimesOutWithoutHoldingUpOtherQueues() {
    monitor.stop();
    monitor = newMonitor(MonitorSettings.builder().fetchTimeout(Duration.ofMillis(200)).build());
    FakeQueue slow = new FakeQueue().waiting(6000).hold();
    monitor.addQueue("slow", slow);
    monitor.addQueue("orders", new FakeQueue().waiting(1));

    tick();
    slow.release();

    assertThat(monitor.health("slow")).map(QueueHealth::status).contains(HealthStatus.UNKNOWN);
    assertThat(monitor.health("orders")).map(QueueHealth::status).contains(HealthStatus.HEALTHY);
    assertThat(events.triggered).isEmpty();
  }

  @Test
  void removingQueueDuringPassDiscardsItsResult() throws Exception {
    FakeQueue queue = new FakeQueue().waiting(6000).hold();
    monitor.addQueue("orders", queue);
    clock.advance(TICK);

    CompletableFuture<GlobalSummary> pass = CompletableFuture.supplyAsync(monitor::collectNow);
    assertThat(queue.awaitFetchStarted(5, TimeUnit.SECONDS)).isTrue();
    assertThat(monitor.removeQueue("orders")).isTrue();
    queue.release();
    GlobalSummary summary = pass.get(5, TimeUnit.SECONDS);

    assertThat(monitor.health("orders")).isEmpty();
    assertThat(monitor.recentSamples("orders", 10)).isEmpty();
    assertThat(monitor.activeAlerts("orders")).isEmpty();
    assertThat(store.range(StateKeys.history("orders"), 10)).isEmpty();
    assertThat(summary.totalQueues()).isZero();
    assertThat(events.triggered).isEmpty();
    assertThat(queue.isSubscribed()).isFalse();
  }

  @Test
  void removeUnknownQueueReturnsFalse() {
    assertThat(monitor.removeQueue("missing")).isFalse();
    assertThat(monitor.recentSamples("missing", 5)).isEmpty();
    assertThat(monitor.acknowledgeAlert("missing", "a1")).isFalse();
  }

  @Test
  void reAddingQueueStartsFromCleanState() {
    FakeQueue original = new FakeQueue().waiting(6000);
    monitor.addQueue("orders", original);
    tick();
    assertThat(monitor.recentSamples("orders", 10)).hasSize(1);

    FakeQueue replacement = new FakeQueue().waiting(3);
    monitor.addQueue("orders", replacement);

    assertThat(monitor.health("orders")).map(QueueHealth::status).contains(HealthStatus.UNKNOWN);
    assertThat(monitor.recentSamples("orders", 10)).isEmpty();
    assertThat(monitor.activeAlerts("orders").orElseThrow()).isEmpty();
    assertThat(original.unsubscribeCount()).isEqualTo(1);
    assertThat(replacement.isSubscribed()).isTrue();
    assertThat(store.range(StateKeys.history("orders"), 10)).isEmpty();
  }

  @Test
  void summaryCoversEveryQueue() {
    monitor.addQueue("a", new FakeQueue().counts(10, 2, 100, 0));
    monitor.addQueue("b", new FakeQueue().counts(10, 2, 100, 0));
    monitor.addQueue("c", new FakeQueue().counts(10, 2, 100, 0));

    tick();

    GlobalSummary summary = monitor.summary();
    assertThat(summary.totalQueues()).isEqualTo(3);
    assertThat(summary.healthyQueues()).isEqualTo(3);
    assertThat(summary.unhealthyQueues()).isZero();
    assertThat(summary.totalJobs()).isEqualTo(336);
    assertThat(summary.averageQueueDepth()).isEqualTo(10d);
    assertThat(store.get(StateKeys.summary("queue-monitor"))).isPresent();
    assertThat(events.passes).hasSize(1);
  }

  @Test
  void acknowledgeIsIdempotent() {
    monitor.addQueue("orders", new FakeQueue().waiting(6000));
    tick();
    String id = monitor.activeAlerts("orders").orElseThrow().get(0).id();

    assertThat(monitor.acknowledgeAlert("orders", id)).isTrue();
    assertThat(monitor.acknowledgeAlert("orders", id)).isTrue();
    assertThat(monitor.acknowledgeAlert("orders", "no-such-alert")).isFalse();

    assertThat(events.acknowledged).hasSize(1);
    assertThat(monitor.health("orders").orElseThrow().activeAlerts())
        .singleElement()
        .satisfies(alert -> assertThat(alert.acknowledged()).isTrue());
  }

  @Test
  void acknowledgementSurvivesFollowingPass() {
    monitor.addQueue("orders", new FakeQueue().waiting(6000));
    tick();
    String id = monitor.activeAlerts("orders").orElseThrow().get(0).id();
    monitor.acknowledgeAlert("orders", id);

    tick();

    AlertEvent alert = monitor.activeAlerts("orders").orElseThrow().get(0);
    assertThat(alert.id()).isEqualTo(id);
    assertThat(alert.acknowledged()).isTrue();
  }

  @Test
  void resolvedAlertCanStillBeAcknowledged() {
    FakeQueue queue = new FakeQueue().waiting(6000);
    monitor.addQueue("orders", queue);
    tick();
    String id = monitor.activeAlerts("orders").orElseThrow().get(0).id();
    queue.waiting(0);
    tick();

    assertThat(monitor.acknowledgeAlert("orders", id)).isTrue();
    assertThat(monitor.resolvedAlerts("orders").orElseThrow().get(0).acknowledged()).isTrue();
  }

  @Test
  void manualResolveClosesAlertUntilNextBreach() {
    monitor.addQueue("orders", new FakeQueue().waiting(6000));
    tick();
    String id = monitor.activeAlerts("orders").orElseThrow().get(0).id();

    assertThat(monitor.resolveAlert("orders", id)).isTrue();
    assertThat(monitor.health("orders").orElseThrow().activeAlerts()).isEmpty();
    assertThat(monitor.resolveAlert("orders", id)).isTrue();
    assertThat(monitor.resolveAlert("orders", "unknown")).isFalse();
    assertThat(events.resolved).hasSize(1);

    tick();

    List<AlertEvent> active = monitor.activeAlerts("orders").orElseThrow();
    assertThat(active).singleElement().satisfies(alert -> assertThat(alert.id()).isNotEqualTo(id));
  }

  @Test
  void disablingRuleResolvesItsAlertOnNextPass() {
    monitor.addQueue("orders", new FakeQueue().waiting(6000));
    tick();

    assertThat(monitor.setRuleEnabled("queue-depth", false)).isTrue();
    assertThat(monitor.setRuleEnabled("no-such-rule", false)).isFalse();
    tick();

    assertThat(monitor.activeAlerts("orders").orElseThrow()).isEmpty();
    assertThat(monitor.resolvedAlerts("orders").orElseThrow()).hasSize(1);
    assertThat(monitor.rules())
        .filteredOn(rule -> rule.id().equals("queue-depth"))
        .singleElement()
        .satisfies(rule -> assertThat(rule.enabled()).isFalse());
    assertThat(monitor.health("orders")).map(QueueHealth::status).contains(HealthStatus.CRITICAL);
  }

  @Test
  void disabledAlertingStillClassifiesHealth() {
    monitor.stop();
    monitor = newMonitor(MonitorSettings.builder().alertingEnabled(false).build());
    monitor.addQueue("orders", new FakeQueue().waiting(6000));

    tick();

    assertThat(monitor.health("orders")).map(QueueHealth::status).contains(HealthStatus.CRITICAL);
    assertThat(monitor.activeAlerts("orders").orElseThrow()).isEmpty();
    assertThat(events.triggered).isEmpty();
  }

  @Test
  void pausedQueueReportsWarning() {
    monitor.addQueue("orders", new FakeQueue().waiting(6000).paused(true));

    tick();

    assertThat(monitor.health("orders")).map(QueueHealth::status).contains(HealthStatus.WARNING);
  }

  @Test
  void staleSampleIsNotApplied() {
    monitor.addQueue("orders", new FakeQueue().counts(1, 0, 0, 0));
    tick();

    monitor.collectNow();

    assertThat(monitor.recentSamples("orders", 10)).hasSize(1);
  }

  @Test
  void derivesRatesAndProcessingTimeFromHistoryAndEvents() {
    FakeQueue queue = new FakeQueue().counts(0, 1, 0, 0);
    monitor.addQueue("orders", queue);
    tick();

    queue.listener().onActive("job-1");
    clock.advance(Duration.ofSeconds(2));
    queue.listener().onCompleted("job-1", null);
    clock.advance(Duration.ofSeconds(28));
    queue.counts(5, 1, 60, 0);
    monitor.collectNow();

    QueueMetrics latest = monitor.recentSamples("orders", 1).get(0);
    assertThat(latest.derived().throughputPerSec()).isEqualTo(2d);
    assertThat(latest.derived().processingRatePerMin()).isEqualTo(120d);
    assertThat(latest.derived().averageProcessingTimeMs()).isEqualTo(2000d);
    assertThat(latest.derived().lagMs()).isEqualTo(10_000d);
    assertThat(latest.derived().errorRatePct()).isZero();
    assertThat(events.jobEvents).containsExactly(JobEventType.ACTIVE, JobEventType.COMPLETED);
  }

  @Test
  void retentionSweepDropsExpiredSamples() {
    monitor.addQueue("orders", new FakeQueue().counts(1, 0, 0, 0));
    tick();
    clock.advance(Duration.ofDays(8));
    monitor.collectNow();

    HistoryStore.SweepResult result = monitor.sweepRetention();

    assertThat(result.samplesRemoved()).isEqualTo(1);
    assertThat(monitor.recentSamples("orders", 10)).hasSize(1);
    assertThat(store.range(StateKeys.history("orders"), 10)).hasSize(1);
  }

  @Test
  void firstRegistrationRestoresPersistedHistory() {
    monitor.addQueue("orders", new FakeQueue().counts(1, 0, 0, 0));
    tick();
    tick();
    monitor.stop();

    monitor = newMonitor(MonitorSettings.defaults());
    monitor.addQueue("orders", new FakeQueue().counts(1, 0, 0, 0));

    assertThat(monitor.recentSamples("orders", 10)).hasSize(2);
  }

  @Test
  void historyWindowAndExport() {
    monitor.addQueue("orders", new FakeQueue().counts(3, 1, 7, 0));
    tick();
    clock.advance(Duration.ofHours(2));
    monitor.collectNow();

    assertThat(monitor.history(Duration.ofHours(1)).get("orders")).hasSize(1);
    assertThat(monitor.history(Duration.ofHours(3)).get("orders")).hasSize(2);

    String csv = monitor.exportHistory(ExportFormat.CSV, Duration.ofHours(1));
    assertThat(csv.split("\n")).hasSize(2);
    assertThat(csv).startsWith("timestamp,queue,waiting");
    assertThat(csv).contains(",orders,3,1,7,0,");
  }

  @Test
  void snapshotListsQueuesRulesAndAlerts() {
    monitor.addQueue("orders", new FakeQueue().waiting(6000));
    monitor.addQueue("billing", new FakeQueue().waiting(1));
    tick();

    var snapshot = monitor.snapshot();

    assertThat(snapshot.queues()).containsOnlyKeys("billing", "orders");
    assertThat(snapshot.rules()).hasSize(7);
    assertThat(snapshot.system().heapMaxBytes()).isPositive();
    assertThat(snapshot.system().storeReachable()).isTrue();
    assertThat(snapshot.activeAlerts()).hasSize(1);
    assertThat(snapshot.summary().unhealthyQueues()).isEqualTo(1);
    assertThat(snapshot.running()).isFalse();
  }

  @Test
  void systemAlertsJoinActiveAlertsAndFollowTheirRule() {
    monitor.stop();
    monitor = newMonitor(MonitorSettings.builder()
        .systemThresholds(new SystemThresholds(new Threshold(0, 1_000), new Threshold(600_000, 600_000)))
        .build());
    monitor.addQueue("orders", new FakeQueue().waiting(6000));

    tick();

    AlertEvent memory = monitor.activeSystemAlerts().get(0);
    assertThat(monitor.activeSystemAlerts()).hasSize(1);
    assertThat(memory.queueName()).isEqualTo("system");
    assertThat(memory.metric()).isEqualTo(MetricKey.MEMORY_USAGE);
    assertThat(memory.severity()).isEqualTo(AlertSeverity.WARNING);
    assertThat(monitor.allActiveAlerts()).extracting(AlertEvent::queueName).containsExactly("orders", "system");
    assertThat(events.triggered).extracting(AlertEvent::queueName).containsExactlyInAnyOrder("orders", "system");
    verify(sink).deliver(argThat((AlertRule rule) -> rule.id().equals("memory-usage")),
        argThat((AlertEvent alert) -> alert.id().equals(memory.id())));
    assertThat(monitor.systemMetrics().heapUsedBytes()).isPositive();

    assertThat(monitor.acknowledgeSystemAlert(memory.id())).isTrue();
    assertThat(monitor.acknowledgeSystemAlert("unknown")).isFalse();
    assertThat(events.acknowledged).singleElement()
        .satisfies(alert -> assertThat(alert.id()).isEqualTo(memory.id()));

    assertThat(monitor.setRuleEnabled("memory-usage", false)).isTrue();
    tick();

    assertThat(monitor.activeSystemAlerts()).isEmpty();
    assertThat(monitor.resolvedSystemAlerts()).singleElement()
        .satisfies(alert -> assertThat(alert.acknowledged()).isTrue());
    assertThat(events.resolved).extracting(AlertEvent::queueName).containsExactly("system");
  }

  @Test
  void stopIsFinal() throws Exception {
    FakeQueue queue = new FakeQueue().counts(1, 0, 0, 0);
    monitor.addQueue("orders", queue);

    monitor.start();
    assertThat(monitor.isRunning()).isTrue();
    monitor.stop();

    assertThat(monitor.isRunning()).isFalse();
    assertThat(queue.isSubscribed()).isFalse();
    assertThatThrownBy(monitor::start).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(monitor::collectNow).isInstanceOf(IllegalStateException.class);
  }

  private static final class RecordingListener implements MonitorEventListener {
    final List<AlertEvent> triggered = new CopyOnWriteArrayList<>();
    final List<AlertEvent> severityChanges = new CopyOnWriteArrayList<>();
    final List<AlertEvent> resolved = new CopyOnWriteArrayList<>();
    final List<AlertEvent> acknowledged = new CopyOnWriteArrayList<>();
    final List<JobEventType> jobEvents = new CopyOnWriteArrayList<>();
    final List<GlobalSummary> passes = new CopyOnWriteArrayList<>();

    @Override
    public void onJobEvent(String queueName, JobEventType type, String jobId) {
      jobEvents.add(type);
    }

    @Override
    public void onAlertTriggered(AlertEvent alert) {
      triggered.add(alert);
    }

    @Override
    public void onAlertSeverityChanged(AlertEvent previous, AlertEvent current) {
      severityChanges.add(current);
    }

    @Override
    public void onAlertResolved(AlertEvent alert) {
      resolved.add(alert);
    }

    @Override
    public void onAlertAcknowledged(AlertEvent alert) {
      acknowledged.add(alert);
    }

    @Override
    public void onPassCompleted(GlobalSummary summary) {
      passes.add(summary);
    }
  }
}
