package io.queuehive.monitor.runtime;

import io.queuehive.monitor.export.ExportFormat;
import io.queuehive.monitor.export.HistoryExporter;
import io.queuehive.monitor.insight.TrendAnalyzer;
import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.AlertRule;
import io.queuehive.monitor.model.GlobalSummary;
import io.queuehive.monitor.model.MonitorSnapshot;
import io.queuehive.monitor.model.QueueHealth;
import io.queuehive.monitor.model.QueueMetrics;
import io.queuehive.monitor.model.SystemMetrics;
import io.queuehive.monitor.model.TrendInsight;
import io.queuehive.monitor.ports.AlertSink;
import io.queuehive.monitor.ports.Clock;
import io.queuehive.monitor.ports.MonitorEventListener;
import io.queuehive.monitor.ports.MonitorMetrics;
import io.queuehive.monitor.ports.QueueHandle;
import io.queuehive.monitor.ports.StateStore;
import io.queuehive.monitor.ports.WorkerRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue health monitor: keeps a registry of queues, samples them on a fixed interval, classifies
 * their health, raises and resolves alerts, and keeps a bounded history.
 * <p>
 * A single daemon scheduler thread drives collection passes and retention sweeps. Per-queue
 * fetches run on a separate fixed pool. A monitor can be started once; {@link #stop()} is final.
 */
public final class QueueMonitor implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(QueueMonitor.class);

  private final MonitorSettings settings;
  private final Clock clock;
  private final QueueRegistry registry;
  private final HistoryStore history;
  private final AlertEngine alerts;
  private final GlobalAggregator aggregator;
  private final EventDispatcher events;
  private final SystemMonitor system;
  private final MetricsSampler sampler;
  private final TrendAnalyzer trends;
  private final HistoryExporter exporter;
  private final ScheduledExecutorService scheduler;
  private final ExecutorService fetchPool;

  private ScheduledFuture<?> passTask;
  private ScheduledFuture<?> sweepTask;
  private volatile boolean running;
  private volatile boolean stopped;

  public QueueMonitor(MonitorSettings settings,
                      WorkerRegistry workers,
                      StateStore store,
                      AlertSink alertSink,
                      MonitorMetrics metrics,
                      Clock clock) {
    this(settings, AlertEngine.defaultRules(settings.thresholds()), workers, store, alertSink, metrics, clock);
  }

  public QueueMonitor(MonitorSettings settings,
                      List<AlertRule> rules,
                      WorkerRegistry workers,
                      StateStore store,
                      AlertSink alertSink,
                      MonitorMetrics metrics,
                      Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(metrics, "metrics");
    JsonCodec codec = new JsonCodec();
    this.history = new HistoryStore(store, codec, settings.maxSamples(), settings.maxResolvedAlerts());
    this.events = new EventDispatcher(metrics, alertSink == null ? AlertSink.none() : alertSink);
    this.registry = new QueueRegistry(history, events, metrics, clock, settings.maxSamples(),
        settings.maxResolvedAlerts());
    this.alerts = new AlertEngine(rules, history, settings.alertingEnabled());
    this.aggregator = new GlobalAggregator(store, codec, settings.instanceId(), settings.summaryTtl(), clock.now());
    this.system = new SystemMonitor(new SystemSampler(store, clock), alerts,
        SystemMonitor.defaultRules(settings.systemThresholds()), settings.maxResolvedAlerts(), clock.now());
    this.fetchPool = Executors.newFixedThreadPool(settings.fetchParallelism(), daemonThreads("queue-monitor-fetch-"));
    this.sampler = new MetricsSampler(registry, history, alerts, new HealthClassifier(), aggregator, events, system,
        metrics, workers == null ? WorkerRegistry.none() : workers, clock, settings, fetchPool);
    this.trends = new TrendAnalyzer();
    this.exporter = new HistoryExporter();
    this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("queue-monitor-" + settings.instanceId() + "-"));
  }

  /**
   * Start periodic collection. The first pass runs immediately on the scheduler thread.
   *
   * @throws IllegalStateException when the monitor has been stopped
   */
  public synchronized void start() {
    if (stopped) {
      throw new IllegalStateException("Queue monitor " + settings.instanceId() + " has been stopped");
    }
    if (running) {
      return;
    }
    long periodMs = settings.metricsInterval().toMillis();
    long sweepMs = settings.retention().sweepInterval().toMillis();
    passTask = scheduler.scheduleAtFixedRate(this::runScheduledPass, 0L, periodMs, TimeUnit.MILLISECONDS);
    sweepTask = scheduler.scheduleAtFixedRate(this::runScheduledSweep, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
    running = true;
    log.info("Queue monitor [{}] started (interval={} queues={} alerting={})",
        settings.instanceId(), settings.metricsInterval(), registry.size(), settings.alertingEnabled());
  }

  /**
   * Cancel the timers, wait for an in-flight pass and detach every queue listener. Idempotent.
   */
  public synchronized void stop() {
    if (stopped) {
      return;
    }
    stopped = true;
    running = false;
    if (passTask != null) {
      passTask.cancel(false);
    }
    if (sweepTask != null) {
      sweepTask.cancel(false);
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Queue monitor [{}] pass still running after {}; interrupting", settings.instanceId(),
            settings.shutdownTimeout());
        scheduler.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      scheduler.shutdownNow();
    }
    registry.unsubscribeAll();
    fetchPool.shutdownNow();
    log.info("Queue monitor [{}] stopped", settings.instanceId());
  }

  @Override
  public void close() {
    stop();
  }

  public boolean isRunning() {
    return running;
  }

  public MonitorSettings settings() {
    return settings;
  }

  public void addQueue(String name, QueueHandle handle) {
    registry.add(name, handle);
  }

  /**
   * @return false when no queue of that name is registered
   */
  public boolean removeQueue(String name) {
    return registry.remove(name);
  }

  public Optional<QueueHealth> health(String name) {
    return registry.health(name);
  }

  /**
   * @return health of every registered queue, keyed by name in name order
   */
  public Map<String, QueueHealth> allHealth() {
    Map<String, QueueHealth> byName = new LinkedHashMap<>();
    registry.healthSnapshots().stream()
        .sorted(Comparator.comparing(QueueHealth::queueName))
        .forEach(health -> byName.put(health.queueName(), health));
    return byName;
  }

  public Optional<List<AlertEvent>> activeAlerts(String queueName) {
    return withRecord(queueName, record -> record.alerts().activeAlerts());
  }

  public Optional<List<AlertEvent>> resolvedAlerts(String queueName) {
    return withRecord(queueName, record -> record.alerts().resolvedAlerts());
  }

  /**
   * Active alerts of every queue followed by the active system alerts.
   */
  public List<AlertEvent> allActiveAlerts() {
    List<AlertEvent> active = new ArrayList<>();
    for (QueueHealth health : allHealth().values()) {
      active.addAll(health.activeAlerts());
    }
    active.addAll(system.activeAlerts());
    return active;
  }

  /**
   * Heap usage and state store reachability of this process, as of the last pass.
   */
  public SystemMetrics systemMetrics() {
    return system.latest();
  }

  public List<AlertEvent> activeSystemAlerts() {
    return system.activeAlerts();
  }

  public List<AlertEvent> resolvedSystemAlerts() {
    return system.resolvedAlerts();
  }

  /**
   * @return true when an active or resolved system alert has that id
   */
  public boolean acknowledgeSystemAlert(String alertId) {
    Optional<AlertEngine.Acknowledgement> ack = system.acknowledge(alertId);
    ack.filter(AlertEngine.Acknowledgement::firstTime).ifPresent(a -> {
      log.info("System alert {} acknowledged", alertId);
      events.alertAcknowledged(a.alert());
    });
    return ack.isPresent();
  }

  /**
   * Mark an alert as acknowledged. Acknowledging twice is harmless.
   *
   * @return true when the queue has an active or resolved alert with that id
   */
  public boolean acknowledgeAlert(String queueName, String alertId) {
    Optional<AlertEngine.Acknowledgement> ack = withRecord(queueName, record -> {
      Optional<AlertEngine.Acknowledgement> result = alerts.acknowledge(record, alertId);
      result.ifPresent(ignored -> refreshActiveAlerts(record));
      return result;
    }).flatMap(Function.identity());
    ack.filter(AlertEngine.Acknowledgement::firstTime).ifPresent(a -> {
      log.info("Alert {} on queue {} acknowledged", alertId, queueName);
      events.alertAcknowledged(a.alert());
    });
    return ack.isPresent();
  }

  /**
   * Resolve an alert by hand.
   *
   * @return true when the queue has an alert with that id, whether or not it was still active
   */
  public boolean resolveAlert(String queueName, String alertId) {
    Optional<List<AlertTransition>> transitions = withRecord(queueName, record -> {
      Optional<List<AlertTransition>> result = alerts.resolveManually(record, alertId, clock.now());
      result.ifPresent(ignored -> refreshActiveAlerts(record));
      return result;
    }).flatMap(Function.identity());
    transitions.ifPresent(events::alertTransitions);
    return transitions.isPresent();
  }

  /**
   * Queue rules followed by system rules.
   */
  public List<AlertRule> rules() {
    List<AlertRule> all = new ArrayList<>(alerts.rules());
    all.addAll(system.rules());
    return all;
  }

  /**
   * Enable or disable a rule. Alerts of a disabled rule resolve on the next pass.
   *
   * @return false when no rule has that id
   */
  public boolean setRuleEnabled(String ruleId, boolean enabled) {
    return alerts.setRuleEnabled(ruleId, enabled) || system.setRuleEnabled(ruleId, enabled);
  }

  /**
   * Most recent samples of a queue, newest first. Unknown queues yield an empty list.
   */
  public List<QueueMetrics> recentSamples(String queueName, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return withRecord(queueName, record -> history.recent(record, limit)).orElse(List.of());
  }

  /**
   * Samples newer than {@code now - window} for every queue, newest first.
   */
  public Map<String, List<QueueMetrics>> history(Duration window) {
    Objects.requireNonNull(window, "window");
    Instant cutoff = clock.now().minus(window);
    Map<String, List<QueueMetrics>> rows = new LinkedHashMap<>();
    for (QueueRecord record : registry.records()) {
      record.lock();
      try {
        if (!record.isRetired()) {
          rows.put(record.name(), history.since(record, cutoff));
        }
      } finally {
        record.unlock();
      }
    }
    return rows;
  }

  public String exportHistory(ExportFormat format, Duration window) {
    return exporter.export(history(window), format);
  }

  /**
   * Capacity insights for queues whose processing rate keeps rising. Empty when insights are
   * disabled.
   */
  public List<TrendInsight> insights() {
    if (!settings.insightsEnabled()) {
      return List.of();
    }
    Instant now = clock.now();
    List<TrendInsight> insights = new ArrayList<>();
    for (QueueRecord record : registry.records()) {
      List<QueueMetrics> rows;
      record.lock();
      try {
        if (record.isRetired()) {
          continue;
        }
        rows = history.recent(record, TrendAnalyzer.DEFAULT_MAX_SAMPLES);
      } finally {
        record.unlock();
      }
      trends.analyze(record.name(), rows, now).ifPresent(insights::add);
    }
    insights.sort(Comparator.comparing(TrendInsight::queueName));
    return insights;
  }

  public GlobalSummary summary() {
    return aggregator.latest();
  }

  public MonitorSnapshot snapshot() {
    return new MonitorSnapshot(clock.now(), running, allHealth(), aggregator.latest(), rules(),
        allActiveAlerts(), insights(), system.latest());
  }

  /**
   * Run a collection pass on the calling thread.
   *
   * @throws IllegalStateException when the monitor has been stopped
   */
  public GlobalSummary collectNow() {
    if (stopped) {
      throw new IllegalStateException("Queue monitor " + settings.instanceId() + " has been stopped");
    }
    return sampler.runPass();
  }

  /**
   * Drop samples and resolved alerts past their retention period.
   */
  public HistoryStore.SweepResult sweepRetention() {
    Instant now = clock.now();
    Instant samplesCutoff = now.minus(settings.retention().metrics());
    Instant alertsCutoff = now.minus(settings.retention().alerts());
    HistoryStore.SweepResult total = HistoryStore.SweepResult.NONE;
    for (QueueRecord record : registry.records()) {
      record.lock();
      try {
        if (!record.isRetired()) {
          total = total.plus(history.sweep(record, samplesCutoff, alertsCutoff));
        }
      } finally {
        record.unlock();
      }
    }
    total = total.plus(new HistoryStore.SweepResult(0, system.sweep(alertsCutoff)));
    if (total.samplesRemoved() > 0 || total.alertsRemoved() > 0) {
      log.info("Retention sweep removed {} samples and {} resolved alerts",
          total.samplesRemoved(), total.alertsRemoved());
    }
    return total;
  }

  public void addListener(MonitorEventListener listener) {
    events.addListener(listener);
  }

  public void removeListener(MonitorEventListener listener) {
    events.removeListener(listener);
  }

  private void runScheduledPass() {
    try {
      sampler.runPass();
    } catch (RuntimeException ex) {
      log.warn("Queue monitor [{}] pass failed", settings.instanceId(), ex);
    }
  }

  private void runScheduledSweep() {
    try {
      sweepRetention();
    } catch (RuntimeException ex) {
      log.warn("Queue monitor [{}] retention sweep failed", settings.instanceId(), ex);
    }
  }

  private void refreshActiveAlerts(QueueRecord record) {
    record.refresh(record.health().withActiveAlerts(record.alerts().activeAlerts()));
  }

  private <T> Optional<T> withRecord(String queueName, Function<QueueRecord, T> action) {
    Optional<QueueRecord> found = registry.find(queueName);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    QueueRecord record = found.get();
    record.lock();
    try {
      if (record.isRetired()) {
        return Optional.empty();
      }
      return Optional.ofNullable(action.apply(record));
    } finally {
      record.unlock();
    }
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, prefix + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }
}
