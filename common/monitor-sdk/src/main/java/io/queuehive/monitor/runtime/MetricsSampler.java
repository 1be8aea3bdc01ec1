package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.DerivedMetrics;
import io.queuehive.monitor.model.GlobalSummary;
import io.queuehive.monitor.model.HealthStatus;
import io.queuehive.monitor.model.QueueHealth;
import io.queuehive.monitor.model.QueueMetrics;
import io.queuehive.monitor.model.SampleMetrics;
import io.queuehive.monitor.model.WorkerMetrics;
import io.queuehive.monitor.ports.Clock;
import io.queuehive.monitor.ports.MonitorMetrics;
import io.queuehive.monitor.ports.QueueHandle;
import io.queuehive.monitor.ports.WorkerRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One collection pass over every registered queue: fetch, derive, classify, evaluate alerts,
 * commit, sample the monitor's own process, then aggregate.
 * <p>
 * Fetches run concurrently on the fetch executor, each bounded by the fetch timeout. A queue whose
 * fetch fails keeps its previous health. Commits happen under the record lock and each queue's
 * alert transitions are published once its lock is released, even when the commit fails part way.
 * A failing commit is logged against its queue and the pass moves on to the next one.
 * <p>
 * The fetch timeout abandons the result, not the thread: a {@link QueueHandle} that never returns
 * keeps its fetch thread busy. Once every fetch thread is held this way, later fetches time out
 * while still queued.
 */
final class MetricsSampler {

  private static final Logger log = LoggerFactory.getLogger(MetricsSampler.class);

  private final QueueRegistry registry;
  private final HistoryStore history;
  private final AlertEngine alerts;
  private final HealthClassifier classifier;
  private final GlobalAggregator aggregator;
  private final EventDispatcher events;
  private final SystemMonitor system;
  private final MonitorMetrics metrics;
  private final WorkerRegistry workers;
  private final Clock clock;
  private final MonitorSettings settings;
  private final Executor fetchExecutor;

  MetricsSampler(QueueRegistry registry,
                 HistoryStore history,
                 AlertEngine alerts,
                 HealthClassifier classifier,
                 GlobalAggregator aggregator,
                 EventDispatcher events,
                 SystemMonitor system,
                 MonitorMetrics metrics,
                 WorkerRegistry workers,
                 Clock clock,
                 MonitorSettings settings,
                 Executor fetchExecutor) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.history = Objects.requireNonNull(history, "history");
    this.alerts = Objects.requireNonNull(alerts, "alerts");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.events = Objects.requireNonNull(events, "events");
    this.system = Objects.requireNonNull(system, "system");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor");
  }

  /**
   * Run a full pass. Never throws; a failure escaping the pass is counted and logged.
   *
   * @return the summary published by this pass, or the previous one when the pass failed
   */
  synchronized GlobalSummary runPass() {
    long startNanos = System.nanoTime();
    try {
      List<QueueRecord> records = registry.records();
      Map<QueueRecord, CompletableFuture<Fetched>> pending = new LinkedHashMap<>();
      for (QueueRecord record : records) {
        pending.put(record, CompletableFuture
            .supplyAsync(() -> fetch(record), fetchExecutor)
            .orTimeout(settings.fetchTimeout().toMillis(), TimeUnit.MILLISECONDS));
      }
      for (Map.Entry<QueueRecord, CompletableFuture<Fetched>> entry : pending.entrySet()) {
        QueueRecord record = entry.getKey();
        Fetched fetched = await(record, entry.getValue());
        if (fetched != null) {
          commitAndPublish(record, fetched);
        }
      }
      sampleSystem();
      GlobalSummary summary = aggregator.update(registry.healthSnapshots(), clock.now());
      metrics.passCompleted(Duration.ofNanos(System.nanoTime() - startNanos), summary);
      events.passCompleted(summary);
      if (log.isDebugEnabled()) {
        log.debug("Collection pass over {} queues: {} healthy, {} unhealthy",
            summary.totalQueues(), summary.healthyQueues(), summary.unhealthyQueues());
      }
      return summary;
    } catch (RuntimeException ex) {
      metrics.passFailed();
      log.warn("Collection pass failed: {}", ex.getMessage(), ex);
      return aggregator.latest();
    }
  }

  private Fetched fetch(QueueRecord record) {
    if (record.isRetired()) {
      return null;
    }
    QueueHandle handle = record.handle();
    try {
      long waiting = handle.getWaitingCount();
      long active = handle.getActiveCount();
      long completed = handle.getCompletedCount();
      long failed = handle.getFailedCount();
      long delayed = handle.getDelayedCount();
      boolean paused = handle.isPaused();
      WorkerMetrics workerMetrics = fetchWorkers(record.name());
      SampleMetrics sample = new SampleMetrics(waiting, active, completed, failed, delayed, paused, clock.now());
      return new Fetched(sample, workerMetrics);
    } catch (Exception ex) {
      throw new CompletionException(ex);
    }
  }

  private WorkerMetrics fetchWorkers(String queueName) throws Exception {
    List<String> ids = workers.listWorkers(queueName);
    if (ids == null || ids.isEmpty()) {
      return WorkerMetrics.NONE;
    }
    int active = 0;
    for (String id : ids) {
      if (WorkerRegistry.STATUS_ACTIVE.equals(workers.getWorkerStatus(id))) {
        active++;
      }
    }
    return WorkerMetrics.of(ids.size(), active);
  }

  private Fetched await(QueueRecord record, CompletableFuture<Fetched> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof TimeoutException) {
        log.warn("Fetch for queue {} timed out after {}; keeping previous health",
            record.name(), settings.fetchTimeout());
      } else {
        log.warn("Fetch for queue {} failed; keeping previous health: {}", record.name(), cause.toString());
      }
      return null;
    }
  }

  private void commitAndPublish(QueueRecord record, Fetched fetched) {
    List<AlertTransition> transitions = new ArrayList<>();
    try {
      commit(record, fetched, transitions);
    } catch (RuntimeException ex) {
      log.warn("Commit for queue {} failed: {}", record.name(), ex.toString(), ex);
    } finally {
      events.alertTransitions(transitions);
    }
  }

  private void commit(QueueRecord record, Fetched fetched, List<AlertTransition> transitions) {
    SampleMetrics sample = fetched.sample();
    record.lock();
    try {
      if (record.isRetired()) {
        log.debug("Discarding sample for removed queue {}", record.name());
        return;
      }
      if (!record.accepts(sample.timestamp())) {
        log.debug("Discarding stale sample for queue {} taken at {}", record.name(), sample.timestamp());
        return;
      }
      List<QueueMetrics> previous = history.recent(record, settings.historyWindow());
      DerivedMetrics derived = DerivedMetricsCalculator.derive(sample, previous, record.timings().drainAverage());
      QueueMetrics row = new QueueMetrics(sample, derived);
      HealthStatus status = classifier.classify(sample, derived, fetched.workers(), settings.thresholds());
      AlertEngine.Outcome outcome = alerts.evaluate(record, row, fetched.workers(), sample.timestamp());
      transitions.addAll(outcome.transitions());
      QueueHealth health = new QueueHealth(record.name(), status, row, fetched.workers(), sample.timestamp(),
          outcome.active());
      record.commit(health);
      history.append(record, row);
      metrics.queueUpdated(health);
    } finally {
      record.unlock();
    }
  }

  private void sampleSystem() {
    List<AlertTransition> transitions = List.of();
    try {
      transitions = system.sample();
      metrics.systemUpdated(system.latest());
    } catch (RuntimeException ex) {
      log.warn("System sample failed: {}", ex.toString(), ex);
    } finally {
      events.alertTransitions(transitions);
    }
  }

  private record Fetched(SampleMetrics sample, WorkerMetrics workers) {
  }
}
