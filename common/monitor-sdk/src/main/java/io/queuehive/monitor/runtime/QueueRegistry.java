package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.JobEventType;
import io.queuehive.monitor.model.QueueHealth;
import io.queuehive.monitor.ports.Clock;
import io.queuehive.monitor.ports.MonitorMetrics;
import io.queuehive.monitor.ports.QueueEventListener;
import io.queuehive.monitor.ports.QueueHandle;
import io.queuehive.monitor.ports.Subscription;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arena of monitored queues: one {@link QueueRecord} per name in a single concurrent map.
 * <p>
 * Registration and removal take the record's lock, which is the same lock a sampling pass holds
 * while committing a result. A pass therefore sees a queue either fully present or fully retired.
 */
public final class QueueRegistry {

  private static final Logger log = LoggerFactory.getLogger(QueueRegistry.class);

  private final ConcurrentMap<String, QueueRecord> queues = new ConcurrentHashMap<>();
  private final HistoryStore history;
  private final EventDispatcher events;
  private final MonitorMetrics metrics;
  private final Clock clock;
  private final int maxSamples;
  private final int maxResolvedAlerts;

  QueueRegistry(HistoryStore history,
                EventDispatcher events,
                MonitorMetrics metrics,
                Clock clock,
                int maxSamples,
                int maxResolvedAlerts) {
    this.history = Objects.requireNonNull(history, "history");
    this.events = Objects.requireNonNull(events, "events");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.maxSamples = maxSamples;
    this.maxResolvedAlerts = maxResolvedAlerts;
  }

  /**
   * Register a queue. Registering a name that is already monitored retires the previous handle and
   * wipes its history and alerts; the queue starts over as {@code unknown}.
   */
  QueueRecord add(String name, QueueHandle handle) {
    requireName(name);
    Objects.requireNonNull(handle, "handle");
    QueueRecord fresh = new QueueRecord(name, handle, clock.now(), maxSamples, maxResolvedAlerts);
    fresh.lock();
    try {
      QueueRecord previous = queues.put(name, fresh);
      if (previous != null) {
        retire(previous);
        log.info("Queue {} re-registered; previous handle retired and state reset", name);
      } else {
        history.hydrate(fresh);
        log.info("Queue {} registered", name);
      }
      fresh.subscription(subscribe(fresh));
    } finally {
      fresh.unlock();
    }
    return fresh;
  }

  /**
   * @return false when the queue was not registered
   */
  boolean remove(String name) {
    QueueRecord record = queues.get(name);
    if (record == null) {
      return false;
    }
    record.lock();
    try {
      if (!queues.remove(name, record)) {
        return false;
      }
      retire(record);
    } finally {
      record.unlock();
    }
    log.info("Queue {} removed", name);
    return true;
  }

  Optional<QueueRecord> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(queues.get(name));
  }

  public Optional<QueueHealth> health(String name) {
    return find(name).map(QueueRecord::health);
  }

  List<QueueRecord> records() {
    return new ArrayList<>(queues.values());
  }

  public List<QueueHealth> healthSnapshots() {
    List<QueueHealth> snapshots = new ArrayList<>(queues.size());
    for (QueueRecord record : queues.values()) {
      snapshots.add(record.health());
    }
    return snapshots;
  }

  public boolean contains(String name) {
    return name != null && queues.containsKey(name);
  }

  public int size() {
    return queues.size();
  }

  /**
   * Detach every event listener without forgetting the queues.
   */
  void unsubscribeAll() {
    for (QueueRecord record : queues.values()) {
      record.lock();
      try {
        unsubscribe(record);
      } finally {
        record.unlock();
      }
    }
  }

  private void retire(QueueRecord record) {
    record.lock();
    try {
      unsubscribe(record);
      history.wipe(record);
      metrics.queueRemoved(record.name());
    } finally {
      record.unlock();
    }
  }

  private Subscription subscribe(QueueRecord record) {
    try {
      return record.handle().subscribe(new Forwarder(record));
    } catch (RuntimeException ex) {
      log.warn("Unable to subscribe to events of queue {}; polling only: {}", record.name(), ex.getMessage());
      return Subscription.none();
    }
  }

  private void unsubscribe(QueueRecord record) {
    try {
      record.detachSubscription().unsubscribe();
    } catch (RuntimeException ex) {
      log.warn("Failed to unsubscribe from queue {}: {}", record.name(), ex.getMessage());
    }
  }

  private static void requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("queue name must not be blank");
    }
  }

  private final class Forwarder implements QueueEventListener {

    private final QueueRecord record;

    Forwarder(QueueRecord record) {
      this.record = record;
    }

    @Override
    public void onWaiting(String jobId) {
      forward(JobEventType.WAITING, jobId);
    }

    @Override
    public void onActive(String jobId) {
      if (!record.isRetired()) {
        record.timings().started(jobId, clock.currentTimeMillis());
      }
      forward(JobEventType.ACTIVE, jobId);
    }

    @Override
    public void onCompleted(String jobId, Object result) {
      if (!record.isRetired()) {
        record.timings().completed(jobId, clock.currentTimeMillis());
      }
      forward(JobEventType.COMPLETED, jobId);
    }

    @Override
    public void onFailed(String jobId, String reason) {
      record.timings().abandoned(jobId);
      if (log.isDebugEnabled()) {
        log.debug("Job {} on queue {} failed: {}", jobId, record.name(), reason);
      }
      forward(JobEventType.FAILED, jobId);
    }

    @Override
    public void onStalled(String jobId) {
      record.timings().abandoned(jobId);
      forward(JobEventType.STALLED, jobId);
    }

    @Override
    public void onProgress(String jobId, Object data) {
      forward(JobEventType.PROGRESS, jobId);
    }

    private void forward(JobEventType type, String jobId) {
      if (record.isRetired()) {
        return;
      }
      events.jobEvent(record.name(), type, jobId);
    }
  }
}
