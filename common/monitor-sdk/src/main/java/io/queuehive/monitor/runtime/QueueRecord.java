package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.QueueHealth;
import io.queuehive.monitor.ports.QueueHandle;
import io.queuehive.monitor.ports.Subscription;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * All state the monitor keeps for one registered queue. Health is readable without locking;
 * every mutation happens while holding {@link #lock()}.
 */
final class QueueRecord {

  private final String name;
  private final QueueHandle handle;
  private final ReentrantLock lock = new ReentrantLock();
  private final SampleHistory history;
  private final AlertBook alerts;
  private final JobTimings timings = new JobTimings();

  private volatile QueueHealth health;
  private volatile boolean retired;
  private Subscription subscription = Subscription.none();
  private Instant lastWrite;

  QueueRecord(String name, QueueHandle handle, Instant registeredAt, int maxSamples, int maxResolvedAlerts) {
    this.name = Objects.requireNonNull(name, "name");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.history = new SampleHistory(maxSamples);
    this.alerts = new AlertBook(maxResolvedAlerts);
    this.health = QueueHealth.unknown(name, registeredAt);
  }

  String name() {
    return name;
  }

  QueueHandle handle() {
    return handle;
  }

  QueueHealth health() {
    return health;
  }

  SampleHistory history() {
    return history;
  }

  AlertBook alerts() {
    return alerts;
  }

  JobTimings timings() {
    return timings;
  }

  boolean isRetired() {
    return retired;
  }

  void lock() {
    lock.lock();
  }

  void unlock() {
    lock.unlock();
  }

  /**
   * Last-writer-wins: a sample is only applied when it is strictly newer than the last one written.
   */
  boolean accepts(Instant sampleTime) {
    return lastWrite == null || sampleTime.isAfter(lastWrite);
  }

  void commit(QueueHealth updated) {
    this.health = updated;
    this.lastWrite = updated.lastUpdated();
  }

  /**
   * Swap the health snapshot without advancing the write watermark (alert acknowledgements).
   */
  void refresh(QueueHealth updated) {
    this.health = updated;
  }

  void subscription(Subscription value) {
    this.subscription = value == null ? Subscription.none() : value;
  }

  Subscription detachSubscription() {
    Subscription current = subscription;
    subscription = Subscription.none();
    return current;
  }

  void retire() {
    retired = true;
    history.clear();
    alerts.clear();
    timings.clear();
  }
}
