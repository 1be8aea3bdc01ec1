package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.QueueMetrics;
import io.queuehive.monitor.ports.StateStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, time-retained per-queue history of samples and resolved alerts.
 * <p>
 * The in-memory copy held by each {@link QueueRecord} is authoritative; every write is mirrored
 * to the {@link StateStore} on a best-effort basis and store failures are only logged. All
 * methods expect the caller to hold the record's lock.
 */
public final class HistoryStore {

  private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

  private final StateStore store;
  private final JsonCodec codec;
  private final int maxSamples;
  private final int maxResolvedAlerts;

  HistoryStore(StateStore store, JsonCodec codec, int maxSamples, int maxResolvedAlerts) {
    this.store = Objects.requireNonNull(store, "store");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.maxSamples = maxSamples;
    this.maxResolvedAlerts = maxResolvedAlerts;
  }

  void append(QueueRecord record, QueueMetrics row) {
    record.history().add(row);
    try {
      store.pushBounded(StateKeys.history(record.name()), codec.write(row), maxSamples);
    } catch (RuntimeException ex) {
      log.warn("History write for queue {} failed; in-memory history stays authoritative: {}",
          record.name(), ex.getMessage());
    }
  }

  List<QueueMetrics> recent(QueueRecord record, int limit) {
    return record.history().recent(limit);
  }

  List<QueueMetrics> since(QueueRecord record, Instant cutoff) {
    return record.history().since(cutoff);
  }

  void recordResolved(QueueRecord record, AlertEvent alert) {
    record.alerts().addResolved(alert);
    try {
      store.pushBounded(StateKeys.resolvedAlerts(record.name()), codec.write(alert), maxResolvedAlerts);
    } catch (RuntimeException ex) {
      log.warn("Alert log write for queue {} failed (alert {}): {}", record.name(), alert.id(), ex.getMessage());
    }
  }

  /**
   * Load previously persisted history for a newly registered queue.
   */
  void hydrate(QueueRecord record) {
    List<QueueMetrics> rows = load(StateKeys.history(record.name()), maxSamples, QueueMetrics.class);
    if (!rows.isEmpty()) {
      record.history().load(rows);
    }
    List<AlertEvent> resolved = load(StateKeys.resolvedAlerts(record.name()), maxResolvedAlerts, AlertEvent.class);
    if (!resolved.isEmpty()) {
      record.alerts().loadResolved(resolved);
    }
    if (!rows.isEmpty() || !resolved.isEmpty()) {
      log.info("Restored {} samples and {} resolved alerts for queue {}", rows.size(), resolved.size(), record.name());
    }
  }

  /**
   * Delete everything kept for the queue, in memory and in the store.
   */
  void wipe(QueueRecord record) {
    record.retire();
    delete(StateKeys.history(record.name()));
    delete(StateKeys.resolvedAlerts(record.name()));
  }

  /**
   * Drop samples and resolved alerts older than the given cut-offs. A queue left with nothing has
   * its store key removed rather than kept as an empty list.
   */
  SweepResult sweep(QueueRecord record, Instant samplesCutoff, Instant alertsCutoff) {
    int samplesBefore = record.history().size();
    int samplesKept = record.history().removeOlderThan(samplesCutoff);
    if (samplesKept != samplesBefore) {
      shrink(StateKeys.history(record.name()), samplesKept);
    }
    int alertsBefore = record.alerts().resolvedAlerts().size();
    int alertsKept = record.alerts().removeResolvedOlderThan(alertsCutoff);
    if (alertsKept != alertsBefore) {
      shrink(StateKeys.resolvedAlerts(record.name()), alertsKept);
    }
    return new SweepResult(samplesBefore - samplesKept, alertsBefore - alertsKept);
  }

  private void shrink(String key, int kept) {
    try {
      if (kept == 0) {
        store.delete(key);
      } else {
        store.trim(key, kept);
      }
    } catch (RuntimeException ex) {
      log.warn("Retention trim of {} failed: {}", key, ex.getMessage());
    }
  }

  private void delete(String key) {
    try {
      store.delete(key);
    } catch (RuntimeException ex) {
      log.warn("Failed to delete {}: {}", key, ex.getMessage());
    }
  }

  private <T> List<T> load(String key, int limit, Class<T> type) {
    List<String> raw;
    try {
      raw = store.range(key, limit);
    } catch (RuntimeException ex) {
      log.warn("Unable to read {} from state store: {}", key, ex.getMessage());
      return List.of();
    }
    List<T> values = new ArrayList<>(raw.size());
    for (String json : raw) {
      try {
        values.add(codec.read(json, type));
      } catch (IllegalArgumentException ex) {
        log.debug("Skipping unreadable entry in {}: {}", key, ex.getMessage());
      }
    }
    return values;
  }

  /**
   * Rows and resolved alerts dropped by a retention sweep.
   */
  public record SweepResult(int samplesRemoved, int alertsRemoved) {

    public static final SweepResult NONE = new SweepResult(0, 0);

    SweepResult plus(SweepResult other) {
      return new SweepResult(samplesRemoved + other.samplesRemoved, alertsRemoved + other.alertsRemoved);
    }
  }
}
