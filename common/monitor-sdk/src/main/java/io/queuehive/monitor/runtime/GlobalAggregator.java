package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.GlobalSummary;
import io.queuehive.monitor.model.HealthStatus;
import io.queuehive.monitor.model.QueueHealth;
import io.queuehive.monitor.ports.StateStore;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds per-queue health into the fleet-wide {@link GlobalSummary} and publishes it with a short
 * TTL. Each monitor instance publishes under its own key; summaries of different instances are
 * not merged.
 */
public final class GlobalAggregator {

  private static final Logger log = LoggerFactory.getLogger(GlobalAggregator.class);

  private final StateStore store;
  private final JsonCodec codec;
  private final String summaryKey;
  private final Duration ttl;
  private final AtomicReference<GlobalSummary> latest;

  GlobalAggregator(StateStore store, JsonCodec codec, String instanceId, Duration ttl, Instant startedAt) {
    this.store = Objects.requireNonNull(store, "store");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.summaryKey = StateKeys.summary(Objects.requireNonNull(instanceId, "instanceId"));
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.latest = new AtomicReference<>(GlobalSummary.empty(startedAt));
  }

  public static GlobalSummary aggregate(Collection<QueueHealth> queues, Instant at) {
    int total = queues.size();
    if (total == 0) {
      return GlobalSummary.empty(at);
    }
    long jobs = 0L;
    long workers = 0L;
    double throughput = 0d;
    double errorRateSum = 0d;
    double depthSum = 0d;
    int healthy = 0;
    for (QueueHealth health : queues) {
      jobs += health.metrics().sample().totalJobs();
      workers += health.workers().total();
      throughput += health.metrics().derived().throughputPerSec();
      errorRateSum += health.metrics().derived().errorRatePct();
      depthSum += health.metrics().sample().waiting();
      if (health.status() == HealthStatus.HEALTHY) {
        healthy++;
      }
    }
    return new GlobalSummary(total, jobs, workers, throughput, errorRateSum / total, depthSum / total,
        healthy, total - healthy, at);
  }

  GlobalSummary update(Collection<QueueHealth> queues, Instant at) {
    GlobalSummary summary = aggregate(queues, at);
    latest.set(summary);
    publish(summary);
    return summary;
  }

  public GlobalSummary latest() {
    return latest.get();
  }

  private void publish(GlobalSummary summary) {
    try {
      store.put(summaryKey, codec.write(summary), ttl);
    } catch (RuntimeException ex) {
      log.warn("Failed to publish global summary to {}: {}", summaryKey, ex.getMessage());
    }
  }
}
