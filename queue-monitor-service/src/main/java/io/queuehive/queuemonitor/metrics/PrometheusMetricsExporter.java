package io.queuehive.queuemonitor.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.GlobalSummary;
import io.queuehive.monitor.model.JobEventType;
import io.queuehive.monitor.model.MonitorSnapshot;
import io.queuehive.monitor.model.QueueHealth;
import io.queuehive.monitor.model.SystemMetrics;
import io.queuehive.monitor.ports.Clock;
import io.queuehive.monitor.ports.MonitorMetrics;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToDoubleFunction;

/**
 * Mirrors monitor state into a Prometheus registry owned by this exporter.
 * <p>
 * Per-queue gauges read from the latest {@link QueueHealth} pushed for that queue and are removed
 * together with every other meter tagged with the queue once it is unregistered.
 */
public final class PrometheusMetricsExporter implements MonitorMetrics, AutoCloseable {

  static final String QUEUE_TAG = "queue";

  private final PrometheusMeterRegistry registry;
  private final ObjectMapper mapper;
  private final Clock clock;
  private final ConcurrentMap<String, QueueGauges> queues = new ConcurrentHashMap<>();
  private final AtomicReference<GlobalSummary> summary;
  private final AtomicReference<SystemMetrics> system;
  private final Timer passDuration;
  private final Counter passErrors;

  public PrometheusMetricsExporter(ObjectMapper mapper, Clock clock) {
    this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.summary = new AtomicReference<>(GlobalSummary.empty(clock.now()));
    this.system = new AtomicReference<>(SystemMetrics.unknown(clock.now()));
    this.passDuration = Timer.builder("queuehive.collection.duration")
        .description("Duration of a collection pass")
        .publishPercentileHistogram(true)
        .register(registry);
    this.passErrors = Counter.builder("queuehive.collection.errors")
        .description("Collection passes that failed")
        .register(registry);
    registerGlobalGauges();
    registerSystemGauges();
  }

  @Override
  public void queueUpdated(QueueHealth health) {
    Objects.requireNonNull(health, "health");
    queues.computeIfAbsent(health.queueName(), QueueGauges::new).set(health);
  }

  @Override
  public void queueRemoved(String queueName) {
    if (queueName == null || queueName.isBlank()) {
      return;
    }
    queues.remove(queueName);
    List<Meter> tagged = new ArrayList<>();
    for (Meter meter : registry.getMeters()) {
      if (queueName.equals(meter.getId().getTag(QUEUE_TAG))) {
        tagged.add(meter);
      }
    }
    tagged.forEach(registry::remove);
  }

  @Override
  public void jobEvent(String queueName, JobEventType type) {
    Counter.builder("queuehive.job.events")
        .description("Job lifecycle events observed per queue")
        .tags(Tags.of(QUEUE_TAG, queueName, "event", type.tagValue()))
        .register(registry)
        .increment();
  }

  @Override
  public void alertTriggered(AlertEvent alert) {
    alertCounter("queuehive.alerts.triggered", "Alerts raised", alert).increment();
  }

  @Override
  public void alertResolved(AlertEvent alert) {
    alertCounter("queuehive.alerts.resolved", "Alerts resolved", alert).increment();
  }

  @Override
  public void passCompleted(Duration duration, GlobalSummary latest) {
    passDuration.record(duration);
    if (latest != null) {
      summary.set(latest);
    }
  }

  @Override
  public void passFailed() {
    passErrors.increment();
  }

  @Override
  public void systemUpdated(SystemMetrics latest) {
    if (latest != null) {
      system.set(latest);
    }
  }

  /**
   * Prometheus text exposition with every sample stamped with the render time (epoch millis).
   */
  public String renderText() {
    String scrape = registry.scrape();
    long timestamp = clock.currentTimeMillis();
    StringBuilder out = new StringBuilder(scrape.length() + 256);
    for (String line : scrape.split("\n")) {
      out.append(line);
      if (!line.isBlank() && !line.startsWith("#")) {
        out.append(' ').append(timestamp);
      }
      out.append('\n');
    }
    return out.toString();
  }

  public String renderJson(MonitorSnapshot snapshot) {
    try {
      return mapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to render monitor snapshot", ex);
    }
  }

  PrometheusMeterRegistry registry() {
    return registry;
  }

  @Override
  public void close() {
    queues.clear();
    registry.close();
  }

  private Counter alertCounter(String name, String description, AlertEvent alert) {
    return Counter.builder(name)
        .description(description)
        .tags(Tags.of(
            QUEUE_TAG, alert.queueName(),
            "metric", alert.metric().key(),
            "severity", alert.severity().wireName()))
        .register(registry);
  }

  private void registerGlobalGauges() {
    globalGauge("queuehive.global.queues", GlobalSummary::totalQueues);
    globalGauge("queuehive.global.jobs", GlobalSummary::totalJobs);
    globalGauge("queuehive.global.workers", GlobalSummary::totalWorkers);
    globalGauge("queuehive.global.throughput.per.second", GlobalSummary::globalThroughput);
    globalGauge("queuehive.global.error.rate.percent", GlobalSummary::globalErrorRate);
    globalGauge("queuehive.global.average.queue.depth", GlobalSummary::averageQueueDepth);
    globalGauge("queuehive.global.healthy.queues", GlobalSummary::healthyQueues);
    globalGauge("queuehive.global.unhealthy.queues", GlobalSummary::unhealthyQueues);
  }

  private void registerSystemGauges() {
    systemGauge("queuehive.system.heap.used.bytes", SystemMetrics::heapUsedBytes);
    systemGauge("queuehive.system.heap.max.bytes", SystemMetrics::heapMaxBytes);
    systemGauge("queuehive.system.nonheap.used.bytes", SystemMetrics::nonHeapUsedBytes);
    systemGauge("queuehive.system.memory.usage.percent", SystemMetrics::memoryUsagePct);
    systemGauge("queuehive.system.store.latency.milliseconds", SystemMetrics::storeLatencyMs);
    systemGauge("queuehive.system.store.reachable", s -> s.storeReachable() ? 1 : 0);
  }

  private void systemGauge(String name, ToDoubleFunction<SystemMetrics> value) {
    Gauge.builder(name, system, ref -> value.applyAsDouble(ref.get()))
        .register(registry);
  }

  private void globalGauge(String name, ToDoubleFunction<GlobalSummary> value) {
    Gauge.builder(name, summary, ref -> value.applyAsDouble(ref.get()))
        .register(registry);
  }

  private final class QueueGauges {

    private volatile QueueHealth health;

    QueueGauges(String queueName) {
      Tags tags = Tags.of(QUEUE_TAG, queueName);
      jobs(tags, "waiting", h -> h.metrics().sample().waiting());
      jobs(tags, "active", h -> h.metrics().sample().active());
      jobs(tags, "completed", h -> h.metrics().sample().completed());
      jobs(tags, "failed", h -> h.metrics().sample().failed());
      jobs(tags, "delayed", h -> h.metrics().sample().delayed());
      gauge("queuehive.queue.processing.rate.per.minute", tags, h -> h.metrics().derived().processingRatePerMin());
      gauge("queuehive.queue.error.rate.percent", tags, h -> h.metrics().derived().errorRatePct());
      gauge("queuehive.queue.throughput.per.second", tags, h -> h.metrics().derived().throughputPerSec());
      gauge("queuehive.queue.lag.milliseconds", tags, h -> h.metrics().derived().lagMs());
      gauge("queuehive.queue.average.processing.time.milliseconds", tags,
          h -> h.metrics().derived().averageProcessingTimeMs());
      gauge("queuehive.queue.workers", tags.and("state", "total"), h -> h.workers().total());
      gauge("queuehive.queue.workers", tags.and("state", "active"), h -> h.workers().active());
      gauge("queuehive.queue.workers", tags.and("state", "idle"), h -> h.workers().idle());
      gauge("queuehive.queue.worker.utilization.percent", tags, h -> h.workers().utilizationPct());
      gauge("queuehive.queue.health.status", tags, h -> h.status().code());
    }

    void set(QueueHealth value) {
      this.health = value;
    }

    private void jobs(Tags tags, String state, ToDoubleFunction<QueueHealth> value) {
      gauge("queuehive.queue.jobs", tags.and("state", state), value);
    }

    private void gauge(String name, Tags tags, ToDoubleFunction<QueueHealth> value) {
      Gauge.builder(name, this, self -> {
            QueueHealth current = self.health;
            return current == null ? Double.NaN : value.applyAsDouble(current);
          })
          .tags(tags)
          .register(registry);
    }
  }
}
