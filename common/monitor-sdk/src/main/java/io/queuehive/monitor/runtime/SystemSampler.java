package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.SystemMetrics;
import io.queuehive.monitor.ports.Clock;
import io.queuehive.monitor.ports.StateStore;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.RuntimeMXBean;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads JVM memory figures and times a round trip to the state store.
 */
final class SystemSampler {

  private static final Logger log = LoggerFactory.getLogger(SystemSampler.class);

  private final StateStore store;
  private final Clock clock;
  private final MemoryMXBean memory;
  private final RuntimeMXBean runtime;
  private final LongSupplier nanoTime;

  SystemSampler(StateStore store, Clock clock) {
    this(store, clock, ManagementFactory.getMemoryMXBean(), ManagementFactory.getRuntimeMXBean(), System::nanoTime);
  }

  SystemSampler(StateStore store, Clock clock, MemoryMXBean memory, RuntimeMXBean runtime, LongSupplier nanoTime) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.memory = Objects.requireNonNull(memory, "memory");
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
  }

  SystemMetrics sample() {
    MemoryUsage heap = memory.getHeapMemoryUsage();
    long limit = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
    double usagePct = limit > 0 ? heap.getUsed() * 100d / limit : 0d;

    boolean reachable = true;
    long started = nanoTime.getAsLong();
    try {
      store.ping();
    } catch (RuntimeException ex) {
      reachable = false;
      log.warn("State store ping failed: {}", ex.getMessage());
    }
    double latencyMs = TimeUnit.NANOSECONDS.toMicros(nanoTime.getAsLong() - started) / 1_000d;

    return new SystemMetrics(heap.getUsed(), limit, usagePct, memory.getNonHeapMemoryUsage().getUsed(),
        Runtime.getRuntime().availableProcessors(), runtime.getUptime(), reachable, latencyMs, clock.now());
  }
}
