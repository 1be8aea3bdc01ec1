package io.queuehive.queuemonitor.config;

import io.queuehive.monitor.model.GlobalSummary;
import io.queuehive.monitor.model.SystemMetrics;
import io.queuehive.monitor.runtime.QueueMonitor;
import java.util.Objects;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

/**
 * Reports the monitor itself: up while collection is scheduled, with the latest fleet counts and
 * process figures. Unhealthy queues and an unreachable state store do not make the service
 * unhealthy.
 */
public class QueueMonitorHealthIndicator extends AbstractHealthIndicator {

  private final QueueMonitor monitor;

  public QueueMonitorHealthIndicator(QueueMonitor monitor) {
    this.monitor = Objects.requireNonNull(monitor, "monitor");
  }

  @Override
  protected void doHealthCheck(Health.Builder builder) {
    GlobalSummary summary = monitor.summary();
    SystemMetrics system = monitor.systemMetrics();
    (monitor.isRunning() ? builder.up() : builder.outOfService())
        .withDetail("queues", summary.totalQueues())
        .withDetail("healthyQueues", summary.healthyQueues())
        .withDetail("unhealthyQueues", summary.unhealthyQueues())
        .withDetail("lastPass", summary.generatedAt().toString())
        .withDetail("stateStoreReachable", system.storeReachable())
        .withDetail("memoryUsagePercent", Math.round(system.memoryUsagePct()));
  }
}
