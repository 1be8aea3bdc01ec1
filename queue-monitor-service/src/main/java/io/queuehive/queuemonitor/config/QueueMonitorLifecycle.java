package io.queuehive.queuemonitor.config;

import io.queuehive.monitor.runtime.QueueMonitor;
import java.util.Objects;
import org.springframework.context.SmartLifecycle;

/**
 * Starts collection once the context is refreshed and stops it before the context's beans are
 * destroyed.
 */
public class QueueMonitorLifecycle implements SmartLifecycle {

  private final QueueMonitor monitor;

  public QueueMonitorLifecycle(QueueMonitor monitor) {
    this.monitor = Objects.requireNonNull(monitor, "monitor");
  }

  @Override
  public void start() {
    monitor.start();
  }

  @Override
  public void stop() {
    monitor.stop();
  }

  @Override
  public boolean isRunning() {
    return monitor.isRunning();
  }
}
