package io.queuehive.queuemonitor.web;

import io.queuehive.monitor.ports.QueueEventListener;
import io.queuehive.monitor.ports.QueueHandle;
import io.queuehive.monitor.ports.Subscription;

final class StubQueue implements QueueHandle {

  private volatile long waiting;
  private volatile long completed;
  private volatile long failed;

  StubQueue counts(long waiting, long completed, long failed) {
    this.waiting = waiting;
    this.completed = completed;
    this.failed = failed;
    return this;
  }

  @Override
  public long getWaitingCount() {
    return waiting;
  }

  @Override
  public long getActiveCount() {
    return 0;
  }

  @Override
  public long getCompletedCount() {
    return completed;
  }

  @Override
  public long getFailedCount() {
    return failed;
  }

  @Override
  public long getDelayedCount() {
    return 0;
  }

  @Override
  public boolean isPaused() {
    return false;
  }

  @Override
  public Subscription subscribe(QueueEventListener listener) {
    return Subscription.none();
  }
}
