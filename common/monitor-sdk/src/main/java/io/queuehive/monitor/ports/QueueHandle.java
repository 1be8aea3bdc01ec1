package io.queuehive.monitor.ports;

/**
 * Read side of a job queue as seen by the monitor. Any backing queue implementation can satisfy
 * it; every call may fail transiently and is invoked off the scheduler thread with a timeout.
 */
public interface QueueHandle {

  long getWaitingCount() throws Exception;

  long getActiveCount() throws Exception;

  long getCompletedCount() throws Exception;

  long getFailedCount() throws Exception;

  long getDelayedCount() throws Exception;

  boolean isPaused() throws Exception;

  /**
   * Attach a listener to the queue's job lifecycle events.
   *
   * @return handle used to detach the listener (never null)
   */
  Subscription subscribe(QueueEventListener listener);
}
