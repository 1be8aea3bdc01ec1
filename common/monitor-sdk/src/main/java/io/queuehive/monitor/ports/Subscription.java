package io.queuehive.monitor.ports;

/**
 * Detaches a previously registered {@link QueueEventListener}. Calling it more than once is a no-op.
 */
@FunctionalInterface
public interface Subscription {

  void unsubscribe();

  static Subscription none() {
    return () -> { };
  }
}
