package io.queuehive.monitor.ports;

/**
 * Raised by {@link StateStore} implementations when the backing store is unreachable or rejects
 * a command.
 */
public class StateStoreException extends RuntimeException {

  public StateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
