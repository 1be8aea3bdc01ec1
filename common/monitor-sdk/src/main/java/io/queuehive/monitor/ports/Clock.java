package io.queuehive.monitor.ports;

import java.time.Instant;

/**
 * Pluggable clock abstraction used for timestamps, windows and retention cut-offs.
 */
public interface Clock {

  long currentTimeMillis();

  Instant now();

  static Clock system() {
    return new Clock() {
      @Override
      public long currentTimeMillis() {
        return System.currentTimeMillis();
      }

      @Override
      public Instant now() {
        return Instant.now();
      }
    };
  }
}
