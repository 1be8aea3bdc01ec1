package io.queuehive.monitor.testing;

import io.queuehive.monitor.ports.Clock;
import java.time.Duration;
import java.time.Instant;

public final class MutableClock implements Clock {

  private volatile Instant current;

  public MutableClock(Instant start) {
    this.current = start;
  }

  public static MutableClock at(String iso) {
    return new MutableClock(Instant.parse(iso));
  }

  public void advance(Duration step) {
    current = current.plus(step);
  }

  public void set(Instant instant) {
    current = instant;
  }

  @Override
  public long currentTimeMillis() {
    return current.toEpochMilli();
  }

  @Override
  public Instant now() {
    return current;
  }
}
