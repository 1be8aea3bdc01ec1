package io.queuehive.monitor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Objects;

/**
 * Sample counts together with the metrics derived from them. This is the row kept in history.
 */
public record QueueMetrics(SampleMetrics sample, DerivedMetrics derived) {

  public QueueMetrics {
    Objects.requireNonNull(sample, "sample");
    derived = derived == null ? DerivedMetrics.ZERO : derived;
  }

  public static QueueMetrics empty(Instant timestamp) {
    return new QueueMetrics(SampleMetrics.empty(timestamp), DerivedMetrics.ZERO);
  }

  @JsonIgnore
  public Instant timestamp() {
    return sample.timestamp();
  }
}
