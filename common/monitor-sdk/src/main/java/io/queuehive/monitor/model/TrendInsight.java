package io.queuehive.monitor.model;

import java.time.Instant;
import java.util.List;

/**
 * Capacity hint derived from a rising throughput trend.
 *
 * @param slopePerSample change of jobs/minute between consecutive samples
 * @param confidence     absolute correlation coefficient of the fit, 0..1
 */
public record TrendInsight(
    String queueName,
    String type,
    double slopePerSample,
    double confidence,
    int samples,
    String message,
    List<String> recommendations,
    Instant generatedAt) {

  public TrendInsight {
    recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
  }
}
