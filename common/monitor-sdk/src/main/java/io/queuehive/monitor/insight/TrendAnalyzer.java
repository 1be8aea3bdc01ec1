package io.queuehive.monitor.insight;

import io.queuehive.monitor.model.QueueMetrics;
import io.queuehive.monitor.model.TrendInsight;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Least-squares trend over a queue's processing rate (jobs/minute). A steadily rising rate is
 * reported as a capacity insight.
 */
public final class TrendAnalyzer {

  public static final String TYPE_CAPACITY = "capacity";
  public static final int DEFAULT_MIN_SAMPLES = 10;
  public static final int DEFAULT_MAX_SAMPLES = 100;
  public static final double DEFAULT_MIN_CONFIDENCE = 0.7d;

  static final List<String> CAPACITY_RECOMMENDATIONS = List.of(
      "Consider increasing worker concurrency",
      "Monitor for potential bottlenecks",
      "Prepare for scaling if trend continues");

  private final int minSamples;
  private final int maxSamples;
  private final double minConfidence;

  public TrendAnalyzer() {
    this(DEFAULT_MIN_SAMPLES, DEFAULT_MAX_SAMPLES, DEFAULT_MIN_CONFIDENCE);
  }

  public TrendAnalyzer(int minSamples, int maxSamples, double minConfidence) {
    if (minSamples < 2) {
      throw new IllegalArgumentException("minSamples must be at least 2");
    }
    if (maxSamples < minSamples) {
      throw new IllegalArgumentException("maxSamples must not be lower than minSamples");
    }
    if (!(minConfidence >= 0d && minConfidence <= 1d)) {
      throw new IllegalArgumentException("minConfidence must be within 0..1");
    }
    this.minSamples = minSamples;
    this.maxSamples = maxSamples;
    this.minConfidence = minConfidence;
  }

  /**
   * @param newestFirst history rows of one queue, most recent first
   * @return an insight when the rate rises with enough confidence
   */
  public Optional<TrendInsight> analyze(String queueName, List<QueueMetrics> newestFirst, Instant now) {
    Objects.requireNonNull(queueName, "queueName");
    Objects.requireNonNull(now, "now");
    if (newestFirst == null || newestFirst.size() < minSamples) {
      return Optional.empty();
    }
    int n = Math.min(newestFirst.size(), maxSamples);
    double[] series = new double[n];
    // oldest sample gets x = 0
    for (int i = 0; i < n; i++) {
      series[n - 1 - i] = newestFirst.get(i).derived().processingRatePerMin();
    }
    Fit fit = fit(series);
    if (fit.slope() > 0d && fit.confidence() > minConfidence) {
      String message = String.format(Locale.ROOT, "Queue throughput is increasing by %.2f jobs/minute",
          fit.slope());
      return Optional.of(new TrendInsight(queueName, TYPE_CAPACITY, fit.slope(), fit.confidence(), n, message,
          CAPACITY_RECOMMENDATIONS, now));
    }
    return Optional.empty();
  }

  static Fit fit(double[] y) {
    int n = y.length;
    double meanX = (n - 1) / 2d;
    double meanY = 0d;
    for (double value : y) {
      meanY += value;
    }
    meanY /= n;
    double sxy = 0d;
    double sxx = 0d;
    double syy = 0d;
    for (int i = 0; i < n; i++) {
      double dx = i - meanX;
      double dy = y[i] - meanY;
      sxy += dx * dy;
      sxx += dx * dx;
      syy += dy * dy;
    }
    double slope = sxx == 0d ? 0d : sxy / sxx;
    double confidence = sxx == 0d || syy == 0d ? 0d : Math.abs(sxy / Math.sqrt(sxx * syy));
    if (!Double.isFinite(slope)) {
      slope = 0d;
    }
    if (!Double.isFinite(confidence)) {
      confidence = 0d;
    }
    return new Fit(slope, confidence);
  }

  record Fit(double slope, double confidence) {
  }
}
