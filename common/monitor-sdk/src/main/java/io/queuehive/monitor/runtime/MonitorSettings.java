package io.queuehive.monitor.runtime;

import io.queuehive.monitor.model.SystemThresholds;
import io.queuehive.monitor.model.Thresholds;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable monitor configuration. Construction fails fast on values that would otherwise surface
 * as runtime anomalies.
 */
public record MonitorSettings(
    String instanceId,
    Duration metricsInterval,
    boolean alertingEnabled,
    Thresholds thresholds,
    SystemThresholds systemThresholds,
    Retention retention,
    int maxSamples,
    int maxResolvedAlerts,
    int historyWindow,
    Duration fetchTimeout,
    int fetchParallelism,
    Duration summaryTtl,
    Duration shutdownTimeout,
    boolean insightsEnabled) {

  public static final Duration DEFAULT_METRICS_INTERVAL = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_SAMPLES = 1_000;
  public static final int DEFAULT_MAX_RESOLVED_ALERTS = 500;
  public static final int DEFAULT_HISTORY_WINDOW = 10;
  public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(5);

  public MonitorSettings {
    requireText(instanceId, "instanceId");
    requirePositive(metricsInterval, "metricsInterval");
    Objects.requireNonNull(thresholds, "thresholds");
    Objects.requireNonNull(systemThresholds, "systemThresholds");
    Objects.requireNonNull(retention, "retention");
    if (maxSamples < 1) {
      throw new IllegalArgumentException("maxSamples must be at least 1");
    }
    if (maxResolvedAlerts < 1) {
      throw new IllegalArgumentException("maxResolvedAlerts must be at least 1");
    }
    if (historyWindow < 1 || historyWindow > maxSamples) {
      throw new IllegalArgumentException(
          "historyWindow must be between 1 and maxSamples (" + maxSamples + "), was " + historyWindow);
    }
    requirePositive(fetchTimeout, "fetchTimeout");
    if (fetchParallelism < 1) {
      throw new IllegalArgumentException("fetchParallelism must be at least 1");
    }
    requirePositive(summaryTtl, "summaryTtl");
    requirePositive(shutdownTimeout, "shutdownTimeout");
  }

  public static MonitorSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .instanceId(instanceId)
        .metricsInterval(metricsInterval)
        .alertingEnabled(alertingEnabled)
        .thresholds(thresholds)
        .systemThresholds(systemThresholds)
        .retention(retention)
        .maxSamples(maxSamples)
        .maxResolvedAlerts(maxResolvedAlerts)
        .historyWindow(historyWindow)
        .fetchTimeout(fetchTimeout)
        .fetchParallelism(fetchParallelism)
        .summaryTtl(summaryTtl)
        .shutdownTimeout(shutdownTimeout)
        .insightsEnabled(insightsEnabled);
  }

  /**
   * How long samples and resolved alerts are kept, and how often the sweep runs.
   */
  public record Retention(Duration metrics, Duration alerts, Duration sweepInterval) {

    public Retention {
      requirePositive(metrics, "retention.metrics");
      requirePositive(alerts, "retention.alerts");
      requirePositive(sweepInterval, "retention.sweepInterval");
    }

    public static Retention ofDays(int metricsDays, int alertsDays) {
      return new Retention(Duration.ofDays(metricsDays), Duration.ofDays(alertsDays), Duration.ofHours(1));
    }
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive, was " + value);
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }

  public static final class Builder {
    private String instanceId = "queue-monitor";
    private Duration metricsInterval = DEFAULT_METRICS_INTERVAL;
    private boolean alertingEnabled = true;
    private Thresholds thresholds = Thresholds.defaults();
    private SystemThresholds systemThresholds = SystemThresholds.defaults();
    private Retention retention = Retention.ofDays(7, 30);
    private int maxSamples = DEFAULT_MAX_SAMPLES;
    private int maxResolvedAlerts = DEFAULT_MAX_RESOLVED_ALERTS;
    private int historyWindow = DEFAULT_HISTORY_WINDOW;
    private Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;
    private int fetchParallelism = 8;
    private Duration summaryTtl = Duration.ofSeconds(60);
    private Duration shutdownTimeout = Duration.ofSeconds(10);
    private boolean insightsEnabled = true;

    private Builder() {
    }

    public Builder instanceId(String value) {
      this.instanceId = value;
      return this;
    }

    public Builder metricsInterval(Duration value) {
      this.metricsInterval = value;
      return this;
    }

    public Builder alertingEnabled(boolean value) {
      this.alertingEnabled = value;
      return this;
    }

    public Builder thresholds(Thresholds value) {
      this.thresholds = value;
      return this;
    }

    public Builder systemThresholds(SystemThresholds value) {
      this.systemThresholds = value;
      return this;
    }

    public Builder retention(Retention value) {
      this.retention = value;
      return this;
    }

    public Builder maxSamples(int value) {
      this.maxSamples = value;
      return this;
    }

    public Builder maxResolvedAlerts(int value) {
      this.maxResolvedAlerts = value;
      return this;
    }

    public Builder historyWindow(int value) {
      this.historyWindow = value;
      return this;
    }

    public Builder fetchTimeout(Duration value) {
      this.fetchTimeout = value;
      return this;
    }

    public Builder fetchParallelism(int value) {
      this.fetchParallelism = value;
      return this;
    }

    public Builder summaryTtl(Duration value) {
      this.summaryTtl = value;
      return this;
    }

    public Builder shutdownTimeout(Duration value) {
      this.shutdownTimeout = value;
      return this;
    }

    public Builder insightsEnabled(boolean value) {
      this.insightsEnabled = value;
      return this;
    }

    public MonitorSettings build() {
      return new MonitorSettings(instanceId, metricsInterval, alertingEnabled, thresholds, systemThresholds, retention,
          maxSamples, maxResolvedAlerts, historyWindow, fetchTimeout, fetchParallelism, summaryTtl,
          shutdownTimeout, insightsEnabled);
    }
  }
}
