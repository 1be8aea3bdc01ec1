package io.queuehive.queuemonitor.config;

import io.queuehive.monitor.model.SystemThresholds;
import io.queuehive.monitor.model.Threshold;
import io.queuehive.monitor.model.Thresholds;
import io.queuehive.monitor.runtime.MonitorSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Binds {@code queuehive.monitor.*}. Threshold levels left unset fall back to the built-in
 * defaults; every other value has a default of its own.
 */
@Validated
@ConfigurationProperties("queuehive.monitor")
public record QueueMonitorProperties(
    @DefaultValue("queue-monitor") @NotBlank String instanceId,
    @DefaultValue("30s") @NotNull Duration metricsInterval,
    @DefaultValue("true") boolean alertingEnabled,
    @DefaultValue("true") boolean insightsEnabled,
    @DefaultValue("5s") @NotNull Duration fetchTimeout,
    @DefaultValue("8") @Min(1) int fetchParallelism,
    @DefaultValue("60s") @NotNull Duration summaryTtl,
    @DefaultValue("10s") @NotNull Duration shutdownTimeout,
    @DefaultValue @NotNull @Valid ThresholdSet thresholds,
    @DefaultValue @NotNull @Valid Retention retention,
    @DefaultValue @NotNull @Valid History history,
    @DefaultValue @NotNull @Valid Webhook webhook,
    @DefaultValue @NotNull @Valid Redis redis) {

  /**
   * @throws IllegalArgumentException when a threshold has warning above critical or a duration
   *     is not positive
   */
  public MonitorSettings toSettings() {
    return MonitorSettings.builder()
        .instanceId(instanceId)
        .metricsInterval(metricsInterval)
        .alertingEnabled(alertingEnabled)
        .insightsEnabled(insightsEnabled)
        .fetchTimeout(fetchTimeout)
        .fetchParallelism(fetchParallelism)
        .summaryTtl(summaryTtl)
        .shutdownTimeout(shutdownTimeout)
        .thresholds(thresholds.toThresholds())
        .systemThresholds(thresholds.toSystemThresholds())
        .retention(new MonitorSettings.Retention(
            Duration.ofDays(retention.metricsDays()),
            Duration.ofDays(retention.alertsDays()),
            retention.sweepInterval()))
        .maxSamples(history.maxSamples())
        .maxResolvedAlerts(history.maxResolvedAlerts())
        .historyWindow(history.window())
        .build();
  }

  public record ThresholdSet(
      @Valid Level queueDepth,
      @Valid Level errorRate,
      @Valid Level processingTime,
      @Valid Level lag,
      @Valid Level workerUtilization,
      @Valid Level memoryUsage,
      @Valid Level storeLatency) {

    Thresholds toThresholds() {
      Thresholds defaults = Thresholds.defaults();
      return new Thresholds(
          merge(queueDepth, defaults.queueDepth()),
          merge(errorRate, defaults.errorRate()),
          merge(processingTime, defaults.processingTime()),
          merge(lag, defaults.lag()),
          merge(workerUtilization, defaults.workerUtilization()));
    }

    /**
     * A memory warning set without a critical bound goes critical at 1.2 times the warning.
     */
    SystemThresholds toSystemThresholds() {
      SystemThresholds defaults = SystemThresholds.defaults();
      Threshold memory = memoryUsage != null && memoryUsage.warning() != null && memoryUsage.critical() == null
          ? new Threshold(memoryUsage.warning(), memoryUsage.warning() * 1.2)
          : merge(memoryUsage, defaults.memoryUsage());
      return new SystemThresholds(memory, merge(storeLatency, defaults.storeLatency()));
    }

    private static Threshold merge(Level level, Threshold fallback) {
      if (level == null) {
        return fallback;
      }
      double warning = level.warning() == null ? fallback.warning() : level.warning();
      double critical = level.critical() == null ? fallback.critical() : level.critical();
      return new Threshold(warning, critical);
    }
  }

  public record Level(@PositiveOrZero Double warning, @PositiveOrZero Double critical) {
  }

  public record Retention(
      @DefaultValue("7") @Min(1) int metricsDays,
      @DefaultValue("30") @Min(1) int alertsDays,
      @DefaultValue("1h") @NotNull Duration sweepInterval) {
  }

  public record History(
      @DefaultValue("1000") @Min(1) int maxSamples,
      @DefaultValue("500") @Min(1) int maxResolvedAlerts,
      @DefaultValue("10") @Min(1) int window) {
  }

  public record Webhook(
      String url,
      @DefaultValue("2s") @NotNull Duration connectTimeout,
      @DefaultValue("5s") @NotNull Duration readTimeout,
      @DefaultValue("100") @Min(1) int queueCapacity) {

    public boolean enabled() {
      return url != null && !url.isBlank();
    }
  }

  public record Redis(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @DefaultValue("false") boolean ssl,
      @DefaultValue("5s") @NotNull Duration timeout) {
  }
}
