package io.queuehive.queuemonitor.web;

import io.queuehive.monitor.export.ExportFormat;
import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.QueueHealth;
import io.queuehive.monitor.model.SystemMetrics;
import io.queuehive.monitor.model.TrendInsight;
import io.queuehive.monitor.runtime.QueueMonitor;
import io.queuehive.queuemonitor.metrics.PrometheusMetricsExporter;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MonitorController {

  private static final Logger log = LoggerFactory.getLogger(MonitorController.class);

  static final MediaType PROMETHEUS_TEXT = MediaType.parseMediaType("text/plain;version=0.0.4;charset=utf-8");

  private final QueueMonitor monitor;
  private final PrometheusMetricsExporter exporter;

  public MonitorController(QueueMonitor monitor, PrometheusMetricsExporter exporter) {
    this.monitor = Objects.requireNonNull(monitor, "monitor");
    this.exporter = Objects.requireNonNull(exporter, "exporter");
  }

  @GetMapping("/metrics")
  public ResponseEntity<String> metrics() {
    return ResponseEntity.ok().contentType(PROMETHEUS_TEXT).body(exporter.renderText());
  }

  @GetMapping("/api/monitor")
  public ResponseEntity<String> snapshot() {
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(exporter.renderJson(monitor.snapshot()));
  }

  @GetMapping("/api/monitor/queues/{queue}")
  public ResponseEntity<QueueHealth> queue(@PathVariable("queue") String queue) {
    return ResponseEntity.of(monitor.health(queue));
  }

  @GetMapping("/api/monitor/queues/{queue}/alerts")
  public ResponseEntity<QueueAlerts> alerts(@PathVariable("queue") String queue) {
    return monitor.activeAlerts(queue)
        .map(active -> new QueueAlerts(queue, active, monitor.resolvedAlerts(queue).orElse(List.of())))
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping("/api/monitor/queues/{queue}/alerts/{alertId}/ack")
  public ResponseEntity<Void> acknowledge(@PathVariable("queue") String queue,
                                          @PathVariable("alertId") String alertId) {
    log.info("[REST] POST acknowledge alert {} on queue {}", alertId, queue);
    return monitor.acknowledgeAlert(queue, alertId)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  @PostMapping("/api/monitor/queues/{queue}/alerts/{alertId}/resolve")
  public ResponseEntity<Void> resolve(@PathVariable("queue") String queue,
                                      @PathVariable("alertId") String alertId) {
    log.info("[REST] POST resolve alert {} on queue {}", alertId, queue);
    return monitor.resolveAlert(queue, alertId)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  @GetMapping("/api/monitor/system")
  public SystemStatus system() {
    return new SystemStatus(monitor.systemMetrics(), monitor.activeSystemAlerts(), monitor.resolvedSystemAlerts());
  }

  @PostMapping("/api/monitor/system/alerts/{alertId}/ack")
  public ResponseEntity<Void> acknowledgeSystem(@PathVariable("alertId") String alertId) {
    log.info("[REST] POST acknowledge system alert {}", alertId);
    return monitor.acknowledgeSystemAlert(alertId)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  @PutMapping("/api/monitor/rules/{ruleId}")
  public ResponseEntity<Void> setRuleEnabled(@PathVariable("ruleId") String ruleId,
                                             @RequestParam("enabled") boolean enabled) {
    log.info("[REST] PUT rule {} enabled={}", ruleId, enabled);
    return monitor.setRuleEnabled(ruleId, enabled)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  @GetMapping("/api/monitor/history")
  public ResponseEntity<String> history(@RequestParam(name = "format", required = false) String format,
                                        @RequestParam(name = "hours", defaultValue = "24") int hours) {
    if (hours < 1) {
      return ResponseEntity.badRequest().build();
    }
    ExportFormat exportFormat;
    try {
      exportFormat = ExportFormat.fromName(format);
    } catch (IllegalArgumentException ex) {
      return ResponseEntity.badRequest().build();
    }
    String body = monitor.exportHistory(exportFormat, Duration.ofHours(hours));
    ResponseEntity.BodyBuilder response = ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(exportFormat.contentType()));
    if (exportFormat == ExportFormat.CSV) {
      response.header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"queue-history.csv\"");
    }
    return response.body(body);
  }

  @GetMapping("/api/monitor/insights")
  public List<TrendInsight> insights() {
    return monitor.insights();
  }

  public record QueueAlerts(String queue, List<AlertEvent> active, List<AlertEvent> resolved) {
  }

  public record SystemStatus(SystemMetrics metrics, List<AlertEvent> active, List<AlertEvent> resolved) {
  }
}
