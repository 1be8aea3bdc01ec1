package io.queuehive.queuemonitor.alert;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.AlertRule;
import io.queuehive.monitor.ports.AlertSink;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts newly triggered alerts as JSON to a webhook. Delivery runs on a dedicated thread behind a
 * bounded queue; alerts arriving while the queue is full are dropped and logged. Failures are
 * logged and not retried.
 */
public final class WebhookAlertSink implements AlertSink, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(WebhookAlertSink.class);

  private final RestTemplate restTemplate;
  private final URI url;
  private final ExecutorService executor;

  public WebhookAlertSink(RestTemplateBuilder restTemplateBuilder,
                          URI url,
                          Duration connectTimeout,
                          Duration readTimeout,
                          int queueCapacity) {
    this(restTemplateBuilder
            .setConnectTimeout(connectTimeout)
            .setReadTimeout(readTimeout)
            .build(),
        url,
        deliveryExecutor(queueCapacity));
  }

  /**
   * Single delivery thread with at most {@code queueCapacity} pending posts. Submissions beyond
   * that are rejected with {@link RejectedExecutionException}.
   */
  static ExecutorService deliveryExecutor(int queueCapacity) {
    if (queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be at least 1");
    }
    return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        r -> {
          Thread thread = new Thread(r, "queue-monitor-webhook");
          thread.setDaemon(true);
          return thread;
        },
        new ThreadPoolExecutor.AbortPolicy());
  }

  WebhookAlertSink(RestTemplate restTemplate, URI url, ExecutorService executor) {
    this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
    this.url = Objects.requireNonNull(url, "url");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public void deliver(AlertRule rule, AlertEvent alert) {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(alert, "alert");
    try {
      executor.execute(() -> post(rule, alert));
    } catch (RejectedExecutionException ex) {
      if (executor.isShutdown()) {
        log.warn("Webhook sink closed; alert {} for queue {} not delivered", alert.id(), alert.queueName());
      } else {
        log.warn("Webhook queue full; dropping alert {} for queue {}", alert.id(), alert.queueName());
      }
    }
  }

  /**
   * @return true when the webhook answered with a 2xx status
   */
  boolean post(AlertRule rule, AlertEvent alert) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    HttpEntity<Map<String, Object>> entity = new HttpEntity<>(payload(rule, alert), headers);
    try {
      ResponseEntity<String> response = restTemplate.postForEntity(url, entity, String.class);
      if (response.getStatusCode().is2xxSuccessful()) {
        log.debug("Alert {} delivered to {}", alert.id(), url);
        return true;
      }
      log.warn("Webhook {} answered {} for alert {}", url, response.getStatusCode().value(), alert.id());
    } catch (RestClientException ex) {
      log.warn("Webhook delivery of alert {} for queue {} failed: {}", alert.id(), alert.queueName(), ex.getMessage());
    }
    return false;
  }

  static Map<String, Object> payload(AlertRule rule, AlertEvent alert) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("ruleId", rule.id());
    body.put("ruleName", rule.name());
    body.put("queue", alert.queueName());
    body.put("metric", alert.metric().key());
    body.put("severity", alert.severity().wireName());
    body.put("value", alert.currentValue());
    body.put("threshold", alert.threshold());
    body.put("timestamp", alert.timestamp().toString());
    return body;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
