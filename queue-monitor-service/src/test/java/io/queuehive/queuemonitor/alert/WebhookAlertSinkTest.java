package io.queuehive.queuemonitor.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.queuehive.monitor.model.AlertEvent;
import io.queuehive.monitor.model.AlertRule;
import io.queuehive.monitor.model.AlertSeverity;
import io.queuehive.monitor.model.MetricKey;
import io.queuehive.monitor.model.Threshold;
import java.net.URI;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class WebhookAlertSinkTest {

  private static final URI URL = URI.create("http://hooks.local/alerts");
  private static final AlertRule RULE =
      new AlertRule("queue-depth", "Queue depth", MetricKey.QUEUE_DEPTH, new Threshold(1_000, 5_000), true);
  private static final AlertEvent ALERT = new AlertEvent("alert-1", "queue-depth", "orders",
      MetricKey.QUEUE_DEPTH, AlertSeverity.CRITICAL, 6_000, 6_000, 5_000,
      Instant.parse("2024-05-01T10:00:00Z"), false, null);

  private RestTemplate restTemplate;
  private MockRestServiceServer server;

  @BeforeEach
  void setUp() {
    restTemplate = new RestTemplate();
    server = MockRestServiceServer.bindTo(restTemplate).build();
  }

  @Test
  void payloadCarriesRuleAndAlertFields() {
    Map<String, Object> payload = WebhookAlertSink.payload(RULE, ALERT);

    assertThat(payload).containsOnlyKeys(
        "ruleId", "ruleName", "queue", "metric", "severity", "value", "threshold", "timestamp");
    assertThat(payload)
        .containsEntry("ruleName", "Queue depth")
        .containsEntry("metric", "queueDepth")
        .containsEntry("value", 6_000d)
        .containsEntry("timestamp", "2024-05-01T10:00:00Z");
  }

  @Test
  void postsAlertAsJson() {
    server.expect(requestTo(URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.ruleId").value("queue-depth"))
        .andExpect(jsonPath("$.queue").value("orders"))
        .andExpect(jsonPath("$.severity").value("critical"))
        .andExpect(jsonPath("$.threshold").value(5000.0))
        .andRespond(withSuccess());

    WebhookAlertSink sink = new WebhookAlertSink(restTemplate, URL, Executors.newSingleThreadExecutor());
    try {
      assertThat(sink.post(RULE, ALERT)).isTrue();
    } finally {
      sink.close();
    }
    server.verify();
  }

  @Test
  void serverErrorIsReportedNotThrown() {
    server.expect(requestTo(URL)).andRespond(withServerError());

    WebhookAlertSink sink = new WebhookAlertSink(restTemplate, URL, Executors.newSingleThreadExecutor());
    try {
      assertThat(sink.post(RULE, ALERT)).isFalse();
    } finally {
      sink.close();
    }
    server.verify();
  }

  @Test
  void deliverPostsOnSinkThread() {
    server.expect(requestTo(URL)).andRespond(withSuccess());

    WebhookAlertSink sink = new WebhookAlertSink(restTemplate, URL, Executors.newSingleThreadExecutor());
    sink.deliver(RULE, ALERT);
    sink.close();

    server.verify();
  }

  @Test
  void deliverAfterCloseIsDropped() {
    WebhookAlertSink sink = new WebhookAlertSink(restTemplate, URL, Executors.newSingleThreadExecutor());
    sink.close();

    sink.deliver(RULE, ALERT);

    server.verify();
  }

  @Test
  void alertsBeyondQueueCapacityAreDropped() throws Exception {
    server.expect(requestTo(URL)).andRespond(withSuccess());
    ExecutorService executor = WebhookAlertSink.deliveryExecutor(1);
    CountDownLatch busy = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    executor.execute(() -> {
      started.countDown();
      try {
        busy.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    WebhookAlertSink sink = new WebhookAlertSink(restTemplate, URL, executor);
    sink.deliver(RULE, ALERT);
    sink.deliver(RULE, ALERT);
    sink.deliver(RULE, ALERT);
    busy.countDown();
    sink.close();

    server.verify();
  }

  @Test
  void deliveryQueueNeedsCapacity() {
    assertThatThrownBy(() -> WebhookAlertSink.deliveryExecutor(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
