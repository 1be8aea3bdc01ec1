package io.queuehive.queuemonitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.queuehive.monitor.ports.AlertSink;
import io.queuehive.monitor.ports.Clock;
import io.queuehive.monitor.ports.QueueHandle;
import io.queuehive.monitor.ports.StateStore;
import io.queuehive.monitor.ports.WorkerRegistry;
import io.queuehive.monitor.runtime.MonitorSettings;
import io.queuehive.monitor.runtime.QueueMonitor;
import io.queuehive.monitor.store.InMemoryStateStore;
import io.queuehive.queuemonitor.alert.WebhookAlertSink;
import io.queuehive.queuemonitor.metrics.PrometheusMetricsExporter;
import io.queuehive.queuemonitor.store.LettuceStateStore;
import java.net.URI;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the monitor runtime. Every {@link QueueHandle} bean in the context is monitored under its
 * bean name.
 */
@Configuration(proxyBeanMethods = false)
public class QueueMonitorConfiguration {

  private static final Logger log = LoggerFactory.getLogger(QueueMonitorConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  Clock monitorClock() {
    return Clock.system();
  }

  @Bean
  MonitorSettings monitorSettings(QueueMonitorProperties properties) {
    return properties.toSettings();
  }

  @Bean
  @ConditionalOnProperty(prefix = "queuehive.monitor.redis", name = "enabled", havingValue = "true")
  StateStore redisStateStore(QueueMonitorProperties properties) {
    QueueMonitorProperties.Redis redis = properties.redis();
    return LettuceStateStore.connect(new LettuceStateStore.ConnectionConfig(
        redis.host(), redis.port(), redis.password(), redis.ssl(), redis.timeout()));
  }

  @Bean
  @ConditionalOnMissingBean(StateStore.class)
  StateStore inMemoryStateStore(Clock clock) {
    log.info("Redis state store disabled; history is kept in memory only");
    return new InMemoryStateStore(clock);
  }

  @Bean
  AlertSink alertSink(QueueMonitorProperties properties, ObjectProvider<RestTemplateBuilder> builders) {
    QueueMonitorProperties.Webhook webhook = properties.webhook();
    if (!webhook.enabled()) {
      return AlertSink.none();
    }
    RestTemplateBuilder builder = builders.getIfAvailable(RestTemplateBuilder::new);
    return new WebhookAlertSink(builder, URI.create(webhook.url()), webhook.connectTimeout(), webhook.readTimeout(),
        webhook.queueCapacity());
  }

  @Bean
  @ConditionalOnMissingBean
  WorkerRegistry workerRegistry() {
    return WorkerRegistry.none();
  }

  @Bean
  PrometheusMetricsExporter prometheusMetricsExporter(ObjectProvider<ObjectMapper> mappers, Clock clock) {
    return new PrometheusMetricsExporter(mappers.getIfAvailable(ObjectMapper::new), clock);
  }

  @Bean
  QueueMonitor queueMonitor(MonitorSettings settings,
                            WorkerRegistry workers,
                            StateStore store,
                            AlertSink alertSink,
                            PrometheusMetricsExporter exporter,
                            Clock clock,
                            ListableBeanFactory beanFactory) {
    QueueMonitor monitor = new QueueMonitor(settings, workers, store, alertSink, exporter, clock);
    Map<String, QueueHandle> queues = beanFactory.getBeansOfType(QueueHandle.class);
    queues.forEach(monitor::addQueue);
    return monitor;
  }

  @Bean
  QueueMonitorLifecycle queueMonitorLifecycle(QueueMonitor monitor) {
    return new QueueMonitorLifecycle(monitor);
  }

  @Bean
  QueueMonitorHealthIndicator queueMonitorHealthIndicator(QueueMonitor monitor) {
    return new QueueMonitorHealthIndicator(monitor);
  }
}
