package io.queuehive.monitor.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class MonitorSettingsTest {

  @Test
  void defaultsMatchDocumentedValues() {
    MonitorSettings settings = MonitorSettings.defaults();

    assertThat(settings.metricsInterval()).isEqualTo(Duration.ofSeconds(30));
    assertThat(settings.maxSamples()).isEqualTo(1000);
    assertThat(settings.historyWindow()).isEqualTo(10);
    assertThat(settings.retention().metrics()).isEqualTo(Duration.ofDays(7));
    assertThat(settings.retention().alerts()).isEqualTo(Duration.ofDays(30));
    assertThat(settings.retention().sweepInterval()).isEqualTo(Duration.ofHours(1));
    assertThat(settings.fetchTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(settings.summaryTtl()).isEqualTo(Duration.ofSeconds(60));
    assertThat(settings.alertingEnabled()).isTrue();
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThatThrownBy(() -> MonitorSettings.builder().metricsInterval(Duration.ZERO).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("metricsInterval");
  }

  @Test
  void rejectsHistoryWindowLargerThanHistory() {
    assertThatThrownBy(() -> MonitorSettings.builder().maxSamples(5).historyWindow(10).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("historyWindow");
  }

  @Test
  void rejectsBlankInstanceId() {
    assertThatThrownBy(() -> MonitorSettings.builder().instanceId(" ").build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toBuilderKeepsValues() {
    MonitorSettings original = MonitorSettings.builder().instanceId("east").fetchParallelism(3).build();

    MonitorSettings copy = original.toBuilder().alertingEnabled(false).build();

    assertThat(copy.instanceId()).isEqualTo("east");
    assertThat(copy.fetchParallelism()).isEqualTo(3);
    assertThat(copy.alertingEnabled()).isFalse();
  }
}
