package io.queuehive.monitor.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.queuehive.monitor.model.QueueMetrics;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Renders retained history as JSON (rows grouped by queue) or as flat CSV, one row per queue and
 * sample, oldest first.
 */
public final class HistoryExporter {

  static final String[] CSV_HEADER = {
      "timestamp", "queue", "waiting", "active", "completed", "failed", "delayed", "paused",
      "processing_rate_per_minute", "error_rate_percent", "throughput_per_second", "lag_ms"};

  private final ObjectMapper mapper;
  private final CSVFormat csvFormat;

  public HistoryExporter() {
    this(new ObjectMapper());
  }

  public HistoryExporter(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);
    this.csvFormat = CSVFormat.DEFAULT
        .builder()
        .setHeader(CSV_HEADER)
        .setRecordSeparator('\n')
        .build();
  }

  /**
   * @param history rows per queue, each list most recent first
   */
  public String export(Map<String, List<QueueMetrics>> history, ExportFormat format) {
    Objects.requireNonNull(format, "format");
    Map<String, List<QueueMetrics>> ordered = oldestFirst(history);
    return switch (format) {
      case JSON -> toJson(ordered);
      case CSV -> toCsv(ordered);
    };
  }

  private String toJson(Map<String, List<QueueMetrics>> history) {
    try {
      return mapper.writeValueAsString(history);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to export history as JSON", ex);
    }
  }

  private String toCsv(Map<String, List<QueueMetrics>> history) {
    List<Row> rows = new ArrayList<>();
    history.forEach((queue, samples) -> samples.forEach(sample -> rows.add(new Row(queue, sample))));
    rows.sort(Comparator.comparing((Row row) -> row.metrics().timestamp()).thenComparing(Row::queue));

    StringWriter out = new StringWriter();
    try (CSVPrinter printer = new CSVPrinter(out, csvFormat)) {
      for (Row row : rows) {
        QueueMetrics m = row.metrics();
        printer.printRecord(
            m.timestamp().toString(),
            row.queue(),
            m.sample().waiting(),
            m.sample().active(),
            m.sample().completed(),
            m.sample().failed(),
            m.sample().delayed(),
            m.sample().paused(),
            m.derived().processingRatePerMin(),
            m.derived().errorRatePct(),
            m.derived().throughputPerSec(),
            m.derived().lagMs());
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to export history as CSV", ex);
    }
    return out.toString();
  }

  private static Map<String, List<QueueMetrics>> oldestFirst(Map<String, List<QueueMetrics>> history) {
    Map<String, List<QueueMetrics>> ordered = new TreeMap<>();
    if (history == null) {
      return ordered;
    }
    history.forEach((queue, samples) -> {
      List<QueueMetrics> copy = new ArrayList<>(samples == null ? List.of() : samples);
      copy.sort(Comparator.comparing(QueueMetrics::timestamp));
      ordered.put(queue, copy);
    });
    return ordered;
  }

  private record Row(String queue, QueueMetrics metrics) {
  }
}
