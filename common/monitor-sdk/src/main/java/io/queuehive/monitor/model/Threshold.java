package io.queuehive.monitor.model;

/**
 * Warning / critical bound pair for one metric. Both bounds are inclusive: a value equal to a
 * bound breaches it.
 */
public record Threshold(double warning, double critical) {

  public Threshold {
    if (!Double.isFinite(warning) || !Double.isFinite(critical)) {
      throw new IllegalArgumentException("threshold bounds must be finite");
    }
    if (warning < 0 || critical < 0) {
      throw new IllegalArgumentException(
          "threshold bounds must not be negative (warning=" + warning + ", critical=" + critical + ")");
    }
    if (warning > critical) {
      throw new IllegalArgumentException(
          "warning bound " + warning + " must not exceed critical bound " + critical);
    }
  }

  /**
   * @return the highest severity breached by {@code value}, or {@code null} when below warning
   */
  public AlertSeverity severityFor(double value) {
    if (value >= critical) {
      return AlertSeverity.CRITICAL;
    }
    if (value >= warning) {
      return AlertSeverity.WARNING;
    }
    return null;
  }

  public double boundFor(AlertSeverity severity) {
    return severity == AlertSeverity.CRITICAL ? critical : warning;
  }
}
