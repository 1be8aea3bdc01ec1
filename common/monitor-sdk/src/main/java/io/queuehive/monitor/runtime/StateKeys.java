package io.queuehive.monitor.runtime;

/**
 * Key layout used in the state store.
 */
public final class StateKeys {

  public static final String PREFIX = "queuehive:";

  private StateKeys() {
  }

  public static String history(String queueName) {
    return PREFIX + "history:" + queueName;
  }

  public static String resolvedAlerts(String queueName) {
    return PREFIX + "alerts:" + queueName;
  }

  public static String summary(String instanceId) {
    return PREFIX + "summary:" + instanceId;
  }
}
