package io.queuehive.monitor.ports;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value store backing history, resolved alerts and summary snapshots. Lists are kept
 * most-recent-first. Implementations throw {@link StateStoreException} on I/O failure; callers
 * treat those as non-fatal.
 */
public interface StateStore {

  /**
   * Prepend {@code value} to the list at {@code key} and keep at most {@code maxLength} entries.
   */
  void pushBounded(String key, String value, int maxLength);

  /**
   * @return up to {@code limit} most recent entries, empty when the key does not exist
   */
  List<String> range(String key, int limit);

  /**
   * Keep only the {@code keep} most recent entries of the list at {@code key}.
   */
  void trim(String key, int keep);

  void put(String key, String value, Duration ttl);

  Optional<String> get(String key);

  void delete(String key);

  /**
   * Round trip to the backing store. Throws {@link StateStoreException} when it is unreachable.
   */
  default void ping() {
    get("__ping__");
  }
}
