package io.queuehive.monitor.store;

import io.queuehive.monitor.ports.Clock;
import io.queuehive.monitor.ports.StateStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link StateStore}. Lists and values live in separate key spaces; values expire
 * lazily on read once their TTL has elapsed.
 */
public final class InMemoryStateStore implements StateStore {

  private final Clock clock;
  private final Map<String, LinkedList<String>> lists = new ConcurrentHashMap<>();
  private final Map<String, Entry> values = new ConcurrentHashMap<>();

  public InMemoryStateStore() {
    this(Clock.system());
  }

  public InMemoryStateStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void pushBounded(String key, String value, int maxLength) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    if (maxLength < 1) {
      throw new IllegalArgumentException("maxLength must be at least 1");
    }
    lists.compute(key, (k, list) -> {
      LinkedList<String> target = list == null ? new LinkedList<>() : list;
      target.addFirst(value);
      while (target.size() > maxLength) {
        target.removeLast();
      }
      return target;
    });
  }

  @Override
  public List<String> range(String key, int limit) {
    List<String> result = new ArrayList<>();
    lists.computeIfPresent(key, (k, list) -> {
      int count = Math.min(Math.max(limit, 0), list.size());
      result.addAll(list.subList(0, count));
      return list;
    });
    return result;
  }

  @Override
  public void trim(String key, int keep) {
    lists.computeIfPresent(key, (k, list) -> {
      while (list.size() > Math.max(keep, 0)) {
        list.removeLast();
      }
      return list.isEmpty() ? null : list;
    });
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long expiresAt = ttl == null ? Long.MAX_VALUE : clock.currentTimeMillis() + ttl.toMillis();
    values.put(key, new Entry(value, expiresAt));
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = values.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.expiresAt() <= clock.currentTimeMillis()) {
      values.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public void delete(String key) {
    lists.remove(key);
    values.remove(key);
  }

  /**
   * @return true when a list or an unexpired value exists under the key
   */
  public boolean contains(String key) {
    return lists.containsKey(key) || get(key).isPresent();
  }

  private record Entry(String value, long expiresAt) {
  }
}
