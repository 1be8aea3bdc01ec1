package io.queuehive.queuemonitor.store;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.queuehive.monitor.ports.StateStore;
import io.queuehive.monitor.ports.StateStoreException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redis-backed {@link StateStore} over a single Lettuce connection. Lists are written with
 * LPUSH + LTRIM so index 0 is always the newest entry.
 */
public final class LettuceStateStore implements StateStore, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(LettuceStateStore.class);

  private final RedisClient client;
  private final StatefulRedisConnection<String, String> connection;
  private final RedisCommands<String, String> commands;

  LettuceStateStore(RedisClient client,
                    StatefulRedisConnection<String, String> connection,
                    RedisCommands<String, String> commands) {
    this.client = client;
    this.connection = connection;
    this.commands = Objects.requireNonNull(commands, "commands");
  }

  public static LettuceStateStore connect(ConnectionConfig config) {
    Objects.requireNonNull(config, "config");
    RedisURI.Builder builder = RedisURI.builder()
        .withHost(config.host())
        .withPort(config.port())
        .withSsl(config.ssl())
        .withTimeout(config.timeout());
    if (config.password() != null && !config.password().isBlank()) {
      builder.withPassword(config.password().toCharArray());
    }
    RedisClient client = RedisClient.create(builder.build());
    try {
      StatefulRedisConnection<String, String> connection = client.connect();
      connection.setTimeout(config.timeout());
      log.info("Connected state store to redis {}:{}", config.host(), config.port());
      return new LettuceStateStore(client, connection, connection.sync());
    } catch (RedisException ex) {
      client.shutdown();
      throw new StateStoreException("Unable to connect to redis " + config.host() + ":" + config.port(), ex);
    }
  }

  @Override
  public void pushBounded(String key, String value, int maxLength) {
    run("LPUSH " + key, () -> {
      commands.lpush(key, value);
      if (maxLength > 0) {
        commands.ltrim(key, 0, maxLength - 1);
      }
      return null;
    });
  }

  @Override
  public List<String> range(String key, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return run("LRANGE " + key, () -> commands.lrange(key, 0, limit - 1));
  }

  @Override
  public void trim(String key, int keep) {
    run("LTRIM " + key, () -> {
      if (keep <= 0) {
        commands.del(key);
      } else {
        commands.ltrim(key, 0, keep - 1);
      }
      return null;
    });
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    run("SET " + key, () -> {
      if (ttl == null) {
        commands.set(key, value);
      } else {
        commands.set(key, value, SetArgs.Builder.px(ttl.toMillis()));
      }
      return null;
    });
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(run("GET " + key, () -> commands.get(key)));
  }

  @Override
  public void delete(String key) {
    run("DEL " + key, () -> commands.del(key));
  }

  @Override
  public void ping() {
    run("PING", commands::ping);
  }

  @Override
  public void close() {
    if (connection != null) {
      connection.close();
    }
    if (client != null) {
      client.shutdown();
    }
  }

  private static <T> T run(String description, Supplier<T> command) {
    try {
      return command.get();
    } catch (RedisException ex) {
      throw new StateStoreException("Redis command failed: " + description, ex);
    }
  }

  public record ConnectionConfig(String host, int port, String password, boolean ssl, Duration timeout) {

    public ConnectionConfig {
      Objects.requireNonNull(host, "host");
      Objects.requireNonNull(timeout, "timeout");
    }
  }
}
