/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.httpstore.redis;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.CacheBackend;
import com.github.mizosoft.httpstore.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.api.StatefulRedisConnection;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link CacheBackend} that keeps values on a Redis Standalone instance. Each value lives under
 * {@code <namespace>:value:<key>} and expires by Redis itself. Each tag is a set under {@code
 * <namespace>:tag:<tag>} holding the keys of the values tagged with it. Saving a tagged value and
 * invalidating tags are done atomically by Lua scripts.
 *
 * <p>Instances are created with {@link #newBuilder()}.
 */
public final class RedisCacheBackend extends AbstractRedisBackend implements CacheBackend {
  private static final Logger logger = System.getLogger(RedisCacheBackend.class.getName());

  private static final Set<Capability> CAPABILITIES =
      Set.copyOf(EnumSet.of(Capability.TAGS, Capability.PRUNE, Capability.CLEAR));

  private static final String VALUE_KIND = "value";
  private static final String TAG_KIND = "tag";

  private static final int SCAN_LIMIT = 128;

  private static final ByteBuffer NO_EXPIRY = encode("-1");

  private final Object lock = new Object();

  @GuardedBy("lock")
  private final Map<String, DeferredValue> deferred = new LinkedHashMap<>();

  private RedisCacheBackend(
      StatefulRedisConnection<String, ByteBuffer> connection,
      RedisConnectionProvider connectionProvider,
      String namespace) {
    super(connection, connectionProvider, namespace);
  }

  @Override
  public Set<Capability> capabilities() {
    return CAPABILITIES;
  }

  @Override
  public Optional<ByteBuffer> get(String key) throws IOException {
    requireNonNull(key);
    synchronized (lock) {
      var deferredValue = deferred.get(key);
      if (deferredValue != null) {
        return deferredValue.isExpired()
            ? Optional.empty()
            : Optional.of(deferredValue.value.duplicate());
      }
    }
    return Optional.ofNullable(execute(() -> commands().get(toKey(VALUE_KIND, key))));
  }

  @Override
  public boolean saveDeferred(
      String key, ByteBuffer value, @Nullable Duration ttl, Set<String> tags) {
    requireNonNull(key);
    tags.forEach(Utils::requireValidTag);
    if (ttl != null) {
      Utils.requireNonNegativeDuration(ttl);
    }
    requireNotClosed();
    synchronized (lock) {
      deferred.put(key, new DeferredValue(Utils.copy(value), ttl, Set.copyOf(tags)));
    }
    return true;
  }

  @Override
  public boolean commit() throws IOException {
    List<Map.Entry<String, DeferredValue>> toCommit;
    synchronized (lock) {
      toCommit = new ArrayList<>(deferred.entrySet());
      deferred.clear();
    }

    boolean committedAll = true;
    for (var entry : toCommit) {
      var valueKey = toKey(VALUE_KIND, entry.getKey());
      var deferredValue = entry.getValue();
      if (deferredValue.isExpired()) {
        execute(() -> commands().del(valueKey));
        continue;
      }

      var keys = new ArrayList<String>();
      keys.add(valueKey);
      deferredValue.tags.forEach(tag -> keys.add(toKey(TAG_KIND, tag)));
      var ttlArgument =
          deferredValue.ttl != null
              ? encode(Long.toString(deferredValue.ttl.toMillis()))
              : NO_EXPIRY.duplicate();
      boolean saved =
          execute(
              () ->
                  Script.SAVE
                      .evalOn(commands())
                      .getAsBoolean(keys, List.of(deferredValue.value.duplicate(), ttlArgument)));
      if (!saved) {
        logger.log(Level.WARNING, () -> "Redis refused to save <" + valueKey + ">");
        committedAll = false;
      }
    }
    return committedAll;
  }

  @Override
  public boolean delete(String key) throws IOException {
    requireNonNull(key);
    boolean removedDeferred;
    synchronized (lock) {
      removedDeferred = deferred.remove(key) != null;
    }
    long deleted = execute(() -> commands().del(toKey(VALUE_KIND, key)));
    return deleted > 0 || removedDeferred;
  }

  @Override
  public boolean invalidateTags(Set<String> tags) throws IOException {
    tags.forEach(Utils::requireValidTag);
    if (tags.isEmpty()) {
      return true;
    }

    synchronized (lock) {
      deferred.values().removeIf(value -> value.tags.stream().anyMatch(tags::contains));
    }
    var tagKeys = new ArrayList<String>();
    tags.forEach(tag -> tagKeys.add(toKey(TAG_KIND, tag)));
    return execute(
        () -> Script.INVALIDATE_TAGS.evalOn(commands()).getAsBoolean(tagKeys, List.of()));
  }

  /**
   * Removes the keys of expired values from tag sets. Values themselves are expired by Redis, so
   * there's nothing else to prune.
   */
  @Override
  public void prune() throws IOException {
    var tagKeys = scan(toKeyPattern(TAG_KIND));
    long removed = 0;
    for (var tagKey : tagKeys) {
      removed +=
          execute(() -> Script.PRUNE_TAG.evalOn(commands()).getAsLong(List.of(tagKey), List.of()));
    }
    long removedCount = removed;
    logger.log(
        Level.DEBUG,
        () -> "Pruned " + removedCount + " dangling keys from " + tagKeys.size() + " tag sets");
  }

  /** Removes all values and tag sets under this backend's namespace. */
  @Override
  public void clear() throws IOException {
    synchronized (lock) {
      deferred.clear();
    }
    for (var pattern : List.of(toKeyPattern(VALUE_KIND), toKeyPattern(TAG_KIND))) {
      var keys = scan(pattern);
      for (int i = 0; i < keys.size(); i += SCAN_LIMIT) {
        var batch = keys.subList(i, Math.min(i + SCAN_LIMIT, keys.size())).toArray(String[]::new);
        execute(() -> commands().del(batch));
      }
    }
  }

  private List<String> scan(String pattern) throws IOException {
    return execute(
        () -> {
          var keys = new ArrayList<String>();
          var scanArgs = ScanArgs.Builder.matches(pattern).limit(SCAN_LIMIT);
          ScanCursor cursor = ScanCursor.INITIAL;
          do {
            var keyScanCursor = commands().scan(cursor, scanArgs);
            for (var key : keyScanCursor.getKeys()) {
              // SCAN may return a key more than once.
              if (!keys.contains(key)) {
                keys.add(key);
              }
            }
            cursor = keyScanCursor;
          } while (!cursor.isFinished());
          return keys;
        });
  }

  @Override
  public void close() {
    synchronized (lock) {
      deferred.clear();
    }
    super.close();
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[namespace=" + namespace + "]";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private static final class DeferredValue {
    final ByteBuffer value;
    final @Nullable Duration ttl;
    final Set<String> tags;

    DeferredValue(ByteBuffer value, @Nullable Duration ttl, Set<String> tags) {
      this.value = value;
      this.ttl = ttl;
      this.tags = tags;
    }

    /** Returns whether the value would already be expired when written. */
    boolean isExpired() {
      return ttl != null && ttl.toMillis() <= 0;
    }
  }

  /** A builder of {@code RedisCacheBackend}. */
  public static final class Builder {
    private @MonotonicNonNull RedisConnectionProvider connectionProvider;
    private String namespace = DEFAULT_NAMESPACE;

    Builder() {}

    /** Specifies the URI of the Redis Standalone instance. */
    @CanIgnoreReturnValue
    public Builder standalone(RedisURI redisUri) {
      return standalone(new RedisClientConnectionProvider(redisUri, RedisClient.create(), true));
    }

    /** Specifies the URI of the Redis Standalone instance and the client used to connect to it. */
    @CanIgnoreReturnValue
    public Builder standalone(RedisURI redisUri, RedisClient client) {
      return standalone(new RedisClientConnectionProvider(redisUri, client, false));
    }

    /** Specifies the connection provider used to connect to the Redis Standalone instance. */
    @CanIgnoreReturnValue
    public Builder standalone(RedisConnectionProvider connectionProvider) {
      this.connectionProvider = requireNonNull(connectionProvider);
      return this;
    }

    /**
     * Specifies the prefix of all keys written by the backend. Backends with different namespaces
     * can share the same Redis instance.
     *
     * @throws IllegalArgumentException if the namespace has characters other than letters, digits,
     *     {@code '_'}, {@code '.'} or {@code '-'}
     */
    @CanIgnoreReturnValue
    public Builder namespace(String namespace) {
      this.namespace = requireValidNamespace(namespace);
      return this;
    }

    /**
     * Connects to Redis and creates a new {@code RedisCacheBackend}.
     *
     * @throws IllegalStateException if no Redis instance is specified
     * @throws IOException if connecting to Redis fails
     */
    public RedisCacheBackend build() throws IOException {
      var connectionProvider = this.connectionProvider;
      if (connectionProvider == null) {
        throw new IllegalStateException("A Redis Standalone instance must be specified");
      }
      try {
        return new RedisCacheBackend(connect(connectionProvider), connectionProvider, namespace);
      } catch (IOException | RuntimeException e) {
        connectionProvider.close();
        throw e;
      }
    }
  }
}
