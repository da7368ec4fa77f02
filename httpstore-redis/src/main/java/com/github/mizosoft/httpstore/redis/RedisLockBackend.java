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

import static com.github.mizosoft.httpstore.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.LockBackend;
import com.github.mizosoft.httpstore.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link LockBackend} whose locks are Redis keys set with {@code NX} to a random token. A lock
 * expires after a configurable time-to-live, so a crashed holder can't keep it forever. Releasing
 * deletes the key only if it still holds the holder's token.
 */
public final class RedisLockBackend extends AbstractRedisBackend implements LockBackend {
  private static final Logger logger = System.getLogger(RedisLockBackend.class.getName());

  static final Duration DEFAULT_LOCK_TTL = Duration.ofSeconds(300);

  private static final String LOCK_KIND = "lock";

  private final Duration lockTtl;

  private RedisLockBackend(
      StatefulRedisConnection<String, ByteBuffer> connection,
      RedisConnectionProvider connectionProvider,
      String namespace,
      Duration lockTtl) {
    super(connection, connectionProvider, namespace);
    this.lockTtl = lockTtl;
  }

  Duration lockTtl() {
    return lockTtl;
  }

  @Override
  public Lock createLock(String name) {
    requireNonNull(name);
    requireNotClosed();
    return new RedisLock(name);
  }

  @Override
  public void close() {
    super.close();
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[namespace="
        + namespace
        + ", lockTtl="
        + lockTtl
        + "]";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private final class RedisLock implements Lock {
    private final String name;
    private final String key;
    private final Object stateLock = new Object();

    @GuardedBy("stateLock")
    private @Nullable String token;

    RedisLock(String name) {
      this.name = name;
      this.key = toKey(LOCK_KIND, name);
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public boolean acquire() throws IOException {
      synchronized (stateLock) {
        if (token != null) {
          return false;
        }
        var newToken = UUID.randomUUID().toString();
        var reply =
            execute(
                () ->
                    commands()
                        .set(key, encode(newToken), SetArgs.Builder.nx().px(lockTtl.toMillis())));
        if (!"OK".equals(reply)) {
          return false;
        }
        token = newToken;
        return true;
      }
    }

    @Override
    public void release() throws IOException {
      synchronized (stateLock) {
        var currentToken = token;
        if (currentToken == null) {
          throw new IOException("Lock <" + name + "> isn't acquired");
        }
        token = null;
        boolean released =
            execute(
                () ->
                    Script.RELEASE_LOCK
                            .evalOn(commands())
                            .getAsLong(List.of(key), List.of(encode(currentToken)))
                        > 0);
        if (!released) {
          throw new IOException("Lock <" + name + "> was lost");
        }
      }
    }

    /** Returns whether this handle still holds the lock according to Redis. */
    @Override
    public boolean isAcquired() {
      synchronized (stateLock) {
        var currentToken = token;
        if (currentToken == null || closed.get()) {
          return false;
        }
        try {
          var value = commands().get(key);
          return value != null && currentToken.equals(decode(value));
        } catch (RedisException e) {
          logger.log(Level.WARNING, "Couldn't check lock <" + name + ">", e);
          return false;
        }
      }
    }
  }

  /** A builder of {@code RedisLockBackend}. */
  public static final class Builder {
    private @MonotonicNonNull RedisConnectionProvider connectionProvider;
    private String namespace = DEFAULT_NAMESPACE;
    private Duration lockTtl = DEFAULT_LOCK_TTL;

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

    /** Specifies the prefix of all lock keys. */
    @CanIgnoreReturnValue
    public Builder namespace(String namespace) {
      this.namespace = requireValidNamespace(namespace);
      return this;
    }

    /**
     * Specifies how long a lock is held before it expires if not released. The default is 300
     * seconds.
     *
     * @throws IllegalArgumentException if the given duration isn't at least one millisecond
     */
    @CanIgnoreReturnValue
    public Builder lockTtl(Duration lockTtl) {
      requireArgument(lockTtl.toMillis() > 0, "non-positive lock ttl: %s", lockTtl);
      this.lockTtl = lockTtl;
      return this;
    }

    /**
     * Connects to Redis and creates a new {@code RedisLockBackend}.
     *
     * @throws IllegalStateException if no Redis instance is specified
     * @throws IOException if connecting to Redis fails
     */
    public RedisLockBackend build() throws IOException {
      var connectionProvider = this.connectionProvider;
      if (connectionProvider == null) {
        throw new IllegalStateException("A Redis Standalone instance must be specified");
      }
      try {
        return new RedisLockBackend(
            connect(connectionProvider), connectionProvider, namespace, lockTtl);
      } catch (IOException | RuntimeException e) {
        connectionProvider.close();
        throw e;
      }
    }
  }
}
