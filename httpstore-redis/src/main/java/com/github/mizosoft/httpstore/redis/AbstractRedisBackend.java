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
import static com.github.mizosoft.httpstore.internal.Validate.requireState;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.internal.Utils;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/** Connection and key-space handling shared by the Redis backends. */
abstract class AbstractRedisBackend {
  static final String DEFAULT_NAMESPACE = "httpstore";

  private static final Pattern NAMESPACE_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+");

  final StatefulRedisConnection<String, ByteBuffer> connection;
  final RedisConnectionProvider connectionProvider;
  final String namespace;
  final AtomicBoolean closed = new AtomicBoolean();

  AbstractRedisBackend(
      StatefulRedisConnection<String, ByteBuffer> connection,
      RedisConnectionProvider connectionProvider,
      String namespace) {
    this.connection = requireNonNull(connection);
    this.connectionProvider = requireNonNull(connectionProvider);
    this.namespace = requireValidNamespace(namespace);
  }

  RedisCommands<String, ByteBuffer> commands() {
    return connection.sync();
  }

  String toKey(String kind, String name) {
    return namespace + ":" + kind + ":" + name;
  }

  String toKeyPattern(String kind) {
    return namespace + ":" + kind + ":*";
  }

  /** Runs the given Redis call, translating Lettuce's unchecked failures to {@code IOException}. */
  <T> T execute(Supplier<T> call) throws IOException {
    requireNotClosed();
    try {
      return call.get();
    } catch (RedisException e) {
      throw new IOException(e.getMessage(), e);
    }
  }

  void requireNotClosed() {
    requireState(!closed.get(), "closed");
  }

  void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try (connectionProvider) {
      connectionProvider.release(connection);
    }
  }

  static String requireValidNamespace(String namespace) {
    requireArgument(
        NAMESPACE_PATTERN.matcher(namespace).matches(), "illegal namespace: '%s'", namespace);
    return namespace;
  }

  static ByteBuffer encode(String value) {
    return UTF_8.encode(value);
  }

  static String decode(ByteBuffer value) {
    return UTF_8.decode(value.duplicate()).toString();
  }

  /** Connects using the given provider, waiting for the connection to be established. */
  static StatefulRedisConnection<String, ByteBuffer> connect(
      RedisConnectionProvider connectionProvider) throws IOException {
    try {
      return Utils.get(connectionProvider.connectAsync().toCompletableFuture());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw Utils.toInterruptedIOException(e);
    } catch (RedisException e) {
      throw new IOException(e.getMessage(), e);
    }
  }
}
