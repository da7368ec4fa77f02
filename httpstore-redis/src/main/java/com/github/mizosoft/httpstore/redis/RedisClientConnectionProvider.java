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

import com.github.mizosoft.httpstore.internal.Utils;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.codec.StringCodec;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletionStage;

/** A {@link RedisConnectionProvider} that creates connections using a {@link RedisClient}. */
final class RedisClientConnectionProvider implements RedisConnectionProvider {
  private static final RedisCodec<String, ByteBuffer> CODEC =
      RedisCodec.of(StringCodec.UTF8, ByteBufferCodec.INSTANCE);

  private final RedisURI redisUri;
  private final RedisClient client;
  private final boolean closeClient;

  RedisClientConnectionProvider(RedisURI redisUri, RedisClient client, boolean closeClient) {
    this.redisUri = requireNonNull(redisUri);
    this.client = requireNonNull(client);
    this.closeClient = closeClient;
  }

  @Override
  public CompletionStage<StatefulRedisConnection<String, ByteBuffer>> connectAsync() {
    return client.connectAsync(CODEC, redisUri);
  }

  @Override
  public void release(StatefulRedisConnection<String, ByteBuffer> connection) {
    connection.close();
  }

  @Override
  public void close() {
    if (closeClient) {
      client.close();
    }
  }

  private enum ByteBufferCodec implements RedisCodec<ByteBuffer, ByteBuffer> {
    INSTANCE;

    @Override
    public ByteBuffer decodeKey(ByteBuffer bytes) {
      return Utils.copy(bytes);
    }

    @Override
    public ByteBuffer decodeValue(ByteBuffer bytes) {
      return Utils.copy(bytes);
    }

    @Override
    public ByteBuffer encodeKey(ByteBuffer key) {
      return Utils.copy(key);
    }

    @Override
    public ByteBuffer encodeValue(ByteBuffer value) {
      return Utils.copy(value);
    }
  }
}
