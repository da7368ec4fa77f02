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

package com.github.mizosoft.httpstore.backend;

import com.github.mizosoft.httpstore.internal.Utils;
import com.github.mizosoft.httpstore.internal.backend.FileSystemCacheBackend;
import com.github.mizosoft.httpstore.internal.backend.MemoryCacheBackend;
import com.github.mizosoft.httpstore.internal.backend.TagAwareCacheBackend;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A key-value repository of binary values, possibly shared by many processes. Values can be saved
 * with a time-to-live and a set of tags. Saves can be deferred to be written as a batch on {@link
 * #commit()}. A deferred value is visible to {@link #get(String)} on the same instance before it's
 * committed.
 *
 * <p>Optional operations are advertised by {@link #capabilities()}. Calling an operation whose
 * capability isn't advertised throws {@code UnsupportedOperationException}.
 *
 * <p>{@code CacheBackend} is thread-safe and is suitable for concurrent use.
 */
public interface CacheBackend extends Closeable {

  /** Returns the optional operations supported by this backend. */
  Set<Capability> capabilities();

  /** Returns the value associated with the given key, unless it's absent or expired. */
  Optional<ByteBuffer> get(String key) throws IOException;

  /**
   * Defers saving the given value under the given key till the next {@link #commit()}. A {@code
   * null} time-to-live denotes a value that never expires.
   *
   * @return {@code false} if this backend refuses to save the value
   * @throws IllegalArgumentException if any of the given tags is invalid
   */
  @CanIgnoreReturnValue
  boolean saveDeferred(String key, ByteBuffer value, @Nullable Duration ttl, Set<String> tags)
      throws IOException;

  /** Defers saving the given value with no expiry and no tags. */
  @CanIgnoreReturnValue
  default boolean saveDeferred(String key, ByteBuffer value) throws IOException {
    return saveDeferred(key, value, null, Set.of());
  }

  /**
   * Writes all deferred values.
   *
   * @return {@code false} if any of the deferred values couldn't be written
   */
  @CanIgnoreReturnValue
  boolean commit() throws IOException;

  /** Deletes the value associated with the given key, returning whether such value existed. */
  @CanIgnoreReturnValue
  boolean delete(String key) throws IOException;

  /**
   * Invalidates all values tagged with any of the given tags.
   *
   * @throws IllegalArgumentException if any of the given tags is invalid
   * @throws UnsupportedOperationException if this backend doesn't support {@link Capability#TAGS}
   */
  @CanIgnoreReturnValue
  default boolean invalidateTags(Set<String> tags) throws IOException {
    throw new UnsupportedOperationException("tags are not supported by " + this);
  }

  /**
   * Removes expired values.
   *
   * @throws UnsupportedOperationException if this backend doesn't support {@link Capability#PRUNE}
   */
  default void prune() throws IOException {
    throw new UnsupportedOperationException("pruning is not supported by " + this);
  }

  /**
   * Removes all values.
   *
   * @throws UnsupportedOperationException if this backend doesn't support {@link Capability#CLEAR}
   */
  default void clear() throws IOException {
    throw new UnsupportedOperationException("clearing is not supported by " + this);
  }

  /** Releases any resources held by this backend. Uncommitted deferred values are lost. */
  @Override
  void close() throws IOException;

  /** Checks that the given tag is non-empty and contains none of the reserved characters. */
  static String requireValidTag(String tag) {
    return Utils.requireValidTag(tag);
  }

  /** Returns a new backend that keeps values in memory. */
  static CacheBackend inMemory() {
    return new MemoryCacheBackend(Utils.systemMillisUtc());
  }

  /** Returns a new backend that keeps values in memory, using the given clock for expiry. */
  static CacheBackend inMemory(Clock clock) {
    return new MemoryCacheBackend(clock);
  }

  /** Returns a new backend that keeps each value in its own file under the given directory. */
  static CacheBackend onDisk(Path directory) throws IOException {
    return FileSystemCacheBackend.open(directory, Utils.systemMillisUtc());
  }

  /**
   * Returns a backend that adds tag support to the given backend. The given backend is returned if
   * it already supports tags.
   */
  static CacheBackend withTags(CacheBackend backend) {
    return backend.capabilities().contains(Capability.TAGS)
        ? backend
        : new TagAwareCacheBackend(backend);
  }

  /** An optional operation a backend might support. */
  enum Capability {
    /** Invalidation of values by tags. */
    TAGS,

    /** Removal of expired values. */
    PRUNE,

    /** Removal of all values. */
    CLEAR
  }
}
