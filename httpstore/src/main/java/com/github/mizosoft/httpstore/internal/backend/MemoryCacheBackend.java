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

package com.github.mizosoft.httpstore.internal.backend;

import static com.github.mizosoft.httpstore.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.CacheBackend;
import com.github.mizosoft.httpstore.internal.Utils;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** {@link CacheBackend} implementation that keeps values in memory. */
public final class MemoryCacheBackend implements CacheBackend {
  private static final Set<Capability> CAPABILITIES =
      Set.copyOf(EnumSet.allOf(Capability.class));

  private final Clock clock;
  private final Object lock = new Object();

  @GuardedBy("lock")
  private final Map<String, Entry> entries = new HashMap<>();

  @GuardedBy("lock")
  private final Map<String, Entry> deferred = new LinkedHashMap<>();

  /** Maps each tag to the keys of the committed entries tagged with it. */
  @GuardedBy("lock")
  private final Map<String, Set<String>> tagIndex = new HashMap<>();

  @GuardedBy("lock")
  private boolean closed;

  public MemoryCacheBackend(Clock clock) {
    this.clock = requireNonNull(clock);
  }

  @Override
  public Set<Capability> capabilities() {
    return CAPABILITIES;
  }

  @Override
  public Optional<ByteBuffer> get(String key) {
    requireNonNull(key);
    synchronized (lock) {
      requireNotClosed();
      var entry = deferred.get(key);
      if (entry == null) {
        entry = entries.get(key);
      }
      return entry != null && !entry.isExpired(clock.millis())
          ? Optional.of(entry.value.duplicate())
          : Optional.empty();
    }
  }

  @Override
  public boolean saveDeferred(
      String key, ByteBuffer value, @Nullable Duration ttl, Set<String> tags) {
    requireNonNull(key);
    tags.forEach(Utils::requireValidTag);
    long expiresAt =
        ttl != null
            ? clock.millis() + Utils.requireNonNegativeDuration(ttl).toMillis()
            : Long.MAX_VALUE;
    var entry = new Entry(key, Utils.copy(value), expiresAt, Set.copyOf(tags));
    synchronized (lock) {
      requireNotClosed();
      deferred.put(key, entry);
    }
    return true;
  }

  @Override
  public boolean commit() {
    synchronized (lock) {
      requireNotClosed();
      for (var entry : deferred.values()) {
        var oldEntry = entries.put(entry.key, entry);
        if (oldEntry != null) {
          unindex(oldEntry);
        }
        for (var tag : entry.tags) {
          tagIndex.computeIfAbsent(tag, __ -> new HashSet<>()).add(entry.key);
        }
      }
      deferred.clear();
    }
    return true;
  }

  @Override
  public boolean delete(String key) {
    requireNonNull(key);
    synchronized (lock) {
      requireNotClosed();
      boolean removedDeferred = deferred.remove(key) != null;
      var entry = entries.remove(key);
      if (entry != null) {
        unindex(entry);
      }
      return entry != null || removedDeferred;
    }
  }

  @Override
  public boolean invalidateTags(Set<String> tags) {
    tags.forEach(Utils::requireValidTag);
    synchronized (lock) {
      requireNotClosed();
      for (var tag : tags) {
        var keys = tagIndex.remove(tag);
        if (keys != null) {
          for (var key : keys) {
            var entry = entries.remove(key);
            if (entry != null) {
              unindex(entry);
            }
          }
        }
      }
      deferred.values().removeIf(entry -> entry.tags.stream().anyMatch(tags::contains));
    }
    return true;
  }

  @Override
  public void prune() {
    synchronized (lock) {
      requireNotClosed();
      long now = clock.millis();
      var iter = entries.values().iterator();
      while (iter.hasNext()) {
        var entry = iter.next();
        if (entry.isExpired(now)) {
          iter.remove();
          unindex(entry);
        }
      }
    }
  }

  @Override
  public void clear() {
    synchronized (lock) {
      requireNotClosed();
      entries.clear();
      deferred.clear();
      tagIndex.clear();
    }
  }

  /** Returns the number of committed entries, including those that are expired but not pruned. */
  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  @Override
  public void close() {
    synchronized (lock) {
      closed = true;
      entries.clear();
      deferred.clear();
      tagIndex.clear();
    }
  }

  @GuardedBy("lock")
  private void unindex(Entry entry) {
    for (var tag : entry.tags) {
      var keys = tagIndex.get(tag);
      if (keys != null && keys.remove(entry.key) && keys.isEmpty()) {
        tagIndex.remove(tag);
      }
    }
  }

  @GuardedBy("lock")
  private void requireNotClosed() {
    requireState(!closed, "closed");
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this);
  }

  private static final class Entry {
    final String key;
    final ByteBuffer value;
    final long expiresAt;
    final Set<String> tags;

    Entry(String key, ByteBuffer value, long expiresAt, Set<String> tags) {
      this.key = key;
      this.value = value;
      this.expiresAt = expiresAt;
      this.tags = tags;
    }

    boolean isExpired(long now) {
      return now >= expiresAt;
    }
  }
}
