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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.CacheBackend;
import com.github.mizosoft.httpstore.internal.Utils;
import com.github.mizosoft.httpstore.internal.codec.ValueReader;
import com.github.mizosoft.httpstore.internal.codec.ValueWriter;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link CacheBackend} that adds tag support to a backend that lacks it. Each tag has a version
 * stored in the delegate under {@code tag-version:<tag>}. A value is saved along with the versions
 * of its tags at the time it's saved, and is only visible while all these versions are current.
 * Invalidating a tag replaces its version with a new random one, which makes all values tagged
 * with the old version read as misses till they expire.
 *
 * <p>A version expires no sooner than the last value saved with it, so versions of tags that
 * are no longer used get pruned along with their values.
 */
public final class TagAwareCacheBackend implements CacheBackend {
  private static final Logger logger = System.getLogger(TagAwareCacheBackend.class.getName());

  static final String TAG_VERSION_KEY_PREFIX = "tag-version:";

  private static final byte[] ENVELOPE_MAGIC = "tg1".getBytes(US_ASCII);

  private final CacheBackend delegate;
  private final Set<Capability> capabilities;
  private final Clock clock;

  public TagAwareCacheBackend(CacheBackend delegate) {
    this(delegate, Utils.systemMillisUtc());
  }

  public TagAwareCacheBackend(CacheBackend delegate, Clock clock) {
    this.delegate = requireNonNull(delegate);
    this.clock = requireNonNull(clock);
    var capabilities = EnumSet.of(Capability.TAGS);
    capabilities.addAll(delegate.capabilities());
    this.capabilities = Set.copyOf(capabilities);
  }

  public CacheBackend delegate() {
    return delegate;
  }

  @Override
  public Set<Capability> capabilities() {
    return capabilities;
  }

  @Override
  public Optional<ByteBuffer> get(String key) throws IOException {
    var envelope = delegate.get(key);
    if (envelope.isEmpty()) {
      return Optional.empty();
    }

    var reader = new ValueReader(envelope.get());
    if (!reader.consumePrefix(ENVELOPE_MAGIC)) {
      return envelope; // Not saved through a TagAwareCacheBackend.
    }

    try {
      for (int i = 0, count = reader.readInt(); i < count; i++) {
        var tag = reader.readUtf8String();
        long version = reader.readLong();
        var currentVersion = currentVersion(tag);
        if (currentVersion.isEmpty() || currentVersion.get().value != version) {
          return Optional.empty(); // Invalidated.
        }
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, () -> "Corrupt tagged value for key: " + key, e);
      return Optional.empty();
    }
    return Optional.of(reader.readRemaining());
  }

  @Override
  public boolean saveDeferred(
      String key, ByteBuffer value, @Nullable Duration ttl, Set<String> tags) throws IOException {
    requireNonNull(key);
    tags.forEach(Utils::requireValidTag);
    long now = clock.millis();
    long expiresAt = expiresAt(now, ttl);
    var versions = new LinkedHashMap<String, Long>();
    for (var tag : tags) {
      var version = currentVersion(tag);
      if (version.isPresent()) {
        // Extend the version's lifetime to cover the new value.
        if (version.get().expiresAt < expiresAt
            && !saveVersion(tag, new TagVersion(version.get().value, expiresAt), now)) {
          return false;
        }
        versions.put(tag, version.get().value);
      } else {
        var newVersion = new TagVersion(ThreadLocalRandom.current().nextLong(), expiresAt);
        if (!saveVersion(tag, newVersion, now)) {
          return false;
        }
        versions.put(tag, newVersion.value);
      }
    }
    return delegate.saveDeferred(key, envelope(versions, value), ttl, Set.of());
  }

  @Override
  public boolean commit() throws IOException {
    return delegate.commit();
  }

  @Override
  public boolean delete(String key) throws IOException {
    return delegate.delete(key);
  }

  @Override
  public boolean invalidateTags(Set<String> tags) throws IOException {
    tags.forEach(Utils::requireValidTag);
    long now = clock.millis();
    boolean saved = true;
    for (var tag : tags) {
      // A tag with no current version has no visible values to invalidate.
      var version = currentVersion(tag);
      if (version.isPresent()) {
        saved &=
            saveVersion(
                tag,
                new TagVersion(ThreadLocalRandom.current().nextLong(), version.get().expiresAt),
                now);
      }
    }
    return delegate.commit() && saved;
  }

  @Override
  public void prune() throws IOException {
    delegate.prune();
  }

  @Override
  public void clear() throws IOException {
    delegate.clear();
  }

  @Override
  public void close() throws IOException {
    delegate.close();
  }

  private Optional<TagVersion> currentVersion(String tag) throws IOException {
    var value = delegate.get(TAG_VERSION_KEY_PREFIX + tag);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    try {
      var reader = new ValueReader(value.get());
      long version = reader.readLong();
      long expiresAt = reader.hasRemaining() ? reader.readLong() : Long.MAX_VALUE;
      return Optional.of(new TagVersion(version, expiresAt));
    } catch (IOException e) {
      logger.log(Level.WARNING, () -> "Corrupt version of tag: " + tag, e);
      return Optional.empty();
    }
  }

  private boolean saveVersion(String tag, TagVersion version, long now) throws IOException {
    var ttl =
        version.expiresAt != Long.MAX_VALUE
            ? Duration.ofMillis(Math.max(1, version.expiresAt - now))
            : null;
    return delegate.saveDeferred(
        TAG_VERSION_KEY_PREFIX + tag,
        new ValueWriter().writeLong(version.value).writeLong(version.expiresAt).snapshot(),
        ttl,
        Set.of());
  }

  /** Returns the epoch millis at which a value saved now with the given TTL expires. */
  private static long expiresAt(long now, @Nullable Duration ttl) {
    if (ttl == null) {
      return Long.MAX_VALUE;
    }
    try {
      return Math.addExact(now, ttl.toMillis());
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private static ByteBuffer envelope(Map<String, Long> versions, ByteBuffer value) {
    var writer = new ValueWriter().writeRaw(ENVELOPE_MAGIC).writeInt(versions.size());
    versions.forEach((tag, version) -> writer.writeUtf8(tag).writeLong(version));
    return writer.writeRaw(Utils.toByteArray(value)).snapshot();
  }

  private static final class TagVersion {
    final long value;

    /** Epoch millis, or {@code Long.MAX_VALUE} if the version never expires. */
    final long expiresAt;

    TagVersion(long value, long expiresAt) {
      this.value = value;
      this.expiresAt = expiresAt;
    }
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[" + delegate + "]";
  }
}
