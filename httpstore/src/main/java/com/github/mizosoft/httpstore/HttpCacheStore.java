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

package com.github.mizosoft.httpstore;

import static com.github.mizosoft.httpstore.internal.Validate.requireArgument;
import static com.github.mizosoft.httpstore.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.CacheBackend;
import com.github.mizosoft.httpstore.backend.CacheBackend.Capability;
import com.github.mizosoft.httpstore.backend.LockBackend;
import com.github.mizosoft.httpstore.internal.Utils;
import com.github.mizosoft.httpstore.internal.Validate;
import com.github.mizosoft.httpstore.internal.extensions.HeadersBuilder;
import com.github.mizosoft.httpstore.internal.store.CacheKeys;
import com.github.mizosoft.httpstore.internal.store.ContentStore;
import com.github.mizosoft.httpstore.internal.store.LockManager;
import com.github.mizosoft.httpstore.internal.store.MetadataEntry;
import com.github.mizosoft.httpstore.internal.store.VariantRecord;
import com.github.mizosoft.httpstore.internal.store.WriteCounter;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Closeable;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;

/**
 * An {@link HttpStore} that keeps responses in a {@link CacheBackend} and locks resources through
 * a {@link LockBackend}.
 *
 * <p>Each URI has a metadata entry holding its variants. Response bodies are stored separately
 * under their content digests, so identical bodies served for different URIs are stored once.
 * Writes are counted to periodically prune expired entries.
 *
 * <p>Concurrent writes of different variants of the same URI may lose updates, as metadata entries
 * are replaced as a whole. The proxy is expected to serialize writes to the same resource by
 * locking it.
 */
public final class HttpCacheStore implements HttpStore {
  private static final Logger logger = System.getLogger(HttpCacheStore.class.getName());

  static final String DEFAULT_CACHE_TAGS_HEADER = "Cache-Tags";
  static final int DEFAULT_PRUNE_THRESHOLD = 500;
  static final String CACHE_DIRECTORY_NAME = "http_cache";
  static final String LOCK_DIRECTORY_NAME = "locks";

  private final CacheBackend cacheBackend;
  private final Set<Capability> capabilities;
  private final LockManager lockManager;
  private final ContentStore contentStore;
  private final WriteCounter writeCounter;
  private final String cacheTagsHeader;
  private final boolean generateContentDigests;
  private final Clock clock;
  private final List<Closeable> ownedResources;
  private final AtomicBoolean closed = new AtomicBoolean();

  private HttpCacheStore(
      CacheBackend cacheBackend,
      LockBackend lockBackend,
      List<Closeable> ownedResources,
      Builder builder) {
    this.cacheBackend = cacheBackend;
    this.capabilities = Set.copyOf(cacheBackend.capabilities());
    this.lockManager = new LockManager(lockBackend);
    this.contentStore =
        new ContentStore(cacheBackend, builder.generateContentDigests, builder.gzipLevel);
    this.writeCounter = new WriteCounter(cacheBackend, builder.pruneThreshold);
    this.cacheTagsHeader = builder.cacheTagsHeader;
    this.generateContentDigests = builder.generateContentDigests;
    this.clock = builder.clock;
    this.ownedResources = List.copyOf(ownedResources);
  }

  /** Returns the backend this store keeps responses in. */
  public CacheBackend cacheBackend() {
    return cacheBackend;
  }

  @Override
  public Optional<ProxyResponse> lookup(ProxyRequest request) throws IOException {
    var entry = getEntry(CacheKeys.cacheKey(request));
    if (entry.isEmpty()) {
      return Optional.empty();
    }

    for (var variant : entry.get().variants().entrySet()) {
      var varyKey = variant.getKey();
      var record = variant.getValue();
      if (varyKey.equals(CacheKeys.NON_VARYING_KEY)
          || varyKey.equals(CacheKeys.varyKey(record.vary(), request))) {
        return contentStore.restore(record, request);
      }
    }
    return Optional.empty();
  }

  @Override
  public String write(ProxyRequest request, ProxyResponse response) throws IOException {
    var maxAge = response.maxAge(clock);
    requireArgument(maxAge.isPresent(), "Response has no max-age: %s", response);

    var tags = extractTags(response);
    var digest = contentStore.ensureStored(response, maxAge.get());
    var cacheKey = CacheKeys.cacheKey(request);
    var entry = getEntry(cacheKey).orElseGet(MetadataEntry::empty);

    var headers = new HeadersBuilder();
    headers.addAll(response.headers());
    headers.remove("Age");
    var vary = response.vary();
    var inlineContent = digest.isEmpty() ? response.body() : null;
    if (vary.isEmpty()) {
      // A non-varying record can't coexist with varying ones.
      entry.clear();
    }
    entry.put(
        CacheKeys.varyKey(vary, request),
        new VariantRecord(
            vary,
            headers.build(),
            response.statusCode(),
            request.normalizedUri(),
            inlineContent));
    if (!vary.isEmpty()) {
      entry.remove(CacheKeys.NON_VARYING_KEY);
    }

    if (writeCounter.countWrite()) {
      prune();
    }

    boolean saved = cacheBackend.saveDeferred(cacheKey, entry.encode(), maxAge.get(), tags);
    boolean committed = cacheBackend.commit();
    if (!saved || !committed) {
      logger.log(Level.WARNING, () -> "Couldn't persist all values written for " + request);
    }
    return cacheKey;
  }

  private Set<String> extractTags(ProxyResponse response) {
    var tags = new LinkedHashSet<String>();
    for (var value : response.headerValues(cacheTagsHeader)) {
      for (var tag : value.split(",")) {
        var trimmedTag = tag.trim();
        if (trimmedTag.isEmpty()) {
          continue;
        }
        if (Utils.isValidTag(trimmedTag)) {
          tags.add(trimmedTag);
        } else {
          logger.log(Level.DEBUG, () -> "Ignoring illegal tag: '" + trimmedTag + "'");
        }
      }
    }
    if (!tags.isEmpty() && !capabilities.contains(Capability.TAGS)) {
      logger.log(Level.DEBUG, () -> "Ignoring tags as " + cacheBackend + " doesn't support them");
      return Set.of();
    }
    return tags;
  }

  @Override
  public void invalidate(ProxyRequest request) throws IOException {
    cacheBackend.delete(CacheKeys.cacheKey(request));
  }

  @Override
  public boolean purge(String url) throws IOException {
    return cacheBackend.delete(CacheKeys.cacheKey(ProxyRequest.create(url)));
  }

  @Override
  public boolean invalidateTags(Collection<String> tags) throws IOException {
    requireState(
        capabilities.contains(Capability.TAGS),
        "Cannot invalidate tags on a cache backend that doesn't support tags: %s",
        cacheBackend);
    try {
      return cacheBackend.invalidateTags(Set.copyOf(tags));
    } catch (IllegalArgumentException e) {
      logger.log(Level.DEBUG, () -> "Tags rejected by " + cacheBackend + ": " + tags, e);
      return false;
    }
  }

  @Override
  public void prune() throws IOException {
    if (capabilities.contains(Capability.PRUNE)) {
      lockManager.runExclusively(LockManager.PRUNE_LOCK, cacheBackend::prune);
    }
  }

  @Override
  public void clear() throws IOException {
    if (capabilities.contains(Capability.CLEAR)) {
      lockManager.runExclusively(LockManager.CLEANUP_LOCK, cacheBackend::clear);
    }
  }

  @Override
  public boolean lock(ProxyRequest request) throws IOException {
    return lockManager.tryLock(CacheKeys.cacheKey(request));
  }

  @Override
  public boolean unlock(ProxyRequest request) {
    return lockManager.unlock(CacheKeys.cacheKey(request));
  }

  @Override
  public boolean isLocked(ProxyRequest request) {
    return lockManager.isLocked(CacheKeys.cacheKey(request));
  }

  @Override
  public void cleanup() {
    lockManager.releaseAll();
  }

  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    lockManager.releaseAll();
    IOException closeFailure = null;
    for (var resource : ownedResources) {
      try {
        resource.close();
      } catch (IOException e) {
        if (closeFailure == null) {
          closeFailure = e;
        } else {
          closeFailure.addSuppressed(e);
        }
      }
    }
    if (closeFailure != null) {
      throw closeFailure;
    }
  }

  private Optional<MetadataEntry> getEntry(String cacheKey) throws IOException {
    var value = cacheBackend.get(cacheKey);
    if (value.isEmpty()) {
      return Optional.empty();
    }

    try {
      return Optional.of(MetadataEntry.decode(value.get()));
    } catch (IOException e) {
      logger.log(Level.WARNING, () -> "Deleting unrecoverable metadata entry: " + cacheKey, e);
      cacheBackend.delete(cacheKey);
      return Optional.empty();
    }
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[cacheBackend="
        + cacheBackend
        + ", generateContentDigests="
        + generateContentDigests
        + "]";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code HttpCacheStore} instances. */
  public static final class Builder {
    @MonotonicNonNull Path directory;
    @MonotonicNonNull CacheBackend cacheBackend;
    @MonotonicNonNull LockBackend lockBackend;
    int pruneThreshold = DEFAULT_PRUNE_THRESHOLD;
    String cacheTagsHeader = DEFAULT_CACHE_TAGS_HEADER;
    boolean generateContentDigests = true;
    int gzipLevel;
    Clock clock = Utils.systemMillisUtc();

    Builder() {}

    /**
     * Sets the directory under which the default backends keep their files. The default cache
     * backend stores values under {@code <directory>/http_cache} and supports tags. The default
     * lock backend keeps its lock files under {@code <directory>/locks}.
     */
    @CanIgnoreReturnValue
    public Builder directory(Path directory) {
      this.directory = requireNonNull(directory);
      return this;
    }

    /**
     * Sets the backend responses are stored in. The backend's locking scope should match that of
     * the lock backend.
     */
    @CanIgnoreReturnValue
    public Builder cacheBackend(CacheBackend cacheBackend) {
      this.cacheBackend = requireNonNull(cacheBackend);
      return this;
    }

    /** Sets the backend resources are locked through. */
    @CanIgnoreReturnValue
    public Builder lockBackend(LockBackend lockBackend) {
      this.lockBackend = requireNonNull(lockBackend);
      return this;
    }

    /**
     * Sets the number of writes after which expired entries are pruned. The default is 500. Zero
     * disables automatic pruning.
     */
    @CanIgnoreReturnValue
    public Builder pruneThreshold(int pruneThreshold) {
      this.pruneThreshold = Validate.requireNonNegative(pruneThreshold, "pruneThreshold");
      return this;
    }

    /**
     * Sets the response header listing the comma-separated tags of a response. The default is
     * {@code Cache-Tags}.
     */
    @CanIgnoreReturnValue
    public Builder cacheTagsHeader(String cacheTagsHeader) {
      this.cacheTagsHeader = Utils.requireValidHeaderName(cacheTagsHeader);
      return this;
    }

    /**
     * Sets whether bodies are stored under their content digests, which is the default. Otherwise,
     * each variant carries its own copy of the body. Bodies of file-backed responses are always
     * stored under their digests.
     */
    @CanIgnoreReturnValue
    public Builder generateContentDigests(boolean generateContentDigests) {
      this.generateContentDigests = generateContentDigests;
      return this;
    }

    /**
     * Sets the level with which stored bodies are gzip-encoded, from 0 to 9. Zero, the default,
     * disables encoding.
     */
    @CanIgnoreReturnValue
    public Builder gzipLevel(int gzipLevel) {
      requireArgument(gzipLevel >= 0 && gzipLevel <= 9, "gzipLevel not in [0, 9]: %d", gzipLevel);
      this.gzipLevel = gzipLevel;
      return this;
    }

    @CanIgnoreReturnValue
    Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    /**
     * Creates a new {@code HttpCacheStore}.
     *
     * @throws IllegalStateException if neither a directory nor both backends are set
     * @throws IOException if a default backend couldn't be created
     */
    public HttpCacheStore build() throws IOException {
      var ownedResources = new ArrayList<Closeable>();
      var cacheBackend = this.cacheBackend;
      var lockBackend = this.lockBackend;
      try {
        if (cacheBackend == null) {
          var cacheDirectory = requireDirectory("cache backend").resolve(CACHE_DIRECTORY_NAME);
          cacheBackend = CacheBackend.withTags(CacheBackend.onDisk(cacheDirectory));
          ownedResources.add(cacheBackend);
        }
        if (lockBackend == null) {
          lockBackend =
              LockBackend.onDisk(requireDirectory("lock backend").resolve(LOCK_DIRECTORY_NAME));
          ownedResources.add(lockBackend);
        }
      } catch (IOException | RuntimeException e) {
        ownedResources.forEach(Utils::closeQuietly);
        throw e;
      }
      return new HttpCacheStore(cacheBackend, lockBackend, ownedResources, this);
    }

    private Path requireDirectory(String missingOption) {
      var directory = this.directory;
      requireState(
          directory != null,
          "The directory option is required unless you set the %s explicitly",
          missingOption);
      return directory;
    }
  }
}
