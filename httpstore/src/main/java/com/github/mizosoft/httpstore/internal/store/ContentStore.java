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

package com.github.mizosoft.httpstore.internal.store;

import static com.github.mizosoft.httpstore.internal.store.VariantRecord.CONTENT_DIGEST_HEADER;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.ProxyRequest;
import com.github.mizosoft.httpstore.ProxyResponse;
import com.github.mizosoft.httpstore.backend.CacheBackend;
import com.github.mizosoft.httpstore.internal.store.ContentEntry.Encoding;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Stores response bodies under their content digests, so that variants with identical bodies share
 * the same stored content. A content entry is retained for the largest max-age among the variants
 * written with it.
 */
public final class ContentStore {
  private static final Logger logger = System.getLogger(ContentStore.class.getName());

  private final CacheBackend backend;
  private final boolean digestsEnabled;
  private final int gzipLevel;

  public ContentStore(CacheBackend backend, boolean digestsEnabled, int gzipLevel) {
    this.backend = requireNonNull(backend);
    this.digestsEnabled = digestsEnabled;
    this.gzipLevel = gzipLevel;
  }

  /**
   * Makes sure the given response's content is stored under its digest, and marks the response
   * with that digest. Returns the response's digest, or an empty optional if the content is to be
   * inlined in the variant record. A response that's already marked is left as is.
   *
   * @throws IOException if the content couldn't be stored
   */
  public Optional<String> ensureStored(ProxyResponse response, Duration maxAge)
      throws IOException {
    var existingDigest = response.header(CONTENT_DIGEST_HEADER);
    if (existingDigest.isPresent()) {
      return existingDigest;
    }

    var maybeDigest = CacheKeys.contentDigest(response, digestsEnabled);
    if (maybeDigest.isEmpty()) {
      return Optional.empty();
    }

    var digest = maybeDigest.get();
    var storedEntry = get(digest);
    var entry = storedEntry.orElseGet(() -> newEntry(response));
    boolean persist = storedEntry.isEmpty();
    long maxAgeSeconds = maxAge.toSeconds();
    if (maxAgeSeconds > entry.expires()) {
      entry = entry.withExpires(maxAgeSeconds);
      persist = true;
    }
    if (persist
        && !backend.saveDeferred(
            digest, entry.encode(), Duration.ofSeconds(entry.expires()), Set.of())) {
      throw new IOException("Unable to store the entity");
    }

    response.setHeader(CONTENT_DIGEST_HEADER, digest);
    if (!response.hasHeader("Transfer-Encoding")) {
      var file = response.file();
      long contentLength = file.isPresent() ? Files.size(file.get()) : response.body().remaining();
      response.setHeader("Content-Length", Long.toString(contentLength));
    }
    return Optional.of(digest);
  }

  private ContentEntry newEntry(ProxyResponse response) {
    var file = response.file();
    if (file.isPresent()) {
      return ContentEntry.ofFile(0, file.get());
    }
    if (gzipLevel > 0 && !response.hasHeader("Content-Encoding")) {
      return ContentEntry.ofBody(0, Encoding.GZIP, GzipCodec.encode(response.body(), gzipLevel));
    }
    return ContentEntry.ofBody(0, Encoding.IDENTITY, response.body());
  }

  /**
   * Restores the response described by the given record, or returns an empty optional if its
   * content isn't available.
   */
  public Optional<ProxyResponse> restore(VariantRecord record, ProxyRequest request)
      throws IOException {
    var digest = record.contentDigest();
    if (digest.isEmpty()) {
      return record.inlineContent().map(content -> newResponse(record, content, false));
    }

    var maybeEntry = get(digest.get());
    if (maybeEntry.isEmpty()) {
      return Optional.empty();
    }

    var entry = maybeEntry.get();
    var file = entry.file();
    if (file.isPresent()) {
      if (!Files.exists(file.get())) {
        logger.log(
            Level.DEBUG, () -> "File of <" + record.uri() + "> no longer exists: " + file.get());
        return Optional.empty();
      }
      return Optional.of(
          ProxyResponse.newBuilder()
              .statusCode(record.statusCode())
              .headers(record.headers())
              .file(file.get())
              .build());
    }

    var body = entry.body().orElseThrow();
    if (entry.encoding() == Encoding.GZIP) {
      if (request.acceptsGzip()) {
        return Optional.of(newResponse(record, body, true));
      }
      try {
        body = GzipCodec.decode(body);
      } catch (IOException e) {
        logger.log(Level.WARNING, () -> "Couldn't decode content of <" + record.uri() + ">", e);
        return Optional.empty();
      }
    }
    return Optional.of(newResponse(record, body, false));
  }

  private Optional<ContentEntry> get(String digest) throws IOException {
    var value = backend.get(digest);
    if (value.isEmpty()) {
      return Optional.empty();
    }

    try {
      return Optional.of(ContentEntry.decode(value.get()));
    } catch (IOException e) {
      logger.log(Level.WARNING, () -> "Deleting unrecoverable content entry: " + digest, e);
      backend.delete(digest);
      return Optional.empty();
    }
  }

  private static ProxyResponse newResponse(
      VariantRecord record, ByteBuffer body, boolean gzipEncoded) {
    var response =
        ProxyResponse.newBuilder()
            .statusCode(record.statusCode())
            .headers(record.headers())
            .body(body)
            .build();
    if (gzipEncoded) {
      response.setHeader("Content-Encoding", "gzip");
    }
    if (!response.hasHeader("Transfer-Encoding")) {
      response.setHeader("Content-Length", Integer.toString(body.remaining()));
    }
    return response;
  }
}
