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

import java.io.IOException;
import java.util.Collection;
import java.util.Optional;

/**
 * A store of HTTP responses used by a caching reverse proxy. Responses are stored per request URI,
 * possibly as multiple variants negotiated by the {@code Vary} header. The proxy serializes
 * revalidation of a resource by locking it through the store.
 *
 * <p>A store holds the locks it acquires till they're unlocked, or till {@link #cleanup()} or
 * {@link #close()} is called.
 */
public interface HttpStore extends AutoCloseable {

  /**
   * Returns the stored response matching the given request, or an empty optional if there's no
   * such response or its content is no longer available.
   */
  Optional<ProxyResponse> lookup(ProxyRequest request) throws IOException;

  /**
   * Stores the given response for the given request, returning the key under which it's stored.
   * The given response is marked with the digest and length of its content.
   *
   * @throws IllegalArgumentException if the response has no max-age
   * @throws IOException if the response's content couldn't be stored
   */
  String write(ProxyRequest request, ProxyResponse response) throws IOException;

  /** Removes all the stored variants of the given request's URI. */
  void invalidate(ProxyRequest request) throws IOException;

  /**
   * Removes all the stored variants of the given URL, returning whether there were any. Relative
   * URLs are resolved against {@code http://localhost}.
   */
  boolean purge(String url) throws IOException;

  /**
   * Invalidates all responses tagged with any of the given tags. Returns {@code false} if the
   * backend rejects the tags.
   *
   * @throws IllegalStateException if the backend doesn't support tags
   */
  boolean invalidateTags(Collection<String> tags) throws IOException;

  /**
   * Removes expired entries, unless the backend doesn't support pruning or another pass is in
   * progress.
   */
  void prune() throws IOException;

  /**
   * Removes all entries, unless the backend doesn't support clearing or another pass is in
   * progress.
   */
  void clear() throws IOException;

  /**
   * Locks the resource of the given request. Returns {@code false} if this store already holds the
   * lock or it's held elsewhere.
   */
  boolean lock(ProxyRequest request) throws IOException;

  /**
   * Unlocks the resource of the given request. Returns {@code false} if this store doesn't hold the
   * lock or the lock couldn't be released cleanly.
   */
  boolean unlock(ProxyRequest request);

  /** Returns whether this store holds the lock of the given request's resource. */
  boolean isLocked(ProxyRequest request);

  /** Releases all locks held by this store, ignoring failures. */
  void cleanup();

  /** Releases all locks held by this store and closes the backends it owns. */
  @Override
  void close() throws IOException;
}
