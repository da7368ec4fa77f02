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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.internal.Utils;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A stored variant of a response: what's needed to restore it, apart from its content. */
public final class VariantRecord {
  /** The header carrying the key of the content entry of a response. */
  public static final String CONTENT_DIGEST_HEADER = "X-Content-Digest";

  private final List<String> vary;
  private final HttpHeaders headers;
  private final int statusCode;
  private final String uri;
  private final @Nullable ByteBuffer inlineContent;

  public VariantRecord(
      List<String> vary,
      HttpHeaders headers,
      int statusCode,
      String uri,
      @Nullable ByteBuffer inlineContent) {
    this.vary = List.copyOf(vary);
    this.headers = requireNonNull(headers);
    this.statusCode = statusCode;
    this.uri = requireNonNull(uri);
    this.inlineContent = inlineContent != null ? Utils.copy(inlineContent) : null;
  }

  /** Returns the names of the request headers the variant was selected by. */
  public List<String> vary() {
    return vary;
  }

  public HttpHeaders headers() {
    return headers;
  }

  public int statusCode() {
    return statusCode;
  }

  /** Returns the URI of the request the variant was written for. Only used for diagnosis. */
  public String uri() {
    return uri;
  }

  public Optional<ByteBuffer> inlineContent() {
    return Optional.ofNullable(inlineContent).map(ByteBuffer::duplicate);
  }

  public Optional<String> contentDigest() {
    return headers.firstValue(CONTENT_DIGEST_HEADER);
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[uri="
        + uri
        + ", statusCode="
        + statusCode
        + ", vary="
        + vary
        + "]";
  }
}
