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
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.internal.HttpDates;
import com.github.mizosoft.httpstore.internal.Utils;
import com.github.mizosoft.httpstore.internal.extensions.HeadersBuilder;
import com.github.mizosoft.httpstore.internal.text.HeaderValueTokenizer;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A response produced by the origin or restored from the store. A response either carries its
 * body in memory or references a file on disk (a binary-file response).
 *
 * <p>Headers are mutable, as the store marks written responses with their content digest and
 * length.
 */
public final class ProxyResponse {
  private static final Logger logger = System.getLogger(ProxyResponse.class.getName());

  private final int statusCode;
  private final HeadersBuilder headers;
  private final ByteBuffer body;
  private final @Nullable Path file;

  private ProxyResponse(
      int statusCode, HeadersBuilder headers, ByteBuffer body, @Nullable Path file) {
    this.statusCode = statusCode;
    this.headers = headers;
    this.body = body;
    this.file = file;
  }

  public int statusCode() {
    return statusCode;
  }

  /** Returns a snapshot of this response's current headers. */
  public HttpHeaders headers() {
    return headers.build();
  }

  public Optional<String> header(String name) {
    return headers.firstValue(name);
  }

  public List<String> headerValues(String name) {
    return headers.allValues(name);
  }

  public boolean hasHeader(String name) {
    return headers.contains(name);
  }

  public void setHeader(String name, String value) {
    headers.set(name, value);
  }

  @CanIgnoreReturnValue
  public boolean removeHeader(String name) {
    return headers.remove(name);
  }

  /** Returns a read-only view of this response's body, which is empty for file-backed responses. */
  public ByteBuffer body() {
    return body.asReadOnlyBuffer();
  }

  public String bodyAsString() {
    return UTF_8.decode(body()).toString();
  }

  /** Returns the file this response's body is read from, if this is a file-backed response. */
  public Optional<Path> file() {
    return Optional.ofNullable(file);
  }

  public boolean isFileBacked() {
    return file != null;
  }

  /**
   * Returns the names of the request headers this response varies on, in the order they appear in
   * {@code Vary}.
   */
  public List<String> vary() {
    var names = new ArrayList<String>();
    for (var value : headers.allValues("Vary")) {
      try {
        var tokenizer = new HeaderValueTokenizer(value);
        var valueNames = new ArrayList<String>();
        tokenizer.consumeDelimiter(',', false);
        while (tokenizer.hasRemaining()) {
          valueNames.add(tokenizer.nextToken());
          if (!tokenizer.consumeDelimiter(',')) {
            break;
          }
        }
        names.addAll(valueNames);
      } catch (IllegalArgumentException | IllegalStateException e) {
        logger.log(Level.WARNING, () -> "Ignoring malformed Vary: '" + value + "'", e);
      }
    }
    return List.copyOf(names);
  }

  public boolean hasVary() {
    return !vary().isEmpty();
  }

  public CacheControl cacheControl() {
    return CacheControl.parse(headers.allValues("Cache-Control"));
  }

  /**
   * Returns how long this response can be stored by a shared cache. This is taken from {@code
   * s-maxage}, then {@code max-age}, then the difference between {@code Expires} and {@code Date}.
   * An absent {@code Date} is taken as the current time.
   */
  public Optional<Duration> maxAge() {
    return maxAge(Utils.systemMillisUtc());
  }

  public Optional<Duration> maxAge(Clock clock) {
    var cacheControl = cacheControl();
    var maxAge = cacheControl.sMaxAge().or(cacheControl::maxAge);
    if (maxAge.isPresent()) {
      return maxAge;
    }

    var expires = headers.firstValue("Expires").flatMap(HttpDates::tryParseHttpDate);
    if (expires.isEmpty()) {
      return Optional.empty();
    }
    var date =
        headers
            .firstValue("Date")
            .flatMap(HttpDates::tryParseHttpDate)
            .orElseGet(() -> Instant.now(clock));
    var freshness = Duration.between(date, expires.get());
    return Optional.of(freshness.isNegative() ? Duration.ZERO : freshness);
  }

  /** Returns a new response with the same status and headers but with the given body. */
  public ProxyResponse withBody(ByteBuffer body) {
    var headersCopy = new HeadersBuilder();
    headersCopy.addAll(headers.build());
    return new ProxyResponse(statusCode, headersCopy, Utils.copy(body), null);
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[status="
        + statusCode
        + (file != null ? ", file=" + file : ", bodyLength=" + body.remaining())
        + "]";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code ProxyResponse} instances. */
  public static final class Builder {
    private final HeadersBuilder headers = new HeadersBuilder();
    private int statusCode = 200;
    private ByteBuffer body = ByteBuffer.allocate(0);
    private @Nullable Path file;

    Builder() {}

    @CanIgnoreReturnValue
    public Builder statusCode(int statusCode) {
      requireArgument(
          statusCode >= 100 && statusCode <= 999, "Invalid status code: %d", statusCode);
      this.statusCode = statusCode;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder header(String name, String value) {
      headers.add(name, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setHeader(String name, String value) {
      headers.set(name, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder headers(HttpHeaders headers) {
      this.headers.addAll(headers);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder body(String body) {
      return body(UTF_8.encode(body));
    }

    @CanIgnoreReturnValue
    public Builder body(byte[] body) {
      return body(ByteBuffer.wrap(body));
    }

    @CanIgnoreReturnValue
    public Builder body(ByteBuffer body) {
      requireState(file == null, "Response already has a file body");
      this.body = Utils.copy(requireNonNull(body));
      return this;
    }

    /** Makes this a binary-file response streaming its body from the given file. */
    @CanIgnoreReturnValue
    public Builder file(Path file) {
      requireState(!body.hasRemaining(), "Response already has an in-memory body");
      this.file = requireNonNull(file);
      return this;
    }

    public ProxyResponse build() {
      var headersCopy = new HeadersBuilder();
      headersCopy.addAll(headers.build());
      return new ProxyResponse(statusCode, headersCopy, body, file);
    }
  }
}
