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
import static com.github.mizosoft.httpstore.internal.text.HttpCharMatchers.OWS_MATCHER;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.internal.Utils;
import com.github.mizosoft.httpstore.internal.extensions.HeadersBuilder;
import com.github.mizosoft.httpstore.internal.text.HeaderValueTokenizer;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable view of a request received by the proxy, exposing what the store needs for
 * deriving cache keys and negotiating variants: the URI, the headers and the cookies.
 */
public final class ProxyRequest {
  private static final URI DEFAULT_BASE_URI = URI.create("http://localhost");

  private final String method;
  private final URI uri;
  private final HttpHeaders headers;
  private final Map<String, String> cookies;

  private ProxyRequest(Builder builder) {
    this.method = builder.method;
    this.uri = builder.uri;
    this.headers = builder.headers.build();
    this.cookies =
        Collections.unmodifiableMap(
            builder.cookies != null
                ? new LinkedHashMap<>(builder.cookies)
                : parseCookies(headers.allValues("Cookie")));
  }

  public String method() {
    return method;
  }

  public URI uri() {
    return uri;
  }

  public String scheme() {
    return castScheme(uri);
  }

  public HttpHeaders headers() {
    return headers;
  }

  /** Returns the request's cookies in the order they were sent. */
  public Map<String, String> cookies() {
    return cookies;
  }

  /**
   * Returns this request's URI in a normalized form: the host is lower-cased, the scheme's default
   * port is dropped, an empty path becomes {@code /}, query parameters are sorted by name and the
   * fragment is dropped.
   */
  public String normalizedUri() {
    var scheme = scheme();
    var sb = new StringBuilder();
    sb.append(scheme).append("://");
    var host = uri.getHost();
    if (host != null) {
      sb.append(host.toLowerCase(Locale.ROOT));
    }
    int port = uri.getPort();
    if (port != -1 && port != defaultPort(scheme)) {
      sb.append(':').append(port);
    }
    var path = uri.getRawPath();
    sb.append(path == null || path.isEmpty() ? "/" : path);
    var query = uri.getRawQuery();
    if (query != null && !query.isEmpty()) {
      sb.append('?').append(normalizeQuery(query));
    }
    return sb.toString();
  }

  /** Returns whether this request's {@code Accept-Encoding} admits {@code gzip}. */
  public boolean acceptsGzip() {
    for (var value : headers.allValues("Accept-Encoding")) {
      try {
        var tokenizer = new HeaderValueTokenizer(value);
        tokenizer.consumeDelimiter(',', false);
        while (tokenizer.hasRemaining()) {
          var coding = tokenizer.nextToken();
          var weight = parseWeight(tokenizer);
          if ((coding.equalsIgnoreCase("gzip") || coding.equals("*")) && weight > 0) {
            return true;
          }
          if (!tokenizer.consumeDelimiter(',')) {
            break;
          }
        }
      } catch (IllegalArgumentException | IllegalStateException ignored) {
        // Ignore malformed values.
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[" + method + " " + uri + "]";
  }

  /** Returns a {@code GET} request to the given URI. */
  public static ProxyRequest create(URI uri) {
    return newBuilder(uri).build();
  }

  /**
   * Returns a {@code GET} request to the given URL. Relative URLs are resolved against {@code
   * http://localhost}.
   */
  public static ProxyRequest create(String url) {
    return create(toAbsoluteUri(url));
  }

  public static Builder newBuilder(URI uri) {
    return new Builder(uri);
  }

  public static Builder newBuilder(String url) {
    return new Builder(toAbsoluteUri(url));
  }

  private static URI toAbsoluteUri(String url) {
    var uri = URI.create(url);
    return uri.isAbsolute() ? uri : DEFAULT_BASE_URI.resolve(uri);
  }

  private static String castScheme(URI uri) {
    var scheme = uri.getScheme();
    requireArgument(scheme != null, "URI has no scheme: %s", uri);
    return scheme.toLowerCase(Locale.ROOT);
  }

  private static int defaultPort(String scheme) {
    switch (scheme) {
      case "http":
        return 80;
      case "https":
        return 443;
      default:
        return -1;
    }
  }

  private static String normalizeQuery(String query) {
    var parameters = new ArrayList<String>();
    for (var parameter : query.split("&")) {
      if (!parameter.isEmpty()) {
        parameters.add(parameter);
      }
    }
    // List.sort is stable, so parameters with equal names retain their relative order.
    parameters.sort(Comparator.comparing(ProxyRequest::parameterName));
    return String.join("&", parameters);
  }

  private static String parameterName(String parameter) {
    int i = parameter.indexOf('=');
    return i >= 0 ? parameter.substring(0, i) : parameter;
  }

  private static double parseWeight(HeaderValueTokenizer tokenizer) {
    double weight = 1;
    while (tokenizer.hasRemaining()) {
      tokenizer.consumeCharsMatching(OWS_MATCHER);
      if (!tokenizer.consumeCharIfPresent(';')) {
        break;
      }
      tokenizer.consumeCharsMatching(OWS_MATCHER);
      var name = tokenizer.nextToken();
      var value = tokenizer.consumeCharIfPresent('=') ? tokenizer.nextTokenOrQuotedString() : "";
      if (name.equalsIgnoreCase("q")) {
        try {
          weight = Double.parseDouble(value);
        } catch (NumberFormatException e) {
          weight = 0;
        }
      }
    }
    return weight;
  }

  private static Map<String, String> parseCookies(List<String> cookieHeaders) {
    var cookies = new LinkedHashMap<String, String>();
    for (var header : cookieHeaders) {
      for (var pair : header.split(";")) {
        int i = pair.indexOf('=');
        if (i <= 0) {
          continue;
        }
        var name = pair.substring(0, i).trim();
        var value = pair.substring(i + 1).trim();
        if (!name.isEmpty()) {
          cookies.put(name, value);
        }
      }
    }
    return cookies;
  }

  /** A builder of {@code ProxyRequest} instances. */
  public static final class Builder {
    private final URI uri;
    private final HeadersBuilder headers = new HeadersBuilder();
    private String method = "GET";
    private @Nullable Map<String, String> cookies;

    Builder(URI uri) {
      this.uri = requireNonNull(uri);
      castScheme(uri);
    }

    @CanIgnoreReturnValue
    public Builder method(String method) {
      this.method = Utils.requireValidToken(method);
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

    /**
     * Sets the request's cookies explicitly, overriding what would otherwise be parsed from {@code
     * Cookie} headers. Iteration order of the given map is retained.
     */
    @CanIgnoreReturnValue
    public Builder cookies(Map<String, String> cookies) {
      var copy = new LinkedHashMap<String, String>();
      cookies.forEach((name, value) -> copy.put(requireNonNull(name), requireNonNull(value)));
      this.cookies = copy;
      return this;
    }

    public ProxyRequest build() {
      return new ProxyRequest(this);
    }
  }
}
