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

import static com.github.mizosoft.httpstore.internal.HttpDates.parseDeltaSeconds;
import static com.github.mizosoft.httpstore.internal.Utils.escapeAndQuoteValueIfNeeded;
import static com.github.mizosoft.httpstore.internal.Validate.requireArgument;

import com.github.mizosoft.httpstore.internal.text.HeaderValueTokenizer;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Cache-Control">cache
 * directives</a> of a response.
 *
 * <p>Only response directives relevant to a shared cache have typed accessors. All directives,
 * standard or not, can be accessed using the {@link #directives()} map.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class CacheControl {
  private static final CacheControl EMPTY = new CacheControl(Map.of());

  private final Map<String, String> directives;
  private final Optional<Duration> maxAge;
  private final Optional<Duration> sMaxAge;
  private final boolean noStore;
  private final boolean isPrivate;
  private final boolean isPublic;
  private final boolean mustRevalidate;

  private @MonotonicNonNull String lazyToString;

  private CacheControl(Map<String, String> directives) {
    this.directives = Collections.unmodifiableMap(directives);
    this.maxAge = deltaSeconds(directives, "max-age");
    this.sMaxAge = deltaSeconds(directives, "s-maxage");
    this.noStore = directives.containsKey("no-store");
    this.isPrivate = directives.containsKey("private");
    this.isPublic = directives.containsKey("public");
    this.mustRevalidate = directives.containsKey("must-revalidate");
  }

  /**
   * Returns a map of all directives and their arguments. Directives that don't have arguments are
   * mapped to an empty string.
   */
  public Map<String, String> directives() {
    return directives;
  }

  /** Returns the value of the {@code max-age} directive if present. */
  public Optional<Duration> maxAge() {
    return maxAge;
  }

  /** Returns the value of the {@code s-maxage} directive if present. */
  public Optional<Duration> sMaxAge() {
    return sMaxAge;
  }

  /** Returns {@code true} if the {@code no-store} directive is set. */
  public boolean noStore() {
    return noStore;
  }

  /** Returns {@code true} if the {@code private} directive is set. */
  public boolean isPrivate() {
    return isPrivate;
  }

  /** Returns {@code true} if the {@code public} directive is set. */
  public boolean isPublic() {
    return isPublic;
  }

  /** Returns {@code true} if the {@code must-revalidate} directive is set. */
  public boolean mustRevalidate() {
    return mustRevalidate;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof CacheControl)) {
      return false;
    }
    return directives.equals(((CacheControl) obj).directives);
  }

  @Override
  public int hashCode() {
    return 31 * directives.hashCode();
  }

  @Override
  public String toString() {
    var toString = lazyToString;
    if (toString == null) {
      toString =
          directives.entrySet().stream()
              .map(
                  entry ->
                      entry.getValue().isEmpty() // Directive has no value?
                          ? entry.getKey()
                          : entry.getKey() + "=" + escapeAndQuoteValueIfNeeded(entry.getValue()))
              .collect(Collectors.joining(", "));
      lazyToString = toString;
    }
    return toString;
  }

  /**
   * Parses the cache directives specified by the given value.
   *
   * @throws IllegalArgumentException if the given value has invalid cache directives
   */
  public static CacheControl parse(String value) {
    return parse(List.of(value));
  }

  /**
   * Parses the cache directives specified by each of the given values.
   *
   * @throws IllegalArgumentException if any of the given values has invalid cache directives
   */
  public static CacheControl parse(List<String> values) {
    if (values.isEmpty()) {
      return empty();
    }

    try {
      var directives = new LinkedHashMap<String, String>();
      values.forEach(value -> parseDirectives(value, directives));
      return new CacheControl(directives);
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new IllegalArgumentException("Couldn't parse: '" + String.join(", ", values) + "'", e);
    }
  }

  /**
   * Parses the cache directives specified by the given headers.
   *
   * @throws IllegalArgumentException if the given headers have any invalid cache directives
   */
  public static CacheControl parse(HttpHeaders headers) {
    return parse(headers.allValues("Cache-Control"));
  }

  /** Returns a {@code CacheControl} with no directives. */
  public static CacheControl empty() {
    return EMPTY;
  }

  private static void parseDirectives(String value, Map<String, String> directives) {
    // Cache-Control   = *( "," OWS ) cache-directive *( OWS "," [ OWS cache-directive ] )
    // cache-directive = token [ "=" ( token / quoted-string ) ]
    var tokenizer = new HeaderValueTokenizer(value);
    tokenizer.consumeDelimiter(',', false); // First delimiter is optional
    while (tokenizer.hasRemaining()) {
      var normalizedDirective = tokenizer.nextToken().toLowerCase(Locale.ROOT);
      var argument = "";
      if (tokenizer.consumeCharIfPresent('=')) {
        argument = tokenizer.nextTokenOrQuotedString();
      }
      boolean duplicateDirective = directives.put(normalizedDirective, argument) != null;
      requireArgument(!duplicateDirective, "Duplicate directive: '%s'", normalizedDirective);
      if (!tokenizer.consumeDelimiter(',')) {
        break;
      }
    }
  }

  private static Optional<Duration> deltaSeconds(Map<String, String> directives, String name) {
    var argument = directives.get(name);
    if (argument == null) {
      return Optional.empty();
    }
    requireArgument(!argument.isEmpty(), "Directive '%s' requires an argument", name);
    return Optional.of(parseDeltaSeconds(argument));
  }
}
