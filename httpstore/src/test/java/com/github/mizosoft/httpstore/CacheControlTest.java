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

import static java.util.Map.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CacheControlTest {
  @Test
  void parseDirectives() {
    var value = "max-age=1, s-maxage=2, no-store, public, private, must-revalidate";
    var cacheControl = CacheControl.parse(value);
    assertThat(cacheControl.maxAge()).hasValue(Duration.ofSeconds(1));
    assertThat(cacheControl.sMaxAge()).hasValue(Duration.ofSeconds(2));
    assertThat(cacheControl.noStore()).isTrue();
    assertThat(cacheControl.isPublic()).isTrue();
    assertThat(cacheControl.isPrivate()).isTrue();
    assertThat(cacheControl.mustRevalidate()).isTrue();
    assertThat(cacheControl.directives())
        .containsExactly(
            entry("max-age", "1"),
            entry("s-maxage", "2"),
            entry("no-store", ""),
            entry("public", ""),
            entry("private", ""),
            entry("must-revalidate", ""));
    assertThat(cacheControl).hasToString(value);
  }

  @Test
  void parseMultipleValues() {
    var cacheControl = CacheControl.parse(List.of("max-age=1, public", "s-maxage=2"));
    assertThat(cacheControl.maxAge()).hasValue(Duration.ofSeconds(1));
    assertThat(cacheControl.isPublic()).isTrue();
    assertThat(cacheControl.sMaxAge()).hasValue(Duration.ofSeconds(2));
  }

  @Test
  void parseFromHeaders() {
    var headers =
        HttpHeaders.of(Map.of("Cache-Control", List.of("public", "max-age=60")), (n, v) -> true);
    var cacheControl = CacheControl.parse(headers);
    assertThat(cacheControl.isPublic()).isTrue();
    assertThat(cacheControl.maxAge()).hasValue(Duration.ofSeconds(60));
  }

  @Test
  void directiveNamesAreCaseInsensitive() {
    var cacheControl = CacheControl.parse("Max-Age=5, NO-STORE");
    assertThat(cacheControl.maxAge()).hasValue(Duration.ofSeconds(5));
    assertThat(cacheControl.noStore()).isTrue();
  }

  @Test
  void parseUnknownDirective() {
    var cacheControl = CacheControl.parse("my-directive=\"some value\"");
    assertThat(cacheControl.directives()).containsOnly(entry("my-directive", "some value"));
    assertThat(cacheControl.maxAge()).isEmpty();
    assertThat(cacheControl).hasToString("my-directive=\"some value\"");
  }

  @Test
  void danglingDelimitersAreIgnored() {
    var cacheControl = CacheControl.parse(", ,public,, max-age=1 ,");
    assertThat(cacheControl.directives())
        .containsExactly(entry("public", ""), entry("max-age", "1"));
  }

  @Test
  void empty() {
    assertThat(CacheControl.empty().directives()).isEmpty();
    assertThat(CacheControl.parse(List.of())).isEqualTo(CacheControl.empty());
    assertThat(CacheControl.parse("")).isEqualTo(CacheControl.empty());
  }

  @Test
  void duplicateDirective() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> CacheControl.parse("max-age=1, max-age=2"));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> CacheControl.parse(List.of("public", "PUBLIC")));
  }

  @Test
  void invalidDirectives() {
    assertThatIllegalArgumentException().isThrownBy(() -> CacheControl.parse("max-age"));
    assertThatIllegalArgumentException().isThrownBy(() -> CacheControl.parse("max-age=-1"));
    assertThatIllegalArgumentException().isThrownBy(() -> CacheControl.parse("max-age=one"));
    assertThatIllegalArgumentException().isThrownBy(() -> CacheControl.parse("public private"));
    assertThatIllegalArgumentException().isThrownBy(() -> CacheControl.parse("a=\"unclosed"));
  }
}
