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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.httpstore.ProxyRequest;
import com.github.mizosoft.httpstore.ProxyResponse;
import com.github.mizosoft.httpstore.internal.Utils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CacheKeysTest {
  @Test
  void cacheKeyIsIndependentOfScheme() {
    var httpKey = CacheKeys.cacheKey(ProxyRequest.create("http://example.com/pokemon?id=25"));
    var httpsKey = CacheKeys.cacheKey(ProxyRequest.create("https://example.com/pokemon?id=25"));
    assertThat(httpKey).isEqualTo(httpsKey).startsWith("md").hasSize(2 + 64);
    assertThat(httpKey)
        .isEqualTo("md" + Utils.sha256Hex("example.com/pokemon?id=25".getBytes(UTF_8)));
  }

  @Test
  void cacheKeyOfNormalizedUri() {
    assertThat(CacheKeys.cacheKey(ProxyRequest.create("http://EXAMPLE.com:80/a?b=2&a=1")))
        .isEqualTo(CacheKeys.cacheKey(ProxyRequest.create("http://example.com/a?a=1&b=2")));
    assertThat(CacheKeys.cacheKey(ProxyRequest.create("http://example.com")))
        .isEqualTo(CacheKeys.cacheKey(ProxyRequest.create("http://example.com/#fragment")));
  }

  @Test
  void cacheKeyDependsOnPathAndQuery() {
    var key = CacheKeys.cacheKey(ProxyRequest.create("http://example.com/a?id=1"));
    assertThat(CacheKeys.cacheKey(ProxyRequest.create("http://example.com/b?id=1")))
        .isNotEqualTo(key);
    assertThat(CacheKeys.cacheKey(ProxyRequest.create("http://example.com/a?id=2")))
        .isNotEqualTo(key);
    assertThat(CacheKeys.cacheKey(ProxyRequest.create("http://example.com:8080/a?id=1")))
        .isNotEqualTo(key);
  }

  @Test
  void nonVaryingKey() {
    assertThat(CacheKeys.varyKey(List.of(), ProxyRequest.create("/")))
        .isEqualTo(CacheKeys.NON_VARYING_KEY);
  }

  @Test
  void varyKeyHashesVaryingHeaders() {
    var request =
        ProxyRequest.newBuilder("/")
            .header("Accept", "text/html")
            .header("Accept-Language", "en")
            .header("Accept-Language", "fr")
            .build();
    assertThat(CacheKeys.varyKey(List.of("Accept-Language", "Accept"), request))
        .isEqualTo(Utils.sha256Hex("accept:text/htmlaccept-language:en, fr".getBytes(UTF_8)));
  }

  @Test
  void varyKeyIsIndependentOfNameOrderAndCase() {
    var request =
        ProxyRequest.newBuilder("/")
            .header("Accept", "text/html")
            .header("Accept-Language", "en")
            .build();
    assertThat(CacheKeys.varyKey(List.of("Accept", "Accept-Language"), request))
        .isEqualTo(CacheKeys.varyKey(List.of("accept-language", "ACCEPT"), request));
  }

  @Test
  void varyKeyOnlyDependsOnVaryingHeaders() {
    var vary = List.of("Accept");
    var request1 =
        ProxyRequest.newBuilder("/").header("Accept", "text/html").header("X-A", "1").build();
    var request2 =
        ProxyRequest.newBuilder("/").header("Accept", "text/html").header("X-A", "2").build();
    var request3 = ProxyRequest.newBuilder("/").header("Accept", "image/png").build();
    assertThat(CacheKeys.varyKey(vary, request1)).isEqualTo(CacheKeys.varyKey(vary, request2));
    assertThat(CacheKeys.varyKey(vary, request1)).isNotEqualTo(CacheKeys.varyKey(vary, request3));
  }

  @Test
  void varyKeyOnCookies() {
    var request1 = ProxyRequest.newBuilder("/").header("Cookie", "a=1; b=2").build();
    var request2 = ProxyRequest.newBuilder("/").header("Cookie", "a=1; b=3").build();
    assertThat(CacheKeys.varyKey(List.of("Cookie"), request1))
        .isNotEqualTo(CacheKeys.varyKey(List.of("Cookie"), request2))
        .isEqualTo(Utils.sha256Hex("a=1b=2".getBytes(UTF_8)));
    assertThat(CacheKeys.varyKey(List.of("Accept"), request1))
        .isEqualTo(CacheKeys.varyKey(List.of("Accept"), request2));
  }

  @Test
  void contentDigestOfBody() throws IOException {
    var response = ProxyResponse.newBuilder().body("Pikachu").build();
    assertThat(CacheKeys.contentDigest(response, true))
        .hasValue("en" + Utils.sha256Hex("Pikachu".getBytes(UTF_8)));
    assertThat(CacheKeys.contentDigest(response, false)).isEmpty();
  }

  @Test
  void contentDigestOfFile(@TempDir Path directory) throws IOException {
    var file = Files.writeString(directory.resolve("pikachu.txt"), "Pikachu");
    var response = ProxyResponse.newBuilder().file(file).build();
    var expected = "bf" + Utils.sha256Hex("Pikachu".getBytes(UTF_8));
    assertThat(CacheKeys.contentDigest(response, true)).hasValue(expected);
    assertThat(CacheKeys.contentDigest(response, false)).hasValue(expected);
    assertThat(CacheKeys.isFileDigest(expected)).isTrue();
    assertThat(CacheKeys.isFileDigest("en" + Utils.sha256Hex(new byte[0]))).isFalse();
  }
}
