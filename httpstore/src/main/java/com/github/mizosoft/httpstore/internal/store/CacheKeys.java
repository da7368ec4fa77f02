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

import com.github.mizosoft.httpstore.ProxyRequest;
import com.github.mizosoft.httpstore.ProxyResponse;
import com.github.mizosoft.httpstore.internal.Utils;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Derives the keys under which metadata and content are stored. */
public final class CacheKeys {
  /** The key of the only variant of a response that doesn't vary. */
  public static final String NON_VARYING_KEY = "non-varying";

  static final String CACHE_KEY_PREFIX = "md";
  static final String CONTENT_DIGEST_PREFIX = "en";
  static final String FILE_DIGEST_PREFIX = "bf";

  private CacheKeys() {}

  /**
   * Returns the key of the metadata entry of the given request. The key is independent of the
   * request's scheme.
   */
  public static String cacheKey(ProxyRequest request) {
    var uri = request.normalizedUri();
    var schemelessUri = uri.substring(request.scheme().length() + "://".length());
    return CACHE_KEY_PREFIX + Utils.sha256Hex(schemelessUri.getBytes(UTF_8));
  }

  /**
   * Returns the key of the variant the given request selects among variants varying on the given
   * header names.
   */
  public static String varyKey(List<String> varyHeaderNames, ProxyRequest request) {
    if (varyHeaderNames.isEmpty()) {
      return NON_VARYING_KEY;
    }

    var normalizedNames = new ArrayList<String>();
    for (var name : varyHeaderNames) {
      normalizedNames.add(name.toLowerCase(Locale.ROOT));
    }
    normalizedNames.sort(null);

    var data = new StringBuilder();
    boolean varyOnCookies = false;
    for (var name : normalizedNames) {
      if (name.equals("cookie")) {
        varyOnCookies = true;
      } else {
        data.append(name)
            .append(':')
            .append(String.join(", ", request.headers().allValues(name)));
      }
    }
    if (varyOnCookies) {
      request.cookies().forEach((name, value) -> data.append(name).append('=').append(value));
    }
    return Utils.sha256Hex(data.toString().getBytes(UTF_8));
  }

  /**
   * Returns the content digest of the given response's body, or an empty optional if the response
   * isn't file-backed and digests are disabled.
   */
  public static Optional<String> contentDigest(ProxyResponse response, boolean digestsEnabled)
      throws IOException {
    var file = response.file();
    if (file.isPresent()) {
      return Optional.of(FILE_DIGEST_PREFIX + Utils.sha256Hex(file.get()));
    }
    return digestsEnabled
        ? Optional.of(
            CONTENT_DIGEST_PREFIX + Utils.sha256Hex(Utils.toByteArray(response.body())))
        : Optional.empty();
  }

  public static boolean isFileDigest(String digest) {
    return digest.startsWith(FILE_DIGEST_PREFIX);
  }
}
