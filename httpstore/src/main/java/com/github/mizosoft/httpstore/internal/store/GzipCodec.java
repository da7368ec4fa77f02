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

import static com.github.mizosoft.httpstore.internal.Validate.requireArgument;

import com.github.mizosoft.httpstore.internal.Utils;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** Encodes and decodes stored bodies in the gzip format. */
final class GzipCodec {
  static final int MIN_LEVEL = 0;
  static final int MAX_LEVEL = Deflater.BEST_COMPRESSION;

  private GzipCodec() {}

  static ByteBuffer encode(ByteBuffer body, int level) {
    requireArgument(level > MIN_LEVEL && level <= MAX_LEVEL, "illegal gzip level: %d", level);
    var out = new ByteArrayOutputStream();
    try (var gzipOut = new LeveledGzipOutputStream(out, level)) {
      gzipOut.write(Utils.toByteArray(body));
    } catch (IOException e) {
      throw new UncheckedIOException("writing to memory failed", e);
    }
    return ByteBuffer.wrap(out.toByteArray());
  }

  /**
   * Decodes the given gzip-encoded body.
   *
   * @throws IOException if the body is not in the gzip format
   */
  static ByteBuffer decode(ByteBuffer body) throws IOException {
    try (var gzipIn = new GZIPInputStream(new ByteArrayInputStream(Utils.toByteArray(body)))) {
      return ByteBuffer.wrap(gzipIn.readAllBytes());
    }
  }

  private static final class LeveledGzipOutputStream extends GZIPOutputStream {
    LeveledGzipOutputStream(ByteArrayOutputStream out, int level) throws IOException {
      super(out);
      def.setLevel(level);
    }
  }
}
