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

package com.github.mizosoft.httpstore.internal.codec;

import static com.github.mizosoft.httpstore.internal.codec.Varints.INT_MASK;
import static com.github.mizosoft.httpstore.internal.codec.Varints.VARINT_HAS_MORE_MASK;
import static com.github.mizosoft.httpstore.internal.codec.Varints.VARINT_MASK;
import static com.github.mizosoft.httpstore.internal.codec.Varints.VARINT_SHIFT;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.github.mizosoft.httpstore.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.ByteArrayOutputStream;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.List;

/**
 * Writes a binary value as a sequence of varints, length-prefixed byte arrays and strings. Values
 * written with a {@code ValueWriter} are read back with a {@link ValueReader}.
 */
public final class ValueWriter {
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

  public ValueWriter() {}

  @CanIgnoreReturnValue
  public ValueWriter writeRaw(byte[] bytes) {
    buffer.write(bytes, 0, bytes.length);
    return this;
  }

  @CanIgnoreReturnValue
  public ValueWriter writeInt(int value) {
    writeVarint(value & INT_MASK);
    return this;
  }

  @CanIgnoreReturnValue
  public ValueWriter writeLong(long value) {
    writeVarint(value);
    return this;
  }

  @CanIgnoreReturnValue
  public ValueWriter writeBoolean(boolean value) {
    buffer.write(value ? 1 : 0);
    return this;
  }

  @CanIgnoreReturnValue
  public ValueWriter writeByteArray(byte[] array) {
    writeInt(array.length);
    buffer.write(array, 0, array.length);
    return this;
  }

  @CanIgnoreReturnValue
  public ValueWriter writeBytes(ByteBuffer bytes) {
    return writeByteArray(Utils.toByteArray(bytes));
  }

  @CanIgnoreReturnValue
  public ValueWriter writeUtf8(String value) {
    return writeByteArray(value.getBytes(UTF_8));
  }

  @CanIgnoreReturnValue
  public ValueWriter writeUtf8List(List<String> values) {
    writeInt(values.size());
    values.forEach(this::writeUtf8);
    return this;
  }

  /** Writes each header value as a {@code name:value} string, preceded by the count of values. */
  @CanIgnoreReturnValue
  public ValueWriter writeHeaders(HttpHeaders headers) {
    var headersMap = headers.map();
    int deepHeaderCount = headersMap.values().stream().mapToInt(Collection::size).sum();
    writeInt(deepHeaderCount);
    headersMap.forEach((name, values) -> values.forEach(value -> writeUtf8(name + ':' + value)));
    return this;
  }

  private void writeVarint(long value) {
    while ((value & ~VARINT_MASK) != 0) { // Value requires more than one varint byte?
      buffer.write(((int) value & VARINT_MASK) | VARINT_HAS_MORE_MASK);
      value >>>= VARINT_SHIFT;
    }
    buffer.write((int) value); // Last varint byte
  }

  public ByteBuffer snapshot() {
    return ByteBuffer.wrap(buffer.toByteArray());
  }
}
