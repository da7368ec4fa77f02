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

import static com.github.mizosoft.httpstore.internal.codec.Varints.VARINT_HAS_MORE_MASK;
import static com.github.mizosoft.httpstore.internal.codec.Varints.VARINT_MASK;
import static com.github.mizosoft.httpstore.internal.codec.Varints.VARINT_SHIFT;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.github.mizosoft.httpstore.internal.extensions.HeadersBuilder;
import java.io.EOFException;
import java.io.IOException;
import java.net.http.HttpHeaders;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.util.ArrayList;
import java.util.List;

/** Reads a binary value written by a {@link ValueWriter}. */
public final class ValueReader {
  private final ByteBuffer buffer;

  public ValueReader(ByteBuffer buffer) {
    // Slice to start with position = 0 to report read bytes when EOF is reached prematurely.
    this.buffer = buffer.slice();
  }

  /** Consumes the given bytes if the value continues with them, returning whether it does. */
  public boolean consumePrefix(byte[] prefix) {
    if (buffer.remaining() < prefix.length) {
      return false;
    }
    int position = buffer.position();
    for (int i = 0; i < prefix.length; i++) {
      if (buffer.get(position + i) != prefix[i]) {
        return false;
      }
    }
    buffer.position(position + prefix.length);
    return true;
  }

  public int readInt() throws IOException {
    return (int) readVarint(Integer.SIZE);
  }

  public long readLong() throws IOException {
    return readVarint(Long.SIZE);
  }

  public boolean readBoolean() throws IOException {
    byte value = requireByte();
    if (value != 0 && value != 1) {
      throw new IOException("malformed boolean: " + value);
    }
    return value == 1;
  }

  private long readVarint(int sizeInBits) throws IOException {
    long value = 0L;
    for (int shift = 0; shift < sizeInBits; shift += VARINT_SHIFT) {
      long currentByte = requireByte() & 0xFF; // Use long as shift might exceed 32.
      value |= (currentByte & VARINT_MASK) << shift;
      if ((currentByte & VARINT_HAS_MORE_MASK) == 0) {
        return value;
      }
    }
    throw new IOException("wrong varint format");
  }

  private byte requireByte() throws EOFException {
    try {
      return buffer.get();
    } catch (BufferUnderflowException e) {
      throw endOfInput();
    }
  }

  private int readLength() throws IOException {
    int length = readInt();
    if (length < 0 || length > buffer.remaining()) {
      throw new EOFException(
          "expected " + length + " bytes (position = " + buffer.position() + ")");
    }
    return length;
  }

  private CharBuffer readUtf8Chars() throws IOException {
    int length = readLength();
    int originalLimit = buffer.limit();
    buffer.limit(buffer.position() + length);
    var value = UTF_8.decode(buffer);
    buffer.limit(originalLimit);
    return value;
  }

  public String readUtf8String() throws IOException {
    return readUtf8Chars().toString();
  }

  public List<String> readUtf8List() throws IOException {
    int count = readInt();
    if (count < 0) {
      throw new IOException("negative list size: " + count);
    }
    var values = new ArrayList<String>();
    for (int i = 0; i < count; i++) {
      values.add(readUtf8String());
    }
    return values;
  }

  public byte[] readByteArray() throws IOException {
    var array = new byte[readLength()];
    buffer.get(array);
    return array;
  }

  public ByteBuffer readBytes() throws IOException {
    return ByteBuffer.wrap(readByteArray());
  }

  /** Returns the bytes following what has been read so far, consuming them. */
  public ByteBuffer readRemaining() {
    var remaining = buffer.slice();
    buffer.position(buffer.limit());
    return remaining;
  }

  public HttpHeaders readHeaders() throws IOException {
    var builder = new HeadersBuilder();
    for (int i = 0, count = readInt(); i < count; i++) {
      addHeader(builder, readUtf8Chars());
    }
    return builder.build();
  }

  private void addHeader(HeadersBuilder builder, CharBuffer header) throws IOException {
    int separatorIndex = indexOfHeaderSeparator(header);
    if (separatorIndex <= 0) {
      throw new IOException("malformed header");
    }

    int originalLimit = header.limit();
    var name = header.limit(separatorIndex).toString();
    var value = header.limit(originalLimit).position(separatorIndex + 1).toString();
    try {
      builder.add(name.trim(), value.trim());
    } catch (IllegalArgumentException e) {
      throw new IOException("malformed header", e);
    }
  }

  private static int indexOfHeaderSeparator(CharBuffer buffer) {
    for (int p = 0; p < buffer.limit(); p++) {
      if (buffer.get(p) == ':') {
        return p;
      }
    }
    return -1;
  }

  public boolean hasRemaining() {
    return buffer.hasRemaining();
  }

  private EOFException endOfInput() {
    return new EOFException("unexpected end of input (position = " + buffer.position() + ")");
  }
}
