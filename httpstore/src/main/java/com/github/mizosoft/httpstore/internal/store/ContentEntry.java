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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.internal.Utils;
import com.github.mizosoft.httpstore.internal.codec.ValueReader;
import com.github.mizosoft.httpstore.internal.codec.ValueWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The value stored under a content digest: a body shared by all variants with the same digest, or
 * the path of the file a file-backed response is read from. {@code expires} is the largest max-age
 * (in seconds) of any variant written with this content.
 *
 * <p>A value that doesn't start with this entry's magic prefix is a body stored as-is by an older
 * version, and is read as an identity-encoded body with {@code expires} 0.
 */
public final class ContentEntry {
  static final byte[] MAGIC = "hsc".getBytes(US_ASCII);
  static final int FORMAT_VERSION = 1;

  private static final int KIND_BODY = 0;
  private static final int KIND_FILE = 1;

  private final long expires;
  private final Encoding encoding;
  private final @Nullable ByteBuffer body;
  private final @Nullable Path file;

  private ContentEntry(
      long expires, Encoding encoding, @Nullable ByteBuffer body, @Nullable Path file) {
    this.expires = expires;
    this.encoding = encoding;
    this.body = body;
    this.file = file;
  }

  public long expires() {
    return expires;
  }

  public Encoding encoding() {
    return encoding;
  }

  public Optional<ByteBuffer> body() {
    return Optional.ofNullable(body).map(ByteBuffer::duplicate);
  }

  public Optional<Path> file() {
    return Optional.ofNullable(file);
  }

  /** Returns a copy of this entry with the given {@code expires}. */
  public ContentEntry withExpires(long expires) {
    return new ContentEntry(expires, encoding, body, file);
  }

  public ByteBuffer encode() {
    var writer =
        new ValueWriter()
            .writeRaw(MAGIC)
            .writeInt(FORMAT_VERSION)
            .writeLong(expires)
            .writeInt(file != null ? KIND_FILE : KIND_BODY)
            .writeInt(encoding.ordinal());
    if (file != null) {
      writer.writeUtf8(file.toString());
    } else {
      writer.writeBytes(requireNonNull(body));
    }
    return writer.snapshot();
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[expires="
        + expires
        + ", encoding="
        + encoding
        + (file != null ? ", file=" + file : "")
        + "]";
  }

  public static ContentEntry ofBody(long expires, Encoding encoding, ByteBuffer body) {
    return new ContentEntry(expires, requireNonNull(encoding), Utils.copy(body), null);
  }

  public static ContentEntry ofFile(long expires, Path file) {
    return new ContentEntry(expires, Encoding.IDENTITY, null, requireNonNull(file));
  }

  /**
   * Decodes an entry from the given value, migrating it to the current version if needed.
   *
   * @throws IOException if the value is malformed or has an unknown version
   */
  public static ContentEntry decode(ByteBuffer value) throws IOException {
    var reader = new ValueReader(value);
    if (!reader.consumePrefix(MAGIC)) {
      return ofBody(0, Encoding.IDENTITY, value); // Legacy raw body.
    }

    int version = reader.readInt();
    if (version != FORMAT_VERSION) {
      throw new IOException("unknown content entry version: " + version);
    }

    long expires = reader.readLong();
    int kind = reader.readInt();
    int encodingOrdinal = reader.readInt();
    if (encodingOrdinal < 0 || encodingOrdinal >= Encoding.values().length) {
      throw new IOException("unknown content encoding: " + encodingOrdinal);
    }
    var encoding = Encoding.values()[encodingOrdinal];
    ContentEntry entry;
    switch (kind) {
      case KIND_BODY:
        entry = new ContentEntry(expires, encoding, reader.readBytes(), null);
        break;
      case KIND_FILE:
        try {
          entry = new ContentEntry(expires, encoding, null, Path.of(reader.readUtf8String()));
        } catch (InvalidPathException e) {
          throw new IOException("malformed file path", e);
        }
        break;
      default:
        throw new IOException("unknown content kind: " + kind);
    }
    if (reader.hasRemaining()) {
      throw new IOException("unexpected trailing bytes in content entry");
    }
    return entry;
  }

  /** How a stored body is encoded. */
  public enum Encoding {
    IDENTITY,
    GZIP
  }
}
