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

import com.github.mizosoft.httpstore.internal.codec.ValueReader;
import com.github.mizosoft.httpstore.internal.codec.ValueWriter;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The value stored under a cache key: the stored variants of a URL, each under its vary key, in
 * insertion order.
 *
 * <p>The binary layout is versioned. Version 1 lacks the request URI and inline content of each
 * variant, and is read as if the URI were empty and there were no inline content.
 */
public final class MetadataEntry {
  static final byte[] MAGIC = "hsm".getBytes(US_ASCII);
  static final int LEGACY_FORMAT_VERSION = 1;
  static final int FORMAT_VERSION = 2;

  private static final int FLAG_HAS_INLINE_CONTENT = 0x1;

  private final Map<String, VariantRecord> variants;

  private MetadataEntry(Map<String, VariantRecord> variants) {
    this.variants = variants;
  }

  /** Returns the variants in this entry, mapped by their vary keys. */
  public Map<String, VariantRecord> variants() {
    return Collections.unmodifiableMap(variants);
  }

  public void put(String varyKey, VariantRecord record) {
    variants.put(varyKey, record);
  }

  public void remove(String varyKey) {
    variants.remove(varyKey);
  }

  public void clear() {
    variants.clear();
  }

  public boolean isEmpty() {
    return variants.isEmpty();
  }

  public ByteBuffer encode() {
    var writer = new ValueWriter().writeRaw(MAGIC).writeInt(FORMAT_VERSION);
    writer.writeInt(variants.size());
    variants.forEach(
        (varyKey, record) -> {
          writer
              .writeUtf8(varyKey)
              .writeUtf8List(record.vary())
              .writeHeaders(record.headers())
              .writeInt(record.statusCode())
              .writeUtf8(record.uri());
          var inlineContent = record.inlineContent();
          writer.writeInt(inlineContent.isPresent() ? FLAG_HAS_INLINE_CONTENT : 0);
          inlineContent.ifPresent(writer::writeBytes);
        });
    return writer.snapshot();
  }

  public static MetadataEntry empty() {
    return new MetadataEntry(new LinkedHashMap<>());
  }

  /**
   * Decodes an entry from the given value, migrating it to the current version if needed.
   *
   * @throws IOException if the value is malformed or has an unknown version
   */
  public static MetadataEntry decode(ByteBuffer value) throws IOException {
    var reader = new ValueReader(value);
    if (!reader.consumePrefix(MAGIC)) {
      throw new IOException("not a metadata entry");
    }

    int version = reader.readInt();
    if (version != LEGACY_FORMAT_VERSION && version != FORMAT_VERSION) {
      throw new IOException("unknown metadata entry version: " + version);
    }

    var variants = new LinkedHashMap<String, VariantRecord>();
    for (int i = 0, count = reader.readInt(); i < count; i++) {
      var varyKey = reader.readUtf8String();
      var vary = reader.readUtf8List();
      var headers = reader.readHeaders();
      int statusCode = reader.readInt();
      var uri = "";
      @Nullable ByteBuffer inlineContent = null;
      if (version >= FORMAT_VERSION) {
        uri = reader.readUtf8String();
        int flags = reader.readInt();
        if ((flags & FLAG_HAS_INLINE_CONTENT) != 0) {
          inlineContent = reader.readBytes();
        }
      }
      variants.put(varyKey, new VariantRecord(vary, headers, statusCode, uri, inlineContent));
    }
    if (reader.hasRemaining()) {
      throw new IOException("unexpected trailing bytes in metadata entry");
    }
    return new MetadataEntry(variants);
  }
}
