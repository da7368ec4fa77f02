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

import static com.github.mizosoft.httpstore.testing.TestUtils.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;

import com.github.mizosoft.httpstore.internal.codec.ValueWriter;
import com.github.mizosoft.httpstore.internal.store.ContentEntry.Encoding;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ContentEntryTest {
  @Test
  void decodeBodyEntry() throws IOException {
    var entry = ContentEntry.decode(ContentEntry.ofBody(600, Encoding.GZIP, utf8("abc")).encode());
    assertThat(entry.expires()).isEqualTo(600);
    assertThat(entry.encoding()).isEqualTo(Encoding.GZIP);
    assertThat(entry.body()).hasValue(utf8("abc"));
    assertThat(entry.file()).isEmpty();
  }

  @Test
  void decodeFileEntry() throws IOException {
    var file = Path.of("pokemon", "pikachu.png").toAbsolutePath();
    var entry = ContentEntry.decode(ContentEntry.ofFile(86400, file).encode());
    assertThat(entry.expires()).isEqualTo(86400);
    assertThat(entry.encoding()).isEqualTo(Encoding.IDENTITY);
    assertThat(entry.file()).hasValue(file);
    assertThat(entry.body()).isEmpty();
  }

  @Test
  void legacyRawBody() throws IOException {
    var entry = ContentEntry.decode(utf8("Pikachu"));
    assertThat(entry.expires()).isZero();
    assertThat(entry.encoding()).isEqualTo(Encoding.IDENTITY);
    assertThat(entry.body()).hasValue(utf8("Pikachu"));
  }

  @Test
  void withExpires() {
    var entry = ContentEntry.ofBody(600, Encoding.IDENTITY, utf8("Pikachu")).withExpires(86400);
    assertThat(entry.expires()).isEqualTo(86400);
    assertThat(entry.body()).hasValue(utf8("Pikachu"));
  }

  @Test
  void unknownVersion() {
    var value = new ValueWriter().writeRaw(ContentEntry.MAGIC).writeInt(2).snapshot();
    assertThatIOException().isThrownBy(() -> ContentEntry.decode(value));
  }

  @Test
  void unknownEncoding() {
    var value =
        new ValueWriter()
            .writeRaw(ContentEntry.MAGIC)
            .writeInt(ContentEntry.FORMAT_VERSION)
            .writeLong(0)
            .writeInt(0)
            .writeInt(Encoding.values().length)
            .writeUtf8("abc")
            .snapshot();
    assertThatIOException().isThrownBy(() -> ContentEntry.decode(value));
  }

  @Test
  void unknownKind() {
    var value =
        new ValueWriter()
            .writeRaw(ContentEntry.MAGIC)
            .writeInt(ContentEntry.FORMAT_VERSION)
            .writeLong(0)
            .writeInt(2)
            .writeInt(0)
            .snapshot();
    assertThatIOException().isThrownBy(() -> ContentEntry.decode(value));
  }

  @Test
  void truncatedEntry() {
    var value = ContentEntry.ofBody(600, Encoding.IDENTITY, utf8("Pikachu")).encode();
    var truncated = value.limit(value.limit() - 1);
    assertThatIOException().isThrownBy(() -> ContentEntry.decode(truncated));
  }
}
