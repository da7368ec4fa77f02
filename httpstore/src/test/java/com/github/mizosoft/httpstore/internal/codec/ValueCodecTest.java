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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIOException;

import java.io.EOFException;
import java.io.IOException;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValueCodecTest {
  @Test
  void varintsUseSevenBitGroups() {
    assertThat(new ValueWriter().writeInt(1).snapshot())
        .isEqualTo(ByteBuffer.wrap(new byte[] {1}));
    assertThat(new ValueWriter().writeInt(300).snapshot())
        .isEqualTo(ByteBuffer.wrap(new byte[] {(byte) 0xAC, 0x02}));
  }

  @Test
  void readWrittenValues() throws IOException {
    var headers =
        HttpHeaders.of(
            Map.of("Content-Type", List.of("text/plain"), "Vary", List.of("Accept", "Cookie")),
            (name, value) -> true);
    var value =
        new ValueWriter()
            .writeInt(Integer.MAX_VALUE)
            .writeLong(-1L)
            .writeBoolean(true)
            .writeUtf8("Pikachu ⚡")
            .writeUtf8List(List.of("a", "b"))
            .writeHeaders(headers)
            .writeRaw("rest".getBytes(US_ASCII))
            .snapshot();
    var reader = new ValueReader(value);
    assertThat(reader.readInt()).isEqualTo(Integer.MAX_VALUE);
    assertThat(reader.readLong()).isEqualTo(-1L);
    assertThat(reader.readBoolean()).isTrue();
    assertThat(reader.readUtf8String()).isEqualTo("Pikachu ⚡");
    assertThat(reader.readUtf8List()).containsExactly("a", "b");
    assertThat(reader.readHeaders()).isEqualTo(headers);
    assertThat(US_ASCII.decode(reader.readRemaining()).toString()).isEqualTo("rest");
    assertThat(reader.hasRemaining()).isFalse();
  }

  @Test
  void consumePrefix() {
    var reader = new ValueReader(ByteBuffer.wrap("hsm123".getBytes(US_ASCII)));
    assertThat(reader.consumePrefix("hsc".getBytes(US_ASCII))).isFalse();
    assertThat(reader.consumePrefix("hsm".getBytes(US_ASCII))).isTrue();
    assertThat(US_ASCII.decode(reader.readRemaining()).toString()).isEqualTo("123");
  }

  @Test
  void prefixLongerThanValue() {
    var reader = new ValueReader(ByteBuffer.wrap("hs".getBytes(US_ASCII)));
    assertThat(reader.consumePrefix("hsm".getBytes(US_ASCII))).isFalse();
    assertThat(reader.hasRemaining()).isTrue();
  }

  @Test
  void truncatedValue() {
    var value = new ValueWriter().writeUtf8("Pikachu").snapshot();
    var truncated = value.limit(value.limit() - 1);
    assertThatExceptionOfType(EOFException.class)
        .isThrownBy(() -> new ValueReader(truncated).readUtf8String());
    assertThatExceptionOfType(EOFException.class)
        .isThrownBy(() -> new ValueReader(ByteBuffer.allocate(0)).readInt());
  }

  @Test
  void malformedBoolean() {
    assertThatIOException()
        .isThrownBy(() -> new ValueReader(ByteBuffer.wrap(new byte[] {2})).readBoolean());
  }

  @Test
  void malformedHeader() {
    var value = new ValueWriter().writeInt(1).writeUtf8("no separator").snapshot();
    assertThatIOException().isThrownBy(() -> new ValueReader(value).readHeaders());

    var invalidName = new ValueWriter().writeInt(1).writeUtf8("bad name:value").snapshot();
    assertThatIOException().isThrownBy(() -> new ValueReader(invalidName).readHeaders());
  }

  @Test
  void overlongVarint() {
    var value = new byte[11];
    Arrays.fill(value, (byte) 0xFF);
    assertThatIOException().isThrownBy(() -> new ValueReader(ByteBuffer.wrap(value)).readLong());
  }
}
