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

package com.github.mizosoft.httpstore.redis;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.httpstore.internal.Utils;
import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ScriptTest {
  @ParameterizedTest
  @EnumSource(Script.class)
  void shaOfResource(Script script) throws IOException, NoSuchAlgorithmException {
    var path = "/scripts/" + script.name().toLowerCase(Locale.ROOT) + ".lua";
    byte[] content;
    try (var in = ScriptTest.class.getResourceAsStream(path)) {
      assertThat(in).isNotNull();
      content = in.readAllBytes();
    }
    assertThat(content).isNotEmpty();
    assertThat(script.shaHex())
        .matches("[0-9a-f]{40}")
        .isEqualTo(Utils.toHexString(MessageDigest.getInstance("SHA1").digest(content)));
  }

  @Test
  void distinctScripts() {
    assertThat(Script.values()).extracting(Script::shaHex).doesNotHaveDuplicates();
  }
}
