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

import com.github.mizosoft.httpstore.internal.Utils;
import io.lettuce.core.RedisNoScriptException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.sync.RedisScriptingCommands;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/** Lua scripts run atomically by Redis, loaded from class-path resources. */
enum Script {
  SAVE("/scripts/save.lua"),
  INVALIDATE_TAGS("/scripts/invalidate_tags.lua"),
  PRUNE_TAG("/scripts/prune_tag.lua"),
  RELEASE_LOCK("/scripts/release_lock.lua");

  private final byte[] content;
  private final String shaHex;

  Script(String scriptPath) {
    this.content = load(scriptPath);
    this.shaHex = Utils.toHexString(newSha1Digest().digest(this.content));
  }

  String shaHex() {
    return shaHex;
  }

  <K, V> RunnableScript<K, V> evalOn(RedisScriptingCommands<K, V> commands) {
    return new RunnableScript<>(this, commands);
  }

  private static byte[] load(String path) {
    try (var in = Script.class.getResourceAsStream(path)) {
      if (in == null) {
        throw new NoSuchFileException(path, null, "can't find resource");
      }
      return in.readAllBytes();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static MessageDigest newSha1Digest() {
    try {
      return MessageDigest.getInstance("SHA1");
    } catch (NoSuchAlgorithmException e) {
      throw new UnsupportedOperationException("SHA1 not available!", e);
    }
  }

  /** A script bound to the commands it's evaluated with. */
  static final class RunnableScript<K, V> {
    private final Script script;
    private final RedisScriptingCommands<K, V> commands;

    RunnableScript(Script script, RedisScriptingCommands<K, V> commands) {
      this.script = script;
      this.commands = commands;
    }

    boolean getAsBoolean(List<K> keys, List<V> values) {
      return getAs(keys, values, ScriptOutputType.BOOLEAN, Boolean.class);
    }

    long getAsLong(List<K> keys, List<V> values) {
      return getAs(keys, values, ScriptOutputType.INTEGER, Long.class);
    }

    @SuppressWarnings("unchecked")
    private <T> T getAs(
        List<K> keys, List<V> values, ScriptOutputType outputType, Class<T> rawReturnType) {
      var keysArray = (K[]) keys.toArray();
      var valuesArray = (V[]) values.toArray();
      try {
        return rawReturnType.cast(
            commands.evalsha(script.shaHex, outputType, keysArray, valuesArray));
      } catch (RedisNoScriptException e) {
        // The script isn't cached by the server yet (or anymore).
        return rawReturnType.cast(
            commands.eval(script.content, outputType, keysArray, valuesArray));
      }
    }
  }
}
