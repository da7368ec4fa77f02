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
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.CacheBackend;
import com.github.mizosoft.httpstore.internal.Validate;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * Counts writes to decide when expired entries are to be pruned. The count is stored in the
 * backend as a decimal string, so it's shared by all stores using the same backend.
 */
public final class WriteCounter {
  private static final Logger logger = System.getLogger(WriteCounter.class.getName());

  /** The key under which the count is stored. */
  public static final String COUNTER_KEY = "write-operations-counter";

  private final CacheBackend backend;
  private final int threshold;

  public WriteCounter(CacheBackend backend, int threshold) {
    this.backend = requireNonNull(backend);
    this.threshold = Validate.requireNonNegative(threshold, "threshold");
  }

  public boolean isEnabled() {
    return threshold > 0;
  }

  /**
   * Counts a write, returning {@code true} if the count exceeded the threshold, in which case the
   * count is reset. The new count is saved as a deferred value.
   */
  public boolean countWrite() throws IOException {
    if (!isEnabled()) {
      return false;
    }

    long count = read();
    boolean exceeded = count > threshold;
    long newCount = exceeded ? 0 : count + 1;
    backend.saveDeferred(COUNTER_KEY, UTF_8.encode(Long.toString(newCount)));
    return exceeded;
  }

  long read() throws IOException {
    var value = backend.get(COUNTER_KEY);
    if (value.isEmpty()) {
      return 0;
    }

    var text = UTF_8.decode(value.get()).toString();
    try {
      return Long.parseLong(text.trim());
    } catch (NumberFormatException e) {
      logger.log(Level.WARNING, () -> "Resetting malformed write count: '" + text + "'", e);
      return 0;
    }
  }
}
