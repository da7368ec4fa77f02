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

package com.github.mizosoft.httpstore.internal.backend;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.LockBackend;
import com.github.mizosoft.httpstore.internal.Utils;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/** A {@link LockBackend} whose locks exclude each other among users of the same instance. */
public final class LocalLockBackend implements LockBackend {
  private final Set<String> heldNames = ConcurrentHashMap.newKeySet();

  public LocalLockBackend() {}

  @Override
  public Lock createLock(String name) {
    return new LocalLock(requireNonNull(name));
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this);
  }

  private final class LocalLock implements Lock {
    private final String name;
    private final AtomicBoolean acquired = new AtomicBoolean();

    LocalLock(String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public boolean acquire() {
      if (acquired.get()) {
        return false;
      }
      if (heldNames.add(name)) {
        acquired.set(true);
        return true;
      }
      return false;
    }

    @Override
    public void release() throws IOException {
      if (!acquired.compareAndSet(true, false)) {
        throw new IOException("Lock <" + name + "> isn't acquired");
      }
      heldNames.remove(name);
    }

    @Override
    public boolean isAcquired() {
      return acquired.get();
    }
  }
}
