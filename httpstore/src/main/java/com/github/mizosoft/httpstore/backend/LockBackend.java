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

package com.github.mizosoft.httpstore.backend;

import com.github.mizosoft.httpstore.internal.backend.FileLockBackend;
import com.github.mizosoft.httpstore.internal.backend.LocalLockBackend;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * A factory of named, non-reentrant locks. Locks with the same name created by different backend
 * instances exclude each other as far as the backend's scope goes (e.g. a JVM, a machine or all
 * clients of a Redis server).
 */
public interface LockBackend extends Closeable {

  /** Creates a new lock handle for the given name. The lock isn't acquired. */
  Lock createLock(String name);

  @Override
  default void close() throws IOException {}

  /**
   * Returns a backend whose locks are scoped to the returned instance. Stores that are to exclude
   * each other must share the instance.
   */
  static LockBackend local() {
    return new LocalLockBackend();
  }

  /**
   * Returns a backend whose locks are files under the given directory, which are locked with OS
   * file locks.
   */
  static LockBackend onDisk(Path directory) throws IOException {
    return FileLockBackend.open(directory);
  }

  /** A handle to a named lock. */
  interface Lock {

    String name();

    /**
     * Tries to acquire this lock without blocking, returning {@code true} if the lock was acquired.
     */
    boolean acquire() throws IOException;

    /**
     * Releases this lock.
     *
     * @throws IOException if the lock couldn't be released cleanly, possibly because it was lost
     *     or it expired
     */
    void release() throws IOException;

    /** Returns whether this handle currently holds the lock. */
    boolean isAcquired();
  }
}
