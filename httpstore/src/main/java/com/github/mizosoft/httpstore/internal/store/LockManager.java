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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.LockBackend;
import com.github.mizosoft.httpstore.backend.LockBackend.Lock;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps track of the locks held by a store instance. A name can be locked at most once by the same
 * manager till it's unlocked, regardless of whether the backend would grant it again.
 */
public final class LockManager {
  private static final Logger logger = System.getLogger(LockManager.class.getName());

  /** Name of the lock held while pruning. */
  public static final String PRUNE_LOCK = "prune-lock";

  /** Name of the lock held while clearing. */
  public static final String CLEANUP_LOCK = "cleanup-lock";

  private final LockBackend backend;
  private final Map<String, Lock> heldLocks = new ConcurrentHashMap<>();

  public LockManager(LockBackend backend) {
    this.backend = requireNonNull(backend);
  }

  /**
   * Tries to acquire the named lock. Returns {@code false} if this manager already holds the lock
   * or the backend doesn't grant it.
   */
  public boolean tryLock(String name) throws IOException {
    if (heldLocks.containsKey(name)) {
      return false;
    }

    var lock = backend.createLock(name);
    if (!lock.acquire()) {
      return false;
    }
    if (heldLocks.putIfAbsent(name, lock) != null) {
      // Raced with another thread locking the same name through this manager.
      releaseQuietly(lock);
      return false;
    }
    return true;
  }

  /**
   * Unlocks the named lock. Returns {@code false} if this manager doesn't hold the lock, or if it
   * couldn't be released cleanly, in which case it's no longer considered held.
   */
  public boolean unlock(String name) {
    var lock = heldLocks.remove(name);
    return lock != null && releaseQuietly(lock);
  }

  public boolean isLocked(String name) {
    var lock = heldLocks.get(name);
    return lock != null && lock.isAcquired();
  }

  /** Releases all held locks, ignoring any failures. */
  public void releaseAll() {
    for (var name : new ArrayList<>(heldLocks.keySet())) {
      var lock = heldLocks.remove(name);
      if (lock != null) {
        releaseQuietly(lock);
      }
    }
  }

  /**
   * Runs the given action while holding a fresh handle of the named lock, which is released when
   * the action completes. Returns {@code false} without running the action if the lock isn't
   * granted.
   */
  public boolean runExclusively(String name, LockedAction action) throws IOException {
    var lock = backend.createLock(name);
    if (!lock.acquire()) {
      logger.log(Level.DEBUG, () -> "Skipping action as <" + name + "> is held elsewhere");
      return false;
    }
    try {
      action.run();
    } finally {
      releaseQuietly(lock);
    }
    return true;
  }

  private static boolean releaseQuietly(Lock lock) {
    try {
      lock.release();
      return true;
    } catch (IOException e) {
      logger.log(Level.DEBUG, () -> "Couldn't release <" + lock.name() + ">", e);
      return false;
    }
  }

  /** An action run while holding a lock. */
  @FunctionalInterface
  public interface LockedAction {
    void run() throws IOException;
  }
}
