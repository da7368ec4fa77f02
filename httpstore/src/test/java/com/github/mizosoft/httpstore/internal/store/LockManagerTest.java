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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.mizosoft.httpstore.backend.LockBackend;
import com.github.mizosoft.httpstore.backend.LockBackend.Lock;
import com.github.mizosoft.httpstore.testing.Logging;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class LockManagerTest {
  static {
    Logging.disable(LockManager.class);
  }

  private final LockBackend backend = LockBackend.local();
  private final LockManager lockManager = new LockManager(backend);

  @Test
  void lockAndUnlock() throws IOException {
    assertThat(lockManager.isLocked("r")).isFalse();
    assertThat(lockManager.tryLock("r")).isTrue();
    assertThat(lockManager.isLocked("r")).isTrue();
    assertThat(lockManager.unlock("r")).isTrue();
    assertThat(lockManager.isLocked("r")).isFalse();
    assertThat(lockManager.unlock("r")).isFalse();
  }

  @Test
  void lockingTwiceFails() throws IOException {
    assertThat(lockManager.tryLock("r")).isTrue();
    assertThat(lockManager.tryLock("r")).isFalse();
    assertThat(lockManager.isLocked("r")).isTrue();
  }

  @Test
  void lockHeldByAnotherManager() throws IOException {
    var otherManager = new LockManager(backend);
    assertThat(otherManager.tryLock("r")).isTrue();
    assertThat(lockManager.tryLock("r")).isFalse();
    assertThat(lockManager.isLocked("r")).isFalse();

    otherManager.unlock("r");
    assertThat(lockManager.tryLock("r")).isTrue();
  }

  @Test
  void deniedLockIsNotRecorded() throws IOException {
    var mockBackend = mock(LockBackend.class);
    var lock = mock(Lock.class);
    when(mockBackend.createLock(anyString())).thenReturn(lock);
    when(lock.acquire()).thenReturn(false, true);

    var manager = new LockManager(mockBackend);
    assertThat(manager.tryLock("r")).isFalse();
    assertThat(manager.unlock("r")).isFalse();
    assertThat(manager.tryLock("r")).isTrue();
    verify(mockBackend, times(2)).createLock("r");
  }

  @Test
  void unlockFailsIfReleaseFails() throws IOException {
    var mockBackend = mock(LockBackend.class);
    var lock = mock(Lock.class);
    when(mockBackend.createLock(anyString())).thenReturn(lock);
    when(lock.name()).thenReturn("r");
    when(lock.acquire()).thenReturn(true);
    when(lock.isAcquired()).thenReturn(true);
    doThrow(new IOException("lost")).when(lock).release();

    var manager = new LockManager(mockBackend);
    assertThat(manager.tryLock("r")).isTrue();
    assertThat(manager.unlock("r")).isFalse();
    assertThat(manager.isLocked("r")).isFalse();
  }

  @Test
  void releaseAllIgnoresFailures() throws IOException {
    var mockBackend = mock(LockBackend.class);
    var failingLock = mock(Lock.class);
    var lock = mock(Lock.class);
    when(mockBackend.createLock("failing")).thenReturn(failingLock);
    when(mockBackend.createLock("ok")).thenReturn(lock);
    when(failingLock.name()).thenReturn("failing");
    when(failingLock.acquire()).thenReturn(true);
    when(lock.acquire()).thenReturn(true);
    doThrow(new IOException("lost")).when(failingLock).release();

    var manager = new LockManager(mockBackend);
    manager.tryLock("failing");
    manager.tryLock("ok");
    manager.releaseAll();

    verify(failingLock).release();
    verify(lock).release();
    assertThat(manager.isLocked("failing")).isFalse();
    assertThat(manager.isLocked("ok")).isFalse();
  }

  @Test
  void runExclusively() throws IOException {
    var ran = new AtomicBoolean();
    assertThat(
            lockManager.runExclusively(
                LockManager.PRUNE_LOCK,
                () -> ran.set(backend.createLock(LockManager.PRUNE_LOCK).acquire())))
        .isTrue();
    assertThat(ran).isFalse(); // The lock is held while running.
    assertThat(backend.createLock(LockManager.PRUNE_LOCK).acquire()).isTrue();
  }

  @Test
  void runExclusivelySkipsActionIfLockIsHeld() throws IOException {
    assertThat(backend.createLock(LockManager.CLEANUP_LOCK).acquire()).isTrue();
    var ran = new AtomicBoolean();
    assertThat(lockManager.runExclusively(LockManager.CLEANUP_LOCK, () -> ran.set(true)))
        .isFalse();
    assertThat(ran).isFalse();
  }

  @Test
  void runExclusivelyReleasesLockOnFailure() throws IOException {
    assertThatIOException()
        .isThrownBy(
            () ->
                lockManager.runExclusively(
                    LockManager.PRUNE_LOCK,
                    () -> {
                      throw new IOException("failed");
                    }));
    assertThat(backend.createLock(LockManager.PRUNE_LOCK).acquire()).isTrue();
  }
}
