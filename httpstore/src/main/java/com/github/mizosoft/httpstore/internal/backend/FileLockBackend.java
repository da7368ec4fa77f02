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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.LockBackend;
import com.github.mizosoft.httpstore.internal.Utils;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link LockBackend} that maps each lock to a file under a directory, which is locked with an OS
 * file lock. Locks exclude each other across processes sharing the directory, and across backends
 * sharing the directory within the same JVM. Locks held by a process are released by the OS when
 * the process dies. Lock files are never deleted.
 */
public final class FileLockBackend implements LockBackend {
  static final String LOCK_FILE_SUFFIX = ".lock";

  private static final int MAX_READABLE_NAME_LENGTH = 32;
  private static final int NAME_HASH_LENGTH = 16;

  private final Path directory;
  private final Set<FileBackedLock> acquiredLocks = ConcurrentHashMap.newKeySet();

  private FileLockBackend(Path directory) {
    this.directory = directory;
  }

  public Path directory() {
    return directory;
  }

  @Override
  public Lock createLock(String name) {
    return new FileBackedLock(requireNonNull(name), lockFile(name));
  }

  /** Releases all locks acquired through this backend. */
  @Override
  public void close() {
    for (var lock : acquiredLocks) {
      lock.closeQuietly();
    }
  }

  Path lockFile(String name) {
    var readableName = name.replaceAll("[^A-Za-z0-9._-]+", "-");
    if (readableName.length() > MAX_READABLE_NAME_LENGTH) {
      readableName = readableName.substring(0, MAX_READABLE_NAME_LENGTH);
    }
    var hash = Utils.sha256Hex(name.getBytes(UTF_8)).substring(0, NAME_HASH_LENGTH);
    return directory.resolve(readableName + "." + hash + LOCK_FILE_SUFFIX);
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[" + directory + "]";
  }

  /** Opens a backend over the given directory, creating the directory if it doesn't exist. */
  public static FileLockBackend open(Path directory) throws IOException {
    Files.createDirectories(directory);
    return new FileLockBackend(directory);
  }

  private final class FileBackedLock implements Lock {
    private final String name;
    private final Path lockFile;
    private final Object lock = new Object();

    @GuardedBy("lock")
    private @Nullable FileChannel channel;

    @GuardedBy("lock")
    private @Nullable FileLock fileLock;

    FileBackedLock(String name, Path lockFile) {
      this.name = name;
      this.lockFile = lockFile;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public boolean acquire() throws IOException {
      synchronized (lock) {
        if (fileLock != null) {
          return false;
        }

        var newChannel = FileChannel.open(lockFile, WRITE, CREATE);
        try {
          var newFileLock = newChannel.tryLock();
          if (newFileLock == null) {
            Utils.closeQuietly(newChannel);
            return false;
          }
          channel = newChannel;
          fileLock = newFileLock;
        } catch (OverlappingFileLockException e) {
          // Held by another channel within this JVM.
          Utils.closeQuietly(newChannel);
          return false;
        } catch (IOException e) {
          Utils.closeQuietly(newChannel);
          throw e;
        }
      }
      acquiredLocks.add(this);
      return true;
    }

    @Override
    public void release() throws IOException {
      FileChannel releasedChannel;
      FileLock releasedFileLock;
      synchronized (lock) {
        releasedChannel = channel;
        releasedFileLock = fileLock;
        channel = null;
        fileLock = null;
      }
      acquiredLocks.remove(this);
      if (releasedChannel == null || releasedFileLock == null) {
        throw new IOException("Lock <" + name + "> isn't acquired");
      }

      try (releasedChannel) {
        if (!releasedFileLock.isValid()) {
          throw new IOException("Lock <" + name + "> was lost");
        }
        releasedFileLock.release();
      }
    }

    @Override
    public boolean isAcquired() {
      synchronized (lock) {
        return fileLock != null && fileLock.isValid();
      }
    }

    void closeQuietly() {
      FileChannel closedChannel;
      synchronized (lock) {
        closedChannel = channel;
        channel = null;
        fileLock = null;
      }
      acquiredLocks.remove(this);
      Utils.closeQuietly(closedChannel); // Closing the channel releases the lock.
    }
  }
}
