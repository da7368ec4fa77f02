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

import static com.github.mizosoft.httpstore.internal.Validate.requireState;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.httpstore.backend.CacheBackend;
import com.github.mizosoft.httpstore.internal.Utils;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.io.EOFException;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@link CacheBackend} implementation that keeps each value in its own file under a directory. The
 * directory can be shared by multiple processes. Files are named after the SHA-256 of their keys
 * and are replaced atomically on commit, so a reader never sees a partially written value.
 *
 * <p>An entry file has the following layout:
 *
 * <pre>{@code
 * +-------------+-----------------+-------------+-----------+-------+
 * | magic (int) | expiresAt(long) | keyLen(int) | key bytes | value |
 * +-------------+-----------------+-------------+-----------+-------+
 * }</pre>
 *
 * <p>Tags aren't supported natively. Use {@link CacheBackend#withTags(CacheBackend)} to add them.
 */
public final class FileSystemCacheBackend implements CacheBackend {
  private static final Logger logger = System.getLogger(FileSystemCacheBackend.class.getName());

  static final int ENTRY_MAGIC = 0x68747073; // "htps"
  static final String ENTRY_FILE_SUFFIX = ".entry";
  static final String TEMP_FILE_SUFFIX = ".tmp";

  private static final int HEADER_SIZE = Integer.BYTES + Long.BYTES + Integer.BYTES;
  private static final long NO_EXPIRY = Long.MAX_VALUE;
  private static final Set<Capability> CAPABILITIES =
      Set.copyOf(EnumSet.of(Capability.PRUNE, Capability.CLEAR));

  private final Path directory;
  private final Clock clock;
  private final Object lock = new Object();

  @GuardedBy("lock")
  private final Map<String, Entry> deferred = new LinkedHashMap<>();

  @GuardedBy("lock")
  private boolean closed;

  private FileSystemCacheBackend(Path directory, Clock clock) {
    this.directory = directory;
    this.clock = clock;
  }

  public Path directory() {
    return directory;
  }

  @Override
  public Set<Capability> capabilities() {
    return CAPABILITIES;
  }

  @Override
  public Optional<ByteBuffer> get(String key) throws IOException {
    requireNonNull(key);
    synchronized (lock) {
      requireNotClosed();
      var entry = deferred.get(key);
      if (entry != null) {
        return entry.isExpired(clock.millis())
            ? Optional.empty()
            : Optional.of(entry.value.duplicate());
      }
    }

    var file = entryFile(key);
    try (var channel = FileChannel.open(file, READ)) {
      var header = FileIO.read(channel, HEADER_SIZE);
      int magic = header.getInt();
      long expiresAt = header.getLong();
      int keyLength = header.getInt();
      if (magic != ENTRY_MAGIC || keyLength < 0 || keyLength > channel.size()) {
        logger.log(Level.WARNING, () -> "Deleting corrupt entry file: " + file);
        Utils.deleteIfExistsQuietly(file);
        return Optional.empty();
      }
      if (clock.millis() >= expiresAt) {
        return Optional.empty();
      }
      var storedKey = UTF_8.decode(FileIO.read(channel, keyLength)).toString();
      if (!storedKey.equals(key)) {
        return Optional.empty(); // SHA-256 collision
      }
      long valueSize = channel.size() - HEADER_SIZE - keyLength;
      return Optional.of(FileIO.read(channel, (int) valueSize));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (EOFException e) {
      logger.log(Level.WARNING, () -> "Deleting truncated entry file: " + file, e);
      Utils.deleteIfExistsQuietly(file);
      return Optional.empty();
    }
  }

  @Override
  public boolean saveDeferred(
      String key, ByteBuffer value, @Nullable Duration ttl, Set<String> tags) {
    requireNonNull(key);
    requireNonNull(value);
    if (!tags.isEmpty()) {
      throw new UnsupportedOperationException("tags are not supported by " + this);
    }
    long expiresAt =
        ttl != null
            ? clock.millis() + Utils.requireNonNegativeDuration(ttl).toMillis()
            : NO_EXPIRY;
    synchronized (lock) {
      requireNotClosed();
      deferred.put(key, new Entry(key, Utils.copy(value), expiresAt));
    }
    return true;
  }

  @Override
  public boolean commit() throws IOException {
    Map<String, Entry> toWrite;
    synchronized (lock) {
      requireNotClosed();
      toWrite = new LinkedHashMap<>(deferred);
      deferred.clear();
    }

    for (var entry : toWrite.values()) {
      write(entry);
    }
    return true;
  }

  private void write(Entry entry) throws IOException {
    var keyBytes = entry.key.getBytes(UTF_8);
    var header =
        ByteBuffer.allocate(HEADER_SIZE)
            .putInt(ENTRY_MAGIC)
            .putLong(entry.expiresAt)
            .putInt(keyBytes.length)
            .flip();
    var targetFile = entryFile(entry.key);
    var tempFile =
        targetFile.resolveSibling(
            targetFile.getFileName()
                + "."
                + Long.toHexString(ThreadLocalRandom.current().nextLong())
                + TEMP_FILE_SUFFIX);
    try {
      try (var channel = FileChannel.open(tempFile, WRITE, CREATE_NEW)) {
        FileIO.write(
            channel, new ByteBuffer[] {header, ByteBuffer.wrap(keyBytes), entry.value.duplicate()});
      }
      Files.move(tempFile, targetFile, ATOMIC_MOVE, REPLACE_EXISTING);
    } catch (IOException e) {
      Utils.deleteIfExistsQuietly(tempFile);
      throw e;
    }
  }

  @Override
  public boolean delete(String key) throws IOException {
    requireNonNull(key);
    boolean removedDeferred;
    synchronized (lock) {
      requireNotClosed();
      removedDeferred = deferred.remove(key) != null;
    }
    return Files.deleteIfExists(entryFile(key)) || removedDeferred;
  }

  @Override
  public void prune() throws IOException {
    synchronized (lock) {
      requireNotClosed();
    }

    long now = clock.millis();
    try (var stream = Files.newDirectoryStream(directory)) {
      for (var file : stream) {
        var filename = file.getFileName().toString();
        if (filename.endsWith(TEMP_FILE_SUFFIX)) {
          // Leftover of a crashed writer, unless it's being written right now.
          var lastModified = Files.getLastModifiedTime(file).toMillis();
          if (now - lastModified > Duration.ofMinutes(1).toMillis()) {
            Files.deleteIfExists(file);
          }
        } else if (filename.endsWith(ENTRY_FILE_SUFFIX) && isExpiredOrCorrupt(file, now)) {
          Files.deleteIfExists(file);
        }
      }
    } catch (DirectoryIteratorException e) {
      throw e.getCause();
    }
  }

  private static boolean isExpiredOrCorrupt(Path file, long now) throws IOException {
    try (var channel = FileChannel.open(file, READ)) {
      var header = FileIO.read(channel, HEADER_SIZE);
      return header.getInt() != ENTRY_MAGIC || now >= header.getLong();
    } catch (NoSuchFileException e) {
      return false;
    } catch (EOFException e) {
      return true;
    }
  }

  @Override
  public void clear() throws IOException {
    synchronized (lock) {
      requireNotClosed();
      deferred.clear();
    }

    try (var stream = Files.newDirectoryStream(directory)) {
      for (var file : stream) {
        var filename = file.getFileName().toString();
        if (filename.endsWith(ENTRY_FILE_SUFFIX) || filename.endsWith(TEMP_FILE_SUFFIX)) {
          Files.deleteIfExists(file);
        }
      }
    } catch (DirectoryIteratorException e) {
      throw e.getCause();
    }
  }

  @Override
  public void close() {
    synchronized (lock) {
      closed = true;
      deferred.clear();
    }
  }

  Path entryFile(String key) {
    return directory.resolve(Utils.sha256Hex(key.getBytes(UTF_8)) + ENTRY_FILE_SUFFIX);
  }

  @GuardedBy("lock")
  private void requireNotClosed() {
    requireState(!closed, "closed");
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[" + directory + "]";
  }

  /** Opens a backend over the given directory, creating the directory if it doesn't exist. */
  public static FileSystemCacheBackend open(Path directory, Clock clock) throws IOException {
    Files.createDirectories(directory);
    return new FileSystemCacheBackend(directory, requireNonNull(clock));
  }

  private static final class Entry {
    final String key;
    final ByteBuffer value;
    final long expiresAt;

    Entry(String key, ByteBuffer value, long expiresAt) {
      this.key = key;
      this.value = value;
      this.expiresAt = expiresAt;
    }

    boolean isExpired(long now) {
      return now >= expiresAt;
    }
  }
}
