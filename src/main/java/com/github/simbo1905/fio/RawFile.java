package com.github.simbo1905.fio;

import static com.github.simbo1905.fio.FileErrorKind.*;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.attribute.FileAttribute;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;

/// Unbuffered file access mirroring POSIX `open`, `read`, `write`, `lseek` and `ftruncate`.
///
/// Each transfer is a single call on the channel and returns what that call moved, which may
/// be less than requested: callers that need every byte must loop. There is no buffering, no
/// text handling and no orientation.
///
/// Construction either yields an open file or throws; the channel is released exactly once by
/// [#close()], normally through try-with-resources:
/// <pre>
/// try (RawFile file = new RawFile(path, OpenFlags.READ_WRITE | OpenFlags.CREATE, ModeFlags.USER_READ_AND_WRITE)) {
///   int written = file.writeBytes(data, data.length);
/// }
/// </pre>
public class RawFile implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(RawFile.class.getName());

  @Getter private final Path filePath;

  @Getter private final int openFlags;

  private final boolean append;

  /*default*/ FileChannel channel;

  private volatile boolean closed;

  /// Opens with the default mode, which only matters when [OpenFlags#CREATE] creates the file.
  public RawFile(Path filePath, int openFlags) throws FileException {
    this(filePath, openFlags, ModeFlags.DEFAULT_MODE);
  }

  /// Opens the file.
  ///
  /// @param filePath  the file to open
  /// @param openFlags [OpenFlags] combined with `|`
  /// @param modeFlags [ModeFlags] applied if the file is created
  /// @throws FileException of kind [FileErrorKind#OPEN] if the file cannot be opened or the
  ///                       requested open-time lock cannot be taken
  public RawFile(Path filePath, int openFlags, int modeFlags) throws FileException {
    this.filePath = Objects.requireNonNull(filePath, "filePath");
    this.openFlags = openFlags;
    this.append = OpenFlags.isSet(openFlags, OpenFlags.APPEND);

    final String action =
        String.format(
            "opening file %s with flags %s and mode %04o",
            filePath, OpenFlags.describe(openFlags), modeFlags);
    final Set<OpenOption> options =
        SystemCalls.invoke(OPEN, filePath, () -> action, () -> OpenFlags.toOpenOptions(openFlags));
    final FileAttribute<?>[] attributes =
        OpenFlags.isSet(openFlags, OpenFlags.CREATE)
            ? ModeFlags.toFileAttributes(filePath.getFileSystem(), modeFlags)
            : new FileAttribute<?>[0];

    if (OpenFlags.isSet(openFlags, OpenFlags.CREATE)
        && (openFlags & OpenFlags.ACCESS_MODE_MASK) == OpenFlags.READ_ONLY) {
      SystemCalls.invoke(OPEN, filePath, () -> action, () -> createForReading(attributes));
    }
    final FileChannel opened =
        SystemCalls.invoke(
            OPEN, filePath, () -> action, () -> FileChannel.open(filePath, options, attributes));
    try {
      lockIfRequested(opened, action);
    } catch (FileException e) {
      // Close the channel if the lock fails to prevent a resource leak
      try {
        opened.close();
      } catch (IOException closeException) {
        logger.log(
            Level.WARNING,
            "Failed to close channel after open-time lock failure on " + filePath,
            closeException);
        e.addSuppressed(closeException);
      }
      throw e;
    }
    this.channel = opened;
    logger.log(Level.FINE, () -> String.format("opened %s flags=%s", filePath, OpenFlags.describe(openFlags)));
  }

  /// The channel ignores creation options when opened for reading only, so a read-only
  /// [OpenFlags#CREATE] makes the file first.
  private Void createForReading(FileAttribute<?>[] attributes) throws IOException {
    try {
      Files.createFile(filePath, attributes);
    } catch (FileAlreadyExistsException e) {
      if (OpenFlags.isSet(openFlags, OpenFlags.EXCLUSIVE)) {
        throw e;
      }
    }
    return null;
  }

  private void lockIfRequested(FileChannel opened, String action) throws FileException {
    final boolean shared = OpenFlags.isSet(openFlags, OpenFlags.SHARED_LOCK);
    if (!shared && !OpenFlags.isSet(openFlags, OpenFlags.EXCLUSIVE_LOCK)) {
      return;
    }
    if (!OpenFlags.isSet(openFlags, OpenFlags.NON_BLOCKING)) {
      SystemCalls.invoke(OPEN, filePath, () -> action, () -> opened.lock(0, Long.MAX_VALUE, shared));
      return;
    }
    final FileLock lock;
    try {
      lock = SystemCalls.invoke(
          OPEN, filePath, () -> action, () -> opened.tryLock(0, Long.MAX_VALUE, shared));
    } catch (FileException e) {
      if (e.getCause() instanceof OverlappingFileLockException) {
        throw FileException.of(OPEN, filePath, Errno.EAGAIN, action);
      }
      throw e;
    }
    if (lock == null) {
      throw FileException.of(OPEN, filePath, Errno.EAGAIN, action);
    }
  }

  public boolean isOpen() {
    return !closed;
  }

  /// The block size of the file store holding this file.
  public long getFileBlockSize() throws FileException {
    final var action = "getting the status of file " + filePath;
    ensureOpen(STATUS, action);
    return SystemCalls.invoke(STATUS, filePath, () -> action, () -> SystemCalls.blockSize(filePath));
  }

  public long getFilePosition() throws FileException {
    return SystemCalls.invoke(
        SEEK, filePath, () -> "getting position for file " + filePath, channel::position);
  }

  public void setFilePosition(long position) throws FileException {
    SystemCalls.invoke(
        SEEK,
        filePath,
        () -> String.format("setting position of file %s to %d", filePath, position),
        () -> channel.position(position));
  }

  /// Seeks relative to the start of the file.
  public void seekSet(long offset) throws FileException {
    SystemCalls.invoke(
        SEEK,
        filePath,
        () -> String.format("seeking to position %d of file %s", offset, filePath),
        () -> channel.position(offset));
  }

  /// Seeks relative to the current position.
  public void seekCurrent(long offset) throws FileException {
    SystemCalls.invoke(
        SEEK,
        filePath,
        () -> String.format("seeking from current position of file %s by %d", filePath, offset),
        () -> channel.position(channel.position() + offset));
  }

  /// Seeks relative to the end of the file.
  public void seekEnd(long offset) throws FileException {
    SystemCalls.invoke(
        SEEK,
        filePath,
        () -> String.format("seeking from the end of file %s by %d", filePath, offset),
        () -> channel.position(channel.size() + offset));
  }

  public long getFileLength() throws FileException {
    return SystemCalls.invoke(
        STATUS, filePath, () -> "getting the status of file " + filePath, channel::size);
  }

  /// Truncates or extends the file. Extension is zero filled; the position does not move.
  public void setFileLength(long length) throws FileException {
    SystemCalls.invoke(
        TRUNCATION,
        filePath,
        () -> String.format("setting length of file %s to %d", filePath, length),
        () -> {
          SystemCalls.setLength(channel, length);
          return null;
        });
  }

  public boolean endOfFile() throws FileException {
    return getFilePosition() >= getFileLength();
  }

  public long getBytesRemaining() throws FileException {
    final long position = getFilePosition();
    final long length = getFileLength();
    return position < length ? length - position : 0;
  }

  public int readBytes(byte[] buffer, int count) throws FileException {
    return readBytes(buffer, 0, count);
  }

  /// Issues one read of up to `count` bytes into `buffer` at `offset`.
  ///
  /// @return the bytes actually read, 0 at end of file
  public int readBytes(byte[] buffer, int offset, int count) throws FileException {
    Objects.checkFromIndexSize(offset, count, buffer.length);
    final int read =
        SystemCalls.invoke(
            READ,
            filePath,
            () -> "reading from file " + filePath,
            () -> channel.read(ByteBuffer.wrap(buffer, offset, count)));
    logger.log(Level.FINEST, () -> String.format("read %s requested=%d actual=%d", filePath, count, read));
    return Math.max(read, 0);
  }

  public int writeBytes(byte[] buffer, int count) throws FileException {
    return writeBytes(buffer, 0, count);
  }

  /// Issues one write of up to `count` bytes from `buffer` at `offset`. With [OpenFlags#APPEND]
  /// the position moves to the end of the file first.
  ///
  /// @return the bytes actually written
  public int writeBytes(byte[] buffer, int offset, int count) throws FileException {
    Objects.checkFromIndexSize(offset, count, buffer.length);
    final int written =
        SystemCalls.invoke(
            WRITE,
            filePath,
            () -> "writing to file " + filePath,
            () -> {
              if (append) {
                channel.position(channel.size());
              }
              return channel.write(ByteBuffer.wrap(buffer, offset, count));
            });
    logger.log(Level.FINEST, () -> String.format("write %s requested=%d actual=%d", filePath, count, written));
    return written;
  }

  /// Releases the channel and any open-time lock. Later calls do nothing.
  ///
  /// @throws FileException of kind [FileErrorKind#CLOSE] if the OS reports a failure; the
  ///                       channel is released regardless
  @Override
  @Synchronized
  public void close() throws FileException {
    if (closed) {
      return;
    }
    closed = true;
    logger.log(Level.FINE, () -> String.format("closed called on %s", filePath));
    SystemCalls.invoke(
        CLOSE,
        filePath,
        () -> "closing file " + filePath,
        () -> {
          channel.close();
          return null;
        });
  }

  private void ensureOpen(FileErrorKind kind, String action) throws FileException {
    if (closed) {
      throw FileException.of(kind, filePath, Errno.EBADF, action);
    }
  }

  @Override
  public String toString() {
    return "RawFile[" + filePath + ", " + OpenFlags.describe(openFlags) + "]";
  }
}
