package com.github.simbo1905.fio;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.NonReadableChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Supplier;

/// Runs one call against the JDK file layer and turns whatever it throws into a
/// [FileException] carrying the OS error code of that call.
final class SystemCalls {

  /// Block size assumed when the file store cannot report one.
  static final long RECOMMENDED_FILE_BLOCK_SIZE =
      System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")
          ? 64 * 1024
          : 2 * 64 * 1024;

  private SystemCalls() {}

  @FunctionalInterface
  interface Call<T> {
    T call() throws IOException;
  }

  static <T> T invoke(FileErrorKind kind, Path filePath, Supplier<String> action, Call<T> call)
      throws FileException {
    try {
      return call.call();
    } catch (FileException e) {
      throw e;
    } catch (IOException
        | NonReadableChannelException
        | NonWritableChannelException
        | OverlappingFileLockException
        | IllegalArgumentException
        | UnsupportedOperationException e) {
      throw FileException.of(kind, filePath, e, action.get());
    }
  }

  /// The block size of the file store holding the file.
  ///
  /// The JDK has no `fstat` on an open channel, so the store is found by path. When the path of
  /// an open file has been unlinked the store of its parent directory is used instead. A path
  /// replaced by a file on another store reports that store.
  static long blockSize(Path filePath) throws IOException {
    try {
      return Files.getFileStore(filePath).getBlockSize();
    } catch (NoSuchFileException e) {
      final Path parent = filePath.toAbsolutePath().getParent();
      if (parent == null) {
        throw e;
      }
      return Files.getFileStore(parent).getBlockSize();
    }
  }

  /// Shrinks or grows the file to exactly `newLength` bytes without moving the channel position.
  /// Growing writes one zero byte at the new last offset so the OS fills the gap.
  static void setLength(FileChannel channel, long newLength) throws IOException {
    if (newLength < 0) {
      throw new IllegalArgumentException("Negative length: " + newLength);
    }
    final long position = channel.position();
    final long size = channel.size();
    if (newLength < size) {
      channel.truncate(newLength);
    } else if (newLength > size) {
      final var zero = ByteBuffer.allocate(1);
      while (zero.hasRemaining()) {
        channel.write(zero, newLength - 1);
      }
    }
    channel.position(position);
  }
}
