package com.github.simbo1905.fio;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

/// Property-based integration test for the short transfer completion loop. Random data is
/// written and read back through channels that move only a few bytes per call, under random
/// buffer sizes and element sizes, and must come back whole.
public class BufferedFileChunkingITCase {

  @Property(tries = 100)
  void elementsSurviveShortTransfers(
      @ForAll @Size(max = 4096) byte[] data,
      @ForAll @IntRange(min = 1, max = 64) int bufferSize,
      @ForAll @IntRange(min = 1, max = 17) int maxBytesPerCall,
      @ForAll @IntRange(min = 1, max = 12) int elementSize,
      @ForAll("bufferModes") BufferMode bufferMode)
      throws IOException {
    final Path path = Files.createTempFile("chunking", ".bin");
    try {
      final int count = data.length / elementSize;
      try (BufferedFile file = new BufferedFile(path, FileType.BINARY, AccessMode.WRITE_EXTENDED)) {
        Assume.that(file.setBuffer(bufferMode, bufferSize));
        file.channel = new ShortTransferFileChannel(file.channel, maxBytesPerCall);

        if (file.writeElements(data, 0, elementSize, count) != count) {
          throw new AssertionError("short write of " + count + " elements");
        }
        file.rewind();

        final byte[] read = new byte[(count + 1) * elementSize];
        final int got = file.readElements(read, 0, elementSize, count + 1);
        if (got != count) {
          throw new AssertionError("read " + got + " elements, expected " + count);
        }
        final int length = count * elementSize;
        if (!Arrays.equals(read, 0, length, data, 0, length)) {
          throw new AssertionError("content differs");
        }
        if (!file.isEndOfFileLatched() || !file.endOfFile()) {
          throw new AssertionError("end of file not reached");
        }
      }
      if (Files.size(path) != (long) count * elementSize) {
        throw new AssertionError("file length " + Files.size(path));
      }
    } finally {
      Files.deleteIfExists(path);
    }
  }

  @Provide
  Arbitrary<BufferMode> bufferModes() {
    return Arbitraries.of(BufferMode.class);
  }
}
