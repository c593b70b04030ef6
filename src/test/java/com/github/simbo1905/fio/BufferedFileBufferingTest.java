package com.github.simbo1905.fio;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class BufferedFileBufferingTest extends JulLoggingConfig {

  private Path file;

  @Before
  public void createFile() throws Exception {
    file = Files.createTempFile("buffered-modes", ".bin");
  }

  @After
  public void deleteFile() throws Exception {
    Files.deleteIfExists(file);
  }

  private static byte[] counting(int length) {
    final byte[] data = new byte[length];
    for (int i = 0; i < length; i++) {
      data[i] = (byte) i;
    }
    return data;
  }

  @Test
  public void fullBufferingDefersWritesUntilFlush() throws Exception {
    try (BufferedFile buffered = new BufferedFile(file, FileType.BINARY, AccessMode.WRITE)) {
      assertThat(buffered.getBufferMode(), is(BufferMode.FULL));
      assertThat(buffered.getBufferSize(), is(BufferedFile.DEFAULT_BUFFER_SIZE));
      buffered.writeBytes(counting(10), 10);
      assertThat(Files.size(file), is(0L));
      assertThat(buffered.getFileLength(), is(10L));
      assertThat(Files.size(file), is(10L));
      buffered.writeBytes(counting(5), 5);
      buffered.flush();
      assertThat(Files.size(file), is(15L));
    }
  }

  @Test
  public void lineBufferingFlushesOnNewline() throws Exception {
    try (BufferedFile text = new BufferedFile(file, FileType.TEXT, AccessMode.WRITE)) {
      assertTrue(text.setBuffer(BufferMode.LINE, 0));
      assertThat(text.getBufferMode(), is(BufferMode.LINE));
      text.putByteString("abc");
      assertThat(Files.size(file), is(0L));
      text.putByteCharacter('\n');
      assertThat(Files.size(file), is(4L));
      text.putByteLine("def");
      assertThat(Files.size(file), is(8L));
    }
  }

  @Test
  public void unbufferedWritesGoStraightThrough() throws Exception {
    try (BufferedFile buffered = new BufferedFile(file, FileType.BINARY, AccessMode.WRITE_EXTENDED)) {
      assertTrue(buffered.setBuffer(BufferMode.NONE, 0));
      assertThat(buffered.getBufferSize(), is(0));
      buffered.writeBytes(counting(3), 3);
      assertThat(Files.size(file), is(3L));
      buffered.rewind();
      final byte[] read = new byte[3];
      assertThat(buffered.readBytes(read, 3), is(3));
      assertArrayEquals(counting(3), read);
    }
  }

  @Test
  public void invalidBufferRequestsAreRefused() throws Exception {
    try (BufferedFile buffered = new BufferedFile(file, FileType.BINARY, AccessMode.WRITE)) {
      assertFalse(buffered.setBuffer(BufferMode.FULL, -1));
      assertFalse(buffered.setBuffer(BufferMode.FULL, 64, new byte[32]));
      assertThat(buffered.getBufferSize(), is(BufferedFile.DEFAULT_BUFFER_SIZE));
      assertTrue(buffered.setBuffer(BufferMode.FULL, 16, new byte[32]));
      assertThat(buffered.getBufferSize(), is(16));
    }
  }

  @Test
  public void userBufferHoldsPendingOutput() throws Exception {
    final byte[] storage = new byte[8];
    try (BufferedFile buffered = new BufferedFile(file, FileType.BINARY, AccessMode.WRITE)) {
      assertTrue(buffered.setBuffer(BufferMode.FULL, 8, storage));
      buffered.writeBytes(new byte[] {7, 7, 7}, 3);
      assertThat(storage[0], is((byte) 7));
      assertThat(storage[2], is((byte) 7));
    }
    assertThat(Files.size(file), is(3L));
  }

  @Test
  public void changingBufferMidStreamKeepsThePosition() throws Exception {
    Files.write(file, counting(100));
    try (BufferedFile buffered = new BufferedFile(file, FileType.BINARY, AccessMode.READ)) {
      buffered.readBytes(new byte[10], 10);
      assertTrue(buffered.setBuffer(BufferMode.FULL, 4));
      assertThat(buffered.getFilePosition(), is(10L));
      final byte[] next = new byte[20];
      assertThat(buffered.readBytes(next, 20), is(20));
      assertThat(next[0], is((byte) 10));
      assertThat(next[19], is((byte) 29));
    }
  }

  @Test
  public void writesLargerThanTheBufferBypassIt() throws Exception {
    try (BufferedFile buffered = new BufferedFile(file, FileType.BINARY, AccessMode.WRITE_EXTENDED)) {
      assertTrue(buffered.setBuffer(BufferMode.FULL, 16));
      buffered.writeBytes(counting(5), 5);
      buffered.writeBytes(counting(100), 100);
      assertThat(buffered.getFilePosition(), is(105L));
      buffered.rewind();
      final byte[] read = new byte[105];
      assertThat(buffered.readBytes(read, 105), is(105));
      assertThat(read[4], is((byte) 4));
      assertThat(read[5], is((byte) 0));
      assertThat(read[104], is((byte) 99));
    }
  }

  @Test
  public void overwriteInsidePendingOutput() throws Exception {
    try (BufferedFile buffered = new BufferedFile(file, FileType.BINARY, AccessMode.WRITE_EXTENDED)) {
      buffered.writeBytes("hello".getBytes(StandardCharsets.US_ASCII), 5);
      assertThat(buffered.getFilePosition(), is(5L));
      buffered.seekSet(1);
      buffered.writeBytes("E".getBytes(StandardCharsets.US_ASCII), 1);
      assertThat(buffered.getFilePosition(), is(2L));
      assertThat(buffered.getFileLength(), is(5L));
    }
    assertThat(Files.readString(file), is("hEllo"));
  }

  @Test
  public void optimalBufferIsAtLeastTheRecommendedSize() throws Exception {
    try (BufferedFile buffered = new BufferedFile(file, FileType.BINARY, AccessMode.WRITE)) {
      assertTrue(buffered.setOptimalBuffer());
      assertThat(buffered.getBufferMode(), is(BufferMode.FULL));
      assertThat(
          (long) buffered.getBufferSize(),
          greaterThanOrEqualTo(BufferedFile.RECOMMENDED_FILE_BLOCK_SIZE));
      assertThat(
          (long) buffered.getBufferSize(), greaterThanOrEqualTo(buffered.getFileBlockSize()));
    }
  }

  @Test
  public void closeWritesPendingOutput() throws Exception {
    final BufferedFile buffered = new BufferedFile(file, FileType.BINARY, AccessMode.WRITE);
    buffered.writeBytes(counting(42), 42);
    assertThat(Files.size(file), is(0L));
    buffered.close();
    assertThat(Files.size(file), is(42L));
  }
}
