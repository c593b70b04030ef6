package com.github.simbo1905.fio;

import static com.github.simbo1905.fio.FileErrorKind.*;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.NonWritableChannelException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;

/// Buffered file access in the manner of a stdio stream, with automatic recovery from short
/// binary transfers.
///
/// A file is opened with a [FileType] and an [AccessMode], both fixed for its lifetime. Text
/// files offer byte and wide character, string, line and formatted operations; a text stream
/// commits to byte or wide characters on first use (see [#setCharacterMode(CharacterMode)]).
/// Binary files offer element and byte transfers which loop until the requested count is met,
/// returning a short count only at end of file.
///
/// Byte characters are the values 0..255, and byte strings map each byte to the char of the same
/// value, as [java.io.RandomAccessFile#readLine()] does. Wide characters are Unicode code points
/// encoded with the stream charset, UTF-8 by default.
///
/// Calling an operation of the wrong family (text on a binary file, reading a write-only file,
/// byte I/O on a wide stream) is a programming error and throws [IllegalStateException]. Every
/// failure reported by the file layer throws a [FileException].
///
/// Instances are not thread-safe. Threads sharing one stream can serialise through the advisory
/// [#lockFile()] family.
public class BufferedFile implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(BufferedFile.class.getName());

  public static final int BYTE_END_OF_FILE = -1;
  public static final int WIDE_END_OF_FILE = -1;

  /// Buffer size used until [#setBuffer(BufferMode, int)] changes it.
  public static final int DEFAULT_BUFFER_SIZE = 8 * 1024;

  /// Minimum buffer size chosen by [#setOptimalBuffer()]: 64 KiB on Windows, 128 KiB elsewhere.
  public static final long RECOMMENDED_FILE_BLOCK_SIZE = SystemCalls.RECOMMENDED_FILE_BLOCK_SIZE;

  static final int BYTE_STRING_BUFFER_LENGTH = 4 * 1024;
  static final int WIDE_STRING_BUFFER_LENGTH = 1024;

  private enum BufferState {
    IDLE,
    READING,
    WRITING
  }

  @Getter private final Path filePath;

  @Getter private final FileType fileType;

  @Getter private final AccessMode accessMode;

  private final WideCodec wideCodec;

  private final GuardedStreamLock streamLock = new GuardedStreamLock();

  ///  The channel is package visible so tests can interpose on it.
  /*default*/ FileChannel channel;

  @Getter private BufferMode bufferMode = BufferMode.FULL;

  /// While reading holds read-ahead between position and limit; while writing holds pending
  /// output between 0 and position.
  private ByteBuffer buffer = ByteBuffer.allocate(DEFAULT_BUFFER_SIZE);

  private BufferState bufferState = BufferState.IDLE;

  /// Bytes given back by unget, most recent first.
  private final Deque<Byte> pushback = new ArrayDeque<>();

  private CharacterMode characterMode = CharacterMode.NO_ORIENTATION;

  private boolean errorLatched;

  private boolean endOfFileLatched;

  private volatile boolean closed;

  public BufferedFile(Path filePath, FileType fileType, AccessMode accessMode)
      throws FileException {
    this(filePath, fileType, accessMode, StandardCharsets.UTF_8);
  }

  /// Opens the file.
  ///
  /// @param filePath   the file to open
  /// @param fileType   text or binary
  /// @param accessMode one of the six `fopen` modes
  /// @param charset    encoding of wide characters
  /// @throws FileException of kind [FileErrorKind#OPEN] if the file cannot be opened; nothing
  ///                       is left open
  public BufferedFile(Path filePath, FileType fileType, AccessMode accessMode, Charset charset)
      throws FileException {
    this.filePath = Objects.requireNonNull(filePath, "filePath");
    this.fileType = Objects.requireNonNull(fileType, "fileType");
    this.accessMode = Objects.requireNonNull(accessMode, "accessMode");
    this.wideCodec = new WideCodec(Objects.requireNonNull(charset, "charset"));
    this.channel =
        SystemCalls.invoke(
            OPEN,
            filePath,
            () ->
                String.format(
                    "opening file %s for %s (%s)",
                    filePath, accessMode.getDescription(), accessMode.modeString(fileType)),
            () -> FileChannel.open(filePath, accessMode.openOptions()));
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "opened %s type=%s mode=%s",
                filePath, fileType.getDisplayName(), accessMode.modeString(fileType)));
  }

  public boolean isTextFile() {
    return fileType == FileType.TEXT;
  }

  public boolean isBinaryFile() {
    return fileType == FileType.BINARY;
  }

  public boolean isReadOnly() {
    return accessMode.isReadOnly();
  }

  public boolean isWriteOnly() {
    return accessMode.isWriteOnly();
  }

  public boolean isReadWrite() {
    return accessMode.isReadWrite();
  }

  public boolean isOpen() {
    return !closed;
  }

  public Charset getCharset() {
    return wideCodec.charset();
  }

  // ---------------------------------------------------------------------------------------------
  // Stream locking

  /// @return true if the stream lock was free or already held by this thread
  public boolean tryLockFile() {
    return streamLock.tryLock();
  }

  public void lockFile() {
    streamLock.lock();
  }

  public void unlockFile() {
    streamLock.unlock();
  }

  /// Locks the stream until the returned guard is closed.
  public GuardedStreamLock.LockGuard lockGuard() {
    return streamLock.guard();
  }

  // ---------------------------------------------------------------------------------------------
  // Buffering

  /// The block size of the file store holding this file.
  public long getFileBlockSize() throws FileException {
    final var action = "getting status of file " + filePath;
    ensureOpen(STATUS, action);
    return SystemCalls.invoke(STATUS, filePath, () -> action, () -> SystemCalls.blockSize(filePath));
  }

  /// The capacity of the stream buffer, 0 when unbuffered.
  public int getBufferSize() {
    return bufferMode == BufferMode.NONE ? 0 : buffer.capacity();
  }

  public boolean setBuffer(BufferMode mode, int size) throws FileException {
    return setBuffer(mode, size, null);
  }

  /// Replaces the stream buffer. Pending output is written and read-ahead is given back first,
  /// so unlike `setvbuf` this may be called at any time.
  ///
  /// @param mode       the buffering strategy
  /// @param size       buffer capacity in bytes; 0 selects [#DEFAULT_BUFFER_SIZE]
  /// @param userBuffer storage to buffer in, at least `size` bytes, or null to allocate
  /// @return false if the size is negative or the user buffer is too small
  /// @throws FileException of kind [FileErrorKind#FLUSH] if pending output cannot be written
  public boolean setBuffer(BufferMode mode, int size, byte[] userBuffer) throws FileException {
    Objects.requireNonNull(mode, "mode");
    if (size < 0 || (userBuffer != null && userBuffer.length < size)) {
      return false;
    }
    final var action = "flushing file " + filePath + " before changing its buffer";
    ensureOpen(FLUSH, action);
    try {
      synchronizeChannel();
    } catch (IOException e) {
      throw failure(FLUSH, e, action);
    }
    if (mode == BufferMode.NONE) {
      buffer = ByteBuffer.allocate(1);
    } else {
      final int capacity = size == 0 ? DEFAULT_BUFFER_SIZE : size;
      buffer =
          userBuffer != null && size > 0
              ? ByteBuffer.wrap(userBuffer, 0, capacity).slice()
              : ByteBuffer.allocate(capacity);
    }
    bufferMode = mode;
    logger.log(
        Level.FINE,
        () -> String.format("setBuffer %s mode=%s size=%d", filePath, mode, buffer.capacity()));
    return true;
  }

  /// Requests full buffering at the larger of the file store block size and
  /// [#RECOMMENDED_FILE_BLOCK_SIZE]. A store that cannot report a block size counts as 0.
  public boolean setOptimalBuffer() throws FileException {
    long blockSize;
    try {
      blockSize = getFileBlockSize();
    } catch (FileException e) {
      if (e.getErrno() != Errno.EOPNOTSUPP) {
        throw e;
      }
      logger.log(Level.FINE, () -> "block size unavailable for " + filePath);
      blockSize = 0;
    }
    final long size = Math.max(blockSize, RECOMMENDED_FILE_BLOCK_SIZE);
    return setBuffer(BufferMode.FULL, (int) Math.min(size, Integer.MAX_VALUE - 8));
  }

  /// Writes any pending output to the file.
  public void flush() throws FileException {
    final var action = "flushing file " + filePath;
    ensureOpen(FLUSH, action);
    try {
      writePending();
    } catch (IOException e) {
      throw failure(FLUSH, e, action);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Positioning

  /// The position the next read or write applies to, accounting for buffered data.
  public long getFilePosition() throws FileException {
    final var action = "getting position for file " + filePath;
    ensureOpen(TELL, action);
    final long position;
    try {
      position = logicalPosition();
    } catch (IOException e) {
      throw failure(TELL, e, action);
    }
    if (position < 0) {
      throw FileException.of(TELL, filePath, Errno.EINVAL, action);
    }
    return position;
  }

  public void setFilePosition(long position) throws FileException {
    seekTo(position, String.format("setting position of file %s to %d", filePath, position));
  }

  /// Seeks relative to the start of the file.
  public void seekSet(long offset) throws FileException {
    seekTo(offset, String.format("seeking to position %d of file %s", offset, filePath));
  }

  /// Seeks relative to the current position.
  public void seekCurrent(long offset) throws FileException {
    final var action =
        String.format("seeking from current position of file %s by %d", filePath, offset);
    ensureOpen(SEEK, action);
    final long target;
    try {
      target = logicalPosition() + offset;
    } catch (IOException e) {
      throw failure(SEEK, e, action);
    }
    seekTo(target, action);
  }

  /// Seeks relative to the end of the file, pending output included.
  public void seekEnd(long offset) throws FileException {
    final var action = String.format("seeking from the end of file %s by %d", filePath, offset);
    ensureOpen(SEEK, action);
    final long target;
    try {
      synchronizeChannel();
      target = channel.size() + offset;
    } catch (IOException e) {
      throw failure(SEEK, e, action);
    }
    seekTo(target, action);
  }

  /// Seeks to the start and clears the error and end of file indicators.
  public void rewind() throws FileException {
    seekTo(0, "rewinding file " + filePath);
    clearErrors();
  }

  private void seekTo(long target, String action) throws FileException {
    ensureOpen(SEEK, action);
    if (target < 0) {
      throw FileException.of(SEEK, filePath, Errno.EINVAL, action);
    }
    try {
      synchronizeChannel();
      channel.position(target);
    } catch (IOException e) {
      throw failure(SEEK, e, action);
    }
    endOfFileLatched = false;
  }

  /// The file length, including output still held in the buffer.
  public long getFileLength() throws FileException {
    final var action = "getting status of file " + filePath;
    ensureOpen(STATUS, action);
    try {
      writePending();
      return channel.size();
    } catch (IOException e) {
      throw failure(STATUS, e, action);
    }
  }

  /// Truncates or extends the file. Extension is zero filled; the position does not move.
  public void setFileLength(long length) throws FileException {
    final var action = String.format("setting length of file %s to %d", filePath, length);
    ensureOpen(TRUNCATION, action);
    if (length < 0) {
      throw FileException.of(TRUNCATION, filePath, Errno.EINVAL, action);
    }
    try {
      synchronizeChannel();
      SystemCalls.setLength(channel, length);
    } catch (IOException | NonWritableChannelException e) {
      throw FileException.of(TRUNCATION, filePath, e, action);
    }
  }

  public boolean endOfFile() throws FileException {
    return getFilePosition() >= getFileLength();
  }

  public long getBytesRemaining() throws FileException {
    final long position = getFilePosition();
    final long length = getFileLength();
    return position < length ? length - position : 0;
  }

  /// Whether a read or write failed since the last [#clearErrors()] or [#rewind()].
  public boolean isErrorLatched() {
    return errorLatched;
  }

  /// Whether a read reached the end of the file since the last seek or [#clearErrors()].
  public boolean isEndOfFileLatched() {
    return endOfFileLatched;
  }

  public void clearErrors() {
    errorLatched = false;
    endOfFileLatched = false;
  }

  // ---------------------------------------------------------------------------------------------
  // Orientation

  /// Requests an orientation and returns the one in effect afterwards. An unoriented stream
  /// takes the requested orientation; a committed stream keeps its own, so requesting
  /// [CharacterMode#NO_ORIENTATION] is a pure query.
  public CharacterMode setCharacterMode(CharacterMode desired) {
    Objects.requireNonNull(desired, "desired");
    requireText();
    final CharacterMode before = characterMode;
    characterMode = characterMode.transitionTo(desired);
    if (before != characterMode) {
      logger.log(Level.FINE, () -> String.format("%s is now %s", filePath, characterMode.getDescription()));
    }
    return characterMode;
  }

  public CharacterMode getCharacterMode() {
    return setCharacterMode(CharacterMode.NO_ORIENTATION);
  }

  // ---------------------------------------------------------------------------------------------
  // Byte characters

  /// @return the next byte as 0..255, or [#BYTE_END_OF_FILE]
  public int getByteCharacter() throws FileException {
    requireCharacterInput(CharacterMode.BYTE_ORIENTATION);
    final var action = "getting character from file " + filePath;
    ensureOpen(READ, action);
    try {
      return nextByte();
    } catch (IOException e) {
      throw failure(READ, e, action);
    }
  }

  /// Pushes a byte back so the next read returns it. Clears the end of file indicator.
  public void ungetByteCharacter(int character) throws FileException {
    requireCharacterInput(CharacterMode.BYTE_ORIENTATION);
    if (character == BYTE_END_OF_FILE) {
      throw FileException.of(
          READ, filePath, Errno.EINVAL, "ungetting EOF character from file " + filePath);
    }
    final var action = "ungetting regular character from file " + filePath;
    ensureOpen(READ, action);
    try {
      unread(new byte[] {(byte) character});
    } catch (IOException e) {
      throw failure(READ, e, action);
    }
  }

  public void putByteCharacter(int character) throws FileException {
    requireCharacterOutput(CharacterMode.BYTE_ORIENTATION);
    final var action = "putting character to file " + filePath;
    ensureOpen(WRITE, action);
    try {
      putBytes(new byte[] {(byte) character}, 0, 1);
    } catch (IOException e) {
      throw failure(WRITE, e, action);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Wide characters

  /// @return the next code point, or [#WIDE_END_OF_FILE]
  /// @throws FileException of kind [FileErrorKind#READ] with EILSEQ for malformed input
  public int getWideCharacter() throws FileException {
    requireCharacterInput(CharacterMode.WIDE_ORIENTATION);
    final var action = "getting wide character from file " + filePath;
    ensureOpen(READ, action);
    try {
      return wideCodec.decode(this::nextByte);
    } catch (IOException e) {
      throw failure(READ, e, action);
    }
  }

  public void ungetWideCharacter(int codePoint) throws FileException {
    requireCharacterInput(CharacterMode.WIDE_ORIENTATION);
    if (codePoint == WIDE_END_OF_FILE) {
      throw FileException.of(
          READ, filePath, Errno.EINVAL, "ungetting EOF wide character from file " + filePath);
    }
    final var action = "ungetting regular wide character from file " + filePath;
    ensureOpen(READ, action);
    try {
      unread(wideCodec.encode(codePoint));
    } catch (IOException e) {
      throw failure(READ, e, action);
    }
  }

  public void putWideCharacter(int codePoint) throws FileException {
    requireCharacterOutput(CharacterMode.WIDE_ORIENTATION);
    final var action = "putting wide character to file " + filePath;
    ensureOpen(WRITE, action);
    try {
      final byte[] encoded = wideCodec.encode(codePoint);
      putBytes(encoded, 0, encoded.length);
    } catch (IOException e) {
      throw failure(WRITE, e, action);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Strings and lines

  /// Reads up to the next newline or the end of the file. The newline is consumed but not
  /// returned.
  public String getByteString() throws FileException {
    return readByteText(false);
  }

  /// Reads up to and including the next newline. At the end of the file the remaining
  /// characters are returned without a newline.
  public String getByteLine() throws FileException {
    return readByteText(true);
  }

  private String readByteText(boolean keepNewline) throws FileException {
    requireCharacterInput(CharacterMode.BYTE_ORIENTATION);
    final var result = new StringBuilder();
    final char[] accumulator = new char[BYTE_STRING_BUFFER_LENGTH];
    int size = 0;
    while (true) {
      final int c = getByteCharacter();
      if (c == BYTE_END_OF_FILE || c == '\n') {
        if (c == '\n' && keepNewline) {
          accumulator[size++] = '\n';
        }
        break;
      }
      accumulator[size++] = (char) c;
      if (size == accumulator.length) {
        result.append(accumulator, 0, size);
        size = 0;
      }
    }
    result.append(accumulator, 0, size);
    return result.toString();
  }

  /// Reads up to the next newline or the end of the file. The newline is consumed but not
  /// returned.
  public String getWideString() throws FileException {
    return readWideText(false);
  }

  /// Reads up to and including the next newline. At the end of the file the remaining
  /// characters are returned without a newline.
  public String getWideLine() throws FileException {
    return readWideText(true);
  }

  private String readWideText(boolean keepNewline) throws FileException {
    requireCharacterInput(CharacterMode.WIDE_ORIENTATION);
    final var result = new StringBuilder();
    final int[] accumulator = new int[WIDE_STRING_BUFFER_LENGTH];
    int size = 0;
    while (true) {
      final int c = getWideCharacter();
      if (c == WIDE_END_OF_FILE || c == '\n') {
        if (c == '\n' && keepNewline) {
          accumulator[size++] = '\n';
        }
        break;
      }
      accumulator[size++] = c;
      if (size == accumulator.length) {
        result.append(new String(accumulator, 0, size));
        size = 0;
      }
    }
    result.append(new String(accumulator, 0, size));
    return result.toString();
  }

  /// Writes each char as one ISO-8859-1 byte. Nothing is written if any char is above `0xFF`.
  ///
  /// @return the number of characters written
  /// @throws FileException of kind [FileErrorKind#WRITE] with EILSEQ for a char above `0xFF`
  public int putByteString(String text) throws FileException {
    requireCharacterOutput(CharacterMode.BYTE_ORIENTATION);
    final var action = "putting string to file " + filePath;
    ensureOpen(WRITE, action);
    final byte[] bytes = new byte[text.length()];
    for (int i = 0; i < bytes.length; i++) {
      final char c = text.charAt(i);
      if (c > 0xFF) {
        errorLatched = true;
        throw FileException.of(WRITE, filePath, Errno.EILSEQ, action);
      }
      bytes[i] = (byte) c;
    }
    try {
      putBytes(bytes, 0, bytes.length);
    } catch (IOException e) {
      throw failure(WRITE, e, action);
    }
    return bytes.length;
  }

  /// Writes the string followed by a newline.
  ///
  /// @return the number of characters written, the newline included
  public int putByteLine(String text) throws FileException {
    final int written = putByteString(text);
    putByteCharacter('\n');
    return written + 1;
  }

  /// Encodes and writes the string.
  ///
  /// @return the number of code points written
  public int putWideString(String text) throws FileException {
    requireCharacterOutput(CharacterMode.WIDE_ORIENTATION);
    final var action = "putting wide string to file " + filePath;
    ensureOpen(WRITE, action);
    try {
      final byte[] encoded = wideCodec.encode(text);
      putBytes(encoded, 0, encoded.length);
    } catch (IOException e) {
      throw failure(WRITE, e, action);
    }
    return text.codePointCount(0, text.length());
  }

  /// Writes the string followed by a newline.
  ///
  /// @return the number of code points written, the newline included
  public int putWideLine(String text) throws FileException {
    final int written = putWideString(text);
    putWideCharacter('\n');
    return written + 1;
  }

  // ---------------------------------------------------------------------------------------------
  // Formatted I/O

  /// Formats with [String#format] conventions in the root locale and writes the result as a
  /// byte string. A bad format or argument throws the formatter's own exception.
  ///
  /// @return the number of characters written
  public int printByte(String format, Object... args) throws FileException {
    requireCharacterOutput(CharacterMode.BYTE_ORIENTATION);
    return putByteString(String.format(Locale.ROOT, format, args));
  }

  /// Formats with [String#format] conventions in the root locale and writes the result as a
  /// wide string.
  ///
  /// @return the number of code points written
  public int printWide(String format, Object... args) throws FileException {
    requireCharacterOutput(CharacterMode.WIDE_ORIENTATION);
    return putWideString(String.format(Locale.ROOT, format, args));
  }

  /// Reads byte characters as directed by a `scanf` format.
  ///
  /// @return the converted values, fewer than the format asks for if the input stops matching
  /// @throws FileException of kind [FileErrorKind#UNEXPECTED_END_OF_FILE] if the input ends
  ///                       before the first conversion
  public List<Object> scanByte(String format) throws FileException {
    requireCharacterInput(CharacterMode.BYTE_ORIENTATION);
    return scan(
        format,
        new ScanFormat.CharacterSource() {
          @Override
          public int next() throws IOException {
            return nextByte();
          }

          @Override
          public void unread(int character) throws IOException {
            BufferedFile.this.unread(new byte[] {(byte) character});
          }
        });
  }

  /// Reads wide characters as directed by a `scanf` format.
  ///
  /// @see #scanByte(String)
  public List<Object> scanWide(String format) throws FileException {
    requireCharacterInput(CharacterMode.WIDE_ORIENTATION);
    return scan(
        format,
        new ScanFormat.CharacterSource() {
          @Override
          public int next() throws IOException {
            return wideCodec.decode(BufferedFile.this::nextByte);
          }

          @Override
          public void unread(int character) throws IOException {
            BufferedFile.this.unread(wideCodec.encode(character));
          }
        });
  }

  private List<Object> scan(String format, ScanFormat.CharacterSource source)
      throws FileException {
    Objects.requireNonNull(format, "format");
    final var action = "scanning file " + filePath;
    ensureOpen(READ, action);
    try {
      return new ScanFormat(format).scan(source);
    } catch (EOFException e) {
      throw FileException.of(
          UNEXPECTED_END_OF_FILE,
          filePath,
          String.format(
              "Unexpected end of file %s before the first conversion of \"%s\".", filePath, format));
    } catch (IOException e) {
      throw failure(READ, e, action);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Binary transfer

  public int readBytes(byte[] buffer, int count) throws FileException {
    return readElements(buffer, 0, 1, count);
  }

  public int readBytes(byte[] buffer, int offset, int count) throws FileException {
    return readElements(buffer, offset, 1, count);
  }

  public int writeBytes(byte[] buffer, int count) throws FileException {
    return writeElements(buffer, 0, 1, count);
  }

  public int writeBytes(byte[] buffer, int offset, int count) throws FileException {
    return writeElements(buffer, offset, 1, count);
  }

  /// Reads exactly `buffer.length` bytes.
  ///
  /// @throws FileException of kind [FileErrorKind#EMPTY_FILE] if the file is empty, or
  ///                       [FileErrorKind#UNEXPECTED_END_OF_FILE] if it ends first
  public void readFully(byte[] buffer) throws FileException {
    requireBinaryInput();
    if (buffer.length == 0) {
      return;
    }
    if (getFileLength() == 0) {
      throw FileException.of(EMPTY_FILE, filePath, "File " + filePath + " is empty.");
    }
    final int read = readBytes(buffer, 0, buffer.length);
    if (read < buffer.length) {
      throw FileException.of(
          UNEXPECTED_END_OF_FILE,
          filePath,
          String.format(
              "Unexpected end of file %s: read %d bytes but expected to read %d bytes.",
              filePath, read, buffer.length));
    }
  }

  /// Reads up to `count` elements of `elementSize` bytes into `buffer` at `offset`, looping
  /// over short reads until the count is met or the file ends.
  ///
  /// @return the whole elements read; fewer than `count` only at end of file
  /// @throws FileException of kind [FileErrorKind#READ] if a read fails, reporting how many
  ///                       elements arrived before the failure
  public int readElements(byte[] buffer, int offset, int elementSize, int count)
      throws FileException {
    requireBinaryInput();
    checkElements(buffer, offset, elementSize, count);
    final var action = "reading from file " + filePath;
    ensureOpen(READ, action);
    int total = 0;
    while (total < count) {
      final Transfer transfer =
          readChunk(buffer, offset + total * elementSize, elementSize, count - total);
      total += transfer.transferred();
      if (transfer.isShort()) {
        if (transfer.failed()) {
          errorLatched = true;
          throw FileException.of(
              READ,
              filePath,
              transfer.failure(),
              String.format(
                  "reading from file %s: read %d elements but expected to read %d elements (of size %d)",
                  filePath, total, count, elementSize));
        }
        break;
      }
    }
    final int read = total;
    logger.log(
        Level.FINEST,
        () -> String.format("readElements %s size=%d requested=%d actual=%d", filePath, elementSize, count, read));
    return total;
  }

  /// Writes `count` elements of `elementSize` bytes from `buffer` at `offset`, looping until
  /// all are accepted.
  ///
  /// @return the elements written
  /// @throws FileException of kind [FileErrorKind#WRITE] if a write fails, reporting how many
  ///                       elements were accepted before the failure
  public int writeElements(byte[] buffer, int offset, int elementSize, int count)
      throws FileException {
    requireBinaryOutput();
    checkElements(buffer, offset, elementSize, count);
    final var action = "writing to file " + filePath;
    ensureOpen(WRITE, action);
    int total = 0;
    while (total < count) {
      final Transfer transfer =
          writeChunk(buffer, offset + total * elementSize, elementSize, count - total);
      total += transfer.transferred();
      if (transfer.isShort()) {
        if (transfer.failed()) {
          errorLatched = true;
          throw FileException.of(
              WRITE,
              filePath,
              transfer.failure(),
              String.format(
                  "writing to file %s: wrote %d elements but expected to write %d elements (of size %d)",
                  filePath, total, count, elementSize));
        }
        break;
      }
    }
    final int written = total;
    logger.log(
        Level.FINEST,
        () -> String.format("writeElements %s size=%d requested=%d actual=%d", filePath, elementSize, count, written));
    return total;
  }

  private static void checkElements(byte[] buffer, int offset, int elementSize, int count) {
    Objects.requireNonNull(buffer, "buffer");
    if (elementSize <= 0) {
      throw new IllegalArgumentException("elementSize must be positive, got " + elementSize);
    }
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative, got " + count);
    }
    Objects.checkFromIndexSize(offset, Math.multiplyExact(elementSize, count), buffer.length);
  }

  /// One bounded read of at most a buffer's worth of whole elements. A partially read element
  /// is consumed but not counted.
  private Transfer readChunk(byte[] target, int offset, int elementSize, int maxElements) {
    final int requested = chunkElements(elementSize, maxElements);
    final int wanted = requested * elementSize;
    int got = 0;
    try {
      while (got < wanted) {
        final int n = readInto(target, offset + got, wanted - got);
        if (n < 0) {
          break;
        }
        got += n;
      }
      return new Transfer(requested, got / elementSize, null);
    } catch (IOException e) {
      return new Transfer(requested, got / elementSize, e);
    }
  }

  /// One bounded write of at most a buffer's worth of whole elements.
  private Transfer writeChunk(byte[] source, int offset, int elementSize, int maxElements) {
    final int requested = chunkElements(elementSize, maxElements);
    try {
      putBytes(source, offset, requested * elementSize);
      return Transfer.complete(requested);
    } catch (IOException e) {
      return new Transfer(requested, 0, e);
    }
  }

  private int chunkElements(int elementSize, int maxElements) {
    return Math.max(1, Math.min(maxElements, buffer.capacity() / elementSize));
  }

  // ---------------------------------------------------------------------------------------------
  // Closing

  /// Writes pending output and releases the channel. The channel is released even if the
  /// write fails. Later calls do nothing.
  ///
  /// Inside try-with-resources a close failure that follows another failure is attached to it
  /// as a suppressed exception, so the first failure is the one thrown.
  ///
  /// @throws FileException of kind [FileErrorKind#CLOSE]; if both the final write and the
  ///                       release fail the release failure is suppressed into the first
  @Override
  @Synchronized
  public void close() throws FileException {
    if (closed) {
      return;
    }
    closed = true;
    logger.log(Level.FINE, () -> String.format("closed called on %s", filePath));
    final var action = "closing file " + filePath;
    FileException failure = null;
    try {
      writePending();
    } catch (IOException e) {
      failure = FileException.of(CLOSE, filePath, e, action);
    }
    try {
      channel.close();
    } catch (IOException e) {
      final var closeFailure = FileException.of(CLOSE, filePath, e, action);
      if (failure == null) {
        failure = closeFailure;
      } else {
        logger.log(
            Level.WARNING, "Failed to release channel after failed final flush of " + filePath, e);
        failure.addSuppressed(closeFailure);
      }
    } finally {
      pushback.clear();
      bufferState = BufferState.IDLE;
    }
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public String toString() {
    return "BufferedFile[" + filePath + ", " + accessMode.modeString(fileType) + "]";
  }

  // ---------------------------------------------------------------------------------------------
  // Buffer mechanics. These throw the raw JDK exception; public operations wrap it.

  /// channel position adjusted for pending output, unread read-ahead and pushback
  private long logicalPosition() throws IOException {
    long position = channel.position();
    if (bufferState == BufferState.WRITING) {
      position = (accessMode.isAppending() ? channel.size() : position) + buffer.position();
    } else if (bufferState == BufferState.READING) {
      position -= buffer.remaining();
    }
    return position - pushback.size();
  }

  /// Moves the channel to the logical position: writes pending output and gives back
  /// read-ahead and pushback. Leaves the buffer idle.
  private void synchronizeChannel() throws IOException {
    writePending();
    final long unread =
        (bufferState == BufferState.READING ? buffer.remaining() : 0) + pushback.size();
    pushback.clear();
    buffer.clear();
    bufferState = BufferState.IDLE;
    if (unread > 0) {
      channel.position(Math.max(0, channel.position() - unread));
    }
  }

  /// Writes the buffered output. On failure the output is dropped and the error latched.
  private void writePending() throws IOException {
    if (bufferState != BufferState.WRITING) {
      return;
    }
    buffer.flip();
    try {
      writeFully(buffer);
    } catch (IOException e) {
      errorLatched = true;
      throw e;
    } finally {
      buffer.clear();
      bufferState = BufferState.IDLE;
    }
  }

  private void writeFully(ByteBuffer source) throws IOException {
    if (accessMode.isAppending()) {
      channel.position(channel.size());
    }
    while (source.hasRemaining()) {
      channel.write(source);
    }
  }

  private void putBytes(byte[] source, int offset, int length) throws IOException {
    if (bufferState != BufferState.WRITING) {
      synchronizeChannel();
      bufferState = BufferState.WRITING;
    }
    if (buffer.position() == 0 && length >= buffer.capacity()) {
      // Too big to buffer: bypass it.
      bufferState = BufferState.IDLE;
      writeFully(ByteBuffer.wrap(source, offset, length));
      return;
    }
    int remaining = length;
    int at = offset;
    while (remaining > 0) {
      final int n = Math.min(remaining, buffer.remaining());
      buffer.put(source, at, n);
      at += n;
      remaining -= n;
      if (!buffer.hasRemaining()) {
        writePending();
        bufferState = BufferState.WRITING;
      }
    }
    if (bufferMode == BufferMode.NONE
        || (bufferMode == BufferMode.LINE && containsNewline(source, offset, length))) {
      writePending();
    }
  }

  private static boolean containsNewline(byte[] bytes, int offset, int length) {
    for (int i = offset; i < offset + length; i++) {
      if (bytes[i] == '\n') {
        return true;
      }
    }
    return false;
  }

  /// @return the next byte as 0..255, or -1 at end of file
  private int nextByte() throws IOException {
    if (!pushback.isEmpty()) {
      return pushback.pop() & 0xFF;
    }
    writePending();
    if ((bufferState != BufferState.READING || !buffer.hasRemaining()) && !fill()) {
      return -1;
    }
    return buffer.get() & 0xFF;
  }

  /// Copies at least one available byte into `target`, reading from the channel if needed.
  ///
  /// @return the bytes copied, or -1 at end of file
  private int readInto(byte[] target, int offset, int length) throws IOException {
    if (!pushback.isEmpty()) {
      target[offset] = pushback.pop();
      return 1;
    }
    writePending();
    if (bufferState != BufferState.READING || !buffer.hasRemaining()) {
      if (length >= buffer.capacity()) {
        // Too big to buffer: read straight into the caller's array.
        buffer.clear();
        bufferState = BufferState.IDLE;
        final int n = channel.read(ByteBuffer.wrap(target, offset, length));
        if (n <= 0) {
          endOfFileLatched = true;
          return -1;
        }
        return n;
      }
      if (!fill()) {
        return -1;
      }
    }
    final int n = Math.min(length, buffer.remaining());
    buffer.get(target, offset, n);
    return n;
  }

  /// Refills the read-ahead from the channel.
  ///
  /// @return false at end of file
  private boolean fill() throws IOException {
    buffer.clear();
    bufferState = BufferState.IDLE;
    final int n;
    try {
      n = channel.read(buffer);
    } catch (IOException e) {
      errorLatched = true;
      throw e;
    }
    buffer.flip();
    bufferState = BufferState.READING;
    if (n <= 0) {
      endOfFileLatched = true;
      return false;
    }
    return true;
  }

  /// Pushes bytes back so the next reads return them in order.
  private void unread(byte[] bytes) throws IOException {
    writePending();
    for (int i = bytes.length - 1; i >= 0; i--) {
      pushback.push(bytes[i]);
    }
    endOfFileLatched = false;
  }

  // ---------------------------------------------------------------------------------------------
  // Preconditions

  private FileException failure(FileErrorKind kind, IOException cause, String action) {
    if (kind == READ || kind == WRITE || kind == FLUSH) {
      errorLatched = true;
    }
    return FileException.of(kind, filePath, cause, action);
  }

  private void ensureOpen(FileErrorKind kind, String action) throws FileException {
    if (closed) {
      throw FileException.of(kind, filePath, Errno.EBADF, action);
    }
  }

  private void requireText() {
    if (fileType != FileType.TEXT) {
      throw new IllegalStateException(
          filePath + " is a binary file; character operations need a text file");
    }
  }

  private void requireReadable() {
    if (!accessMode.isReadable()) {
      throw new IllegalStateException(
          filePath + " is open for " + accessMode.getDescription() + " and cannot be read");
    }
  }

  private void requireWritable() {
    if (!accessMode.isWritable()) {
      throw new IllegalStateException(
          filePath + " is open for " + accessMode.getDescription() + " and cannot be written");
    }
  }

  private void orient(CharacterMode family) {
    if (setCharacterMode(family) != family) {
      throw new IllegalStateException(
          String.format(
              "%s is %s; %s operations are not permitted",
              filePath,
              characterMode.getDescription(),
              family == CharacterMode.BYTE_ORIENTATION ? "byte character" : "wide character"));
    }
  }

  private void requireCharacterInput(CharacterMode family) {
    requireText();
    requireReadable();
    orient(family);
  }

  private void requireCharacterOutput(CharacterMode family) {
    requireText();
    requireWritable();
    orient(family);
  }

  private void requireBinaryInput() {
    if (fileType != FileType.BINARY) {
      throw new IllegalStateException(
          filePath + " is a text file; element transfers need a binary file");
    }
    requireReadable();
  }

  private void requireBinaryOutput() {
    if (fileType != FileType.BINARY) {
      throw new IllegalStateException(
          filePath + " is a text file; element transfers need a binary file");
    }
    requireWritable();
  }
}
