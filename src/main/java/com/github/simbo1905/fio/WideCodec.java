package com.github.simbo1905.fio;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.MalformedInputException;

/// Converts between Unicode code points and the bytes of a stream charset one character at a
/// time, which is what wide character I/O needs on top of a byte stream.
final class WideCodec {

  @FunctionalInterface
  interface ByteSource {
    /// The next byte as 0..255, or a negative value at end of input.
    int next() throws IOException;
  }

  private final Charset charset;
  private final CharsetDecoder decoder;
  private final CharsetEncoder encoder;
  private final int maxBytesPerCodePoint;

  WideCodec(Charset charset) {
    this.charset = charset;
    this.decoder =
        charset
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    this.encoder =
        charset
            .newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    this.maxBytesPerCodePoint = (int) Math.ceil(encoder.maxBytesPerChar() * 2);
  }

  Charset charset() {
    return charset;
  }

  /// Reads bytes until they form one code point.
  ///
  /// @return the code point, or -1 if the input ends before its first byte
  /// @throws MalformedInputException if the bytes are not a valid sequence, including a
  ///                                 sequence cut short by the end of input
  int decode(ByteSource source) throws IOException {
    final byte[] pending = new byte[maxBytesPerCodePoint];
    final CharBuffer out = CharBuffer.allocate(2);
    int count = 0;
    while (true) {
      final int next = source.next();
      if (next < 0) {
        if (count == 0) {
          return -1;
        }
        throw new MalformedInputException(count);
      }
      if (count == pending.length) {
        throw new MalformedInputException(count);
      }
      pending[count++] = (byte) next;

      decoder.reset();
      out.clear();
      final CoderResult result = decoder.decode(ByteBuffer.wrap(pending, 0, count), out, false);
      if (result.isError()) {
        result.throwException();
      }
      if (out.position() == 0) {
        continue;
      }
      out.flip();
      final char first = out.get();
      if (!Character.isHighSurrogate(first)) {
        return first;
      }
      if (out.hasRemaining()) {
        return Character.toCodePoint(first, out.get());
      }
    }
  }

  /// The bytes of one code point.
  byte[] encode(int codePoint) throws CharacterCodingException {
    if (!Character.isValidCodePoint(codePoint)) {
      throw new MalformedInputException(1);
    }
    return encode(new String(Character.toChars(codePoint)));
  }

  byte[] encode(String text) throws CharacterCodingException {
    final ByteBuffer encoded = encoder.encode(CharBuffer.wrap(text));
    final byte[] bytes = new byte[encoded.remaining()];
    encoded.get(bytes);
    return bytes;
  }
}
