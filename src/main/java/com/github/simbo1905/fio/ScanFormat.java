package com.github.simbo1905.fio;

import java.io.EOFException;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/// A `scanf` style reader over a character source.
///
/// Supported directives: whitespace (skips any amount of input whitespace), ordinary
/// characters (must match), and conversions `%[*][width][length]conversion` where conversion
/// is one of `d i u o x X` (a [Long]), `f F e E g G a A` (a [Double]), `s c [set]` (a [String]),
/// `n` (a [Long] holding the characters consumed so far) and `%%`. Length modifiers are
/// accepted and ignored. A `*` suppresses the value.
///
/// As in C, a failing conversion stops the scan and only one character of lookahead is
/// returned to the source.
final class ScanFormat {

  /// Characters come from a stream that accepts them back.
  interface CharacterSource {
    /// The next character as a code point, or a negative value at end of input.
    int next() throws IOException;

    void unread(int character) throws IOException;
  }

  private static final int NONE = -2;

  private final String format;

  ScanFormat(String format) {
    this.format = format;
  }

  /// Scans according to the format.
  ///
  /// @return the converted values in order, possibly fewer than the format asks for if the
  ///         input stops matching
  /// @throws EOFException if the input ends before the first conversion completes
  /// @throws IllegalArgumentException if the format itself is malformed
  List<Object> scan(CharacterSource source) throws IOException {
    final var in = new Cursor(source);
    try {
      return scan(in);
    } finally {
      in.release();
    }
  }

  private List<Object> scan(Cursor in) throws IOException {
    final List<Object> values = new ArrayList<>();
    int completed = 0;
    int i = 0;
    final int length = format.length();
    while (i < length) {
      final char f = format.charAt(i);
      if (Character.isWhitespace(f)) {
        in.skipWhitespace();
        i++;
        continue;
      }
      if (f != '%') {
        final int c = in.peek();
        if (c < 0) {
          return finish(values, completed);
        }
        if (c != f) {
          return values;
        }
        in.take();
        i++;
        continue;
      }

      i++;
      boolean suppress = false;
      if (i < length && format.charAt(i) == '*') {
        suppress = true;
        i++;
      }
      int width = 0;
      while (i < length && Character.isDigit(format.charAt(i))) {
        width = width * 10 + (format.charAt(i) - '0');
        i++;
      }
      while (i < length && "hlLjzt".indexOf(format.charAt(i)) >= 0) {
        i++;
      }
      if (i >= length) {
        throw new IllegalArgumentException("Incomplete conversion at end of format: " + format);
      }
      final char conversion = format.charAt(i++);
      String scanset = null;
      if (conversion == '[') {
        final int end = scansetEnd(i);
        scanset = format.substring(i, end);
        i = end + 1;
      }
      if (conversion != '[' && conversion != 'c' && conversion != 'n') {
        in.skipWhitespace();
      }

      final Object value;
      switch (conversion) {
        case '%':
          if (in.peek() < 0) {
            return finish(values, completed);
          }
          if (in.peek() != '%') {
            return values;
          }
          in.take();
          continue;
        case 'n':
          if (!suppress) {
            values.add((long) in.consumed());
          }
          continue;
        case 'd':
        case 'u':
          value = scanInteger(in, width, 10);
          break;
        case 'i':
          value = scanInteger(in, width, 0);
          break;
        case 'o':
          value = scanInteger(in, width, 8);
          break;
        case 'x':
        case 'X':
          value = scanInteger(in, width, 16);
          break;
        case 'f':
        case 'F':
        case 'e':
        case 'E':
        case 'g':
        case 'G':
        case 'a':
        case 'A':
          value = scanFloat(in, width);
          break;
        case 's':
          value = scanString(in, width);
          break;
        case 'c':
          value = scanCharacters(in, width == 0 ? 1 : width);
          break;
        case '[':
          value = scanSet(in, width, scanset);
          break;
        default:
          throw new IllegalArgumentException(
              "Unsupported conversion %" + conversion + " in format: " + format);
      }
      if (value == null) {
        return in.atEndOfInput() ? finish(values, completed) : values;
      }
      completed++;
      if (!suppress) {
        values.add(value);
      }
    }
    return values;
  }

  private static List<Object> finish(List<Object> values, int completed) throws EOFException {
    if (completed == 0) {
      throw new EOFException("Input ended before the first conversion");
    }
    return values;
  }

  /// Index of the `]` closing a scanset that starts at `start`; a `]` right after `[` or
  /// `[^` is a member of the set.
  private int scansetEnd(int start) {
    int i = start;
    if (i < format.length() && format.charAt(i) == '^') {
      i++;
    }
    if (i < format.length() && format.charAt(i) == ']') {
      i++;
    }
    final int end = format.indexOf(']', i);
    if (end < 0) {
      throw new IllegalArgumentException("Unterminated scanset in format: " + format);
    }
    return end;
  }

  private static Long scanInteger(Cursor in, int width, int radix) throws IOException {
    int remaining = width == 0 ? Integer.MAX_VALUE : width;
    boolean negative = false;
    int c = in.peek();
    if ((c == '+' || c == '-') && remaining > 0) {
      negative = c == '-';
      in.take();
      remaining--;
      c = in.peek();
    }
    final var digits = new StringBuilder();
    if ((radix == 0 || radix == 16) && c == '0' && remaining > 0) {
      digits.append('0');
      in.take();
      remaining--;
      c = in.peek();
      if ((c == 'x' || c == 'X') && remaining > 0) {
        in.take();
        remaining--;
        c = in.peek();
        radix = 16;
      } else if (radix == 0) {
        radix = 8;
      }
    }
    if (radix == 0) {
      radix = 10;
    }
    while (remaining > 0 && c >= 0 && Character.digit(c, radix) >= 0) {
      digits.appendCodePoint(c);
      in.take();
      remaining--;
      c = in.peek();
    }
    if (digits.length() == 0) {
      return null;
    }
    final var magnitude = new BigInteger(digits.toString(), radix);
    return (negative ? magnitude.negate() : magnitude).longValue();
  }

  private static Double scanFloat(Cursor in, int width) throws IOException {
    int remaining = width == 0 ? Integer.MAX_VALUE : width;
    final var text = new StringBuilder();
    int c = in.peek();
    if ((c == '+' || c == '-') && remaining > 0) {
      text.append((char) c);
      in.take();
      remaining--;
      c = in.peek();
    }
    boolean sawDigit = false;
    while (remaining > 0 && c >= '0' && c <= '9') {
      text.append((char) c);
      sawDigit = true;
      in.take();
      remaining--;
      c = in.peek();
    }
    if (c == '.' && remaining > 0) {
      text.append('.');
      in.take();
      remaining--;
      c = in.peek();
      while (remaining > 0 && c >= '0' && c <= '9') {
        text.append((char) c);
        sawDigit = true;
        in.take();
        remaining--;
        c = in.peek();
      }
    }
    if (!sawDigit) {
      return null;
    }
    if ((c == 'e' || c == 'E') && remaining > 0) {
      final var exponent = new StringBuilder("e");
      in.take();
      remaining--;
      c = in.peek();
      if ((c == '+' || c == '-') && remaining > 0) {
        exponent.append((char) c);
        in.take();
        remaining--;
        c = in.peek();
      }
      boolean sawExponentDigit = false;
      while (remaining > 0 && c >= '0' && c <= '9') {
        exponent.append((char) c);
        sawExponentDigit = true;
        in.take();
        remaining--;
        c = in.peek();
      }
      if (sawExponentDigit) {
        text.append(exponent);
      }
    }
    return Double.parseDouble(text.toString());
  }

  private static String scanString(Cursor in, int width) throws IOException {
    int remaining = width == 0 ? Integer.MAX_VALUE : width;
    final var text = new StringBuilder();
    int c = in.peek();
    while (remaining > 0 && c >= 0 && !Character.isWhitespace(c)) {
      text.appendCodePoint(c);
      in.take();
      remaining--;
      c = in.peek();
    }
    return text.length() == 0 ? null : text.toString();
  }

  private static String scanCharacters(Cursor in, int count) throws IOException {
    final var text = new StringBuilder();
    for (int n = 0; n < count; n++) {
      final int c = in.peek();
      if (c < 0) {
        return null;
      }
      text.appendCodePoint(c);
      in.take();
    }
    return text.toString();
  }

  private static String scanSet(Cursor in, int width, String scanset) throws IOException {
    final boolean negated = scanset.startsWith("^");
    final String members = negated ? scanset.substring(1) : scanset;
    int remaining = width == 0 ? Integer.MAX_VALUE : width;
    final var text = new StringBuilder();
    int c = in.peek();
    while (remaining > 0 && c >= 0 && inSet(members, c) != negated) {
      text.appendCodePoint(c);
      in.take();
      remaining--;
      c = in.peek();
    }
    return text.length() == 0 ? null : text.toString();
  }

  /// Scanset membership; `a-z` is a range unless the `-` is first or last.
  private static boolean inSet(String members, int c) {
    for (int i = 0; i < members.length(); i++) {
      final char m = members.charAt(i);
      if (i + 2 < members.length() && members.charAt(i + 1) == '-') {
        if (c >= m && c <= members.charAt(i + 2)) {
          return true;
        }
        i += 2;
      } else if (c == m) {
        return true;
      }
    }
    return false;
  }

  /// One character of lookahead over the source, given back on release.
  private static final class Cursor {
    private final CharacterSource source;
    private int lookahead = NONE;
    private int consumed;
    private boolean endOfInput;

    Cursor(CharacterSource source) {
      this.source = source;
    }

    int peek() throws IOException {
      if (lookahead == NONE) {
        lookahead = source.next();
        if (lookahead < 0) {
          lookahead = -1;
          endOfInput = true;
        }
      }
      return lookahead;
    }

    void take() {
      lookahead = NONE;
      consumed++;
    }

    /// Skips whitespace, leaving the first other character as lookahead.
    void skipWhitespace() throws IOException {
      int c = peek();
      while (c >= 0 && Character.isWhitespace(c)) {
        take();
        c = peek();
      }
    }

    int consumed() {
      return consumed;
    }

    boolean atEndOfInput() {
      return endOfInput;
    }

    void release() throws IOException {
      if (lookahead >= 0) {
        source.unread(lookahead);
      }
      lookahead = NONE;
    }
  }
}
