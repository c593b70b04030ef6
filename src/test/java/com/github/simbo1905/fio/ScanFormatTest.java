package com.github.simbo1905.fio;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.*;

import java.io.EOFException;
import java.io.IOException;
import java.util.List;
import org.junit.Test;

public class ScanFormatTest extends JulLoggingConfig {

  /// Reads a string and checks every character given back is the one just read.
  private static final class StringSource implements ScanFormat.CharacterSource {
    private final String text;
    private int index;

    StringSource(String text) {
      this.text = text;
    }

    @Override
    public int next() {
      return index < text.length() ? text.charAt(index++) : -1;
    }

    @Override
    public void unread(int character) throws IOException {
      if (index == 0 || text.charAt(index - 1) != character) {
        throw new IOException("unread of a character that was not read: " + (char) character);
      }
      index--;
    }

    String rest() {
      return text.substring(index);
    }
  }

  private static List<Object> scan(String format, StringSource source) throws IOException {
    return new ScanFormat(format).scan(source);
  }

  private static List<Object> scan(String format, String input) throws IOException {
    return scan(format, new StringSource(input));
  }

  @Test
  public void integersInEachRadix() throws Exception {
    assertEquals(List.of(-12L, 7L), scan("%d %u", "-12 +7"));
    assertEquals(List.of(255L, 31L), scan("%x %X", "ff 0x1F"));
    assertEquals(List.of(15L), scan("%o", "017"));
    assertEquals(List.of(16L, 8L, 10L), scan("%i %i %i", "0x10 010 10"));
    assertEquals(List.of(1L, 2L, 3L), scan("%ld %hd %zu", "1 2 3"));
  }

  @Test
  public void floatingPointForms() throws Exception {
    assertEquals(List.of(3.5, -1500.0, 0.25), scan("%f %e %g", "3.5 -1.5e3 .25"));
    assertEquals(List.of(0.02), scan("%lf", "2E-2"));
  }

  @Test
  public void widthLimitsAConversion() throws Exception {
    final StringSource source = new StringSource("12345 abcdef");
    assertEquals(List.of(123L, 45L, "ab"), scan("%3d%d %2s", source));
    assertThat(source.rest(), is("cdef"));
  }

  @Test
  public void charactersAndScansets() throws Exception {
    assertEquals(List.of(" ", "x"), scan("%c%c", " x"));
    assertEquals(List.of("abc"), scan("%3c", "abcd"));
    assertEquals(List.of("abcab", "XY z"), scan("%[a-c]%[^\n]", "abcabXY z\n"));
    assertEquals(List.of("]a]"), scan("%[]a]", "]a]b"));
  }

  @Test
  public void suppressionCountAndLiterals() throws Exception {
    assertEquals(List.of(2L), scan("%*d %d", "1 2"));
    assertEquals(List.of(5L, 5L), scan("x=%d,%%%n", "x=5,%"));
    assertEquals(List.of(42L, 5L), scan("%d%*[ ]%n", "42   "));
  }

  @Test
  public void mismatchStopsAndUnreadsLookahead() throws Exception {
    final StringSource source = new StringSource("7 apples");
    assertEquals(List.of(7L), scan("%d %d", source));
    assertThat(source.rest(), is("apples"));

    final StringSource literal = new StringSource("a=1");
    assertEquals(List.of(), scan("b=%d", literal));
    assertThat(literal.rest(), is("a=1"));
  }

  @Test
  public void endOfInputBeforeFirstConversion() throws Exception {
    assertThrows(EOFException.class, () -> scan("%d", ""));
    assertThrows(EOFException.class, () -> scan(" %s", "   "));
    assertEquals(List.of(5L), scan("%d %d", "5"));
  }

  @Test
  public void malformedFormatsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> scan("%q", "1"));
    assertThrows(IllegalArgumentException.class, () -> scan("%[abc", "a"));
    assertThrows(IllegalArgumentException.class, () -> scan("%", "1"));
  }
}
