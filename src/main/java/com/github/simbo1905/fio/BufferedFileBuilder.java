package com.github.simbo1905.fio;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for opening a [BufferedFile] and configuring its buffer in one step.
///
/// Example usage:
/// <pre>
/// try (BufferedFile file = new BufferedFileBuilder()
///     .path("/path/to/data.bin")
///     .accessMode(AccessMode.WRITE_EXTENDED)
///     .optimalBuffer()
///     .open()) {
///   file.writeBytes(data, data.length);
/// }
/// </pre>
///
/// Defaults come from the system properties [#BUFFER_SIZE_PROPERTY] and [#CHARSET_PROPERTY].
public class BufferedFileBuilder {

  private static final Logger logger = Logger.getLogger(BufferedFileBuilder.class.getName());

  public static final String BUFFER_SIZE_PROPERTY = "com.github.simbo1905.fio.bufferSize";

  public static final String CHARSET_PROPERTY = "com.github.simbo1905.fio.charset";

  private Path path;
  private String tempFilePrefix;
  private String tempFileSuffix;
  private FileType fileType = FileType.BINARY;
  private AccessMode accessMode = AccessMode.READ;
  private BufferMode bufferMode = BufferMode.FULL;
  private int bufferSize = defaultBufferSize();
  private boolean optimalBuffer = false;
  private Charset charset = defaultCharset();

  static int defaultBufferSize() {
    final var configured = System.getProperty(BUFFER_SIZE_PROPERTY);
    if (configured == null) {
      return BufferedFile.DEFAULT_BUFFER_SIZE;
    }
    int size;
    try {
      size = Integer.parseInt(configured.trim());
    } catch (NumberFormatException e) {
      logger.log(Level.WARNING, "Ignoring " + BUFFER_SIZE_PROPERTY + "=" + configured, e);
      return BufferedFile.DEFAULT_BUFFER_SIZE;
    }
    if (size <= 0) {
      logger.log(Level.WARNING, () -> "Ignoring non-positive " + BUFFER_SIZE_PROPERTY + "=" + configured);
      return BufferedFile.DEFAULT_BUFFER_SIZE;
    }
    return size;
  }

  static Charset defaultCharset() {
    final var configured = System.getProperty(CHARSET_PROPERTY, "UTF-8");
    try {
      return Charset.forName(configured.trim());
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Ignoring " + CHARSET_PROPERTY + "=" + configured + ", using UTF-8", e);
      return StandardCharsets.UTF_8;
    }
  }

  /// Sets the file to open.
  ///
  /// @param path the path to the file
  /// @return this builder for chaining
  public BufferedFileBuilder path(Path path) {
    this.path = path;
    return this;
  }

  /// Sets the file to open using a string, which is converted to a normalized Path.
  ///
  /// @param path the path string to the file
  /// @return this builder for chaining
  public BufferedFileBuilder path(String path) {
    this.path = Paths.get(path).normalize();
    return this;
  }

  /// Opens a new temporary file instead of a named one. The file is deleted on JVM exit.
  ///
  /// @param prefix the prefix for the temporary file
  /// @param suffix the suffix for the temporary file
  /// @return this builder for chaining
  public BufferedFileBuilder tempFile(String prefix, String suffix) {
    this.tempFilePrefix = prefix;
    this.tempFileSuffix = suffix;
    return this;
  }

  public BufferedFileBuilder fileType(FileType fileType) {
    this.fileType = Objects.requireNonNull(fileType, "fileType");
    return this;
  }

  public BufferedFileBuilder accessMode(AccessMode accessMode) {
    this.accessMode = Objects.requireNonNull(accessMode, "accessMode");
    return this;
  }

  public BufferedFileBuilder bufferMode(BufferMode bufferMode) {
    this.bufferMode = Objects.requireNonNull(bufferMode, "bufferMode");
    return this;
  }

  /// Sets the buffer capacity in bytes.
  ///
  /// @throws IllegalArgumentException if the size is not positive
  public BufferedFileBuilder bufferSize(int bufferSize) {
    if (bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be positive, got " + bufferSize);
    }
    this.bufferSize = bufferSize;
    this.optimalBuffer = false;
    return this;
  }

  /// Sizes the buffer from the file store block size once the file is open, see
  /// [BufferedFile#setOptimalBuffer()]. Overrides any buffer mode and size.
  public BufferedFileBuilder optimalBuffer() {
    this.optimalBuffer = true;
    return this;
  }

  public BufferedFileBuilder charset(Charset charset) {
    this.charset = Objects.requireNonNull(charset, "charset");
    return this;
  }

  /// Opens the file and applies the buffer settings. If the settings cannot be applied the file
  /// is closed before the failure is thrown.
  ///
  /// @return a new open BufferedFile
  /// @throws IllegalStateException if neither a path nor a temporary file was configured
  /// @throws IOException if the temporary file cannot be created or the file cannot be opened
  public BufferedFile open() throws IOException {
    final Path target;
    if (tempFilePrefix != null && tempFileSuffix != null) {
      target = Files.createTempFile(tempFilePrefix, tempFileSuffix);
      target.toFile().deleteOnExit();
    } else if (path != null) {
      target = path;
    } else {
      throw new IllegalStateException("Either path() or tempFile() must be called before open()");
    }
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "open %s type=%s mode=%s buffer=%s/%d optimal=%b charset=%s",
                target, fileType, accessMode, bufferMode, bufferSize, optimalBuffer, charset));

    final var file = new BufferedFile(target, fileType, accessMode, charset);
    try {
      final boolean configured =
          optimalBuffer ? file.setOptimalBuffer() : file.setBuffer(bufferMode, bufferSize);
      if (!configured) {
        throw new IllegalStateException(
            String.format("Could not set buffer %s/%d on %s", bufferMode, bufferSize, target));
      }
      return file;
    } catch (IOException | RuntimeException e) {
      // Close the file if configuration fails to prevent a resource leak
      try {
        file.close();
      } catch (IOException closeException) {
        logger.log(
            Level.WARNING, "Failed to close file after configuration failure: " + target, closeException);
        e.addSuppressed(closeException);
      }
      throw e;
    }
  }
}
