package com.github.simbo1905.fio;

import java.io.IOException;
import java.nio.file.Path;
import lombok.Getter;

/// The single failure shape of this library: a kind, the OS error code captured at the failing
/// call, and the path of the file involved.
///
/// Messages read `Error <action>: <description> (<code>).`, for example
/// `Error opening file /tmp/x for reading (r): No such file or directory (2).`
public class FileException extends IOException {

  private static final long serialVersionUID = 1L;

  @Getter private final FileErrorKind kind;

  /// The numeric OS error code, 0 for kinds that are not OS-linked.
  @Getter private final int errorCode;

  @Getter private final transient Path filePath;

  FileException(FileErrorKind kind, Path filePath, int errorCode, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.filePath = filePath;
    this.errorCode = errorCode;
  }

  public Errno getErrno() {
    return errorCode == 0 ? Errno.NONE : Errno.valueOf(errorCode);
  }

  /// Builds an OS-linked failure from the exception the JDK raised.
  static FileException of(FileErrorKind kind, Path filePath, Throwable cause, String action) {
    return of(kind, filePath, Errno.of(cause), action, cause);
  }

  /// Builds an OS-linked failure detected before reaching the JDK, such as a negative offset.
  static FileException of(FileErrorKind kind, Path filePath, Errno errno, String action) {
    return of(kind, filePath, errno, action, null);
  }

  private static FileException of(
      FileErrorKind kind, Path filePath, Errno errno, String action, Throwable cause) {
    final var message =
        String.format("Error %s: %s (%d).", action, errno.getDescription(), errno.getCode());
    return new FileException(kind, filePath, errno.getCode(), message, cause);
  }

  /// Builds one of the data failures that carry no OS error code.
  static FileException of(FileErrorKind kind, Path filePath, String message) {
    if (kind.isSystemError()) {
      throw new IllegalArgumentException(kind + " requires an OS error code");
    }
    return new FileException(kind, filePath, 0, message, null);
  }
}
