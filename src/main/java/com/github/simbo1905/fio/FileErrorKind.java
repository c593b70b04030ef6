package com.github.simbo1905.fio;

import lombok.Getter;

/// The closed set of failure kinds raised by [BufferedFile] and [RawFile].
///
/// OS-linked kinds carry the error code of the failing call. [#EMPTY_FILE] and
/// [#UNEXPECTED_END_OF_FILE] describe the data rather than the OS and always carry code 0.
@Getter
public enum FileErrorKind {
  OPEN(true),
  CLOSE(true),
  STATUS(true),
  FLUSH(true),
  READ(true),
  WRITE(true),
  SEEK(true),
  TELL(true),
  TRUNCATION(true),
  /// Reserved: no current operation maps files into memory.
  MEMORY_MAPPING(true),
  EMPTY_FILE(false),
  UNEXPECTED_END_OF_FILE(false);

  private final boolean systemError;

  FileErrorKind(boolean systemError) {
    this.systemError = systemError;
  }
}
