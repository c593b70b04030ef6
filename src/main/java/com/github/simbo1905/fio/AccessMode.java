package com.github.simbo1905.fio;

import java.nio.file.StandardOpenOption;
import java.util.EnumSet;
import java.util.Set;

/// How a [BufferedFile] is opened, mirroring the six `fopen` modes.
///
/// | mode | text | binary | opens |
/// |---|---|---|---|
/// | READ | r | rb | existing file for reading |
/// | WRITE | w | wb | truncated or new file for writing |
/// | APPEND | a | ab | file for writing at its end |
/// | READ_EXTENDED | r+ | rb+ | existing file for reading and writing |
/// | WRITE_EXTENDED | w+ | wb+ | truncated or new file for reading and writing |
/// | APPEND_EXTENDED | a+ | ab+ | file for reading anywhere and writing at its end |
@SuppressWarnings("LombokGetterMayBeUsed")
public enum AccessMode {
  READ("reading", "r", true, false, false),
  WRITE("writing", "w", false, true, false),
  APPEND("appending", "a", false, true, true),
  READ_EXTENDED("extended reading", "r+", true, true, false),
  WRITE_EXTENDED("extended writing", "w+", true, true, false),
  APPEND_EXTENDED("extended appending", "a+", true, true, true);

  private final String description;
  private final String mode;
  private final boolean readable;
  private final boolean writable;
  private final boolean appending;

  AccessMode(
      String description, String mode, boolean readable, boolean writable, boolean appending) {
    this.description = description;
    this.mode = mode;
    this.readable = readable;
    this.writable = writable;
    this.appending = appending;
  }

  public String getDescription() {
    return description;
  }

  /// The native mode string, with `b` after the first letter for binary files.
  public String modeString(FileType fileType) {
    return fileType == FileType.BINARY ? mode.charAt(0) + "b" + mode.substring(1) : mode;
  }

  public boolean isReadOnly() {
    return readable && !writable;
  }

  public boolean isWriteOnly() {
    return writable && !readable;
  }

  public boolean isReadWrite() {
    return readable && writable;
  }

  public boolean isReadable() {
    return readable;
  }

  public boolean isWritable() {
    return writable;
  }

  /// Whether every write goes to the end of the file regardless of the position.
  public boolean isAppending() {
    return appending;
  }

  /// Channel options for this mode. Appending is not passed to the channel as the JDK
  /// refuses to combine it with reading; [BufferedFile] positions at the end before each write.
  Set<StandardOpenOption> openOptions() {
    final Set<StandardOpenOption> options = EnumSet.noneOf(StandardOpenOption.class);
    if (readable) {
      options.add(StandardOpenOption.READ);
    }
    if (writable) {
      options.add(StandardOpenOption.WRITE);
    }
    if (this == WRITE || this == WRITE_EXTENDED) {
      options.add(StandardOpenOption.CREATE);
      options.add(StandardOpenOption.TRUNCATE_EXISTING);
    } else if (appending) {
      options.add(StandardOpenOption.CREATE);
    }
    return options;
  }
}
