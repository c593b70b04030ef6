package com.github.simbo1905.fio;

import java.nio.file.LinkOption;
import java.nio.file.OpenOption;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.Set;

/// Open flags for [RawFile], laid out as in the BSD `<fcntl.h>`. Combine with `|`; exactly one
/// of [#READ_ONLY], [#WRITE_ONLY] and [#READ_WRITE] selects the access mode.
public final class OpenFlags {

  public static final int READ_ONLY = 0x0000;
  public static final int WRITE_ONLY = 0x0001;
  public static final int READ_WRITE = 0x0002;
  /// Mask selecting the access mode bits.
  public static final int ACCESS_MODE_MASK = 0x0003;

  /// Regular files never block; only changes how the open-time lock flags wait.
  public static final int NON_BLOCKING = 0x0004;
  public static final int APPEND = 0x0008;
  /// Take a shared whole-file lock while opening.
  public static final int SHARED_LOCK = 0x0010;
  /// Take an exclusive whole-file lock while opening.
  public static final int EXCLUSIVE_LOCK = 0x0020;
  /// Fail with ELOOP if the path is a symbolic link.
  public static final int NO_SYMLINK = 0x0100;
  public static final int CREATE = 0x0200;
  public static final int TRUNCATE = 0x0400;
  /// With [#CREATE], fail with EEXIST if the file already exists.
  public static final int EXCLUSIVE = 0x0800;
  /// Not supported on the JVM; opening fails with EOPNOTSUPP.
  public static final int EVENT_NOTIFICATIONS_ONLY = 0x8000;
  /// Open the link itself rather than its target. Not supported on the JVM.
  public static final int SYMLINK = 0x200000;
  /// JVM descriptors are never inherited by child processes, so this is always in effect.
  public static final int CLOSE_ON_EXECUTE = 0x1000000;

  private OpenFlags() {}

  static boolean isSet(int flags, int flag) {
    return (flags & flag) != 0;
  }

  /// Translates flags into channel options. Appending and locking are not options: the caller
  /// applies them around the channel.
  ///
  /// @throws IllegalArgumentException for an invalid access mode or conflicting lock flags
  /// @throws UnsupportedOperationException for flags the JVM cannot honour
  static Set<OpenOption> toOpenOptions(int flags) {
    final Set<OpenOption> options = new HashSet<>();
    final int access = flags & ACCESS_MODE_MASK;
    switch (access) {
      case READ_ONLY:
        options.add(StandardOpenOption.READ);
        break;
      case WRITE_ONLY:
        options.add(StandardOpenOption.WRITE);
        break;
      case READ_WRITE:
        options.add(StandardOpenOption.READ);
        options.add(StandardOpenOption.WRITE);
        break;
      default:
        throw new IllegalArgumentException("Invalid access mode bits: " + access);
    }
    if (isSet(flags, SYMLINK) || isSet(flags, EVENT_NOTIFICATIONS_ONLY)) {
      throw new UnsupportedOperationException(
          "SYMLINK and EVENT_NOTIFICATIONS_ONLY have no JVM equivalent");
    }
    if (isSet(flags, SHARED_LOCK) && isSet(flags, EXCLUSIVE_LOCK)) {
      throw new IllegalArgumentException("SHARED_LOCK and EXCLUSIVE_LOCK are exclusive");
    }
    if (isSet(flags, CREATE)) {
      options.add(
          isSet(flags, EXCLUSIVE) ? StandardOpenOption.CREATE_NEW : StandardOpenOption.CREATE);
    }
    if (isSet(flags, TRUNCATE)) {
      options.add(StandardOpenOption.TRUNCATE_EXISTING);
    }
    if (isSet(flags, NO_SYMLINK)) {
      options.add(LinkOption.NOFOLLOW_LINKS);
    }
    return options;
  }

  /// Renders flags the way they would be written in C, for log and error messages.
  static String describe(int flags) {
    final var text = new StringBuilder();
    switch (flags & ACCESS_MODE_MASK) {
      case WRITE_ONLY:
        text.append("WRITE_ONLY");
        break;
      case READ_WRITE:
        text.append("READ_WRITE");
        break;
      default:
        text.append("READ_ONLY");
    }
    appendIfSet(text, flags, NON_BLOCKING, "NON_BLOCKING");
    appendIfSet(text, flags, APPEND, "APPEND");
    appendIfSet(text, flags, SHARED_LOCK, "SHARED_LOCK");
    appendIfSet(text, flags, EXCLUSIVE_LOCK, "EXCLUSIVE_LOCK");
    appendIfSet(text, flags, NO_SYMLINK, "NO_SYMLINK");
    appendIfSet(text, flags, CREATE, "CREATE");
    appendIfSet(text, flags, TRUNCATE, "TRUNCATE");
    appendIfSet(text, flags, EXCLUSIVE, "EXCLUSIVE");
    appendIfSet(text, flags, EVENT_NOTIFICATIONS_ONLY, "EVENT_NOTIFICATIONS_ONLY");
    appendIfSet(text, flags, SYMLINK, "SYMLINK");
    appendIfSet(text, flags, CLOSE_ON_EXECUTE, "CLOSE_ON_EXECUTE");
    return text.toString();
  }

  private static void appendIfSet(StringBuilder text, int flags, int flag, String name) {
    if (isSet(flags, flag)) {
      text.append('|').append(name);
    }
  }
}
