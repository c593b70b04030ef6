package com.github.simbo1905.fio;

import java.nio.file.FileSystem;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;
import java.util.Set;

/// Permission bits for files created by [RawFile], with the `<sys/stat.h>` octal values.
public final class ModeFlags {

  public static final int USER_READ = 0400;
  public static final int USER_WRITE = 0200;
  public static final int USER_EXECUTE = 0100;
  public static final int GROUP_READ = 040;
  public static final int GROUP_WRITE = 020;
  public static final int GROUP_EXECUTE = 010;
  public static final int OTHER_READ = 04;
  public static final int OTHER_WRITE = 02;
  public static final int OTHER_EXECUTE = 01;
  public static final int SET_USER_ID = 04000;
  public static final int SET_GROUP_ID = 02000;
  public static final int SAVE_SWAPPED_TEXT = 01000;

  public static final int USER_READ_AND_WRITE = USER_READ | USER_WRITE;
  public static final int GROUP_READ_AND_WRITE = GROUP_READ | GROUP_WRITE;
  public static final int OTHER_READ_AND_WRITE = OTHER_READ | OTHER_WRITE;

  public static final int USER_ALL = USER_READ | USER_WRITE | USER_EXECUTE;
  public static final int GROUP_ALL = GROUP_READ | GROUP_WRITE | GROUP_EXECUTE;
  public static final int OTHER_ALL = OTHER_READ | OTHER_WRITE | OTHER_EXECUTE;

  /// The mode used when none is given: read and write for everyone, less the process umask.
  public static final int DEFAULT_MODE =
      USER_READ_AND_WRITE | GROUP_READ_AND_WRITE | OTHER_READ_AND_WRITE;

  private static final int[] PERMISSION_BITS = {
    USER_READ, USER_WRITE, USER_EXECUTE,
    GROUP_READ, GROUP_WRITE, GROUP_EXECUTE,
    OTHER_READ, OTHER_WRITE, OTHER_EXECUTE
  };

  private static final PosixFilePermission[] PERMISSIONS = {
    PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE,
    PosixFilePermission.OWNER_EXECUTE,
    PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE,
    PosixFilePermission.GROUP_EXECUTE,
    PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE,
    PosixFilePermission.OTHERS_EXECUTE
  };

  private ModeFlags() {}

  /// The nine permission bits as POSIX permissions. Set-user-ID, set-group-ID and the sticky
  /// bit have no JVM counterpart and are dropped.
  public static Set<PosixFilePermission> toPermissions(int modeFlags) {
    final Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
    for (int i = 0; i < PERMISSION_BITS.length; i++) {
      if ((modeFlags & PERMISSION_BITS[i]) != 0) {
        permissions.add(PERMISSIONS[i]);
      }
    }
    return permissions;
  }

  /// Creation attributes for the given file system: the permissions on a POSIX file system,
  /// none elsewhere.
  static FileAttribute<?>[] toFileAttributes(FileSystem fileSystem, int modeFlags) {
    if (!fileSystem.supportedFileAttributeViews().contains("posix")) {
      return new FileAttribute<?>[0];
    }
    return new FileAttribute<?>[] {PosixFilePermissions.asFileAttribute(toPermissions(modeFlags))};
  }
}
