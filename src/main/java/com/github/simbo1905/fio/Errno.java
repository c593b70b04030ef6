package com.github.simbo1905.fio;

import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NonReadableChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import lombok.Getter;

/// Operating system error codes with their standard descriptions, numbered as on Linux.
///
/// The JDK does not surface `errno`; it translates it into an exception type or into the
/// `strerror` text of the exception reason. [#of(Throwable)] reverses that translation so a
/// [FileException] can carry the numeric code captured at the failing call.
@Getter
public enum Errno {
  NONE(0, "Success"),
  EPERM(1, "Operation not permitted"),
  ENOENT(2, "No such file or directory"),
  EINTR(4, "Interrupted system call"),
  EIO(5, "Input/output error"),
  EBADF(9, "Bad file descriptor"),
  EAGAIN(11, "Resource temporarily unavailable"),
  ENOMEM(12, "Cannot allocate memory"),
  EACCES(13, "Permission denied"),
  EBUSY(16, "Device or resource busy"),
  EEXIST(17, "File exists"),
  ENOTDIR(20, "Not a directory"),
  EISDIR(21, "Is a directory"),
  EINVAL(22, "Invalid argument"),
  EMFILE(24, "Too many open files"),
  ETXTBSY(26, "Text file busy"),
  EFBIG(27, "File too large"),
  ENOSPC(28, "No space left on device"),
  ESPIPE(29, "Illegal seek"),
  EROFS(30, "Read-only file system"),
  EDEADLK(35, "Resource deadlock avoided"),
  ENAMETOOLONG(36, "File name too long"),
  ELOOP(40, "Too many levels of symbolic links"),
  EILSEQ(84, "Invalid or incomplete multibyte or wide character"),
  EOPNOTSUPP(95, "Operation not supported"),
  EDQUOT(122, "Disk quota exceeded");

  private final int code;
  private final String description;

  Errno(int code, String description) {
    this.code = code;
    this.description = description;
  }

  /// Looks up a code, falling back to [#EIO] for codes this enum does not name.
  public static Errno valueOf(int code) {
    for (Errno errno : values()) {
      if (errno.code == code) {
        return errno;
      }
    }
    return EIO;
  }

  /// Recovers the OS error behind a JDK failure. Exception types are checked first as they
  /// are exact; otherwise the reason text is matched against the standard descriptions.
  public static Errno of(Throwable failure) {
    if (failure instanceof FileException) {
      return ((FileException) failure).getErrno();
    }
    if (failure instanceof NoSuchFileException) {
      return ENOENT;
    }
    if (failure instanceof AccessDeniedException) {
      return EACCES;
    }
    if (failure instanceof FileAlreadyExistsException) {
      return EEXIST;
    }
    if (failure instanceof NotDirectoryException) {
      return ENOTDIR;
    }
    if (failure instanceof FileSystemLoopException) {
      return ELOOP;
    }
    if (failure instanceof ClosedByInterruptException) {
      return EINTR;
    }
    if (failure instanceof ClosedChannelException
        || failure instanceof NonReadableChannelException
        || failure instanceof NonWritableChannelException) {
      return EBADF;
    }
    if (failure instanceof OverlappingFileLockException) {
      return EDEADLK;
    }
    if (failure instanceof CharacterCodingException) {
      return EILSEQ;
    }
    if (failure instanceof UnsupportedOperationException) {
      return EOPNOTSUPP;
    }
    if (failure instanceof IllegalArgumentException) {
      return EINVAL;
    }
    final var reason =
        failure instanceof FileSystemException
            ? ((FileSystemException) failure).getReason()
            : failure.getMessage();
    if (reason != null) {
      for (Errno errno : values()) {
        if (errno != NONE && reason.contains(errno.description)) {
          return errno;
        }
      }
    }
    return EIO;
  }
}
