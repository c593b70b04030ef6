package com.github.simbo1905.fio;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Throws an IOException with a chosen OS reason once an operation has succeeded a given number
/// of times, and on every call of it after that, the way a full disk stays full.
class FailingFileChannel extends AbstractDelegatingFileChannel {

  private static final Logger logger = Logger.getLogger(FailingFileChannel.class.getName());

  static final String NO_SPACE = "No space left on device";
  static final String IO_ERROR = "Input/output error";

  private final Map<Operation, Integer> remaining = new EnumMap<>(Operation.class);
  private final Map<Operation, String> reasons = new EnumMap<>(Operation.class);

  private int failures = 0;

  FailingFileChannel(FileChannel delegate) {
    super(delegate);
  }

  /// Fails `operation` after `successfulCalls` calls of it succeed.
  FailingFileChannel failAfter(Operation operation, int successfulCalls, String reason) {
    remaining.put(operation, successfulCalls);
    reasons.put(operation, reason);
    return this;
  }

  FailingFileChannel fail(Operation operation, String reason) {
    return failAfter(operation, 0, reason);
  }

  int getFailures() {
    return failures;
  }

  @Override
  protected void beforeOperation(Operation operation) throws IOException {
    final Integer left = remaining.get(operation);
    if (left == null) {
      return;
    }
    if (left > 0) {
      remaining.put(operation, left - 1);
      return;
    }
    failures++;
    logger.log(
        Level.FINE,
        () -> String.format("THROWING at operation %d (%s)", operationCount, operation));
    throw new IOException(reasons.get(operation));
  }
}
