package com.github.simbo1905.fio;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/// Moves at most a fixed number of bytes per read or write call, as a pipe or a signal
/// interrupted call may.
class ShortTransferFileChannel extends AbstractDelegatingFileChannel {

  private final int maxBytesPerCall;

  ShortTransferFileChannel(FileChannel delegate, int maxBytesPerCall) {
    super(delegate);
    this.maxBytesPerCall = maxBytesPerCall;
  }

  @Override
  protected void beforeOperation(Operation operation) {}

  @Override
  public int read(ByteBuffer dst) throws IOException {
    checkOperation(Operation.READ);
    final ByteBuffer window = limited(dst);
    final int n = delegate.read(window);
    if (n > 0) {
      dst.position(dst.position() + n);
    }
    return n;
  }

  @Override
  public int write(ByteBuffer src) throws IOException {
    checkOperation(Operation.WRITE);
    final ByteBuffer window = limited(src);
    final int n = delegate.write(window);
    src.position(src.position() + n);
    return n;
  }

  private ByteBuffer limited(ByteBuffer buffer) {
    final ByteBuffer window = buffer.duplicate();
    window.limit(window.position() + Math.min(buffer.remaining(), maxBytesPerCall));
    return window;
  }
}
