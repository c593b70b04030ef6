package com.github.simbo1905.fio;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// A FileChannel that forwards to a real one, counting calls and giving subclasses a hook
/// before each so they can misbehave. Swapped into a file under test through its package
/// visible `channel` field.
abstract class AbstractDelegatingFileChannel extends FileChannel {

  private static final Logger logger =
      Logger.getLogger(AbstractDelegatingFileChannel.class.getName());

  enum Operation {
    READ,
    WRITE,
    POSITION,
    SIZE,
    TRUNCATE,
    FORCE,
    LOCK,
    CLOSE
  }

  protected final FileChannel delegate;

  @Getter protected int operationCount = 0;

  AbstractDelegatingFileChannel(FileChannel delegate) {
    this.delegate = delegate;
    logger.log(
        Level.FINE, () -> String.format("Created %s over %s", getClass().getSimpleName(), delegate));
  }

  /// Hook called before each forwarded call.
  protected abstract void beforeOperation(Operation operation) throws IOException;

  protected void checkOperation(Operation operation) throws IOException {
    operationCount++;
    logger.log(
        Level.FINEST, () -> String.format("Operation %d: %s", operationCount, operation));
    beforeOperation(operation);
  }

  @Override
  public int read(ByteBuffer dst) throws IOException {
    checkOperation(Operation.READ);
    return delegate.read(dst);
  }

  @Override
  public long read(ByteBuffer[] dsts, int offset, int length) throws IOException {
    checkOperation(Operation.READ);
    return delegate.read(dsts, offset, length);
  }

  @Override
  public int read(ByteBuffer dst, long position) throws IOException {
    checkOperation(Operation.READ);
    return delegate.read(dst, position);
  }

  @Override
  public int write(ByteBuffer src) throws IOException {
    checkOperation(Operation.WRITE);
    return delegate.write(src);
  }

  @Override
  public long write(ByteBuffer[] srcs, int offset, int length) throws IOException {
    checkOperation(Operation.WRITE);
    return delegate.write(srcs, offset, length);
  }

  @Override
  public int write(ByteBuffer src, long position) throws IOException {
    checkOperation(Operation.WRITE);
    return delegate.write(src, position);
  }

  @Override
  public long position() throws IOException {
    checkOperation(Operation.POSITION);
    return delegate.position();
  }

  @Override
  public FileChannel position(long newPosition) throws IOException {
    checkOperation(Operation.POSITION);
    delegate.position(newPosition);
    return this;
  }

  @Override
  public long size() throws IOException {
    checkOperation(Operation.SIZE);
    return delegate.size();
  }

  @Override
  public FileChannel truncate(long size) throws IOException {
    checkOperation(Operation.TRUNCATE);
    delegate.truncate(size);
    return this;
  }

  @Override
  public void force(boolean metaData) throws IOException {
    checkOperation(Operation.FORCE);
    delegate.force(metaData);
  }

  @Override
  public long transferTo(long position, long count, WritableByteChannel target)
      throws IOException {
    checkOperation(Operation.READ);
    return delegate.transferTo(position, count, target);
  }

  @Override
  public long transferFrom(ReadableByteChannel src, long position, long count)
      throws IOException {
    checkOperation(Operation.WRITE);
    return delegate.transferFrom(src, position, count);
  }

  @Override
  public MappedByteBuffer map(MapMode mode, long position, long size) throws IOException {
    throw new UnsupportedOperationException("mapping is not delegated");
  }

  @Override
  public FileLock lock(long position, long size, boolean shared) throws IOException {
    checkOperation(Operation.LOCK);
    return delegate.lock(position, size, shared);
  }

  @Override
  public FileLock tryLock(long position, long size, boolean shared) throws IOException {
    checkOperation(Operation.LOCK);
    return delegate.tryLock(position, size, shared);
  }

  @Override
  protected void implCloseChannel() throws IOException {
    try {
      delegate.close();
    } finally {
      checkOperation(Operation.CLOSE);
    }
  }
}
