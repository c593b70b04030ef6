package com.github.simbo1905.fio;

import java.util.concurrent.locks.ReentrantLock;

/// The advisory per-stream lock of a [BufferedFile], the counterpart of `flockfile`: reentrant,
/// owned by one thread at a time, and never taken by the stream's own operations.
///
/// Besides the raw lock/unlock calls it hands out AutoCloseable guards so a caller cannot forget
/// to unlock:
/// <pre>
/// try (var ignored = file.lockGuard()) {
///   file.putByteLine("header");
///   file.putByteLine("body");
/// }
/// </pre>
public final class GuardedStreamLock {
  private final ReentrantLock lock = new ReentrantLock();

  public boolean tryLock() {
    return lock.tryLock();
  }

  public void lock() {
    lock.lock();
  }

  /// @throws IllegalMonitorStateException if the current thread does not hold the lock
  public void unlock() {
    lock.unlock();
  }

  /// Locks and returns a guard that unlocks when closed.
  public LockGuard guard() {
    return new LockGuard(lock);
  }

  /// A lock guard that automatically releases the lock when closed.
  public static final class LockGuard implements AutoCloseable {
    private final ReentrantLock lock;

    LockGuard(ReentrantLock lock) {
      this.lock = lock;
      lock.lock();
    }

    @Override
    public void close() {
      lock.unlock();
    }
  }
}
