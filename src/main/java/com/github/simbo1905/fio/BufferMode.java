package com.github.simbo1905.fio;

/// The three stdio buffering strategies.
public enum BufferMode {
  /// Every write reaches the channel immediately and reads fetch one byte at a time.
  NONE,
  /// Output is written when a newline is put or the buffer fills.
  LINE,
  /// Output is written when the buffer fills.
  FULL
}
