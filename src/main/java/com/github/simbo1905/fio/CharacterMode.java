package com.github.simbo1905.fio;

import lombok.Getter;

/// Orientation of a text stream. A stream starts unoriented and commits to byte or wide
/// characters exactly once, after which the orientation never changes.
@Getter
public enum CharacterMode {
  BYTE_ORIENTATION(-1, "byte oriented"),
  NO_ORIENTATION(0, "not oriented"),
  WIDE_ORIENTATION(1, "wide oriented");

  /// The `fwide` value: negative for byte, zero for none, positive for wide.
  private final int value;

  private final String description;

  CharacterMode(int value, String description) {
    this.value = value;
    this.description = description;
  }

  /// The orientation after requesting `desired`. Only an unoriented stream moves, and
  /// requesting [#NO_ORIENTATION] never moves anything.
  CharacterMode transitionTo(CharacterMode desired) {
    return this == NO_ORIENTATION ? desired : this;
  }
}
