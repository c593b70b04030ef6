package com.github.simbo1905.fio;

import java.io.IOException;

/// Outcome of one bounded element transfer: how many whole elements were asked for and moved,
/// and the failure that stopped it, if any. Carrying the failure in the result keeps the
/// completion loop in [BufferedFile] free of shared error state.
record Transfer(int requested, int transferred, IOException failure) {

  static Transfer complete(int requested) {
    return new Transfer(requested, requested, null);
  }

  boolean isShort() {
    return transferred < requested;
  }

  boolean failed() {
    return failure != null;
  }
}
