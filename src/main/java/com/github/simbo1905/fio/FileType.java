package com.github.simbo1905.fio;

/// Whether a [BufferedFile] carries text (character, string, line and formatted operations) or
/// binary data (element and byte transfers). Fixed when the file is opened.
public enum FileType {
  TEXT("text"),
  BINARY("binary");

  private final String displayName;

  FileType(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
