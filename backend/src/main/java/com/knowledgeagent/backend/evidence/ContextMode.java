package com.knowledgeagent.backend.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ContextMode {
  DATE_RANGE("date-range"),
  FILE_SELECTION("file-selection"),
  COMMIT_SELECTION("commit-selection");

  private final String token;

  ContextMode(String token) {
    this.token = token;
  }

  @JsonValue
  public String token() {
    return token;
  }

  @JsonCreator
  public static ContextMode fromToken(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (ContextMode mode : values()) {
      if (mode.token.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unsupported context mode: " + value);
  }
}
