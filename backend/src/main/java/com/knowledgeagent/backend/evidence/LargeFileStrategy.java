package com.knowledgeagent.backend.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum LargeFileStrategy {
  SUMMARY("summary"),
  HEAD_TAIL("headTail"),
  EXCLUDE("exclude");

  private final String token;

  LargeFileStrategy(String token) {
    this.token = token;
  }

  @JsonValue
  public String token() {
    return token;
  }

  @JsonCreator
  public static LargeFileStrategy fromToken(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    for (LargeFileStrategy strategy : values()) {
      if (strategy.token.toLowerCase(Locale.ROOT).equals(normalized)) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("Unsupported large file strategy: " + value);
  }
}
