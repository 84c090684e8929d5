package com.knowledgeagent.backend.cards;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AssetSlot {
  TOP("top"),
  AFTER_INTRO("after_intro"),
  BEFORE_CONCLUSION("before_conclusion"),
  APPENDIX("appendix");

  private final String token;

  AssetSlot(String token) {
    this.token = token;
  }

  @JsonValue
  public String token() {
    return token;
  }

  @JsonCreator
  public static AssetSlot fromToken(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (AssetSlot slot : values()) {
      if (slot.token.equals(normalized)) {
        return slot;
      }
    }
    throw new IllegalArgumentException("Unsupported asset slot: " + value);
  }
}
