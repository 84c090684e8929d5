package com.knowledgeagent.backend.cards;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CardAudience {
  TECH_NEW_HIRE("tech_new_hire"),
  TECH_YOUR_TEAM("tech_your_team"),
  TECH_OTHER_TEAM("tech_other_team"),
  BIZ("biz"),
  EXPERT("expert");

  private final String token;

  CardAudience(String token) {
    this.token = token;
  }

  @JsonValue
  public String token() {
    return token;
  }

  /** Returns {@code null} for unknown values so that validation can report them. */
  @JsonCreator
  public static CardAudience fromToken(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (CardAudience audience : values()) {
      if (audience.token.equals(normalized)) {
        return audience;
      }
    }
    return null;
  }
}
