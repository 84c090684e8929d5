package com.knowledgeagent.backend.evidence;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceType {
  GITHUB("github", "Github");

  private final String token;
  private final String displayName;

  SourceType(String token, String displayName) {
    this.token = token;
    this.displayName = displayName;
  }

  @JsonValue
  public String token() {
    return token;
  }

  public String displayName() {
    return displayName;
  }
}
