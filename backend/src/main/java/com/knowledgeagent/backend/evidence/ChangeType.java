package com.knowledgeagent.backend.evidence;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ChangeType {
  ADDED("added"),
  MODIFIED("modified"),
  DELETED("deleted"),
  RENAMED("renamed"),
  OTHER("other");

  private final String token;

  ChangeType(String token) {
    this.token = token;
  }

  @JsonValue
  public String token() {
    return token;
  }

  /** Maps a hosting API file status ({@code added|modified|removed|renamed}) to a change type. */
  public static ChangeType fromStatus(String status) {
    if (status == null) {
      return OTHER;
    }
    return switch (status.trim().toLowerCase(Locale.ROOT)) {
      case "added" -> ADDED;
      case "modified" -> MODIFIED;
      case "removed" -> DELETED;
      case "renamed" -> RENAMED;
      default -> OTHER;
    };
  }
}
