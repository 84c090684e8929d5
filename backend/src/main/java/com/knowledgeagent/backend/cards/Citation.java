package com.knowledgeagent.backend.cards;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Reference from a card back to the raw context: either a named section ({@code ref}) or an
 * evidence item ({@code id} with optional {@code path} and {@code sha}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Citation(Type type, String ref, String id, String path, String sha) {

  public static Citation section(String ref) {
    return new Citation(Type.SECTION, ref, null, null, null);
  }

  public static Citation evidence(String id, String path, String sha) {
    return new Citation(Type.EVIDENCE, null, id, path, sha);
  }

  public enum Type {
    SECTION("section"),
    EVIDENCE("evidence");

    private final String token;

    Type(String token) {
      this.token = token;
    }

    @JsonValue
    public String token() {
      return token;
    }

    @JsonCreator
    public static Type fromToken(String value) {
      if (value == null) {
        return null;
      }
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (Type type : values()) {
        if (type.token.equals(normalized)) {
          return type;
        }
      }
      return null;
    }
  }
}
