package com.knowledgeagent.backend.cards;

import java.util.List;

/** The generation service returned a result that does not match the card batch schema. */
public class CardSchemaValidationException extends RuntimeException {

  private final List<String> violations;

  public CardSchemaValidationException(String message, List<String> violations) {
    super(message);
    this.violations = violations == null ? List.of() : List.copyOf(violations);
  }

  public CardSchemaValidationException(String message, Throwable cause) {
    super(message, cause);
    this.violations = List.of(cause != null && cause.getMessage() != null ? cause.getMessage() : message);
  }

  public List<String> getViolations() {
    return violations;
  }
}
