package com.knowledgeagent.backend.cards;

import java.util.Objects;

/** Everything the generation service receives for a single chunk. */
public record CardGenerationRequest(
    String systemInstruction,
    String chunkBody,
    String frontmatter,
    String positionNote,
    String schemaDescription) {

  public CardGenerationRequest {
    Objects.requireNonNull(systemInstruction, "systemInstruction");
    Objects.requireNonNull(chunkBody, "chunkBody");
  }

  /** Schema first, then the shared header, the positional note and the chunk body. */
  public String userPrompt() {
    StringBuilder context = new StringBuilder();
    if (frontmatter != null && !frontmatter.isBlank()) {
      context.append(frontmatter.strip()).append("\n\n");
    }
    if (positionNote != null && !positionNote.isBlank()) {
      context.append(positionNote.strip()).append("\n\n");
    }
    context.append(chunkBody);
    return String.join(
        "\n",
        "SCHEMA_BEGIN",
        schemaDescription == null ? "" : schemaDescription.strip(),
        "SCHEMA_END",
        "",
        "RAW_CONTEXT_BEGIN",
        context.toString(),
        "RAW_CONTEXT_END");
  }
}
