package com.knowledgeagent.backend.chunking;

import java.util.Objects;

/** A token-bounded slice of a document body; {@code frontmatter} is shared by every chunk. */
public record DocumentChunk(String content, int chunkIndex, int totalChunks, String frontmatter) {

  public DocumentChunk {
    Objects.requireNonNull(content, "content");
    if (chunkIndex < 0 || chunkIndex >= totalChunks) {
      throw new IllegalArgumentException(
          "chunkIndex %d out of range for %d chunks".formatted(chunkIndex, totalChunks));
    }
  }

  public boolean isLast() {
    return chunkIndex == totalChunks - 1;
  }

  /** 1-based position used in prompts and progress messages. */
  public int position() {
    return chunkIndex + 1;
  }
}
