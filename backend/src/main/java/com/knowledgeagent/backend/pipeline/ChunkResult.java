package com.knowledgeagent.backend.pipeline;

import com.knowledgeagent.backend.cards.CardBatch;
import java.util.Objects;

/** A validated batch together with the index of the chunk that produced it. */
public record ChunkResult(int chunkIndex, CardBatch batch) {

  public ChunkResult {
    Objects.requireNonNull(batch, "batch");
  }
}
