package com.knowledgeagent.backend.pipeline;

import com.knowledgeagent.backend.cards.Card;
import com.knowledgeagent.backend.cards.PipelineResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.util.StringUtils;

/** Concatenates chunk results in order and drops cards whose title duplicates an earlier one. */
public class ResultMerger {

  private final TitleSimilarity titleSimilarity;

  public ResultMerger(TitleSimilarity titleSimilarity) {
    this.titleSimilarity = Objects.requireNonNull(titleSimilarity, "titleSimilarity");
  }

  public PipelineResult merge(List<ChunkResult> results) {
    List<Card> all = new ArrayList<>();
    List<String> notes = new ArrayList<>();
    boolean complete = true;
    for (ChunkResult result : results) {
      all.addAll(result.batch().cards());
      String chunkNotes = result.batch().exhaustivenessNotes();
      if (StringUtils.hasText(chunkNotes)) {
        notes.add("Chunk %d: %s".formatted(result.chunkIndex() + 1, chunkNotes));
      }
      complete &= result.batch().reportedComplete();
    }
    return PipelineResult.of(deduplicate(all), String.join("\n\n", notes), complete);
  }

  List<Card> deduplicate(List<Card> cards) {
    List<Card> unique = new ArrayList<>();
    for (Card card : cards) {
      boolean duplicate =
          unique.stream().anyMatch(kept -> titleSimilarity.isDuplicate(card.title(), kept.title()));
      if (!duplicate) {
        unique.add(card);
      }
    }
    return unique;
  }
}
