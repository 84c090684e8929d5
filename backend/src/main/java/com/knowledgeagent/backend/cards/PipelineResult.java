package com.knowledgeagent.backend.cards;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Deduplicated cards merged from every successfully processed chunk")
public record PipelineResult(
    List<Card> cards,
    @JsonProperty("exhaustiveness_notes") String exhaustivenessNotes,
    boolean complete,
    @JsonProperty("card_count") int cardCount) {

  public PipelineResult {
    cards = cards == null ? List.of() : List.copyOf(cards);
    exhaustivenessNotes = exhaustivenessNotes == null ? "" : exhaustivenessNotes;
    if (cardCount != cards.size()) {
      throw new IllegalArgumentException(
          "card_count %d does not match %d cards".formatted(cardCount, cards.size()));
    }
  }

  public static PipelineResult of(List<Card> cards, String exhaustivenessNotes, boolean complete) {
    List<Card> copy = cards == null ? List.of() : List.copyOf(cards);
    return new PipelineResult(copy, exhaustivenessNotes, complete, copy.size());
  }
}
