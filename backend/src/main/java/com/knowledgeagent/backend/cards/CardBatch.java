package com.knowledgeagent.backend.cards;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Cards returned by the generation service for one chunk. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CardBatch(
    List<Card> cards,
    @JsonProperty("exhaustiveness_notes") String exhaustivenessNotes,
    Boolean complete,
    @JsonProperty("card_count") Integer cardCount) {

  /** An absent completion flag counts as complete. */
  public boolean reportedComplete() {
    return complete == null || complete;
  }
}
