package com.knowledgeagent.backend.cards;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Card(
    String title,
    CardAudience audience,
    String pain,
    CardContext context,
    @JsonProperty("content_markdown") String contentMarkdown,
    @JsonProperty("content_html") String contentHtml,
    List<Citation> citations,
    List<String> tags,
    @JsonProperty("collection_hint") String collectionHint,
    @JsonProperty("related_card_titles") List<String> relatedCardTitles,
    CardAssets assets) {

  public Card {
    citations = citations == null ? List.of() : citations;
    tags = tags == null ? List.of() : tags;
    relatedCardTitles = relatedCardTitles == null ? List.of() : relatedCardTitles;
    assets = assets == null ? CardAssets.empty() : assets;
  }
}
