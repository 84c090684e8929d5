package com.knowledgeagent.backend.cards;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Placement hints for images and diagrams; rendering them is left to the publisher. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CardAssets(List<ImageAsset> images, List<DiagramAsset> mermaid) {

  public CardAssets {
    images = images == null ? List.of() : images;
    mermaid = mermaid == null ? List.of() : mermaid;
  }

  public static CardAssets empty() {
    return new CardAssets(List.of(), List.of());
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ImageAsset(
      AssetSlot slot, String description, @JsonProperty("source_ref") String sourceRef) {

    public ImageAsset {
      slot = slot == null ? AssetSlot.AFTER_INTRO : slot;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DiagramAsset(
      AssetSlot slot, String description, @JsonProperty("based_on") List<Citation> basedOn) {

    public DiagramAsset {
      slot = slot == null ? AssetSlot.BEFORE_CONCLUSION : slot;
      basedOn = basedOn == null ? List.of() : basedOn;
    }
  }
}
