package com.knowledgeagent.backend.tools;

import com.knowledgeagent.backend.cards.PipelineResult;
import com.knowledgeagent.backend.pipeline.CardPipelineException;
import com.knowledgeagent.backend.pipeline.CardPipelineService;
import com.knowledgeagent.backend.progress.CollectingProgressSink;
import com.knowledgeagent.backend.progress.ProgressEvent;
import com.knowledgeagent.backend.rawcontext.RawContextDocument;
import com.knowledgeagent.backend.rawcontext.RawContextRequest;
import com.knowledgeagent.backend.rawcontext.RawContextService;
import java.util.List;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class KnowledgeAgentTools {

  private final RawContextService rawContextService;
  private final CardPipelineService cardPipelineService;

  public KnowledgeAgentTools(
      RawContextService rawContextService, CardPipelineService cardPipelineService) {
    this.rawContextService = rawContextService;
    this.cardPipelineService = cardPipelineService;
  }

  @Tool(
      name = "knowledge.build_raw_context",
      description =
          "Collects commits and files from GitHub sources and renders a consolidated raw context "
              + "markdown document. Required field: `sources` (org, repos, branches, contextOptions).")
  public RawContextDocument buildRawContext(RawContextRequest input) {
    if (input == null || input.sources().isEmpty()) {
      throw new IllegalArgumentException("At least one source is required");
    }
    return rawContextService.build(input);
  }

  @Tool(
      name = "knowledge.generate_cards",
      description =
          "Splits a raw context document into chunks, generates knowledge cards for each chunk and "
              + "merges them. Returns the merged result together with the progress events. "
              + "Required field: `rawContext`.")
  public GenerateCardsResponse generateCards(GenerateCardsInput input) {
    if (input == null || !StringUtils.hasText(input.rawContext())) {
      throw new IllegalArgumentException("rawContext must not be blank");
    }
    CollectingProgressSink sink = new CollectingProgressSink();
    try {
      PipelineResult result = cardPipelineService.run(input.rawContext(), sink);
      return new GenerateCardsResponse(result, sink.events());
    } catch (CardPipelineException ex) {
      return new GenerateCardsResponse(null, sink.events());
    }
  }

  public record GenerateCardsInput(String rawContext) {}

  public record GenerateCardsResponse(PipelineResult result, List<ProgressEvent> events) {}
}
