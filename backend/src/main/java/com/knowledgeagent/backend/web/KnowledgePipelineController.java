package com.knowledgeagent.backend.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeagent.backend.cards.PipelineResult;
import com.knowledgeagent.backend.pipeline.CardPipelineService;
import com.knowledgeagent.backend.progress.CollectingProgressSink;
import com.knowledgeagent.backend.progress.SseProgressSink;
import com.knowledgeagent.backend.rawcontext.RawContextDocument;
import com.knowledgeagent.backend.rawcontext.RawContextRequest;
import com.knowledgeagent.backend.rawcontext.RawContextService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@Slf4j
@RestController
@RequestMapping("/api")
public class KnowledgePipelineController {

  private final RawContextService rawContextService;
  private final CardPipelineService cardPipelineService;
  private final ObjectMapper objectMapper;

  public KnowledgePipelineController(
      RawContextService rawContextService,
      CardPipelineService cardPipelineService,
      ObjectMapper objectMapper) {
    this.rawContextService = rawContextService;
    this.cardPipelineService = cardPipelineService;
    this.objectMapper = objectMapper;
  }

  @PostMapping("/raw-context")
  public RawContextDocument buildRawContext(@Valid @RequestBody RawContextRequest request) {
    return rawContextService.build(request);
  }

  @PostMapping("/cards")
  public PipelineResult generateCards(@Valid @RequestBody CardGenerationCommand command) {
    return cardPipelineService.run(command.rawContext(), new CollectingProgressSink());
  }

  /** Streams progress events as {@code data: <json>} frames until the run completes or fails. */
  @PostMapping(value = "/cards/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public ResponseEntity<StreamingResponseBody> streamCards(
      @Valid @RequestBody CardGenerationCommand command) {
    StreamingResponseBody body =
        outputStream -> {
          try {
            cardPipelineService.run(
                command.rawContext(), new SseProgressSink(outputStream, objectMapper));
          } catch (RuntimeException ex) {
            // the fatal event has already been written to the stream
            log.warn("Card stream ended with failure: {}", ex.getMessage());
          }
        };
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_EVENT_STREAM)
        .header("Cache-Control", "no-cache")
        .body(body);
  }
}
