package com.knowledgeagent.backend.pipeline;

import com.knowledgeagent.backend.cards.PipelineResult;
import com.knowledgeagent.backend.chunking.DocumentChunk;
import com.knowledgeagent.backend.chunking.DocumentChunker;
import com.knowledgeagent.backend.progress.ProgressEvent;
import com.knowledgeagent.backend.progress.ProgressReporter;
import com.knowledgeagent.backend.progress.ProgressSink;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw context document into a merged card set: chunk, process every chunk, merge, publish.
 * Every stage transition is reported to the supplied sink; the sink is closed when the run ends.
 */
public class CardPipelineService {

  private static final Logger log = LoggerFactory.getLogger(CardPipelineService.class);

  private final DocumentChunker chunker;
  private final ChunkProcessor chunkProcessor;
  private final ResultMerger resultMerger;
  private final List<CardResultPublisher> publishers;

  public CardPipelineService(
      DocumentChunker chunker,
      ChunkProcessor chunkProcessor,
      ResultMerger resultMerger,
      List<CardResultPublisher> publishers) {
    this.chunker = Objects.requireNonNull(chunker, "chunker");
    this.chunkProcessor = Objects.requireNonNull(chunkProcessor, "chunkProcessor");
    this.resultMerger = Objects.requireNonNull(resultMerger, "resultMerger");
    this.publishers = publishers == null ? List.of() : List.copyOf(publishers);
  }

  public PipelineResult run(String rawContext, ProgressSink sink) {
    Objects.requireNonNull(rawContext, "rawContext");
    ProgressReporter reporter = new ProgressReporter(sink);
    try {
      reporter.emit(
          ProgressEvent.progress(
              ProgressEvent.Phase.CHUNKING, "Analyzing document size and creating chunks...", 0, 0));
      List<DocumentChunk> chunks = chunker.chunk(rawContext);
      int total = chunks.size();
      reporter.emit(
          ProgressEvent.progress(
              ProgressEvent.Phase.CHUNKING,
              "Document split into %d chunk(s) (~%d tokens)"
                  .formatted(total, chunker.estimateTokens(rawContext)),
              0,
              total));

      List<ChunkResult> results = chunkProcessor.process(chunks, reporter);

      reporter.emit(
          ProgressEvent.progress(
              ProgressEvent.Phase.MERGING,
              "Merging results from %d chunks...".formatted(results.size()),
              total,
              total));
      PipelineResult result = resultMerger.merge(results);
      log.info(
          "Card pipeline finished: {} cards from {}/{} chunks, complete={}",
          result.cardCount(),
          results.size(),
          total,
          result.complete());
      publish(result);
      reporter.complete(result);
      return result;
    } catch (CardPipelineException ex) {
      log.warn("Card pipeline failed: {}", ex.getMessage());
      reporter.fatal(ex.getMessage(), null);
      throw ex;
    } catch (RuntimeException ex) {
      log.error("Card pipeline aborted", ex);
      reporter.fatal("Fatal error: " + ex.getMessage(), null);
      throw ex;
    }
  }

  private void publish(PipelineResult result) {
    for (CardResultPublisher publisher : publishers) {
      try {
        publisher.publish(result);
      } catch (RuntimeException ex) {
        log.warn(
            "Result publisher {} failed, continuing: {}",
            publisher.getClass().getSimpleName(),
            ex.getMessage(),
            ex);
      }
    }
  }
}
