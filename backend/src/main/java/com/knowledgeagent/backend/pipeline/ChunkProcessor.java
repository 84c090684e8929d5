package com.knowledgeagent.backend.pipeline;

import com.knowledgeagent.backend.cards.CardBatch;
import com.knowledgeagent.backend.cards.CardBatchValidator;
import com.knowledgeagent.backend.cards.CardGenerationClient;
import com.knowledgeagent.backend.cards.CardGenerationRequest;
import com.knowledgeagent.backend.cards.CardPromptFactory;
import com.knowledgeagent.backend.cards.CardSchemaValidationException;
import com.knowledgeagent.backend.chunking.DocumentChunk;
import com.knowledgeagent.backend.progress.ProgressEvent;
import com.knowledgeagent.backend.progress.ProgressReporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Sends chunks to the generation service one at a time, in index order. A chunk whose response
 * fails validation or whose call fails is reported and skipped; the run fails only when no chunk
 * succeeds. The rate limiter is consulted between chunks, never after the last one.
 */
public class ChunkProcessor {

  private static final Logger log = LoggerFactory.getLogger(ChunkProcessor.class);

  static final String TOTAL_FAILURE_MESSAGE = "Failed to process any chunks successfully";

  private final CardGenerationClient generationClient;
  private final CardBatchValidator validator;
  private final CardPromptFactory promptFactory;
  private final RateLimiter rateLimiter;
  private final Timer generationTimer;
  private final Counter successCounter;
  private final Counter failureCounter;

  public ChunkProcessor(
      CardGenerationClient generationClient,
      CardBatchValidator validator,
      CardPromptFactory promptFactory,
      RateLimiter rateLimiter,
      @Nullable MeterRegistry meterRegistry) {
    this.generationClient = Objects.requireNonNull(generationClient, "generationClient");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.promptFactory = Objects.requireNonNull(promptFactory, "promptFactory");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.generationTimer = registry.timer("knowledge_chunk_generation_duration");
    this.successCounter = registry.counter("knowledge_chunk_success_total");
    this.failureCounter = registry.counter("knowledge_chunk_failure_total");
  }

  public List<ChunkResult> process(List<DocumentChunk> chunks, ProgressReporter reporter) {
    Objects.requireNonNull(chunks, "chunks");
    Objects.requireNonNull(reporter, "reporter");
    int total = chunks.size();
    List<ChunkResult> results = new ArrayList<>();
    for (DocumentChunk chunk : chunks) {
      int position = chunk.position();
      reporter.emit(
          ProgressEvent.progress(
              ProgressEvent.Phase.PROCESSING,
              "Processing chunk %d/%d (~%d chars)".formatted(position, total, chunk.content().length()),
              chunk.chunkIndex(),
              total));

      CardBatch batch = generate(chunk, reporter);
      if (batch != null) {
        results.add(new ChunkResult(chunk.chunkIndex(), batch));
        reporter.emit(
            ProgressEvent.chunkCompleted(
                "Chunk %d completed: %d cards generated".formatted(position, batch.cards().size()),
                position,
                total,
                batch.cards().size()));
      }

      if (!chunk.isLast()) {
        awaitCooldown(position, total, reporter);
      }
    }
    if (results.isEmpty()) {
      throw new CardPipelineException(TOTAL_FAILURE_MESSAGE);
    }
    log.info("Processed {} of {} chunks successfully", results.size(), total);
    return results;
  }

  private CardBatch generate(DocumentChunk chunk, ProgressReporter reporter) {
    int position = chunk.position();
    CardGenerationRequest request = promptFactory.create(chunk);
    Instant startedAt = Instant.now();
    try {
      CardBatch batch = validator.validate(generationClient.generate(request));
      successCounter.increment();
      return batch;
    } catch (CardSchemaValidationException ex) {
      failureCounter.increment();
      log.warn("Chunk {} validation failed: {}", position, ex.getViolations());
      reporter.error(
          "Chunk %d validation failed".formatted(position), Map.of("issues", ex.getViolations()));
      return null;
    } catch (RuntimeException ex) {
      failureCounter.increment();
      log.warn("Error processing chunk {}: {}", position, ex.getMessage(), ex);
      reporter.error("Error processing chunk %d: %s".formatted(position, ex.getMessage()), null);
      return null;
    } finally {
      generationTimer.record(Duration.between(startedAt, Instant.now()));
    }
  }

  private void awaitCooldown(int completed, int total, ProgressReporter reporter) {
    long waitSeconds = waitSeconds(rateLimiter.nextDelay());
    reporter.emit(
        ProgressEvent.waiting(
            "Waiting %d seconds to respect rate limits...".formatted(waitSeconds),
            completed,
            total,
            waitSeconds));
    try {
      rateLimiter.awaitNextPermit();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new CardPipelineException("Interrupted while waiting between chunks", ex);
    }
  }

  // Rounded up so a sub-second cooldown never reports 0.
  static long waitSeconds(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return 0;
    }
    long millis = delay.toMillis();
    return Math.max(1, (millis + 999) / 1000);
  }
}
