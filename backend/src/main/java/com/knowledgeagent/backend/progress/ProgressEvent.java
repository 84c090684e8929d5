package com.knowledgeagent.backend.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.knowledgeagent.backend.cards.PipelineResult;

/**
 * One status message of the pipeline stream. {@code currentChunk} counts chunks already finished,
 * so {@code progress} is {@code round(currentChunk / totalChunks * 100)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
    Type type,
    Phase phase,
    String message,
    Integer totalChunks,
    Integer currentChunk,
    Integer progress,
    Integer cardsInChunk,
    Long waitTime,
    Object details,
    PipelineResult data) {

  public static ProgressEvent progress(
      Phase phase, String message, int currentChunk, int totalChunks) {
    return new ProgressEvent(
        Type.PROGRESS,
        phase,
        message,
        totalChunks,
        currentChunk,
        percentage(currentChunk, totalChunks),
        null,
        null,
        null,
        null);
  }

  public static ProgressEvent chunkCompleted(
      String message, int currentChunk, int totalChunks, int cardsInChunk) {
    return new ProgressEvent(
        Type.PROGRESS,
        Phase.COMPLETED,
        message,
        totalChunks,
        currentChunk,
        percentage(currentChunk, totalChunks),
        cardsInChunk,
        null,
        null,
        null);
  }

  public static ProgressEvent waiting(
      String message, int currentChunk, int totalChunks, long waitSeconds) {
    return new ProgressEvent(
        Type.PROGRESS,
        Phase.WAITING,
        message,
        totalChunks,
        currentChunk,
        percentage(currentChunk, totalChunks),
        null,
        waitSeconds,
        null,
        null);
  }

  public static ProgressEvent error(String message, Object details) {
    return new ProgressEvent(Type.ERROR, null, message, null, null, null, null, null, details, null);
  }

  public static ProgressEvent complete(PipelineResult result) {
    return new ProgressEvent(
        Type.COMPLETE,
        null,
        "Processing complete: %d total cards generated".formatted(result.cardCount()),
        null,
        null,
        null,
        null,
        null,
        null,
        result);
  }

  static int percentage(int currentChunk, int totalChunks) {
    if (totalChunks <= 0) {
      return 0;
    }
    return (int) Math.round(currentChunk * 100.0d / totalChunks);
  }

  public enum Type {
    PROGRESS("progress"),
    ERROR("error"),
    COMPLETE("complete");

    private final String token;

    Type(String token) {
      this.token = token;
    }

    @JsonValue
    public String token() {
      return token;
    }
  }

  public enum Phase {
    CHUNKING("chunking"),
    PROCESSING("processing"),
    WAITING("waiting"),
    MERGING("merging"),
    COMPLETED("completed");

    private final String token;

    Phase(String token) {
      this.token = token;
    }

    @JsonValue
    public String token() {
      return token;
    }
  }
}
