package com.knowledgeagent.backend.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeagent.backend.cards.PipelineResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes each result as {@code cards-<epochMillis>.json} into a directory. */
public class JsonFileCardResultPublisher implements CardResultPublisher {

  private static final Logger log = LoggerFactory.getLogger(JsonFileCardResultPublisher.class);

  private final Path directory;
  private final ObjectMapper objectMapper;

  public JsonFileCardResultPublisher(Path directory, ObjectMapper objectMapper) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public void publish(PipelineResult result) {
    Path target = directory.resolve("cards-" + Instant.now().toEpochMilli() + ".json");
    try {
      Files.createDirectories(directory);
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), result);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write card result to " + target, ex);
    }
    log.info("Stored {} cards in {}", result.cardCount(), target);
  }
}
