package com.knowledgeagent.backend.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SseProgressSinkTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void framesEventsAsDataLinesAndOmitsNullFields() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    SseProgressSink sink = new SseProgressSink(out, objectMapper);

    sink.send(ProgressEvent.progress(ProgressEvent.Phase.PROCESSING, "Processing chunk 1/4", 0, 4));
    sink.send(ProgressEvent.waiting("Waiting 30 seconds to respect rate limits...", 1, 4, 30));

    assertThat(out.toString(StandardCharsets.UTF_8))
        .isEqualTo(
            "data: {\"type\":\"progress\",\"phase\":\"processing\",\"message\":\"Processing chunk 1/4\","
                + "\"totalChunks\":4,\"currentChunk\":0,\"progress\":0}\n\n"
                + "data: {\"type\":\"progress\",\"phase\":\"waiting\","
                + "\"message\":\"Waiting 30 seconds to respect rate limits...\",\"totalChunks\":4,"
                + "\"currentChunk\":1,\"progress\":25,\"waitTime\":30}\n\n");
  }

  @Test
  void errorEventsCarryDetails() {
    SseProgressSink sink = new SseProgressSink(new ByteArrayOutputStream(), objectMapper);

    String frame = sink.frame(ProgressEvent.error("Chunk 2 validation failed", Map.of("issues", List.of("cards: required"))));

    assertThat(frame)
        .isEqualTo(
            "data: {\"type\":\"error\",\"message\":\"Chunk 2 validation failed\","
                + "\"details\":{\"issues\":[\"cards: required\"]}}\n\n");
  }

  @Test
  void writeFailuresSurfaceAsUncheckedExceptions() {
    OutputStream broken =
        new OutputStream() {
          @Override
          public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
          }
        };
    SseProgressSink sink = new SseProgressSink(broken, objectMapper);

    assertThatThrownBy(() -> sink.send(ProgressEvent.error("x", null)))
        .isInstanceOf(UncheckedIOException.class)
        .hasRootCauseMessage("Broken pipe");
  }
}
