package com.knowledgeagent.backend.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Writes each event as {@code data: <json>\n\n} and flushes immediately. */
public class SseProgressSink implements ProgressSink {

  private final OutputStream outputStream;
  private final ObjectMapper objectMapper;

  public SseProgressSink(OutputStream outputStream, ObjectMapper objectMapper) {
    this.outputStream = Objects.requireNonNull(outputStream, "outputStream");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public void send(ProgressEvent event) {
    String frame = frame(event);
    try {
      outputStream.write(frame.getBytes(StandardCharsets.UTF_8));
      outputStream.flush();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write progress event", ex);
    }
  }

  /** Flushes pending frames; the servlet container owns the underlying stream and ends the response. */
  @Override
  public void close() {
    try {
      outputStream.flush();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to flush progress stream", ex);
    }
  }

  String frame(ProgressEvent event) {
    try {
      return "data: " + objectMapper.writeValueAsString(event) + "\n\n";
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize progress event", ex);
    }
  }
}
