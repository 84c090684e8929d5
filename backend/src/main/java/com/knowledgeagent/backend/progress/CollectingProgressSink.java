package com.knowledgeagent.backend.progress;

import java.util.ArrayList;
import java.util.List;

/** Keeps every event in memory; used by synchronous callers. */
public class CollectingProgressSink implements ProgressSink {

  private final List<ProgressEvent> events = new ArrayList<>();
  private boolean closed;

  @Override
  public void send(ProgressEvent event) {
    events.add(event);
  }

  @Override
  public void close() {
    closed = true;
  }

  public List<ProgressEvent> events() {
    return List.copyOf(events);
  }

  public boolean isClosed() {
    return closed;
  }
}
