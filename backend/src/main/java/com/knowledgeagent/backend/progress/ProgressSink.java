package com.knowledgeagent.backend.progress;

/** Transport receiving progress events in order. */
public interface ProgressSink {

  void send(ProgressEvent event);

  void close();
}
