package com.knowledgeagent.backend.progress;

import com.knowledgeagent.backend.cards.PipelineResult;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards events of one pipeline run to its sink. After {@link #complete} or {@link #fatal} the
 * sink is closed and later events are dropped.
 */
public class ProgressReporter {

  private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

  private final ProgressSink sink;
  private boolean terminated;

  public ProgressReporter(ProgressSink sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  public void emit(ProgressEvent event) {
    if (terminated) {
      log.debug("Dropping progress event after termination: {}", event.message());
      return;
    }
    sink.send(event);
  }

  /** Recoverable error; the run continues. */
  public void error(String message, Object details) {
    emit(ProgressEvent.error(message, details));
  }

  public void complete(PipelineResult result) {
    terminate(ProgressEvent.complete(result));
  }

  /** Terminal error. Sink failures while delivering it are logged at debug level. */
  public void fatal(String message, Object details) {
    try {
      terminate(ProgressEvent.error(message, details));
    } catch (RuntimeException sinkFailure) {
      log.debug("Unable to deliver fatal progress event: {}", sinkFailure.getMessage());
    }
  }

  public boolean isTerminated() {
    return terminated;
  }

  private void terminate(ProgressEvent event) {
    if (terminated) {
      return;
    }
    terminated = true;
    try {
      sink.send(event);
    } finally {
      sink.close();
    }
  }
}
