package com.knowledgeagent.backend.progress;

import static org.assertj.core.api.Assertions.assertThat;

import com.knowledgeagent.backend.cards.PipelineResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressReporterTest {

  @Test
  void eventsAfterCompletionAreDropped() {
    CollectingProgressSink sink = new CollectingProgressSink();
    ProgressReporter reporter = new ProgressReporter(sink);

    reporter.emit(ProgressEvent.progress(ProgressEvent.Phase.CHUNKING, "Analyzing", 0, 0));
    reporter.complete(PipelineResult.of(List.of(), "", true));
    reporter.emit(ProgressEvent.progress(ProgressEvent.Phase.MERGING, "late", 1, 1));
    reporter.fatal("late failure", null);

    assertThat(sink.events())
        .extracting(ProgressEvent::type)
        .containsExactly(ProgressEvent.Type.PROGRESS, ProgressEvent.Type.COMPLETE);
    assertThat(sink.isClosed()).isTrue();
    assertThat(reporter.isTerminated()).isTrue();
  }

  @Test
  void nonFatalErrorsKeepTheStreamOpen() {
    CollectingProgressSink sink = new CollectingProgressSink();
    ProgressReporter reporter = new ProgressReporter(sink);

    reporter.error("Chunk 1 validation failed", null);

    assertThat(sink.isClosed()).isFalse();
    assertThat(reporter.isTerminated()).isFalse();
  }

  @Test
  void fatalDeliveryFailureIsNotRethrown() {
    ProgressSink failing =
        new ProgressSink() {
          @Override
          public void send(ProgressEvent event) {
            throw new IllegalStateException("client gone");
          }

          @Override
          public void close() {}
        };
    ProgressReporter reporter = new ProgressReporter(failing);

    reporter.fatal("Fatal error: boom", null);

    assertThat(reporter.isTerminated()).isTrue();
  }

  @Test
  void percentageRoundsAndHandlesEmptyTotals() {
    assertThat(ProgressEvent.percentage(1, 3)).isEqualTo(33);
    assertThat(ProgressEvent.percentage(2, 3)).isEqualTo(67);
    assertThat(ProgressEvent.percentage(0, 0)).isZero();
  }
}
