package com.knowledgeagent.backend.pipeline;

import com.knowledgeagent.backend.cards.PipelineResult;

/**
 * Receives the final result of a run, e.g. to persist or publish it. Failures are logged by the
 * pipeline and never fail the run.
 */
public interface CardResultPublisher {

  void publish(PipelineResult result);
}
