package com.knowledgeagent.backend.pipeline;

import java.time.Duration;

/** Paces successive calls to the generation service. */
public interface RateLimiter {

  /** Expected wait before the next call, reported to progress listeners. */
  Duration nextDelay();

  void awaitNextPermit() throws InterruptedException;
}
