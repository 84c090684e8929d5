package com.knowledgeagent.backend.pipeline;

import java.time.Duration;
import java.util.Objects;

public class FixedDelayRateLimiter implements RateLimiter {

  private final Duration cooldown;

  public FixedDelayRateLimiter(Duration cooldown) {
    this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
    if (cooldown.isNegative()) {
      throw new IllegalArgumentException("cooldown must not be negative");
    }
  }

  @Override
  public Duration nextDelay() {
    return cooldown;
  }

  @Override
  public void awaitNextPermit() throws InterruptedException {
    if (!cooldown.isZero()) {
      Thread.sleep(cooldown.toMillis());
    }
  }
}
