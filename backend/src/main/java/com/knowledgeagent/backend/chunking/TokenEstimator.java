package com.knowledgeagent.backend.chunking;

/** Approximates how many model tokens a text occupies. */
public interface TokenEstimator {

  int estimate(String text);
}
