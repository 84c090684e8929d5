package com.knowledgeagent.backend.pipeline;

/** Decides whether two card titles describe the same card. */
public interface TitleSimilarity {

  boolean isDuplicate(String candidate, String existing);
}
