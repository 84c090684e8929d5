package com.knowledgeagent.backend.pipeline;

/** No chunk produced a usable result, or the run was interrupted. */
public class CardPipelineException extends RuntimeException {

  public CardPipelineException(String message) {
    super(message);
  }

  public CardPipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
