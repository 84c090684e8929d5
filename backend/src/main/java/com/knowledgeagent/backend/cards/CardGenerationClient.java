package com.knowledgeagent.backend.cards;

/** External structured-generation service producing cards for one chunk. */
public interface CardGenerationClient {

  /**
   * @throws CardSchemaValidationException if the service answered with something that is not a
   *     card batch
   */
  CardBatch generate(CardGenerationRequest request);
}
