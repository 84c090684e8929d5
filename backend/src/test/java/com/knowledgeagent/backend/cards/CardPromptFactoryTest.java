package com.knowledgeagent.backend.cards;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.knowledgeagent.backend.chunking.DocumentChunk;
import org.junit.jupiter.api.Test;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.core.io.DefaultResourceLoader;

class CardPromptFactoryTest {

  private static final String HEADER = "---\nphaseState: {\"phase\":\"phase-1\"}\n---\n";

  @Test
  void buildsRequestWithSchemaHeaderAndPositionNote() {
    CardPromptFactory factory =
        new CardPromptFactory(
            new DefaultResourceLoader(),
            "classpath:prompts/card-generation-system.st",
            new BeanOutputConverter<>(CardBatch.class));

    CardGenerationRequest request = factory.create(new DocumentChunk("## Part two\n", 1, 3, HEADER));

    assertThat(request.systemInstruction()).contains("Who, What, Where, Why, How");
    assertThat(request.schemaDescription()).contains("card_count").contains("exhaustiveness_notes");
    String userPrompt = request.userPrompt();
    assertThat(userPrompt).startsWith("SCHEMA_BEGIN\n");
    assertThat(userPrompt.indexOf("phaseState:"))
        .isLessThan(userPrompt.indexOf("This is chunk 2 of 3 from a large document."));
    assertThat(userPrompt.indexOf("This is chunk 2 of 3 from a large document."))
        .isLessThan(userPrompt.indexOf("## Part two"));
    assertThat(userPrompt).endsWith("## Part two\n\nRAW_CONTEXT_END");
  }

  @Test
  void positionNoteIsPresentForSingleChunk() {
    assertThat(CardPromptFactory.positionNote(new DocumentChunk("body", 0, 1, null)))
        .startsWith("CHUNK PROCESSING CONTEXT:\nThis is chunk 1 of 1");
  }

  @Test
  void missingTemplateFailsOnFirstUse() {
    CardPromptFactory factory =
        new CardPromptFactory(
            new DefaultResourceLoader(),
            "classpath:prompts/missing.st",
            new BeanOutputConverter<>(CardBatch.class));

    assertThatThrownBy(() -> factory.create(new DocumentChunk("body", 0, 1, null)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Unable to load template: classpath:prompts/missing.st");
  }
}
