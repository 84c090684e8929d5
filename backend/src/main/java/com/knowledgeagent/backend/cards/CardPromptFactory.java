package com.knowledgeagent.backend.cards;

import com.knowledgeagent.backend.chunking.DocumentChunk;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

/** Builds per-chunk generation requests from the system prompt template and the batch schema. */
public class CardPromptFactory {

  private final ResourceLoader resourceLoader;
  private final String systemPromptLocation;
  private final BeanOutputConverter<CardBatch> outputConverter;
  private volatile String systemPrompt;

  public CardPromptFactory(
      ResourceLoader resourceLoader,
      String systemPromptLocation,
      BeanOutputConverter<CardBatch> outputConverter) {
    this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
    this.systemPromptLocation = Objects.requireNonNull(systemPromptLocation, "systemPromptLocation");
    this.outputConverter = Objects.requireNonNull(outputConverter, "outputConverter");
  }

  public CardGenerationRequest create(DocumentChunk chunk) {
    return new CardGenerationRequest(
        systemPrompt(),
        chunk.content(),
        chunk.frontmatter(),
        positionNote(chunk),
        outputConverter.getJsonSchema());
  }

  static String positionNote(DocumentChunk chunk) {
    return """
        CHUNK PROCESSING CONTEXT:
        This is chunk %d of %d from a large document.
        - Focus on generating cards for the content in this specific chunk
        - Maintain consistency with the overall document structure
        - Be thorough within this chunk's scope
        - The final results will be merged with other chunks"""
        .formatted(chunk.position(), chunk.totalChunks());
  }

  String systemPrompt() {
    String cached = systemPrompt;
    if (cached == null) {
      cached = loadTemplate(systemPromptLocation);
      systemPrompt = cached;
    }
    return cached;
  }

  private String loadTemplate(String location) {
    Resource resource = resourceLoader.getResource(location);
    try (InputStream inputStream = resource.getInputStream()) {
      return StreamUtils.copyToString(inputStream, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new IllegalStateException("Unable to load template: " + location, ex);
    }
  }
}
