package com.knowledgeagent.backend.cards;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.util.StringUtils;

/** {@link CardGenerationClient} calling the configured Spring AI chat model. */
public class SpringAiCardGenerationClient implements CardGenerationClient {

  private static final Logger log = LoggerFactory.getLogger(SpringAiCardGenerationClient.class);

  private final ObjectProvider<ChatClient.Builder> chatClientBuilderProvider;
  private final ObjectMapper objectMapper;

  public SpringAiCardGenerationClient(
      ObjectProvider<ChatClient.Builder> chatClientBuilderProvider, ObjectMapper objectMapper) {
    this.chatClientBuilderProvider =
        Objects.requireNonNull(chatClientBuilderProvider, "chatClientBuilderProvider");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public CardBatch generate(CardGenerationRequest request) {
    ChatClient.Builder builder = chatClientBuilderProvider.getIfAvailable();
    if (builder == null) {
      throw new IllegalStateException("Card generation chat client is not configured");
    }
    ChatResponse response =
        builder
            .clone()
            .build()
            .prompt()
            .system(request.systemInstruction())
            .user(request.userPrompt())
            .call()
            .chatResponse();
    String content = extractContent(response);
    if (!StringUtils.hasText(content)) {
      throw new CardSchemaValidationException(
          "Model returned empty response for card generation", List.of("response: empty"));
    }
    if (log.isDebugEnabled()) {
      log.debug("Card generation returned {} chars", content.length());
    }
    try {
      return objectMapper.readValue(extractJson(content), CardBatch.class);
    } catch (JsonProcessingException ex) {
      throw new CardSchemaValidationException("Model response does not conform to card schema", ex);
    }
  }

  private String extractContent(ChatResponse response) {
    if (response == null || response.getResults() == null) {
      return null;
    }
    StringBuilder builder = new StringBuilder();
    for (Generation generation : response.getResults()) {
      if (generation == null || generation.getOutput() == null) {
        continue;
      }
      String text = generation.getOutput().getText();
      if (StringUtils.hasText(text)) {
        builder.append(text);
      }
    }
    return builder.toString();
  }

  static String extractJson(String raw) {
    int start = raw.indexOf('{');
    int end = raw.lastIndexOf('}');
    if (start >= 0 && end >= start) {
      return raw.substring(start, end + 1);
    }
    return raw;
  }
}
