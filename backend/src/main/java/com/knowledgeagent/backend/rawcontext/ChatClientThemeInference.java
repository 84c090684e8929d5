package com.knowledgeagent.backend.rawcontext;

import com.knowledgeagent.backend.evidence.EvidenceItem;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.util.StringUtils;

/**
 * Asks the chat model for themes and workflows over evidence labels (origin names and top-level
 * path segments). Falls back to {@link PathThemeInference} when the model is unavailable or fails.
 */
public class ChatClientThemeInference implements ThemeInference {

  private static final Logger log = LoggerFactory.getLogger(ChatClientThemeInference.class);

  private static final String THEMES_INSTRUCTION =
      "Extract 3-5 concise themes from the provided labels. Return a comma-separated list without extra prose.";
  private static final String WORKFLOWS_INSTRUCTION =
      "Infer 2-5 likely workflows affected (short nouns or verb phrases) from the provided labels. Comma-separated.";

  private final ObjectProvider<ChatClient.Builder> chatClientBuilderProvider;
  private final ThemeInference fallback;
  private final int maxLabels;
  private final int maxItems;

  public ChatClientThemeInference(
      ObjectProvider<ChatClient.Builder> chatClientBuilderProvider,
      ThemeInference fallback,
      int maxLabels,
      int maxItems) {
    this.chatClientBuilderProvider =
        Objects.requireNonNull(chatClientBuilderProvider, "chatClientBuilderProvider");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
    this.maxLabels = maxLabels;
    this.maxItems = maxItems;
  }

  @Override
  public ThemeSummary infer(List<EvidenceItem> evidence) {
    ChatClient.Builder builder = chatClientBuilderProvider.getIfAvailable();
    if (builder == null) {
      log.warn("No chat client configured for theme inference, using path heuristics");
      return fallback.infer(evidence);
    }
    String labels = labels(evidence);
    String prompt = StringUtils.hasText(labels) ? labels : "general";
    try {
      ChatClient chatClient = builder.clone().build();
      List<String> themes = ask(chatClient, THEMES_INSTRUCTION, prompt);
      List<String> workflows = ask(chatClient, WORKFLOWS_INSTRUCTION, prompt);
      return new ThemeSummary(themes, workflows);
    } catch (RuntimeException ex) {
      log.warn("Theme inference via chat model failed, using path heuristics: {}", ex.getMessage());
      return fallback.infer(evidence);
    }
  }

  String labels(List<EvidenceItem> evidence) {
    Set<String> labels = new LinkedHashSet<>();
    for (EvidenceItem item : evidence) {
      labels.add(item.sourceName());
      labels.add(item.identifier().split("/", 2)[0]);
    }
    return String.join(", ", labels.stream().limit(maxLabels).toList());
  }

  private List<String> ask(ChatClient chatClient, String instruction, String prompt) {
    String text = chatClient.prompt().system(instruction).user(prompt).call().content();
    if (!StringUtils.hasText(text)) {
      return List.of();
    }
    return Arrays.stream(text.split(","))
        .map(String::trim)
        .filter(StringUtils::hasText)
        .limit(maxItems)
        .toList();
  }
}
