package com.knowledgeagent.backend.cards;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Checks a generated {@link CardBatch} against the card schema and fills documented defaults.
 * Every violation is collected so the error event can list all of them.
 */
@Component
public class CardBatchValidator {

  static final Set<String> TITLE_OPENERS = Set.of("who", "what", "where", "why", "how");

  public CardBatch validate(CardBatch batch) {
    if (batch == null) {
      throw new CardSchemaValidationException("Card batch is missing", List.of("response: required"));
    }
    List<String> violations = new ArrayList<>();
    if (batch.cards() == null) {
      violations.add("cards: required");
    }
    if (batch.cardCount() == null) {
      violations.add("card_count: required");
    } else if (batch.cardCount() < 0) {
      violations.add("card_count: must be a non-negative integer");
    }
    List<Card> cards = batch.cards() == null ? List.of() : batch.cards();
    for (int i = 0; i < cards.size(); i++) {
      validateCard("cards[" + i + "]", cards.get(i), violations);
    }
    if (!violations.isEmpty()) {
      throw new CardSchemaValidationException(
          "Card batch failed schema validation with %d violation(s)".formatted(violations.size()),
          violations);
    }
    return new CardBatch(
        List.copyOf(cards),
        batch.exhaustivenessNotes() == null ? "" : batch.exhaustivenessNotes(),
        batch.reportedComplete(),
        batch.cardCount());
  }

  private void validateCard(String path, Card card, List<String> violations) {
    if (card == null) {
      violations.add(path + ": must not be null");
      return;
    }
    if (card.title() == null || card.title().trim().length() < 3) {
      violations.add(path + ".title: must have at least 3 characters");
    } else if (!startsWithInterrogative(card.title())) {
      violations.add(path + ".title: must start with Who, What, Where, Why or How");
    }
    if (card.audience() == null) {
      violations.add(path + ".audience: must be one of " + audienceTokens());
    }
    if (card.pain() == null || card.pain().trim().length() < 3) {
      violations.add(path + ".pain: must have at least 3 characters");
    }
    validateContext(path + ".context", card.context(), violations);
    requireText(path + ".content_markdown", card.contentMarkdown(), violations);
    requireText(path + ".content_html", card.contentHtml(), violations);
    for (int i = 0; i < card.citations().size(); i++) {
      validateCitation(path + ".citations[" + i + "]", card.citations().get(i), violations);
    }
    validateAssets(path + ".assets", card.assets(), violations);
  }

  private void validateContext(String path, CardContext context, List<String> violations) {
    if (context == null) {
      violations.add(path + ": required");
      return;
    }
    if (context.userCategory() == null) {
      violations.add(path + ".user_category: must be one of " + audienceTokens());
    }
    requireText(path + ".specific_pain", context.specificPain(), violations);
    requireText(path + ".when_where", context.whenWhere(), violations);
    requireText(path + ".current_state", context.currentState(), violations);
    requireText(path + ".desired_outcome", context.desiredOutcome(), violations);
  }

  private void validateCitation(String path, Citation citation, List<String> violations) {
    if (citation == null || citation.type() == null) {
      violations.add(path + ".type: must be section or evidence");
      return;
    }
    switch (citation.type()) {
      case SECTION -> requireText(path + ".ref", citation.ref(), violations);
      case EVIDENCE -> requireText(path + ".id", citation.id(), violations);
    }
  }

  private void validateAssets(String path, CardAssets assets, List<String> violations) {
    for (int i = 0; i < assets.images().size(); i++) {
      CardAssets.ImageAsset image = assets.images().get(i);
      String imagePath = path + ".images[" + i + "]";
      if (image == null) {
        violations.add(imagePath + ": must not be null");
        continue;
      }
      requireText(imagePath + ".description", image.description(), violations);
    }
    for (int i = 0; i < assets.mermaid().size(); i++) {
      CardAssets.DiagramAsset diagram = assets.mermaid().get(i);
      String diagramPath = path + ".mermaid[" + i + "]";
      if (diagram == null) {
        violations.add(diagramPath + ": must not be null");
        continue;
      }
      requireText(diagramPath + ".description", diagram.description(), violations);
      for (int j = 0; j < diagram.basedOn().size(); j++) {
        validateCitation(diagramPath + ".based_on[" + j + "]", diagram.basedOn().get(j), violations);
      }
    }
  }

  static boolean startsWithInterrogative(String title) {
    String trimmed = title.trim();
    int end = 0;
    while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
      end++;
    }
    return TITLE_OPENERS.contains(trimmed.substring(0, end).toLowerCase(Locale.ROOT));
  }

  private static void requireText(String path, String value, List<String> violations) {
    if (!StringUtils.hasText(value)) {
      violations.add(path + ": must not be blank");
    }
  }

  private static String audienceTokens() {
    List<String> tokens = new ArrayList<>();
    for (CardAudience audience : CardAudience.values()) {
      tokens.add(audience.token());
    }
    return String.join(", ", tokens);
  }
}
