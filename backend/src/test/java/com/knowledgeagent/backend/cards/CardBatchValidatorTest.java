package com.knowledgeagent.backend.cards;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class CardBatchValidatorTest {

  private final CardBatchValidator validator = new CardBatchValidator();

  @Test
  void fillsDefaultsForValidBatch() {
    CardBatch validated =
        validator.validate(new CardBatch(List.of(TestCards.card("How to Reset a Password")), null, null, 1));

    assertThat(validated.exhaustivenessNotes()).isEmpty();
    assertThat(validated.complete()).isTrue();
    assertThat(validated.cards()).hasSize(1);
  }

  @Test
  void acceptsInterrogativeOpenersInAnyCase() {
    assertThat(CardBatchValidator.startsWithInterrogative("HOW to Deploy the API")).isTrue();
    assertThat(CardBatchValidator.startsWithInterrogative("  why: the cache exists")).isTrue();
    assertThat(CardBatchValidator.startsWithInterrogative("Whoever owns billing")).isFalse();
    assertThat(CardBatchValidator.startsWithInterrogative("Deploying the API")).isFalse();
  }

  @Test
  void collectsEveryViolation() {
    Card invalid =
        new Card(
            "Deploy",
            null,
            "x",
            new CardContext(null, "", "when", "now", "later"),
            "",
            "<p>ok</p>",
            List.of(new Citation(Citation.Type.EVIDENCE, null, " ", null, null)),
            null,
            null,
            null,
            new CardAssets(List.of(new CardAssets.ImageAsset(null, "", null)), null));

    assertThatThrownBy(() -> validator.validate(new CardBatch(List.of(invalid), "", true, 1)))
        .isInstanceOfSatisfying(
            CardSchemaValidationException.class,
            ex ->
                assertThat(ex.getViolations())
                    .containsExactly(
                        "cards[0].title: must start with Who, What, Where, Why or How",
                        "cards[0].audience: must be one of tech_new_hire, tech_your_team, tech_other_team, biz, expert",
                        "cards[0].pain: must have at least 3 characters",
                        "cards[0].context.user_category: must be one of tech_new_hire, tech_your_team, tech_other_team, biz, expert",
                        "cards[0].context.specific_pain: must not be blank",
                        "cards[0].content_markdown: must not be blank",
                        "cards[0].citations[0].id: must not be blank",
                        "cards[0].assets.images[0].description: must not be blank"));
  }

  @Test
  void requiresCardsAndCardCount() {
    assertThatThrownBy(() -> validator.validate(new CardBatch(null, null, null, null)))
        .isInstanceOfSatisfying(
            CardSchemaValidationException.class,
            ex -> assertThat(ex.getViolations()).containsExactly("cards: required", "card_count: required"));
  }

  @Test
  void rejectsNegativeCardCount() {
    assertThatThrownBy(() -> validator.validate(new CardBatch(List.of(), null, true, -1)))
        .isInstanceOf(CardSchemaValidationException.class)
        .hasMessageContaining("1 violation");
  }

  @Test
  void assetSlotsDefaultWhenMissing() {
    CardAssets assets =
        new CardAssets(
            List.of(new CardAssets.ImageAsset(null, "Architecture overview", null)),
            List.of(new CardAssets.DiagramAsset(null, "Deploy flow", null)));

    assertThat(assets.images().get(0).slot()).isEqualTo(AssetSlot.AFTER_INTRO);
    assertThat(assets.mermaid().get(0).slot()).isEqualTo(AssetSlot.BEFORE_CONCLUSION);
    assertThat(assets.mermaid().get(0).basedOn()).isEmpty();
  }
}
