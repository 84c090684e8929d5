package com.knowledgeagent.backend.cards;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

@ExtendWith(MockitoExtension.class)
class SpringAiCardGenerationClientTest {

  private static final String BATCH_JSON =
      """
      {"cards":[{"title":"How to Deploy","audience":"tech_new_hire","pain":"Deploys fail",
      "context":{"user_category":"tech_new_hire","specific_pain":"p","when_where":"w",
      "current_state":"c","desired_outcome":"d"},"content_markdown":"m","content_html":"<p>h</p>",
      "citations":[{"type":"evidence","id":"acme/api:main:c1:deploy.sh","sha":"c1"}],
      "assets":{"mermaid":[{"description":"Deploy flow"}]}}],
      "exhaustiveness_notes":"done","complete":false,"card_count":1}
      """;

  @Mock private ChatModel chatModel;

  private SpringAiCardGenerationClient client;

  @BeforeEach
  void setUp() {
    StaticListableBeanFactory beanFactory =
        new StaticListableBeanFactory(Map.of("builder", ChatClient.builder(chatModel)));
    client =
        new SpringAiCardGenerationClient(
            beanFactory.getBeanProvider(ChatClient.Builder.class), new ObjectMapper());
  }

  @Test
  void parsesBatchWrappedInProse() {
    when(chatModel.call(any(Prompt.class))).thenReturn(response("Here you go:\n```json\n" + BATCH_JSON + "```"));

    CardBatch batch = client.generate(request());

    assertThat(batch.cardCount()).isEqualTo(1);
    assertThat(batch.complete()).isFalse();
    Card card = batch.cards().get(0);
    assertThat(card.audience()).isEqualTo(CardAudience.TECH_NEW_HIRE);
    assertThat(card.citations()).containsExactly(Citation.evidence("acme/api:main:c1:deploy.sh", null, "c1"));
    assertThat(card.tags()).isEmpty();
    assertThat(card.assets().mermaid().get(0).slot()).isEqualTo(AssetSlot.BEFORE_CONCLUSION);
  }

  @Test
  void sendsSystemInstructionAndFramedUserPrompt() {
    when(chatModel.call(any(Prompt.class))).thenReturn(response(BATCH_JSON));

    client.generate(request());

    ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
    verify(chatModel).call(prompt.capture());
    assertThat(prompt.getValue().getSystemMessage().getText()).isEqualTo("You generate cards.");
    assertThat(prompt.getValue().getUserMessage().getText())
        .startsWith("SCHEMA_BEGIN\n{}\nSCHEMA_END\n\nRAW_CONTEXT_BEGIN\n")
        .endsWith("# Body\nRAW_CONTEXT_END");
  }

  @Test
  void emptyResponseIsASchemaViolation() {
    when(chatModel.call(any(Prompt.class))).thenReturn(response(""));

    assertThatThrownBy(() -> client.generate(request()))
        .isInstanceOf(CardSchemaValidationException.class)
        .hasMessageContaining("empty response");
  }

  @Test
  void malformedJsonIsASchemaViolation() {
    when(chatModel.call(any(Prompt.class))).thenReturn(response("{\"cards\": [oops]}"));

    assertThatThrownBy(() -> client.generate(request()))
        .isInstanceOfSatisfying(
            CardSchemaValidationException.class, ex -> assertThat(ex.getViolations()).hasSize(1));
  }

  @Test
  void unknownAssetSlotIsASchemaViolation() {
    when(chatModel.call(any(Prompt.class)))
        .thenReturn(response(BATCH_JSON.replace("\"description\":\"Deploy flow\"", "\"slot\":\"sidebar\",\"description\":\"Deploy flow\"")));

    assertThatThrownBy(() -> client.generate(request())).isInstanceOf(CardSchemaValidationException.class);
  }

  @Test
  void extractsOutermostJsonObject() {
    assertThat(SpringAiCardGenerationClient.extractJson("noise {\"a\":{\"b\":1}} trailing")).isEqualTo("{\"a\":{\"b\":1}}");
    assertThat(SpringAiCardGenerationClient.extractJson("no json")).isEqualTo("no json");
  }

  private static CardGenerationRequest request() {
    return new CardGenerationRequest("You generate cards.", "# Body", null, null, "{}");
  }

  private static ChatResponse response(String text) {
    return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
  }
}
