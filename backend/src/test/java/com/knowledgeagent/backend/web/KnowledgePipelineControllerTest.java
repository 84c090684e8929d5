package com.knowledgeagent.backend.web;

import static com.knowledgeagent.backend.cards.TestCards.card;
import static org.hamcrest.Matchers.equalTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.knowledgeagent.backend.cards.PipelineResult;
import com.knowledgeagent.backend.evidence.SourceFetchException;
import com.knowledgeagent.backend.pipeline.CardPipelineException;
import com.knowledgeagent.backend.pipeline.CardPipelineService;
import com.knowledgeagent.backend.progress.ProgressEvent;
import com.knowledgeagent.backend.progress.ProgressReporter;
import com.knowledgeagent.backend.progress.ProgressSink;
import com.knowledgeagent.backend.rawcontext.RawContextDocument;
import com.knowledgeagent.backend.rawcontext.RawContextService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@WebMvcTest(KnowledgePipelineController.class)
class KnowledgePipelineControllerTest {

  private static final String SOURCE_REQUEST =
      """
      {"sources":[{"org":"acme","repos":["api"],"branches":["main"],
      "contextOptions":[{"mode":"date-range","sinceDate":"2024-01-01"}]}]}
      """;

  @Autowired private MockMvc mockMvc;

  @MockBean private RawContextService rawContextService;

  @MockBean private CardPipelineService cardPipelineService;

  @Test
  void buildsRawContextDocument() throws Exception {
    given(rawContextService.build(any()))
        .willReturn(
            new RawContextDocument(
                "raw-context-Github-date-range-20240101.md",
                "docs/raw-context/github/raw-context-Github-date-range-20240101.md",
                "---\nphaseState: {}\n---\n",
                3,
                List.of("src"),
                List.of("Testing")));

    mockMvc
        .perform(post("/api/raw-context").contentType(MediaType.APPLICATION_JSON).content(SOURCE_REQUEST))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.fileName", equalTo("raw-context-Github-date-range-20240101.md")))
        .andExpect(jsonPath("$.evidenceCount", equalTo(3)));
  }

  @Test
  void rejectsRequestWithoutSources() throws Exception {
    mockMvc
        .perform(post("/api/raw-context").contentType(MediaType.APPLICATION_JSON).content("{\"sources\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title", equalTo("Validation failed")));
  }

  @Test
  void mapsSourceFetchFailureToBadGateway() throws Exception {
    given(rawContextService.build(any()))
        .willThrow(new SourceFetchException("acme/api", "Failed to list commits for acme/api", null));

    mockMvc
        .perform(post("/api/raw-context").contentType(MediaType.APPLICATION_JSON).content(SOURCE_REQUEST))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.source", equalTo("acme/api")));
  }

  @Test
  void generatesCards() throws Exception {
    given(cardPipelineService.run(eq("# Raw"), any()))
        .willReturn(PipelineResult.of(List.of(card("How to Deploy")), "", true));

    mockMvc
        .perform(post("/api/cards").contentType(MediaType.APPLICATION_JSON).content("{\"rawContext\":\"# Raw\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.card_count", equalTo(1)))
        .andExpect(jsonPath("$.cards[0].title", equalTo("How to Deploy")))
        .andExpect(jsonPath("$.cards[0].audience", equalTo("tech_your_team")));
  }

  @Test
  void mapsTotalFailureToUnprocessableEntity() throws Exception {
    given(cardPipelineService.run(any(), any()))
        .willThrow(new CardPipelineException("Failed to process any chunks successfully"));

    mockMvc
        .perform(post("/api/cards").contentType(MediaType.APPLICATION_JSON).content("{\"rawContext\":\"# Raw\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.detail", equalTo("Failed to process any chunks successfully")));
  }

  @Test
  void rejectsBlankRawContext() throws Exception {
    mockMvc
        .perform(post("/api/cards").contentType(MediaType.APPLICATION_JSON).content("{\"rawContext\":\" \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail", equalTo("rawContext must not be blank")));
  }

  @Test
  void streamsProgressEventsAsServerSentEvents() throws Exception {
    willAnswer(
            invocation -> {
              ProgressReporter reporter = new ProgressReporter(invocation.<ProgressSink>getArgument(1));
              reporter.emit(
                  ProgressEvent.progress(
                      ProgressEvent.Phase.CHUNKING, "Analyzing document size and creating chunks...", 0, 0));
              PipelineResult result = PipelineResult.of(List.of(), "", true);
              reporter.complete(result);
              return result;
            })
        .given(cardPipelineService)
        .run(eq("# Raw"), any());

    MvcResult started =
        mockMvc
            .perform(post("/api/cards/stream").contentType(MediaType.APPLICATION_JSON).content("{\"rawContext\":\"# Raw\"}"))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(started))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM))
        .andExpect(
            content()
                .string(
                    "data: {\"type\":\"progress\",\"phase\":\"chunking\","
                        + "\"message\":\"Analyzing document size and creating chunks...\","
                        + "\"totalChunks\":0,\"currentChunk\":0,\"progress\":0}\n\n"
                        + "data: {\"type\":\"complete\","
                        + "\"message\":\"Processing complete: 0 total cards generated\","
                        + "\"data\":{\"cards\":[],\"exhaustiveness_notes\":\"\",\"complete\":true,\"card_count\":0}}\n\n"));
  }
}
