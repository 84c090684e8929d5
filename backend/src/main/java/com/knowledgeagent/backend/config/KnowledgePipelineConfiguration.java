package com.knowledgeagent.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeagent.backend.cards.CardBatch;
import com.knowledgeagent.backend.cards.CardBatchValidator;
import com.knowledgeagent.backend.cards.CardGenerationClient;
import com.knowledgeagent.backend.cards.CardPromptFactory;
import com.knowledgeagent.backend.cards.SpringAiCardGenerationClient;
import com.knowledgeagent.backend.chunking.CharacterRatioTokenEstimator;
import com.knowledgeagent.backend.chunking.DocumentChunker;
import com.knowledgeagent.backend.chunking.JtokkitTokenEstimator;
import com.knowledgeagent.backend.chunking.TokenEstimator;
import com.knowledgeagent.backend.pipeline.CardPipelineService;
import com.knowledgeagent.backend.pipeline.CardResultPublisher;
import com.knowledgeagent.backend.pipeline.ChunkProcessor;
import com.knowledgeagent.backend.pipeline.ContainmentTitleSimilarity;
import com.knowledgeagent.backend.pipeline.FixedDelayRateLimiter;
import com.knowledgeagent.backend.pipeline.JsonFileCardResultPublisher;
import com.knowledgeagent.backend.pipeline.RateLimiter;
import com.knowledgeagent.backend.pipeline.ResultMerger;
import com.knowledgeagent.backend.pipeline.TitleSimilarity;
import com.knowledgeagent.backend.rawcontext.ChatClientThemeInference;
import com.knowledgeagent.backend.rawcontext.PathThemeInference;
import com.knowledgeagent.backend.rawcontext.ThemeInference;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.advisor.SimpleLoggerAdvisor;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class KnowledgePipelineConfiguration {

  @Bean
  TokenEstimator tokenEstimator(KnowledgePipelineProperties properties) {
    KnowledgePipelineProperties.Chunking chunking = properties.getChunking();
    return switch (chunking.getEstimator()) {
      case RATIO -> new CharacterRatioTokenEstimator(chunking.getCharsPerToken());
      case JTOKKIT -> new JtokkitTokenEstimator();
    };
  }

  @Bean
  DocumentChunker documentChunker(
      TokenEstimator tokenEstimator, KnowledgePipelineProperties properties) {
    return new DocumentChunker(tokenEstimator, properties.getChunking().getMaxTokensPerChunk());
  }

  @Bean
  BeanOutputConverter<CardBatch> cardBatchOutputConverter() {
    return new BeanOutputConverter<>(CardBatch.class);
  }

  @Bean(name = "cardGenerationChatClientBuilder")
  ChatClient.Builder cardGenerationChatClientBuilder(
      OpenAiChatModel chatModel, KnowledgePipelineProperties properties) {
    OpenAiChatOptions options =
        OpenAiChatOptions.builder()
            .model(properties.getGeneration().getModel())
            .temperature(properties.getGeneration().getTemperature())
            .build();
    return ChatClient.builder(chatModel)
        .defaultOptions(options)
        .defaultAdvisors(SimpleLoggerAdvisor.builder().build());
  }

  @Bean(name = "themeInferenceChatClientBuilder")
  ChatClient.Builder themeInferenceChatClientBuilder(
      OpenAiChatModel chatModel, KnowledgePipelineProperties properties) {
    OpenAiChatOptions options =
        OpenAiChatOptions.builder()
            .model(properties.getThemes().getModel())
            .temperature(properties.getThemes().getTemperature())
            .build();
    return ChatClient.builder(chatModel).defaultOptions(options);
  }

  @Bean
  CardGenerationClient cardGenerationClient(
      @Qualifier("cardGenerationChatClientBuilder") ObjectProvider<ChatClient.Builder> builder,
      ObjectMapper objectMapper) {
    return new SpringAiCardGenerationClient(builder, objectMapper);
  }

  @Bean
  CardPromptFactory cardPromptFactory(
      ResourceLoader resourceLoader,
      KnowledgePipelineProperties properties,
      BeanOutputConverter<CardBatch> cardBatchOutputConverter) {
    return new CardPromptFactory(
        resourceLoader,
        properties.getGeneration().getSystemPromptTemplate(),
        cardBatchOutputConverter);
  }

  @Bean
  RateLimiter chunkRateLimiter(KnowledgePipelineProperties properties) {
    return new FixedDelayRateLimiter(properties.getRateLimit().getCooldown());
  }

  @Bean
  TitleSimilarity titleSimilarity() {
    return new ContainmentTitleSimilarity();
  }

  @Bean
  ResultMerger resultMerger(TitleSimilarity titleSimilarity) {
    return new ResultMerger(titleSimilarity);
  }

  @Bean
  ChunkProcessor chunkProcessor(
      CardGenerationClient cardGenerationClient,
      CardBatchValidator cardBatchValidator,
      CardPromptFactory cardPromptFactory,
      RateLimiter chunkRateLimiter,
      ObjectProvider<MeterRegistry> meterRegistry) {
    return new ChunkProcessor(
        cardGenerationClient,
        cardBatchValidator,
        cardPromptFactory,
        chunkRateLimiter,
        meterRegistry.getIfAvailable());
  }

  @Bean
  CardPipelineService cardPipelineService(
      DocumentChunker documentChunker,
      ChunkProcessor chunkProcessor,
      ResultMerger resultMerger,
      ObjectProvider<CardResultPublisher> publishers) {
    return new CardPipelineService(
        documentChunker, chunkProcessor, resultMerger, publishers.orderedStream().toList());
  }

  @Bean
  @ConditionalOnProperty(prefix = "knowledge.pipeline.output", name = "results-directory")
  CardResultPublisher jsonFileCardResultPublisher(
      KnowledgePipelineProperties properties, ObjectMapper objectMapper) {
    return new JsonFileCardResultPublisher(
        Path.of(properties.getOutput().getResultsDirectory()), objectMapper);
  }

  @Bean
  ThemeInference themeInference(
      KnowledgePipelineProperties properties,
      @Qualifier("themeInferenceChatClientBuilder") ObjectProvider<ChatClient.Builder> builder) {
    KnowledgePipelineProperties.Themes themes = properties.getThemes();
    PathThemeInference heuristic = new PathThemeInference(themes.getMaxItems());
    return switch (themes.getMode()) {
      case HEURISTIC -> heuristic;
      case LLM ->
          new ChatClientThemeInference(
              builder, heuristic, themes.getMaxLabels(), themes.getMaxItems());
    };
  }
}
