package com.knowledgeagent.backend.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.knowledgeagent.backend.evidence.ContentSizePolicy;
import com.knowledgeagent.backend.evidence.LargeFileStrategy;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class KnowledgePipelinePropertiesTest {

  @Test
  void defaultsMatchDocumentedValues() {
    KnowledgePipelineProperties properties = bind(Map.of());
    properties.afterPropertiesSet();

    assertThat(properties.getGovernor().toPolicy()).isEqualTo(ContentSizePolicy.defaults());
    assertThat(properties.getChunking().getMaxTokensPerChunk()).isEqualTo(150_000);
    assertThat(properties.getChunking().getEstimator()).isEqualTo(KnowledgePipelineProperties.Estimator.RATIO);
    assertThat(properties.getRateLimit().getCooldown()).isEqualTo(Duration.ofSeconds(30));
    assertThat(properties.getThemes().getMode()).isEqualTo(KnowledgePipelineProperties.ThemeMode.HEURISTIC);
    assertThat(properties.getOutput().getRawContextDirectory()).isEqualTo("docs/raw-context/github");
    assertThat(properties.getOutput().getResultsDirectory()).isNull();
  }

  @Test
  void bindsRelaxedNamesAndStrategyTokens() {
    Map<String, String> props = new HashMap<>();
    props.put("knowledge.pipeline.governor.max-file-lines", "500");
    props.put("knowledge.pipeline.governor.large-file-strategy", "headTail");
    props.put("knowledge.pipeline.governor.head-tail-head-lines", "20");
    props.put("knowledge.pipeline.chunking.max-tokens-per-chunk", "200000");
    props.put("knowledge.pipeline.chunking.estimator", "jtokkit");
    props.put("knowledge.pipeline.rate-limit.cooldown", "5s");
    props.put("knowledge.pipeline.themes.mode", "llm");

    KnowledgePipelineProperties properties = bind(props);
    properties.afterPropertiesSet();

    ContentSizePolicy policy = properties.getGovernor().toPolicy();
    assertThat(policy.maxFileLines()).isEqualTo(500);
    assertThat(policy.largeFileStrategy()).isEqualTo(LargeFileStrategy.HEAD_TAIL);
    assertThat(policy.headTailHeadLines()).isEqualTo(20);
    assertThat(properties.getChunking().getMaxTokensPerChunk()).isEqualTo(200_000);
    assertThat(properties.getChunking().getEstimator()).isEqualTo(KnowledgePipelineProperties.Estimator.JTOKKIT);
    assertThat(properties.getRateLimit().getCooldown()).isEqualTo(Duration.ofSeconds(5));
    assertThat(properties.getThemes().getMode()).isEqualTo(KnowledgePipelineProperties.ThemeMode.LLM);
  }

  @Test
  void rejectsNonPositiveChunkBudget() {
    KnowledgePipelineProperties properties =
        bind(Map.of("knowledge.pipeline.chunking.max-tokens-per-chunk", "0"));

    assertThatThrownBy(properties::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("max-tokens-per-chunk");
  }

  @Test
  void rejectsNegativeCooldown() {
    KnowledgePipelineProperties properties =
        bind(Map.of("knowledge.pipeline.rate-limit.cooldown", "-1s"));

    assertThatThrownBy(properties::afterPropertiesSet).isInstanceOf(IllegalStateException.class);
  }

  private KnowledgePipelineProperties bind(Map<String, String> props) {
    Binder binder = new Binder(new MapConfigurationPropertySource(props));
    return binder
        .bind("knowledge.pipeline", Bindable.of(KnowledgePipelineProperties.class))
        .orElseGet(KnowledgePipelineProperties::new);
  }
}
