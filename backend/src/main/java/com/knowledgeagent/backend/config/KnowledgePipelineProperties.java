package com.knowledgeagent.backend.config;

import com.knowledgeagent.backend.evidence.ContentSizePolicy;
import com.knowledgeagent.backend.evidence.LargeFileStrategy;
import java.time.Duration;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "knowledge.pipeline")
public class KnowledgePipelineProperties implements InitializingBean {

  private final Governor governor = new Governor();
  private final Chunking chunking = new Chunking();
  private final Generation generation = new Generation();
  private final RateLimit rateLimit = new RateLimit();
  private final Themes themes = new Themes();
  private final Output output = new Output();

  @Override
  public void afterPropertiesSet() {
    if (governor.getMaxFileLines() <= 0 || governor.getMaxFileBytes() <= 0) {
      throw new IllegalStateException("knowledge.pipeline.governor limits must be positive");
    }
    if (governor.getHeadTailHeadLines() < 0 || governor.getHeadTailTailLines() < 0) {
      throw new IllegalStateException("knowledge.pipeline.governor head/tail lines must not be negative");
    }
    if (chunking.getMaxTokensPerChunk() <= 0) {
      throw new IllegalStateException("knowledge.pipeline.chunking.max-tokens-per-chunk must be positive");
    }
    if (chunking.getCharsPerToken() <= 0) {
      throw new IllegalStateException("knowledge.pipeline.chunking.chars-per-token must be positive");
    }
    if (rateLimit.getCooldown() == null || rateLimit.getCooldown().isNegative()) {
      throw new IllegalStateException("knowledge.pipeline.rate-limit.cooldown must not be negative");
    }
    if (!StringUtils.hasText(generation.getSystemPromptTemplate())) {
      throw new IllegalStateException("knowledge.pipeline.generation.system-prompt-template must be set");
    }
  }

  public Governor getGovernor() {
    return governor;
  }

  public Chunking getChunking() {
    return chunking;
  }

  public Generation getGeneration() {
    return generation;
  }

  public RateLimit getRateLimit() {
    return rateLimit;
  }

  public Themes getThemes() {
    return themes;
  }

  public Output getOutput() {
    return output;
  }

  public static class Governor {
    private int maxFileLines = 2000;
    private long maxFileBytes = 200 * 1024L;
    private LargeFileStrategy largeFileStrategy = LargeFileStrategy.SUMMARY;
    private boolean summarizeLockfiles = true;
    private int headTailHeadLines = 200;
    private int headTailTailLines = 50;

    public ContentSizePolicy toPolicy() {
      return new ContentSizePolicy(
          maxFileLines,
          maxFileBytes,
          largeFileStrategy,
          summarizeLockfiles,
          headTailHeadLines,
          headTailTailLines);
    }

    public int getMaxFileLines() {
      return maxFileLines;
    }

    public void setMaxFileLines(int maxFileLines) {
      this.maxFileLines = maxFileLines;
    }

    public long getMaxFileBytes() {
      return maxFileBytes;
    }

    public void setMaxFileBytes(long maxFileBytes) {
      this.maxFileBytes = maxFileBytes;
    }

    public LargeFileStrategy getLargeFileStrategy() {
      return largeFileStrategy;
    }

    public void setLargeFileStrategy(LargeFileStrategy largeFileStrategy) {
      this.largeFileStrategy = largeFileStrategy;
    }

    public boolean isSummarizeLockfiles() {
      return summarizeLockfiles;
    }

    public void setSummarizeLockfiles(boolean summarizeLockfiles) {
      this.summarizeLockfiles = summarizeLockfiles;
    }

    public int getHeadTailHeadLines() {
      return headTailHeadLines;
    }

    public void setHeadTailHeadLines(int headTailHeadLines) {
      this.headTailHeadLines = headTailHeadLines;
    }

    public int getHeadTailTailLines() {
      return headTailTailLines;
    }

    public void setHeadTailTailLines(int headTailTailLines) {
      this.headTailTailLines = headTailTailLines;
    }
  }

  public enum Estimator {
    RATIO,
    JTOKKIT
  }

  public static class Chunking {
    private int maxTokensPerChunk = 150_000;
    private int charsPerToken = 4;
    private Estimator estimator = Estimator.RATIO;

    public int getMaxTokensPerChunk() {
      return maxTokensPerChunk;
    }

    public void setMaxTokensPerChunk(int maxTokensPerChunk) {
      this.maxTokensPerChunk = maxTokensPerChunk;
    }

    public int getCharsPerToken() {
      return charsPerToken;
    }

    public void setCharsPerToken(int charsPerToken) {
      this.charsPerToken = charsPerToken;
    }

    public Estimator getEstimator() {
      return estimator;
    }

    public void setEstimator(Estimator estimator) {
      this.estimator = estimator;
    }
  }

  public static class Generation {
    private String model = "gpt-4o-mini";
    private Double temperature = 0.2d;
    private String systemPromptTemplate = "classpath:prompts/card-generation-system.st";

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public Double getTemperature() {
      return temperature;
    }

    public void setTemperature(Double temperature) {
      this.temperature = temperature;
    }

    public String getSystemPromptTemplate() {
      return systemPromptTemplate;
    }

    public void setSystemPromptTemplate(String systemPromptTemplate) {
      this.systemPromptTemplate = systemPromptTemplate;
    }
  }

  public static class RateLimit {
    private Duration cooldown = Duration.ofSeconds(30);

    public Duration getCooldown() {
      return cooldown;
    }

    public void setCooldown(Duration cooldown) {
      this.cooldown = cooldown;
    }
  }

  public enum ThemeMode {
    HEURISTIC,
    LLM
  }

  public static class Themes {
    private ThemeMode mode = ThemeMode.HEURISTIC;
    private int maxLabels = 200;
    private int maxItems = 5;
    private String model = "gpt-4o-mini";
    private Double temperature = 0.2d;

    public ThemeMode getMode() {
      return mode;
    }

    public void setMode(ThemeMode mode) {
      this.mode = mode;
    }

    public int getMaxLabels() {
      return maxLabels;
    }

    public void setMaxLabels(int maxLabels) {
      this.maxLabels = maxLabels;
    }

    public int getMaxItems() {
      return maxItems;
    }

    public void setMaxItems(int maxItems) {
      this.maxItems = maxItems;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public Double getTemperature() {
      return temperature;
    }

    public void setTemperature(Double temperature) {
      this.temperature = temperature;
    }
  }

  public static class Output {
    private String rawContextDirectory = "docs/raw-context/github";
    private String resultsDirectory;

    public String getRawContextDirectory() {
      return rawContextDirectory;
    }

    public void setRawContextDirectory(String rawContextDirectory) {
      this.rawContextDirectory = rawContextDirectory;
    }

    public String getResultsDirectory() {
      return resultsDirectory;
    }

    public void setResultsDirectory(String resultsDirectory) {
      this.resultsDirectory = resultsDirectory;
    }
  }
}
