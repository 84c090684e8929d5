package com.knowledgeagent.backend.chunking;

/** Estimates tokens as {@code ceil(length / charsPerToken)}. */
public class CharacterRatioTokenEstimator implements TokenEstimator {

  public static final int DEFAULT_CHARS_PER_TOKEN = 4;

  private final int charsPerToken;

  public CharacterRatioTokenEstimator() {
    this(DEFAULT_CHARS_PER_TOKEN);
  }

  public CharacterRatioTokenEstimator(int charsPerToken) {
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("charsPerToken must be positive");
    }
    this.charsPerToken = charsPerToken;
  }

  @Override
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (int) Math.ceil((double) text.length() / charsPerToken);
  }
}
