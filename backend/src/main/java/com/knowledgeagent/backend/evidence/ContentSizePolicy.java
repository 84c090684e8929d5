package com.knowledgeagent.backend.evidence;

import java.util.Objects;

/** Thresholds the {@link ContentSizeGovernor} applies to a single file body. */
public record ContentSizePolicy(
    int maxFileLines,
    long maxFileBytes,
    LargeFileStrategy largeFileStrategy,
    boolean summarizeLockfiles,
    int headTailHeadLines,
    int headTailTailLines) {

  public ContentSizePolicy {
    Objects.requireNonNull(largeFileStrategy, "largeFileStrategy");
    if (maxFileLines <= 0 || maxFileBytes <= 0) {
      throw new IllegalArgumentException("size limits must be positive");
    }
    if (headTailHeadLines < 0 || headTailTailLines < 0) {
      throw new IllegalArgumentException("head/tail line counts must not be negative");
    }
  }

  public static ContentSizePolicy defaults() {
    return new ContentSizePolicy(2000, 200 * 1024L, LargeFileStrategy.SUMMARY, true, 200, 50);
  }

  public ContentSizePolicy withOverrides(ContentSizeOverrides overrides) {
    if (overrides == null) {
      return this;
    }
    return new ContentSizePolicy(
        overrides.maxFileLines() != null ? overrides.maxFileLines() : maxFileLines,
        overrides.maxFileBytes() != null ? overrides.maxFileBytes() : maxFileBytes,
        overrides.largeFileStrategy() != null ? overrides.largeFileStrategy() : largeFileStrategy,
        overrides.summarizeLockfiles() != null ? overrides.summarizeLockfiles() : summarizeLockfiles,
        overrides.headTailHeadLines() != null ? overrides.headTailHeadLines() : headTailHeadLines,
        overrides.headTailTailLines() != null ? overrides.headTailTailLines() : headTailTailLines);
  }
}
