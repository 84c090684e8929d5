package com.knowledgeagent.backend.evidence;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(description = "Per-source overrides of the configured size policy")
public record ContentSizeOverrides(
    @Positive Integer maxFileLines,
    @Positive Long maxFileBytes,
    LargeFileStrategy largeFileStrategy,
    Boolean summarizeLockfiles,
    @PositiveOrZero Integer headTailHeadLines,
    @PositiveOrZero Integer headTailTailLines) {}
