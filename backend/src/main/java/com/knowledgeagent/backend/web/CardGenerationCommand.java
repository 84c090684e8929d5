package com.knowledgeagent.backend.web;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Raw context document to turn into knowledge cards")
public record CardGenerationCommand(
    @Schema(description = "Markdown document produced by the raw context step, frontmatter included")
        @NotBlank(message = "rawContext must not be blank")
        String rawContext) {}
