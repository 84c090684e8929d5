package com.knowledgeagent.backend.evidence;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;

@Schema(description = "One evidence selection mode applied to every repo/branch of a source")
public record ContextOption(
    @NotNull ContextMode mode,
    @Schema(description = "Inclusive lower bound for date-range mode", example = "2024-01-01")
        LocalDate sinceDate,
    @Schema(description = "Paths to snapshot in file-selection mode") List<String> selectedPaths,
    @Schema(description = "Commit SHAs for commit-selection mode") List<String> selectedCommits) {

  public ContextOption {
    selectedPaths = selectedPaths == null ? List.of() : List.copyOf(selectedPaths);
    selectedCommits = selectedCommits == null ? List.of() : List.copyOf(selectedCommits);
  }

  public static ContextOption dateRange(LocalDate sinceDate) {
    return new ContextOption(ContextMode.DATE_RANGE, sinceDate, List.of(), List.of());
  }

  public static ContextOption fileSelection(List<String> paths) {
    return new ContextOption(ContextMode.FILE_SELECTION, null, paths, List.of());
  }

  public static ContextOption commitSelection(List<String> commits) {
    return new ContextOption(ContextMode.COMMIT_SELECTION, null, List.of(), commits);
  }
}
