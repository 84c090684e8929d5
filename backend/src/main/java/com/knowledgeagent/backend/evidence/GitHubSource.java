package com.knowledgeagent.backend.evidence;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

@Schema(description = "GitHub organization, repositories and branches to collect evidence from")
public record GitHubSource(
    @NotBlank @Schema(example = "octo-org") String org,
    @NotEmpty @Schema(description = "Repository names; \"*\" expands to every repo of the org")
        List<String> repos,
    @NotEmpty List<String> branches,
    @NotEmpty @Valid List<ContextOption> contextOptions,
    @Schema(description = "Path prefixes skipped in every mode") List<String> excludePaths,
    @Valid ContentSizeOverrides sizePolicy) {

  public static final String ALL_REPOSITORIES = "*";

  public GitHubSource {
    repos = repos == null ? List.of() : List.copyOf(repos);
    branches = branches == null ? List.of() : List.copyOf(branches);
    contextOptions = contextOptions == null ? List.of() : List.copyOf(contextOptions);
    excludePaths = excludePaths == null ? List.of() : List.copyOf(excludePaths);
  }

  public boolean isExcluded(String path) {
    return excludePaths.stream().anyMatch(prefix -> !prefix.isBlank() && path.startsWith(prefix));
  }
}
