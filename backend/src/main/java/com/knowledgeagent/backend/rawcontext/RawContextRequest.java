package com.knowledgeagent.backend.rawcontext;

import com.knowledgeagent.backend.evidence.GitHubSource;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

@Schema(description = "Sources to collect into one raw context document")
public record RawContextRequest(@NotEmpty @Valid List<GitHubSource> sources) {

  public RawContextRequest {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }
}
