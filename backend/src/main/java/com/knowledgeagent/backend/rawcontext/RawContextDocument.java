package com.knowledgeagent.backend.rawcontext;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Rendered raw context document and its proposed repository location")
public record RawContextDocument(
    String fileName,
    String filePath,
    String content,
    int evidenceCount,
    List<String> themes,
    List<String> workflows) {

  public RawContextDocument {
    themes = themes == null ? List.of() : List.copyOf(themes);
    workflows = workflows == null ? List.of() : List.copyOf(workflows);
  }
}
