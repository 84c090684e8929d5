package com.knowledgeagent.backend.rawcontext;

import java.util.List;

public record ThemeSummary(List<String> themes, List<String> workflows) {

  public ThemeSummary {
    themes = themes == null ? List.of() : List.copyOf(themes);
    workflows = workflows == null ? List.of() : List.copyOf(workflows);
  }

  public static ThemeSummary empty() {
    return new ThemeSummary(List.of(), List.of());
  }
}
