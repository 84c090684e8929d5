package com.knowledgeagent.backend.rawcontext;

import com.knowledgeagent.backend.evidence.EvidenceItem;
import java.util.List;
import java.util.Objects;

public record RenderInput(
    PhaseState phaseState,
    String generatedAt,
    String changePeriod,
    List<String> selectedSources,
    List<EvidenceItem> evidence,
    ThemeSummary themes,
    DependencySummary dependencySummary) {

  public RenderInput {
    Objects.requireNonNull(phaseState, "phaseState");
    Objects.requireNonNull(generatedAt, "generatedAt");
    selectedSources = selectedSources == null ? List.of() : List.copyOf(selectedSources);
    evidence = evidence == null ? List.of() : List.copyOf(evidence);
    themes = themes == null ? ThemeSummary.empty() : themes;
  }
}
