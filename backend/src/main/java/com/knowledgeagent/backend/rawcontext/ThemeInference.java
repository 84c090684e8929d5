package com.knowledgeagent.backend.rawcontext;

import com.knowledgeagent.backend.evidence.EvidenceItem;
import java.util.List;

/** Infers the executive-summary themes and affected workflows of a set of evidence. */
public interface ThemeInference {

  ThemeSummary infer(List<EvidenceItem> evidence);
}
