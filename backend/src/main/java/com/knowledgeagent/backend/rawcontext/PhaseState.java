package com.knowledgeagent.backend.rawcontext;

import java.util.List;

/** State block serialized into the document frontmatter and read back by later phases. */
public record PhaseState(
    String phase,
    String status,
    RawContextRequest params,
    List<Artifact> artifacts,
    String lastUpdatedAt) {

  public static final String PHASE_ONE = "phase-1";
  public static final String AWAITING_APPROVAL = "awaiting_approval";

  public PhaseState {
    artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
  }

  public static PhaseState awaitingApproval(
      RawContextRequest params, List<Artifact> artifacts, String lastUpdatedAt) {
    return new PhaseState(PHASE_ONE, AWAITING_APPROVAL, params, artifacts, lastUpdatedAt);
  }

  public record Artifact(String id, String kind, String title, String path) {}
}
