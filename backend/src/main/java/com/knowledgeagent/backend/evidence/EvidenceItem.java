package com.knowledgeagent.backend.evidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One observed file-level change. The {@code id} is unique within a run so that generated
 * citations resolve to exactly one item of the raw context document.
 */
public record EvidenceItem(
    String id,
    SourceType sourceType,
    String sourceName,
    ChangeType changeType,
    String identifier,
    String timestamp,
    Map<String, Object> metadata,
    String snippet) {

  public EvidenceItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceType, "sourceType");
    Objects.requireNonNull(sourceName, "sourceName");
    Objects.requireNonNull(changeType, "changeType");
    Objects.requireNonNull(identifier, "identifier");
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
