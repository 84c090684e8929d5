package com.knowledgeagent.backend.evidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record GovernedContent(String snippet, Map<String, Object> metadata) {

  public GovernedContent {
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
