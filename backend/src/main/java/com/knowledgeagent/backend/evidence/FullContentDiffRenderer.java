package com.knowledgeagent.backend.evidence;

import org.springframework.stereotype.Component;

/**
 * Emits the full new content under a unified-diff style header instead of a computed delta. The
 * previous content is accepted but not compared.
 */
@Component
public class FullContentDiffRenderer implements DiffRenderer {

  @Override
  public String render(String path, String previousContent, String newContent) {
    return "--- a/%s\n+++ b/%s\n@@ FULL FILE DIFF @@\n%s"
        .formatted(path, path, newContent == null ? "" : newContent);
  }
}
