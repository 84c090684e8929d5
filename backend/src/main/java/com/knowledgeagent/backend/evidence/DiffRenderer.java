package com.knowledgeagent.backend.evidence;

/** Renders the snippet of a changed file from its previous and governed new content. */
public interface DiffRenderer {

  String render(String path, String previousContent, String newContent);
}
