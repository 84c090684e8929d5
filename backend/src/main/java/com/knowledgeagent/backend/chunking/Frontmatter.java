package com.knowledgeagent.backend.chunking;

/**
 * A document split into its leading header block and the remaining body. The header is the text
 * from an opening {@code ---} line through the first closing {@code ---} line, inclusive.
 */
public record Frontmatter(String header, String body) {

  private static final String OPENING = "---\n";
  private static final String CLOSING = "\n---\n";

  public static Frontmatter split(String document) {
    String text = document == null ? "" : document;
    if (!text.startsWith(OPENING)) {
      return new Frontmatter(null, text);
    }
    int closing = text.indexOf(CLOSING, OPENING.length());
    if (closing < 0) {
      return new Frontmatter(null, text);
    }
    int bodyStart = closing + CLOSING.length();
    return new Frontmatter(text.substring(0, bodyStart), text.substring(bodyStart));
  }

  public boolean hasHeader() {
    return header != null;
  }
}
