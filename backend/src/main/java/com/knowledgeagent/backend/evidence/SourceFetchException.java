package com.knowledgeagent.backend.evidence;

/** The commit list, a commit or a branch head could not be read; the whole run is aborted. */
public class SourceFetchException extends RuntimeException {

  private final String source;

  public SourceFetchException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
