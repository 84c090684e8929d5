package com.knowledgeagent.backend.github;

class GitHubClientException extends RuntimeException {

  GitHubClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
