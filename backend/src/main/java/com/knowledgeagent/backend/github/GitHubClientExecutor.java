package com.knowledgeagent.backend.github;

import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.GHException;
import org.kohsuke.github.GitHub;
import org.springframework.stereotype.Component;

@Component
class GitHubClientExecutor {

  private final GitHubClientFactory clientFactory;

  GitHubClientExecutor(GitHubClientFactory clientFactory) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  <T> T execute(GitHubOperation<T> operation) {
    Objects.requireNonNull(operation, "operation");
    try {
      GitHub client = clientFactory.createClient();
      return operation.apply(client);
    } catch (IOException | GHException ex) {
      throw new GitHubClientException("Failed to execute GitHub API call", ex);
    }
  }

  @FunctionalInterface
  interface GitHubOperation<T> {
    T apply(GitHub github) throws IOException;
  }
}
