package com.knowledgeagent.backend.github;

import com.knowledgeagent.backend.config.GitHubBackendProperties;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.Objects;
import org.kohsuke.github.AbuseLimitHandler;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.HttpConnector;
import org.kohsuke.github.RateLimitHandler;
import org.kohsuke.github.extras.ImpatientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class GitHubClientFactory {

  private final GitHubBackendProperties properties;

  GitHubClientFactory(GitHubBackendProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  /** Builds a client for the configured personal access token, or an anonymous one without it. */
  GitHub createClient() throws IOException {
    GitHubBuilder builder = configure(new GitHubBuilder());
    if (StringUtils.hasText(properties.getPersonalAccessToken())) {
      builder.withOAuthToken(properties.getPersonalAccessToken().trim());
    }
    return builder.build();
  }

  @SuppressWarnings("deprecation")
  private GitHubBuilder configure(GitHubBuilder builder) {
    builder.withRateLimitHandler(RateLimitHandler.WAIT);
    builder.withAbuseLimitHandler(AbuseLimitHandler.WAIT);
    builder.withConnector(connector());
    if (StringUtils.hasText(properties.getBaseUrl())) {
      builder.withEndpoint(properties.getBaseUrl().trim());
    }
    return builder;
  }

  /** Opens connections with the configured user agent and connect/read timeouts applied. */
  @SuppressWarnings("deprecation")
  HttpConnector connector() {
    String userAgent = properties.getUserAgent();
    HttpConnector base =
        url -> {
          HttpURLConnection connection = (HttpURLConnection) url.openConnection();
          if (StringUtils.hasText(userAgent)) {
            connection.setRequestProperty("User-Agent", userAgent.trim());
          }
          return connection;
        };
    return new ImpatientHttpConnector(
        base, toMillis(properties.getConnectTimeout()), toMillis(properties.getReadTimeout()));
  }

  // 0 leaves the connection without a timeout
  private static int toMillis(Duration timeout) {
    if (timeout == null || timeout.isNegative()) {
      return 0;
    }
    return (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
  }
}
