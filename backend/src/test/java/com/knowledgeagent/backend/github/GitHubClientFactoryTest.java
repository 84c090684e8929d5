package com.knowledgeagent.backend.github;

import static org.assertj.core.api.Assertions.assertThat;

import com.knowledgeagent.backend.config.GitHubBackendProperties;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class GitHubClientFactoryTest {

  @Test
  @SuppressWarnings("deprecation")
  void connectionsCarryUserAgentAndTimeouts() throws IOException {
    GitHubBackendProperties properties = new GitHubBackendProperties();
    properties.setUserAgent("GuruAgent/1.0.0");
    properties.setConnectTimeout(Duration.ofSeconds(3));
    properties.setReadTimeout(Duration.ofSeconds(7));

    HttpURLConnection connection =
        new GitHubClientFactory(properties).connector().connect(new URL("https://api.github.com/rate_limit"));

    assertThat(connection.getRequestProperty("User-Agent")).isEqualTo("GuruAgent/1.0.0");
    assertThat(connection.getConnectTimeout()).isEqualTo(3_000);
    assertThat(connection.getReadTimeout()).isEqualTo(7_000);
  }

  @Test
  @SuppressWarnings("deprecation")
  void defaultsApplyWhenNothingIsConfigured() throws IOException {
    HttpURLConnection connection =
        new GitHubClientFactory(new GitHubBackendProperties())
            .connector()
            .connect(new URL("https://api.github.com/rate_limit"));

    assertThat(connection.getRequestProperty("User-Agent")).isEqualTo("Knowledge Agent Backend/0.1");
    assertThat(connection.getConnectTimeout()).isEqualTo(10_000);
    assertThat(connection.getReadTimeout()).isEqualTo(30_000);
  }
}
