package com.knowledgeagent.backend.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class GitHubBackendPropertiesTest {

  @Test
  void defaults() {
    GitHubBackendProperties properties = bind(Map.of());

    assertThat(properties.getBaseUrl()).isEqualTo("https://api.github.com");
    assertThat(properties.getUserAgent()).isEqualTo("Knowledge Agent Backend/0.1");
    assertThat(properties.getConnectTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(properties.getReadTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(properties.getCommitPageSize()).isEqualTo(100);
  }

  @Test
  void bindsUserAgentAndTimeouts() {
    GitHubBackendProperties properties =
        bind(
            Map.of(
                "github.backend.user-agent", "GuruAgent/1.0.0",
                "github.backend.connect-timeout", "2s",
                "github.backend.read-timeout", "45s"));

    assertThat(properties.getUserAgent()).isEqualTo("GuruAgent/1.0.0");
    assertThat(properties.getConnectTimeout()).isEqualTo(Duration.ofSeconds(2));
    assertThat(properties.getReadTimeout()).isEqualTo(Duration.ofSeconds(45));
  }

  private static GitHubBackendProperties bind(Map<String, String> values) {
    Binder binder = new Binder(new MapConfigurationPropertySource(values));
    return binder
        .bind("github.backend", Bindable.ofInstance(new GitHubBackendProperties()))
        .orElseGet(GitHubBackendProperties::new);
  }
}
