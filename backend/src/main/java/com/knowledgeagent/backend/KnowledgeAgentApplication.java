package com.knowledgeagent.backend;

import com.knowledgeagent.backend.config.GitHubBackendProperties;
import com.knowledgeagent.backend.config.KnowledgePipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({GitHubBackendProperties.class, KnowledgePipelineProperties.class})
public class KnowledgeAgentApplication {

  public static void main(String[] args) {
    SpringApplication.run(KnowledgeAgentApplication.class, args);
  }
}
