package com.knowledgeagent.backend.tools;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class KnowledgeAgentToolConfiguration {

  @Bean
  ToolCallbackProvider knowledgeAgentToolCallbackProvider(KnowledgeAgentTools knowledgeAgentTools) {
    return MethodToolCallbackProvider.builder().toolObjects(knowledgeAgentTools).build();
  }
}
