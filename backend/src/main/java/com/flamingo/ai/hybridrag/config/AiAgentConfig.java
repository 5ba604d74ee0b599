package com.flamingo.ai.hybridrag.config;

import com.flamingo.ai.hybridrag.agent.AnswerGenerationAgent;
import com.flamingo.ai.hybridrag.agent.QueryClassificationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the AI agents used by the pipeline.
 *
 * <p>Pattern: agent interfaces declare their prompts with @SystemMessage/@UserMessage and
 * AiServices.builder() supplies the implementation.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public QueryClassificationAgent queryClassificationAgent(
      @Qualifier("classificationChatModel") ChatModel classificationChatModel) {
    return AiServices.builder(QueryClassificationAgent.class)
        .chatModel(classificationChatModel)
        .build();
  }

  @Bean
  public AnswerGenerationAgent answerGenerationAgent(ChatModel chatModel) {
    return AiServices.builder(AnswerGenerationAgent.class).chatModel(chatModel).build();
  }
}
