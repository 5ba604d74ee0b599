package com.flamingo.ai.hybridrag.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that assigns exactly one query type label to a question. */
public interface QueryClassificationAgent {

  @SystemMessage(
      """
        You classify questions for a document question-answering system.

        Query types:
        - factual: a direct question about a specific fact
          (e.g. "What is X?", "When did Y happen?", "Where does Z work?")
        - relational: a question about relationships between entities
          (e.g. "How is X related to Y?", "Who works with Z?")
        - reasoning: a question that needs several facts combined through multi-step reasoning
          (e.g. "Why did X lead to Y?", "What would happen if...?")

        Respond with ONLY the type name: factual, relational, or reasoning.
        """)
  @UserMessage("Question: {{question}}")
  String classify(@V("question") String question);
}
