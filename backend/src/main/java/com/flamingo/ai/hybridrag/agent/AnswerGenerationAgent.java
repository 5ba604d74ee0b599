package com.flamingo.ai.hybridrag.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that answers a question strictly from the supplied context. */
public interface AnswerGenerationAgent {

  @SystemMessage(
      """
        You are a precise question-answering assistant.

        Rules:
        1. Answer ONLY from the information in the provided context.
        2. Do NOT use prior knowledge or information that is not in the context.
        3. If the context does not contain enough information to answer, reply exactly:
           "Insufficient information to answer this question from the provided context."
        4. Be concise and cite the specific facts from the context that support the answer.
        5. Never make up information.
        """)
  @UserMessage(
      """
        Context:
        {{context}}

        Question: {{question}}

        Answer (based strictly on the context above):
        """)
  String answer(@V("context") String context, @V("question") String question);
}
