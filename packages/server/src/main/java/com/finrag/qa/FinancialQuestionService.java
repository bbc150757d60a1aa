package com.finrag.qa;

import com.finrag.exception.ValidationException;
import com.finrag.logging.LoggingService;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/** Answers free-form financial questions through the configured {@link LlmClient}. */
public class FinancialQuestionService {
  private static final Logger log = LoggingService.getLogger(FinancialQuestionService.class);

  public static final String QUERY_TYPE = "GENERAL";

  static final String SYSTEM_PROMPT =
      "You are a financial assistant. Answer the question precisely, the way a finance "
          + "professional would. If you are not sure of the answer, say you are not sure.";

  private final LlmClient llm;

  public FinancialQuestionService(LlmClient llm) {
    this.llm = llm;
  }

  /**
   * @throws ValidationException if the question is blank
   * @throws com.finrag.exception.LlmException if the model backend fails
   */
  public Answer answer(String question) {
    if (question == null || question.isBlank()) {
      throw new ValidationException("question must not be blank");
    }
    log.debug("Answering question ({} chars) with {}", question.length(), llm.name());
    String text =
        llm.chat(
            List.of(
                LlmClient.Message.system(SYSTEM_PROMPT),
                LlmClient.Message.user(
                    "Question: " + question.trim() + "\n\nProvide a precise, finance-professional answer.")));
    return new Answer(
        text,
        QUERY_TYPE,
        Map.of("reason", "General question answered by the language model"),
        llm.name());
  }
}
