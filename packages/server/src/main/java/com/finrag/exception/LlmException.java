package com.finrag.exception;

/** The language model backend could not be reached or returned an unusable response. */
public class LlmException extends FinRagException {
  public LlmException(String message) {
    super(FinRagErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(FinRagErrorCode.LLM_ERROR, message, cause);
  }
}
