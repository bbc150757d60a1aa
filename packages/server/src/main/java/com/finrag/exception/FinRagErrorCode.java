package com.finrag.exception;

/** Stable error codes carried by {@link FinRagException} and surfaced in API error bodies. */
public enum FinRagErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  NETWORK_ERROR,
  STATE_ERROR,
  VALIDATION_ERROR,
  NOT_FOUND,
  LLM_ERROR
}
