package com.finrag.exception;

/** A component was used before it was initialized or after it was closed. */
public class StateException extends FinRagException {
  public StateException(String message) {
    super(FinRagErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(FinRagErrorCode.STATE_ERROR, message, cause);
  }
}
