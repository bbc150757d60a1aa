package com.finrag.exception;

/** Rejected input, such as a malformed request body or an unknown status name. */
public class ValidationException extends FinRagException {
  public ValidationException(String message) {
    super(FinRagErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(FinRagErrorCode.VALIDATION_ERROR, message, cause);
  }
}
