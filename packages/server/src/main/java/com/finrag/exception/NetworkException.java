package com.finrag.exception;

/** Failures while binding or talking to network endpoints. */
public class NetworkException extends FinRagException {
  public NetworkException(String message) {
    super(FinRagErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(FinRagErrorCode.NETWORK_ERROR, message, cause);
  }
}
