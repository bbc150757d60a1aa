package com.finrag.exception;

/** Invalid or missing configuration. */
public class ConfigException extends FinRagException {
  public ConfigException(String message) {
    super(FinRagErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(FinRagErrorCode.CONFIG_ERROR, message, cause);
  }
}
