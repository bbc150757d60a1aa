package com.finrag.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the application's unchecked exception hierarchy. Every subclass carries a {@link
 * FinRagErrorCode} and an optional context map that ends up in structured error details.
 */
public class FinRagException extends RuntimeException {
  private final FinRagErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public FinRagException(FinRagErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public FinRagException(FinRagErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public FinRagErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry; returns {@code this} for chaining at the throw site. */
  public FinRagException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
