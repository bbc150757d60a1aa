package com.finrag.exception;

import java.time.Instant;
import java.util.Map;

/** Structured view of a failure, suitable for logs and JSON error bodies. */
public record ErrorDetails(
    String type,
    String message,
    FinRagErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
