package com.finrag.qa;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Answer to one question, serialized as the chat response body and as async task results. */
public record Answer(
    @JsonProperty("answer") String answer,
    @JsonProperty("query_type") String queryType,
    @JsonProperty("router") Map<String, Object> router,
    @JsonProperty("source") String source) {}
