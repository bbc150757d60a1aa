package com.finrag.qa;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of the chat endpoints. */
public record ChatRequest(
    @JsonProperty("user_id") String userId, @JsonProperty("question") String question) {}
