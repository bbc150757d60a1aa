package com.finrag.qa;

import java.util.List;

/** Offline stand-in used when no model backend is configured. Answers deterministically. */
public final class MockLlmClient implements LlmClient {

  @Override
  public String chat(List<Message> messages) {
    String question = "";
    for (Message message : messages) {
      if (message.role() == Role.USER) {
        question = message.content();
      }
    }
    return "[demo mode] No language model backend is configured, so this is a placeholder answer."
        + " Configure llm.provider to get real answers. Question received: "
        + question.trim();
  }

  @Override
  public String name() {
    return "mock";
  }

  @Override
  public String model() {
    return "mock";
  }
}
