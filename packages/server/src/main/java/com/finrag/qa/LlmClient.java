package com.finrag.qa;

import java.util.List;
import java.util.Locale;

/** Minimal chat-completion boundary towards a language model backend. */
public interface LlmClient {

  /**
   * Send the conversation and return the model's reply text.
   *
   * @throws com.finrag.exception.LlmException if the backend fails or answers with something
   *     unusable
   */
  String chat(List<Message> messages);

  /** Short backend identifier reported as the answer's source, e.g. {@code openai}. */
  String name();

  /** Model the backend is asked for, e.g. {@code gpt-4o-mini}. */
  String model();

  enum Role {
    SYSTEM,
    USER,
    ASSISTANT;

    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  record Message(Role role, String content) {
    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }
  }
}
