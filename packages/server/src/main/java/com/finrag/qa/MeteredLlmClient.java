package com.finrag.qa;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Objects;

/**
 * Decorator that counts and times every call to the wrapped backend.
 *
 * <ul>
 *   <li>{@value #REQUESTS} counter tagged {@code provider}, {@code model} and {@code status}
 *       ({@code success} or {@code error})
 *   <li>{@value #DURATION} timer tagged {@code provider} and {@code model}
 * </ul>
 */
public final class MeteredLlmClient implements LlmClient {
  public static final String REQUESTS = "finrag.llm.requests";
  public static final String DURATION = "finrag.llm.request.duration";

  private final LlmClient delegate;
  private final MeterRegistry registry;
  private final Counter succeeded;
  private final Counter failed;
  private final Timer duration;

  public MeteredLlmClient(LlmClient delegate, MeterRegistry registry) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.registry = registry;
    String provider = Objects.requireNonNullElse(delegate.name(), "unknown");
    String model = Objects.requireNonNullElse(delegate.model(), "unknown");
    this.succeeded = requests(provider, model, "success");
    this.failed = requests(provider, model, "error");
    this.duration =
        Timer.builder(DURATION)
            .description("Language model request latency")
            .tag("provider", provider)
            .tag("model", model)
            .register(registry);
  }

  private Counter requests(String provider, String model, String status) {
    return Counter.builder(REQUESTS)
        .description("Language model requests")
        .tag("provider", provider)
        .tag("model", model)
        .tag("status", status)
        .register(registry);
  }

  @Override
  public String chat(List<Message> messages) {
    Timer.Sample sample = Timer.start(registry);
    try {
      String reply = delegate.chat(messages);
      succeeded.increment();
      return reply;
    } catch (RuntimeException e) {
      failed.increment();
      throw e;
    } finally {
      sample.stop(duration);
    }
  }

  @Override
  public String name() {
    return delegate.name();
  }

  @Override
  public String model() {
    return delegate.model();
  }
}
