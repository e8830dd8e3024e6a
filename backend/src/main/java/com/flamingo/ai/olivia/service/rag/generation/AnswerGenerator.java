package com.flamingo.ai.olivia.service.rag.generation;

import com.flamingo.ai.olivia.config.RagConfig;
import com.flamingo.ai.olivia.exception.LlmServiceException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Calls the chat model, single-shot or token by token. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerGenerator {

  private final ChatModel chatModel;
  private final StreamingChatModel streamingChatModel;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Generates a complete answer.
   *
   * @throws LlmServiceException if the model call fails
   */
  @Timed(value = "rag.generation", description = "Time to generate an answer")
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public String generate(List<ChatMessage> messages, double temperature) {
    try {
      ChatResponse response = chatModel.chat(request(messages, temperature));
      meterRegistry.counter("rag.generation.requests", "mode", "batch").increment();
      String text = response.aiMessage().text();
      return text != null ? text : "";
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.generation.errors", "mode", "batch").increment();
      throw new LlmServiceException("Answer generation failed: " + e.getMessage(), e);
    }
  }

  /**
   * Streams answer fragments. The model call starts on subscription.
   *
   * <p>Cancelling only stops forwarding: the streaming API offers no way to abort a request, so the
   * model call keeps running to completion and its remaining fragments are discarded.
   */
  public Flux<String> stream(List<ChatMessage> messages, double temperature) {
    return Flux.defer(
        () -> {
          Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
          AtomicBoolean cancelled = new AtomicBoolean(false);
          AtomicInteger fragments = new AtomicInteger();

          StreamingChatResponseHandler handler =
              new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                  if (cancelled.get() || partialResponse == null) {
                    return;
                  }
                  fragments.incrementAndGet();
                  var result = sink.tryEmitNext(partialResponse);
                  if (result.isFailure()) {
                    log.warn("Failed to emit answer fragment: {}", result);
                  }
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                  log.debug("Streaming answer completed after {} fragments", fragments.get());
                  meterRegistry.counter("rag.generation.requests", "mode", "stream").increment();
                  sink.tryEmitComplete();
                }

                @Override
                public void onError(Throwable error) {
                  log.error("Error during answer streaming: {}", error.getMessage(), error);
                  meterRegistry.counter("rag.generation.errors", "mode", "stream").increment();
                  sink.tryEmitError(
                      new LlmServiceException(
                          "Answer streaming failed: " + error.getMessage(), error));
                }
              };

          try {
            streamingChatModel.chat(request(messages, temperature), handler);
          } catch (RuntimeException e) {
            handler.onError(e);
          }
          return sink.asFlux()
              .doOnCancel(
                  () -> {
                    cancelled.set(true);
                    log.debug("Answer stream cancelled by subscriber");
                  });
        });
  }

  private ChatRequest request(List<ChatMessage> messages, double temperature) {
    return ChatRequest.builder()
        .messages(messages)
        .temperature(temperature)
        .maxOutputTokens(ragConfig.getGeneration().getMaxTokens())
        .build();
  }
}
