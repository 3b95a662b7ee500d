package com.roomchat.backend.chat.generator;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.backend.chat.context.ConversationTurn;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class GeminiReplyGeneratorTest {

  private static final String FAILURE = "I'm experiencing technical difficulties. Please try again later.";
  private static final String EMPTY = "I'm sorry, I couldn't process that.";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private SimpleMeterRegistry meterRegistry;
  private GeneratorProperties properties;
  private AtomicReference<URI> lastUri;
  private AtomicReference<HttpMethod> lastMethod;
  private AtomicInteger calls;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    properties = new GeneratorProperties();
    properties.setApiKey("test-key");
    lastUri = new AtomicReference<>();
    lastMethod = new AtomicReference<>();
    calls = new AtomicInteger();
  }

  @Test
  void returnsCandidateTextFromGeminiPayload() {
    GeminiReplyGenerator generator =
        generator(
            respond(
                HttpStatus.OK,
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"hi there\"}]}}]}"));

    GeneratedReply reply = generator.generate("hello", List.of());

    assertThat(reply.text()).isEqualTo("hi there");
    assertThat(reply.outcome()).isEqualTo(GenerationOutcome.GENERATED);
    assertThat(reply.isFallback()).isFalse();
    assertThat(lastMethod.get()).isEqualTo(HttpMethod.POST);
    assertThat(lastUri.get().getPath())
        .isEqualTo("/v1beta/models/gemini-2.0-flash:generateContent");
    assertThat(lastUri.get().getQuery()).isEqualTo("key=test-key");
    assertThat(meterRegistry.counter("chat.generator.requests", "outcome", "generated").count())
        .isEqualTo(1.0d);
  }

  @Test
  void rendersHistoryIntoRequestWithoutFailing() {
    GeminiReplyGenerator generator = generator(respond(HttpStatus.OK, "{\"text\":\"sure\"}"));

    GeneratedReply reply =
        generator.generate(
            "and now?",
            List.of(new ConversationTurn("alice", "hi"), new ConversationTurn("AI Assistant", "hey")));

    assertThat(reply.text()).isEqualTo("sure");
  }

  @Test
  void timeoutYieldsFailureFallback() {
    properties.setTimeout(Duration.ofMillis(200));
    ExchangeFunction hanging =
        request -> {
          calls.incrementAndGet();
          return Mono.never();
        };

    GeneratedReply reply = generator(hanging).generate("hello", List.of());

    assertThat(reply.text()).isEqualTo(FAILURE);
    assertThat(reply.outcome()).isEqualTo(GenerationOutcome.TRANSPORT_FAILURE);
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  void transportErrorYieldsFailureFallback() {
    ExchangeFunction broken = request -> Mono.error(new IllegalStateException("connection refused"));

    GeneratedReply reply = generator(broken).generate("hello", List.of());

    assertThat(reply.text()).isEqualTo(FAILURE);
    assertThat(reply.outcome()).isEqualTo(GenerationOutcome.TRANSPORT_FAILURE);
  }

  @Test
  void non2xxStatusYieldsFailureFallback() {
    GeneratedReply reply =
        generator(respond(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"boom\"}"))
            .generate("hello", List.of());

    assertThat(reply.text()).isEqualTo(FAILURE);
    assertThat(reply.outcome()).isEqualTo(GenerationOutcome.HTTP_ERROR);
  }

  @Test
  void nonJsonBodyYieldsFailureFallback() {
    GeneratedReply reply =
        generator(respond(HttpStatus.OK, "<html>gateway</html>")).generate("hello", List.of());

    assertThat(reply.text()).isEqualTo(FAILURE);
    assertThat(reply.outcome()).isEqualTo(GenerationOutcome.MALFORMED_PAYLOAD);
  }

  @Test
  void whitespaceOnlyTextYieldsEmptyReplyFallback() {
    GeneratedReply reply =
        generator(
                respond(
                    HttpStatus.OK,
                    "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"   \"}]}}]}"))
            .generate("hello", List.of());

    assertThat(reply.text()).isEqualTo(EMPTY);
    assertThat(reply.outcome()).isEqualTo(GenerationOutcome.EMPTY_REPLY);
  }

  @Test
  void missingApiKeySkipsUpstreamCall() {
    properties.setApiKey(" ");
    GeminiReplyGenerator generator = generator(respond(HttpStatus.OK, "{\"text\":\"unused\"}"));

    GeneratedReply reply = generator.generate("hello", List.of());

    assertThat(reply.text()).isEqualTo(FAILURE);
    assertThat(reply.outcome()).isEqualTo(GenerationOutcome.NOT_CONFIGURED);
    assertThat(calls.get()).isZero();
  }

  private GeminiReplyGenerator generator(ExchangeFunction exchangeFunction) {
    WebClient webClient =
        WebClient.builder().baseUrl("http://generator.test").exchangeFunction(exchangeFunction).build();
    return new GeminiReplyGenerator(
        webClient,
        objectMapper,
        properties,
        new ConversationPromptRenderer(properties.getHistoryLimit()),
        ReplyExtractors.defaultChain(),
        new GeneratorMetrics(meterRegistry));
  }

  private ExchangeFunction respond(HttpStatus status, String body) {
    return request -> {
      calls.incrementAndGet();
      lastUri.set(request.url());
      lastMethod.set(request.method());
      return Mono.just(
          ClientResponse.create(status)
              .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
              .body(body)
              .build());
    };
  }
}
