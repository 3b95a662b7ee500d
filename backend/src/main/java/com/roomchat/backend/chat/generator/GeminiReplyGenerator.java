package com.roomchat.backend.chat.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roomchat.backend.chat.context.ConversationTurn;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Calls the Gemini {@code generateContent} endpoint once per reply.
 *
 * <p>The upstream response schema is not contractually fixed, so the text is pulled out through an
 * ordered chain of {@link ReplyExtractionStrategy extraction strategies}. Any failure along the way
 * (missing key, transport error, timeout, non-2xx status, undecodable body, blank text) becomes a
 * fallback reply; this class never throws to its caller.
 */
public class GeminiReplyGenerator implements ReplyGenerator {

  private static final Logger log = LoggerFactory.getLogger(GeminiReplyGenerator.class);
  private static final String GENERATE_PATH = "/v1beta/models/{model}:generateContent";

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final GeneratorProperties properties;
  private final ConversationPromptRenderer promptRenderer;
  private final List<ReplyExtractionStrategy> extractionChain;
  private final GeneratorMetrics metrics;

  public GeminiReplyGenerator(
      WebClient generatorWebClient,
      ObjectMapper objectMapper,
      GeneratorProperties properties,
      ConversationPromptRenderer promptRenderer,
      List<ReplyExtractionStrategy> extractionChain,
      GeneratorMetrics metrics) {
    this.webClient = generatorWebClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.promptRenderer = promptRenderer;
    this.extractionChain =
        extractionChain != null && !extractionChain.isEmpty()
            ? List.copyOf(extractionChain)
            : ReplyExtractors.defaultChain();
    this.metrics = metrics;
  }

  @Override
  public GeneratedReply generate(String prompt, List<ConversationTurn> history) {
    long start = System.nanoTime();
    GeneratedReply reply;
    try {
      reply = callUpstream(prompt, history);
    } catch (RuntimeException unexpected) {
      log.error("Unexpected failure while generating reply with model {}", properties.getModel(), unexpected);
      reply = failure(GenerationOutcome.TRANSPORT_FAILURE);
    }
    if (metrics != null) {
      metrics.record(reply.outcome(), System.nanoTime() - start);
    }
    return reply;
  }

  private GeneratedReply callUpstream(String prompt, List<ConversationTurn> history) {
    String apiKey = properties.getApiKey();
    if (!StringUtils.hasText(apiKey)) {
      log.warn("Generator API key is not configured, returning fallback reply");
      return failure(GenerationOutcome.NOT_CONFIGURED);
    }

    String context = promptRenderer.render(prompt, history);
    if (log.isDebugEnabled()) {
      log.debug(
          "Requesting reply from model {} with {} context turns ({} chars)",
          properties.getModel(),
          history != null ? history.size() : 0,
          context.length());
    }

    String body;
    try {
      body =
          webClient
              .post()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path(GENERATE_PATH)
                          .queryParam("key", apiKey.trim())
                          .build(properties.getModel()))
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_JSON)
              .bodyValue(requestBody(context))
              .retrieve()
              .bodyToMono(String.class)
              .timeout(properties.getTimeout())
              .block();
    } catch (WebClientResponseException httpError) {
      log.warn(
          "Generator model {} answered HTTP {}", properties.getModel(), httpError.getStatusCode().value());
      return failure(GenerationOutcome.HTTP_ERROR);
    } catch (RuntimeException transportError) {
      log.warn(
          "Generator call to model {} failed: {}", properties.getModel(), describe(transportError));
      return failure(GenerationOutcome.TRANSPORT_FAILURE);
    }

    if (!StringUtils.hasText(body)) {
      log.warn("Generator model {} returned an empty body", properties.getModel());
      return failure(GenerationOutcome.MALFORMED_PAYLOAD);
    }

    JsonNode payload;
    try {
      payload = objectMapper.readTree(body);
    } catch (JsonProcessingException parseError) {
      log.warn(
          "Generator model {} returned a non-JSON body: {}",
          properties.getModel(),
          parseError.getOriginalMessage());
      return failure(GenerationOutcome.MALFORMED_PAYLOAD);
    }

    Optional<String> text = ReplyExtractors.extract(payload, extractionChain);
    if (text.isEmpty()) {
      log.warn("No reply text found in generator payload from model {}", properties.getModel());
      return GeneratedReply.fallback(
          properties.getEmptyReplyFallback(), GenerationOutcome.EMPTY_REPLY);
    }
    return GeneratedReply.generated(text.get());
  }

  private ObjectNode requestBody(String context) {
    ObjectNode root = objectMapper.createObjectNode();
    root.putArray("contents").addObject().putArray("parts").addObject().put("text", context);
    ObjectNode generationConfig = root.putObject("generationConfig");
    generationConfig.put("temperature", properties.getTemperature());
    generationConfig.put("maxOutputTokens", properties.getMaxOutputTokens());
    return root;
  }

  private GeneratedReply failure(GenerationOutcome outcome) {
    return GeneratedReply.fallback(properties.getFailureFallback(), outcome);
  }

  private String describe(Throwable error) {
    Throwable root = error;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    String message = root.getMessage();
    String apiKey = properties.getApiKey();
    if (message != null && StringUtils.hasText(apiKey)) {
      message = message.replace(apiKey.trim(), "***");
    }
    return root.getClass().getSimpleName() + (message != null ? ": " + message : "");
  }
}
