package com.roomchat.backend.chat.generator;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
@EnableConfigurationProperties(GeneratorProperties.class)
public class GeneratorConfiguration {

  @Bean
  WebClient generatorWebClient(GeneratorProperties properties) {
    HttpClient httpClient =
        HttpClient.create()
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                (int) properties.getConnectTimeout().toMillis())
            .responseTimeout(properties.getTimeout());
    return WebClient.builder()
        .baseUrl(properties.getBaseUrl())
        .defaultHeader(HttpHeaders.ACCEPT, "application/json")
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .build();
  }

  @Bean
  GeneratorMetrics generatorMetrics(MeterRegistry meterRegistry) {
    return new GeneratorMetrics(meterRegistry);
  }

  @Bean
  ConversationPromptRenderer conversationPromptRenderer(GeneratorProperties properties) {
    return new ConversationPromptRenderer(properties.getHistoryLimit());
  }

  @Bean
  ReplyGenerator replyGenerator(
      WebClient generatorWebClient,
      ObjectMapper objectMapper,
      GeneratorProperties properties,
      ConversationPromptRenderer conversationPromptRenderer,
      GeneratorMetrics generatorMetrics) {
    return new GeminiReplyGenerator(
        generatorWebClient,
        objectMapper,
        properties,
        conversationPromptRenderer,
        ReplyExtractors.defaultChain(),
        generatorMetrics);
  }
}
