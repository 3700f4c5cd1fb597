package com.flamingo.ai.museumguide.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.ollama.OllamaStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models. The inference backend is either a local Ollama server
 * (default) or OpenAI, selected by {@code langchain4j.provider}.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  private static final String OPENAI = "openai";

  @Value("${langchain4j.provider:ollama}")
  private String provider;

  @Value("${langchain4j.temperature:0.7}")
  private double temperature;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String openAiChatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:2048}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String openAiEmbeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1024}")
  private int openAiEmbeddingDimensions;

  @Value("${langchain4j.ollama.base-url:http://localhost:11434}")
  private String ollamaBaseUrl;

  @Value("${langchain4j.ollama.chat-model.model-name:qwen2.5:7b}")
  private String ollamaChatModelName;

  @Value("${langchain4j.ollama.embedding-model.model-name:bge-m3}")
  private String ollamaEmbeddingModelName;

  @Bean
  public ChatModel chatModel() {
    if (isOpenAi()) {
      validateApiKey();
      return OpenAiChatModel.builder()
          .apiKey(openAiApiKey)
          .modelName(openAiChatModelName)
          .temperature(temperature)
          .maxCompletionTokens(maxCompletionTokens)
          .timeout(Duration.ofSeconds(60))
          .logRequests(false)
          .logResponses(false)
          .build();
    }
    log.info("Using Ollama chat model {} at {}", ollamaChatModelName, ollamaBaseUrl);
    return OllamaChatModel.builder()
        .baseUrl(ollamaBaseUrl)
        .modelName(ollamaChatModelName)
        .temperature(temperature)
        .timeout(Duration.ofSeconds(120))
        .build();
  }

  @Bean
  public StreamingChatModel streamingChatModel() {
    if (isOpenAi()) {
      validateApiKey();
      return OpenAiStreamingChatModel.builder()
          .apiKey(openAiApiKey)
          .modelName(openAiChatModelName)
          .temperature(temperature)
          .maxCompletionTokens(maxCompletionTokens)
          .timeout(Duration.ofSeconds(120))
          .logRequests(false)
          .logResponses(false)
          .build();
    }
    return OllamaStreamingChatModel.builder()
        .baseUrl(ollamaBaseUrl)
        .modelName(ollamaChatModelName)
        .temperature(temperature)
        .timeout(Duration.ofSeconds(120))
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    if (isOpenAi()) {
      validateApiKey();
      return OpenAiEmbeddingModel.builder()
          .apiKey(openAiApiKey)
          .modelName(openAiEmbeddingModelName)
          .dimensions(openAiEmbeddingDimensions)
          .timeout(Duration.ofSeconds(30))
          .build();
    }
    log.info("Using Ollama embedding model {} at {}", ollamaEmbeddingModelName, ollamaBaseUrl);
    return OllamaEmbeddingModel.builder()
        .baseUrl(ollamaBaseUrl)
        .modelName(ollamaEmbeddingModelName)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private boolean isOpenAi() {
    return OPENAI.equalsIgnoreCase(provider);
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
