package com.flamingo.ai.museumguide.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.museumguide.exception.RetrievalUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);
    embeddingService = new EmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("should convert the model vector to a float list")
  void shouldEmbedQuery() {
    when(embeddingModel.embed("When was ITRI founded?"))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f, 0.3f})));

    List<Float> vector = embeddingService.embedQuery("When was ITRI founded?");

    assertThat(vector).containsExactly(0.1f, 0.2f, 0.3f);
    verify(counter).increment();
  }

  @Test
  @DisplayName("should truncate passages longer than the model accepts")
  void shouldTruncateLongPassages() {
    String longPassage = "工".repeat(6000);
    when(embeddingModel.embed("工".repeat(5000)))
        .thenReturn(Response.from(Embedding.from(new float[] {1f})));

    assertThat(embeddingService.embedPassage(longPassage)).containsExactly(1f);
  }

  @Test
  @DisplayName("should report query embedding failures as retrieval unavailable")
  void shouldWrapQueryFailures() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("model not found"));

    assertThatThrownBy(() -> embeddingService.embedQuery("robots"))
        .isInstanceOf(RetrievalUnavailableException.class)
        .hasMessageContaining("model not found");
  }

  @Test
  @DisplayName("should reject an empty vector")
  void shouldRejectEmptyVector() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[0])));

    assertThatThrownBy(() -> embeddingService.embedQuery("robots"))
        .isInstanceOf(RetrievalUnavailableException.class);
  }
}
