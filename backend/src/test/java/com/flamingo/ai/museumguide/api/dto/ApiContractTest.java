package com.flamingo.ai.museumguide.api.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.museumguide.api.dto.request.QueryRequest;
import com.flamingo.ai.museumguide.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.museumguide.domain.model.Chunk;
import com.flamingo.ai.museumguide.domain.model.RetrievalResult;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Wire format of the streaming events and the query request accepted by the API. */
class ApiContractTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Nested
  @DisplayName("stream events")
  class StreamEvents {

    @Test
    @DisplayName("context event should carry rank, source and score")
    void contextEventShape() throws Exception {
      RetrievalResult result =
          new RetrievalResult(
              "itri.txt_0",
              "ITRI was founded in 1973.",
              Map.of(Chunk.META_SOURCE, "itri.txt", Chunk.META_TITLE, "History"),
              0.8,
              0.4,
              1.0,
              1.0,
              1.0,
              0);

      JsonNode json = objectMapper.valueToTree(StreamChunkResponse.context(1, result));

      assertThat(json.get("eventType").asText()).isEqualTo("context");
      assertThat(json.at("/data/rank").asInt()).isEqualTo(1);
      assertThat(json.at("/data/chunkId").asText()).isEqualTo("itri.txt_0");
      assertThat(json.at("/data/source").asText()).isEqualTo("itri.txt");
      assertThat(json.at("/data/title").asText()).isEqualTo("History");
      assertThat(json.has("terminal")).isFalse();
    }

    @Test
    @DisplayName("done event should carry tone, degraded flag and token count")
    void doneEventShape() {
      StreamChunkResponse done = StreamChunkResponse.done("elder_friendly", true, 12);

      JsonNode json = objectMapper.valueToTree(done);

      assertThat(done.isTerminal()).isTrue();
      assertThat(json.at("/data/tone").asText()).isEqualTo("elder_friendly");
      assertThat(json.at("/data/degraded").asBoolean()).isTrue();
      assertThat(json.at("/data/tokenCount").asInt()).isEqualTo(12);
    }

    @Test
    @DisplayName("only done and error should be terminal")
    void terminalEvents() {
      assertThat(StreamChunkResponse.token("x").isTerminal()).isFalse();
      assertThat(StreamChunkResponse.error("abcd1234", "failed").isTerminal()).isTrue();
    }
  }

  @Nested
  @DisplayName("query request")
  class QueryRequestContract {

    @Test
    @DisplayName("should accept the snake_case field names")
    void shouldAcceptAliases() throws Exception {
      QueryRequest request =
          objectMapper.readValue(
              "{\"query\": \"When was ITRI founded?\", \"session_id\": \"kiosk-3\","
                  + " \"include_history\": false, \"user_description\": \"a boy\","
                  + " \"apply_tone_conversion\": true}",
              QueryRequest.class);

      assertThat(request.getText()).isEqualTo("When was ITRI founded?");
      assertThat(request.effectiveSessionId()).isEqualTo("kiosk-3");
      assertThat(request.isIncludeHistory()).isFalse();
      assertThat(request.getAuxiliaryContext()).isEqualTo("a boy");
      assertThat(request.isApplyStyleConversion()).isTrue();
    }

    @Test
    @DisplayName("should default the session, history and style flags")
    void shouldApplyDefaults() throws Exception {
      QueryRequest request = objectMapper.readValue("{\"text\": \"Hi\"}", QueryRequest.class);

      assertThat(request.effectiveSessionId()).isEqualTo(QueryRequest.DEFAULT_SESSION_ID);
      assertThat(request.isIncludeHistory()).isTrue();
      assertThat(request.isApplyStyleConversion()).isFalse();
    }
  }
}
