package com.flamingo.ai.museumguide.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.service.session.InMemorySessionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("SessionController Tests")
class SessionControllerTest {

  private MockMvc mockMvc;
  private InMemorySessionStore sessionStore;

  @BeforeEach
  void setUp() {
    sessionStore = new InMemorySessionStore(new RagConfig(), new SimpleMeterRegistry());
    mockMvc = MockMvcBuilders.standaloneSetup(new SessionController(sessionStore)).build();
  }

  @Test
  @DisplayName("Should return the session history in order")
  void shouldReturnHistory() throws Exception {
    sessionStore.appendExchange("s1", "When was ITRI founded?", "In 1973.");

    mockMvc
        .perform(get("/api/rag/sessions/{sessionId}/history", "s1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sessionId").value("s1"))
        .andExpect(jsonPath("$.exchangeCount").value(1))
        .andExpect(jsonPath("$.messages.length()").value(2))
        .andExpect(jsonPath("$.messages[0].role").value("USER"))
        .andExpect(jsonPath("$.messages[1].content").value("In 1973."));
  }

  @Test
  @DisplayName("Should return an empty history for an unknown session")
  void shouldReturnEmptyHistory() throws Exception {
    mockMvc
        .perform(get("/api/rag/sessions/{sessionId}/history", "unknown"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.messages.length()").value(0))
        .andExpect(jsonPath("$.exchangeCount").value(0));
  }

  @Test
  @DisplayName("Should clear the history and keep the session")
  void shouldClearHistory() throws Exception {
    sessionStore.appendExchange("s1", "q", "a");

    mockMvc
        .perform(delete("/api/rag/sessions/{sessionId}/history", "s1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.removedMessages").value(2))
        .andExpect(jsonPath("$.active").value(true));

    assertThat(sessionStore.getHistory("s1")).isEmpty();
    assertThat(sessionStore.exists("s1")).isTrue();
  }

  @Test
  @DisplayName("Should close the session")
  void shouldCloseSession() throws Exception {
    sessionStore.appendExchange("s1", "q", "a");

    mockMvc
        .perform(post("/api/rag/sessions/{sessionId}/close", "s1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(false));

    assertThat(sessionStore.exists("s1")).isFalse();
  }
}
