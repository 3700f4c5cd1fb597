package com.flamingo.ai.museumguide.service.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.domain.enums.MessageRole;
import com.flamingo.ai.museumguide.domain.model.ChatTurn;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemorySessionStore Tests")
class InMemorySessionStoreTest {

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private InMemorySessionStore store;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    store = new InMemorySessionStore(ragConfig, meterRegistry);
  }

  @Nested
  @DisplayName("history")
  class History {

    @Test
    @DisplayName("should be empty for an unknown session without creating it")
    void shouldBeEmptyForUnknownSession() {
      assertThat(store.getHistory("nobody")).isEmpty();
      assertThat(store.exists("nobody")).isFalse();
      assertThat(store.lastActivity("nobody")).isEmpty();
    }

    @Test
    @DisplayName("should record exchanges in order as user then assistant")
    void shouldRecordExchangesInOrder() {
      store.appendExchange("s1", "When was ITRI founded?", "In 1973.");
      store.appendExchange("s1", "Where?", "In Hsinchu.");

      List<ChatTurn> history = store.getHistory("s1");

      assertThat(history)
          .extracting(ChatTurn::role)
          .containsExactly(
              MessageRole.USER, MessageRole.ASSISTANT, MessageRole.USER, MessageRole.ASSISTANT);
      assertThat(history)
          .extracting(ChatTurn::content)
          .containsExactly("When was ITRI founded?", "In 1973.", "Where?", "In Hsinchu.");
      assertThat(meterRegistry.counter("session.exchanges.recorded").count()).isEqualTo(2.0);
      assertThat(store.lastActivity("s1")).isPresent();
    }

    @Test
    @DisplayName("should keep sessions isolated")
    void shouldIsolateSessions() {
      store.appendExchange("a", "question a", "answer a");
      store.append("b", MessageRole.USER, "question b");

      assertThat(store.getHistory("a")).hasSize(2);
      assertThat(store.getHistory("b"))
          .singleElement()
          .extracting(ChatTurn::content)
          .isEqualTo("question b");
    }

    @Test
    @DisplayName("should drop the oldest messages beyond the history cap")
    void shouldTruncateToCap() {
      ragConfig.getSession().setMaxHistoryMessages(4);

      for (int i = 0; i < 5; i++) {
        store.appendExchange("s1", "q" + i, "a" + i);
      }

      assertThat(store.getHistory("s1"))
          .extracting(ChatTurn::content)
          .containsExactly("q3", "a3", "q4", "a4");
    }

    @Test
    @DisplayName("should return a snapshot unaffected by later appends")
    void shouldReturnSnapshot() {
      store.appendExchange("s1", "q", "a");
      List<ChatTurn> snapshot = store.getHistory("s1");

      store.appendExchange("s1", "q2", "a2");

      assertThat(snapshot).hasSize(2);
    }
  }

  @Nested
  @DisplayName("clear and close")
  class ClearAndClose {

    @Test
    @DisplayName("clear should empty the history but keep the session")
    void clearShouldKeepSession() {
      store.appendExchange("s1", "q", "a");

      assertThat(store.clear("s1")).isEqualTo(2);
      assertThat(store.getHistory("s1")).isEmpty();
      assertThat(store.exists("s1")).isTrue();
    }

    @Test
    @DisplayName("clear of an unknown session should create it empty")
    void clearShouldCreateUnknownSession() {
      assertThat(store.clear("fresh")).isZero();
      assertThat(store.exists("fresh")).isTrue();
    }

    @Test
    @DisplayName("close should remove the session")
    void closeShouldRemoveSession() {
      store.appendExchange("s1", "q", "a");

      assertThat(store.close("s1")).isEqualTo(2);
      assertThat(store.exists("s1")).isFalse();
      assertThat(store.close("s1")).isZero();
    }

    @Test
    @DisplayName("appending after close should start a new session")
    void appendAfterCloseShouldStartFresh() {
      store.appendExchange("s1", "old", "old answer");
      store.close("s1");

      store.appendExchange("s1", "new", "new answer");

      assertThat(store.getHistory("s1")).extracting(ChatTurn::content).containsExactly(
          "new", "new answer");
    }
  }

  @Test
  @DisplayName("concurrent exchanges on one session should keep every pair adjacent")
  void concurrentExchangesShouldStayPaired() throws Exception {
    ragConfig.getSession().setMaxHistoryMessages(0);
    int threads = 8;
    int perThread = 50;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        int thread = t;
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < perThread; i++) {
                    store.appendExchange("shared", "q" + thread + "-" + i, "a" + thread + "-" + i);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }

    List<ChatTurn> history = store.getHistory("shared");
    assertThat(history).hasSize(threads * perThread * 2);
    for (int i = 0; i < history.size(); i += 2) {
      assertThat(history.get(i).role()).isEqualTo(MessageRole.USER);
      assertThat(history.get(i + 1).content())
          .isEqualTo("a" + history.get(i).content().substring(1));
    }
  }

  @Test
  @DisplayName("a session held busy should not block work on another session")
  void busySessionShouldNotBlockOtherSessions() throws Exception {
    CountDownLatch holdingA = new CountDownLatch(1);
    CountDownLatch releaseA = new CountDownLatch(1);
    AtomicReference<Thread> writerA = new AtomicReference<>();
    // the history cap is read while the session lock is held, which lets the test park inside it
    ragConfig.setSession(
        new RagConfig.Session() {
          @Override
          public int getMaxHistoryMessages() {
            if (Thread.currentThread() == writerA.get()) {
              holdingA.countDown();
              try {
                releaseA.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            }
            return super.getMaxHistoryMessages();
          }
        });
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<?> busy =
          pool.submit(
              () -> {
                writerA.set(Thread.currentThread());
                store.appendExchange("a", "question a", "answer a");
              });
      assertThat(holdingA.await(2, TimeUnit.SECONDS)).isTrue();

      Future<?> other = pool.submit(() -> store.appendExchange("b", "question b", "answer b"));

      other.get(500, TimeUnit.MILLISECONDS);
      assertThat(store.getHistory("b")).hasSize(2);
      assertThat(store.exists("b")).isTrue();
      assertThat(busy.isDone()).isFalse();

      releaseA.countDown();
      busy.get(2, TimeUnit.SECONDS);
      assertThat(store.getHistory("a")).hasSize(2);
    } finally {
      releaseA.countDown();
      pool.shutdownNow();
    }
  }
}
