package com.flamingo.ai.museumguide.service.session;

import com.flamingo.ai.museumguide.config.RagConfig;
import com.flamingo.ai.museumguide.domain.enums.MessageRole;
import com.flamingo.ai.museumguide.domain.model.ChatTurn;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Process-local {@link SessionStore}. Each session owns its lock; the map itself is only touched
 * through {@link ConcurrentHashMap} atomic operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InMemorySessionStore implements SessionStore {

  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();

  @Override
  public List<ChatTurn> getHistory(String sessionId) {
    SessionState state = sessions.get(sessionId);
    if (state == null) {
      return List.of();
    }
    state.lock.lock();
    try {
      return List.copyOf(state.history);
    } finally {
      state.lock.unlock();
    }
  }

  @Override
  public void append(String sessionId, MessageRole role, String content) {
    withSession(sessionId, state -> state.add(new ChatTurn(role, content, Instant.now())));
  }

  @Override
  public void appendExchange(String sessionId, String userMessage, String assistantMessage) {
    withSession(
        sessionId,
        state -> {
          state.add(ChatTurn.user(userMessage));
          state.add(ChatTurn.assistant(assistantMessage));
        });
    meterRegistry.counter("session.exchanges.recorded").increment();
  }

  @Override
  public int clear(String sessionId) {
    SessionState state = sessions.computeIfAbsent(sessionId, id -> new SessionState());
    state.lock.lock();
    try {
      int removed = state.history.size();
      state.history.clear();
      state.lastActivity = Instant.now();
      log.debug("Cleared {} messages from session {}", removed, sessionId);
      return removed;
    } finally {
      state.lock.unlock();
    }
  }

  @Override
  public int close(String sessionId) {
    SessionState state = sessions.remove(sessionId);
    if (state == null) {
      return 0;
    }
    state.lock.lock();
    try {
      int removed = state.history.size();
      state.history.clear();
      state.closed = true;
      log.info("Closed session {} ({} messages removed)", sessionId, removed);
      return removed;
    } finally {
      state.lock.unlock();
    }
  }

  @Override
  public boolean exists(String sessionId) {
    return sessions.containsKey(sessionId);
  }

  @Override
  public Optional<Instant> lastActivity(String sessionId) {
    SessionState state = sessions.get(sessionId);
    return state == null ? Optional.empty() : Optional.of(state.lastActivity);
  }

  private void withSession(String sessionId, Consumer<SessionState> action) {
    while (true) {
      SessionState state = sessions.computeIfAbsent(sessionId, id -> new SessionState());
      state.lock.lock();
      try {
        // a concurrent close() may have detached this state; retry against a fresh one
        if (state.closed) {
          continue;
        }
        action.accept(state);
        state.truncate(ragConfig.getSession().getMaxHistoryMessages());
        state.lastActivity = Instant.now();
        return;
      } finally {
        state.lock.unlock();
      }
    }
  }

  private static final class SessionState {
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<ChatTurn> history = new ArrayDeque<>();
    private volatile Instant lastActivity = Instant.now();
    private boolean closed;

    void add(ChatTurn turn) {
      history.addLast(turn);
    }

    void truncate(int maxMessages) {
      while (maxMessages > 0 && history.size() > maxMessages) {
        history.removeFirst();
      }
    }
  }
}
