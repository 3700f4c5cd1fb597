package com.flamingo.ai.museumguide.service.chat;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs a blocking supplier on an executor and interrupts its worker thread when the returned
 * future is completed from outside, by {@code cancel} or a timeout. Blocking HTTP calls to the
 * model backends abort their request on interrupt, which releases the connection.
 */
final class InterruptibleTask {

  private InterruptibleTask() {}

  static <T> CompletableFuture<T> supply(Supplier<T> task, Executor executor) {
    CompletableFuture<T> result = new CompletableFuture<>();
    Object guard = new Object();
    Thread[] worker = new Thread[1];

    executor.execute(
        () -> {
          synchronized (guard) {
            if (result.isDone()) {
              return;
            }
            worker[0] = Thread.currentThread();
          }
          try {
            result.complete(task.get());
          } catch (Throwable t) {
            result.completeExceptionally(t);
          } finally {
            synchronized (guard) {
              worker[0] = null;
              // an interrupt aimed at this task must not leak into the pooled thread's next task
              Thread.interrupted();
            }
          }
        });

    result.whenComplete(
        (value, error) -> {
          synchronized (guard) {
            Thread running = worker[0];
            if (running != null && running != Thread.currentThread()) {
              running.interrupt();
            }
          }
        });
    return result;
  }
}
