package com.flamingo.ai.museumguide.service.rag.index;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A reader's hold on one {@link IndexSnapshot}. While any lease on a replaced snapshot is open its
 * dense collection is kept; closing the last one lets the collection be dropped. Closing twice is
 * a no-op.
 */
public final class IndexLease implements AutoCloseable {

  private final IndexSnapshot snapshot;
  private final Runnable onRelease;
  private final AtomicBoolean released = new AtomicBoolean(false);

  public IndexLease(IndexSnapshot snapshot, Runnable onRelease) {
    this.snapshot = snapshot;
    this.onRelease = onRelease;
  }

  public IndexSnapshot snapshot() {
    return snapshot;
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      onRelease.run();
    }
  }
}
