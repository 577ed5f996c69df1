package com.scholary.storage.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for long-running migrations and syncs. Checked between items; a copy in
 * flight always completes.
 */
public class CancellationSignal {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public static CancellationSignal none() {
    return new CancellationSignal();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
