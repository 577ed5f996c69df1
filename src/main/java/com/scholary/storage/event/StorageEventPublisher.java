package com.scholary.storage.event;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fire-and-forget delivery of {@link StorageEvent}s to an explicit list of listeners. */
public class StorageEventPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(StorageEventPublisher.class);

  private final List<StorageEventListener> listeners;
  private final Executor executor;

  public StorageEventPublisher(List<StorageEventListener> listeners, Executor executor) {
    this.listeners = List.copyOf(listeners);
    this.executor = executor;
  }

  public void publish(StorageEvent event) {
    for (StorageEventListener listener : listeners) {
      try {
        executor.execute(() -> deliver(listener, event));
      } catch (RejectedExecutionException e) {
        LOGGER.warn(
            "Listener queue full, dropping event: type={}, key={}, listener={}",
            event.type(),
            event.key(),
            listener.getClass().getSimpleName());
      }
    }
  }

  private static void deliver(StorageEventListener listener, StorageEvent event) {
    try {
      listener.onEvent(event);
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Storage listener failed: type={}, key={}, listener={}",
          event.type(),
          event.key(),
          listener.getClass().getSimpleName(),
          e);
    }
  }
}
