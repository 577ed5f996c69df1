package com.scholary.storage.event;

/**
 * Callback for completed storage operations, e.g. to persist file records.
 *
 * <p>Listeners run asynchronously after the operation finished. Their failures are logged and never
 * change the operation result.
 */
@FunctionalInterface
public interface StorageEventListener {

  void onEvent(StorageEvent event);
}
