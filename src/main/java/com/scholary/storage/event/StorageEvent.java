package com.scholary.storage.event;

import java.time.Instant;
import java.util.Map;

/**
 * A completed storage operation, handed to {@link StorageEventListener}s.
 *
 * @param type what happened
 * @param key object key
 * @param provider primary provider id
 * @param size bytes written, 0 for deletes
 * @param backup whether the backup provider was updated as well
 * @param actor uploader id when known
 * @param occurredAt completion time
 * @param attributes extra values such as the original file name
 */
public record StorageEvent(
    Type type,
    String key,
    String provider,
    long size,
    boolean backup,
    String actor,
    Instant occurredAt,
    Map<String, String> attributes) {

  public enum Type {
    UPLOADED,
    DELETED,
    MIGRATED,
    SYNCED
  }

  public StorageEvent {
    attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
  }
}
