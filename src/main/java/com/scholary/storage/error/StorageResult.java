package com.scholary.storage.error;

import java.util.Objects;

/**
 * Outcome of a storage service operation: either data or an error, never both.
 *
 * @param <T> payload type
 */
public record StorageResult<T>(boolean success, T data, StorageError error) {

  public static <T> StorageResult<T> ok(T data) {
    return new StorageResult<>(true, data, null);
  }

  public static <T> StorageResult<T> failure(StorageError error) {
    return new StorageResult<>(false, null, Objects.requireNonNull(error, "error"));
  }

  public static <T> StorageResult<T> failure(StorageException e) {
    return failure(StorageError.from(e));
  }
}
