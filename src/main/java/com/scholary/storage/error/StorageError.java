package com.scholary.storage.error;

/**
 * Failure description returned to callers instead of a thrown exception.
 *
 * <p>The message is always sanitized.
 */
public record StorageError(ErrorKind kind, String message, String provider, String key) {

  public static StorageError from(StorageException e) {
    return new StorageError(
        e.kind(), ErrorSanitizer.sanitize(e.getMessage()), e.provider(), e.key());
  }
}
