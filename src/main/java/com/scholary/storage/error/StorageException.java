package com.scholary.storage.error;

/**
 * Exception thrown when a storage operation fails.
 *
 * <p>Runtime exception carrying an {@link ErrorKind} so that the retry loop and the service layer
 * can decide what to do without inspecting provider-specific exception types. The provider id and
 * object key are attached when known.
 */
public class StorageException extends RuntimeException {

  private final ErrorKind kind;
  private final String provider;
  private final String key;

  public StorageException(ErrorKind kind, String message) {
    this(kind, message, null, null, null);
  }

  public StorageException(ErrorKind kind, String message, Throwable cause) {
    this(kind, message, null, null, cause);
  }

  public StorageException(
      ErrorKind kind, String message, String provider, String key, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.provider = provider;
    this.key = key;
  }

  public ErrorKind kind() {
    return kind;
  }

  public String provider() {
    return provider;
  }

  public String key() {
    return key;
  }

  public boolean isRetriable() {
    return kind.isRetriable();
  }
}
