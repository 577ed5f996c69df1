package com.scholary.storage.error;

/**
 * Classification of storage failures.
 *
 * <p>The kind decides how many times an operation may be attempted. Caller mistakes and missing
 * objects fail fast. Network trouble gets a bounded backoff loop. Failures the backend reported
 * without saying why get exactly one more attempt.
 */
public enum ErrorKind {
  CONFIGURATION(Retry.NEVER),
  AUTHENTICATION(Retry.NEVER),
  VALIDATION(Retry.NEVER),
  NOT_FOUND(Retry.NEVER),
  CONNECTION(Retry.BACKOFF),
  TIMEOUT(Retry.BACKOFF),
  UPLOAD(Retry.ONCE),
  DELETE(Retry.ONCE),
  STORAGE(Retry.ONCE);

  /** Retry behaviour attached to a kind. */
  public enum Retry {
    NEVER,
    ONCE,
    BACKOFF
  }

  private final Retry retry;

  ErrorKind(Retry retry) {
    this.retry = retry;
  }

  public Retry retry() {
    return retry;
  }

  public boolean isRetriable() {
    return retry != Retry.NEVER;
  }
}
