package com.scholary.storage.retry;

import com.scholary.storage.error.ErrorKind;

/**
 * State of one logical operation across its retries.
 *
 * <p>Created per call and dropped when the call returns or fails for good.
 */
public class RetryContext {

  private final String operation;
  private final String provider;
  private final String key;
  private final ErrorKind fallbackKind;

  private int attempts;
  private long totalDelayMs;
  private ErrorKind lastErrorKind;

  public RetryContext(String operation, String provider, String key, ErrorKind fallbackKind) {
    this.operation = operation;
    this.provider = provider;
    this.key = key;
    this.fallbackKind = fallbackKind;
  }

  void recordAttempt() {
    attempts++;
  }

  void recordFailure(ErrorKind kind) {
    lastErrorKind = kind;
  }

  void recordDelay(long delayMs) {
    totalDelayMs += delayMs;
  }

  public String operation() {
    return operation;
  }

  public String provider() {
    return provider;
  }

  public String key() {
    return key;
  }

  public ErrorKind fallbackKind() {
    return fallbackKind;
  }

  public int attempts() {
    return attempts;
  }

  public long totalDelayMs() {
    return totalDelayMs;
  }

  public ErrorKind lastErrorKind() {
    return lastErrorKind;
  }
}
