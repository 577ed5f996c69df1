package com.scholary.storage.retry;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff with jitter.
 *
 * <p>The delay before retry {@code n} (1-based) is {@code baseDelay * factor^(n-1)}, capped at
 * {@code maxDelay}, plus a random jitter in {@code [0, jitter)}.
 *
 * @param maxRetries retries allowed for connection and timeout failures
 * @param baseDelay delay before the first retry
 * @param factor multiplier applied per retry
 * @param maxDelay cap applied before jitter
 * @param jitter upper bound of the random extra delay
 */
public record BackoffPolicy(
    int maxRetries, Duration baseDelay, double factor, Duration maxDelay, Duration jitter) {

  public static BackoffPolicy defaults() {
    return new BackoffPolicy(
        3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), Duration.ofSeconds(1));
  }

  /** Policy without any waiting, used where retries must not slow the caller down. */
  public static BackoffPolicy immediate(int maxRetries) {
    return new BackoffPolicy(maxRetries, Duration.ZERO, 1.0, Duration.ZERO, Duration.ZERO);
  }

  public long delayMillis(int retry, Random random) {
    double exponential = baseDelay.toMillis() * Math.pow(factor, Math.max(0, retry - 1));
    long capped = (long) Math.min(exponential, maxDelay.toMillis());
    long jitterMs = jitter.toMillis();
    return capped + (jitterMs > 0 ? (long) (random.nextDouble() * jitterMs) : 0);
  }
}
