package com.scholary.storage.retry;

import com.scholary.storage.error.ErrorClassifier;
import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import com.scholary.storage.logging.StructuredLogger;
import java.util.Random;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Runs a provider call under the retry rules of its {@link ErrorKind}.
 *
 * <p>Connection and timeout failures are retried with exponential backoff up to {@link
 * BackoffPolicy#maxRetries()}. Generic upload/delete failures get one more attempt. Configuration,
 * authentication, validation and not-found failures are surfaced on the first attempt. When the
 * budget runs out the last classified error is thrown. Any other exception is a programming error
 * and propagates untouched.
 */
public class RetryExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);

  /** Pause between attempts. Tests replace it to avoid real waiting. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final BackoffPolicy policy;
  private final Sleeper sleeper;
  private final Random random;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public RetryExecutor(BackoffPolicy policy) {
    this(policy, Thread::sleep, new Random());
  }

  public RetryExecutor(BackoffPolicy policy, Sleeper sleeper, Random random) {
    this.policy = policy;
    this.sleeper = sleeper;
    this.random = random;
  }

  public <T> T execute(RetryContext context, Supplier<T> action) {
    while (true) {
      context.recordAttempt();
      try {
        return action.get();
      } catch (StorageException | SdkException e) {
        StorageException failure =
            ErrorClassifier.classify(
                e, context.fallbackKind(), context.provider(), context.key());
        context.recordFailure(failure.kind());

        int maxAttempts = maxAttempts(failure.kind());
        if (context.attempts() >= maxAttempts) {
          if (maxAttempts > 1) {
            structuredLogger.logOperationFailed(
                context.operation(),
                context.attempts(),
                failure.kind().name(),
                failure.getMessage());
          }
          throw failure;
        }

        long delayMs =
            failure.kind().retry() == ErrorKind.Retry.BACKOFF
                ? policy.delayMillis(context.attempts(), random)
                : 0L;
        structuredLogger.logRetry(
            context.operation(),
            context.attempts(),
            maxAttempts,
            delayMs,
            failure.kind().name(),
            failure.getMessage());
        pause(delayMs, context);
      }
    }
  }

  /** Run an action that has no result. */
  public void run(RetryContext context, Runnable action) {
    execute(
        context,
        () -> {
          action.run();
          return null;
        });
  }

  int maxAttempts(ErrorKind kind) {
    switch (kind.retry()) {
      case BACKOFF:
        return policy.maxRetries() + 1;
      case ONCE:
        return 2;
      default:
        return 1;
    }
  }

  private void pause(long delayMs, RetryContext context) {
    if (delayMs <= 0) {
      return;
    }
    try {
      sleeper.sleep(delayMs);
      context.recordDelay(delayMs);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new StorageException(
          ErrorKind.CONNECTION,
          String.format("Retry of %s interrupted", context.operation()),
          context.provider(),
          context.key(),
          ie);
    }
  }
}
