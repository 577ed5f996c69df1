package com.scholary.storage.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call so that a JSON
 * encoder or a pattern layout can pick them up as separate columns.
 */
public class StructuredLogger {

  private static final String[] EVENT_FIELDS = {
    "event_type",
    "operation",
    "attempt",
    "maxAttempts",
    "delayMs",
    "errorKind",
    "backupProvider",
    "processed",
    "total",
    "succeeded",
    "failed",
    "skipped",
    "direction"
  };

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a retry that is about to be scheduled. */
  public void logRetry(
      String operation,
      int attempt,
      int maxAttempts,
      long delayMs,
      String errorKind,
      String message) {
    try {
      MDC.put("event_type", "storage_retry");
      MDC.put("operation", operation);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("delayMs", String.valueOf(delayMs));
      MDC.put("errorKind", errorKind);

      logger.warn(
          "Storage retry: operation={}, attempt={}/{}, delay={}ms, error={}, message={}",
          operation,
          attempt,
          maxAttempts,
          delayMs,
          errorKind,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log an operation that failed for good. */
  public void logOperationFailed(String operation, int attempts, String errorKind, String message) {
    try {
      MDC.put("event_type", "storage_failed");
      MDC.put("operation", operation);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorKind", errorKind);

      logger.error(
          "Storage operation failed: operation={}, attempts={}, error={}, message={}",
          operation,
          attempts,
          errorKind,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed write to the backup provider. */
  public void logBackupFailed(String operation, String backupProvider, String message) {
    try {
      MDC.put("event_type", "backup_failed");
      MDC.put("operation", operation);
      MDC.put("backupProvider", backupProvider);

      logger.warn(
          "Backup {} failed: provider={}, message={}", operation, backupProvider, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log migration progress. */
  public void logMigrationProgress(
      int processed, int total, int succeeded, int skipped, int failed) {
    try {
      MDC.put("event_type", "migration_progress");
      MDC.put("processed", String.valueOf(processed));
      MDC.put("total", String.valueOf(total));
      MDC.put("succeeded", String.valueOf(succeeded));
      MDC.put("skipped", String.valueOf(skipped));
      MDC.put("failed", String.valueOf(failed));

      logger.info(
          "Migration progress: files={}/{}, migrated={}, skipped={}, errors={}",
          processed,
          total,
          succeeded,
          skipped,
          failed);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of a sync run. */
  public void logSyncFinished(String direction, int succeeded, int failed, int conflicts) {
    try {
      MDC.put("event_type", "sync_finished");
      MDC.put("direction", direction);
      MDC.put("succeeded", String.valueOf(succeeded));
      MDC.put("failed", String.valueOf(failed));
      MDC.put("skipped", String.valueOf(conflicts));

      logger.info(
          "Sync finished: direction={}, copied={}, failed={}, conflicts={}",
          direction,
          succeeded,
          failed,
          conflicts);
    } finally {
      clearEventFields();
    }
  }

  /** Set operation context in MDC. */
  public static void setOperationContext(String operationId, String provider, String key) {
    MDC.put("operationId", operationId);
    MDC.put("provider", provider);
    if (key != null) {
      MDC.put("key", key);
    }
  }

  /** Clear operation context from MDC. */
  public static void clearOperationContext() {
    MDC.remove("operationId");
    MDC.remove("provider");
    MDC.remove("key");
  }

  private void clearEventFields() {
    for (String field : EVENT_FIELDS) {
      MDC.remove(field);
    }
  }
}
