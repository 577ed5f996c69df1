package com.scholary.storage.service;

import java.util.concurrent.atomic.AtomicLong;

/** Process-wide operation counters. */
public class StorageCounters {

  private final AtomicLong uploads = new AtomicLong();
  private final AtomicLong downloads = new AtomicLong();
  private final AtomicLong deletes = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private final AtomicLong bytesUploaded = new AtomicLong();
  private final AtomicLong backupFailures = new AtomicLong();

  public void recordUpload(long bytes) {
    uploads.incrementAndGet();
    bytesUploaded.addAndGet(bytes);
  }

  public void recordDownload() {
    downloads.incrementAndGet();
  }

  public void recordDelete() {
    deletes.incrementAndGet();
  }

  public void recordError() {
    errors.incrementAndGet();
  }

  public void recordBackupFailure() {
    backupFailures.incrementAndGet();
  }

  public Snapshot snapshot() {
    return new Snapshot(
        uploads.get(),
        downloads.get(),
        deletes.get(),
        errors.get(),
        bytesUploaded.get(),
        backupFailures.get());
  }

  /**
   * @param downloads URL generations, not bytes served
   */
  public record Snapshot(
      long uploads,
      long downloads,
      long deletes,
      long errors,
      long bytesUploaded,
      long backupFailures) {}
}
