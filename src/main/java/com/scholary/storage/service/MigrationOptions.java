package com.scholary.storage.service;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Options of one migration run.
 *
 * @param batchSize files per batch; 0 or less uses the configured default
 * @param dryRun compute keys without writing anything
 * @param skipExisting leave keys that already exist on the primary provider untouched
 * @param filter which files to migrate; null migrates all
 * @param onProgress called after every file; null for none
 */
public record MigrationOptions(
    int batchSize,
    boolean dryRun,
    boolean skipExisting,
    Predicate<LocalFile> filter,
    Consumer<MigrationProgress> onProgress) {

  public static MigrationOptions defaults() {
    return new MigrationOptions(0, false, false, null, null);
  }

  public MigrationOptions asDryRun() {
    return new MigrationOptions(batchSize, true, skipExisting, filter, onProgress);
  }

  public MigrationOptions withBatchSize(int size) {
    return new MigrationOptions(size, dryRun, skipExisting, filter, onProgress);
  }

  public MigrationOptions withFilter(Predicate<LocalFile> predicate) {
    return new MigrationOptions(batchSize, dryRun, skipExisting, predicate, onProgress);
  }

  public MigrationOptions withProgress(Consumer<MigrationProgress> listener) {
    return new MigrationOptions(batchSize, dryRun, skipExisting, filter, listener);
  }

  public MigrationOptions skippingExisting() {
    return new MigrationOptions(batchSize, dryRun, true, filter, onProgress);
  }
}
