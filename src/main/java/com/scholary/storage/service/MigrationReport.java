package com.scholary.storage.service;

import java.util.List;

/**
 * Outcome of a migration run. Per-file failures are collected here and never abort the run.
 *
 * @param cancelled whether the run stopped early on a cancellation signal
 */
public record MigrationReport(
    int total, int migrated, int skipped, int failed, boolean cancelled, List<Item> items) {

  public MigrationReport {
    items = List.copyOf(items);
  }

  public enum Status {
    MIGRATED,
    SKIPPED,
    FAILED
  }

  /**
   * @param reason why the file was skipped or failed, null when migrated
   */
  public record Item(String path, String key, Status status, String reason) {}

  public List<Item> failures() {
    return items.stream().filter(item -> item.status() == Status.FAILED).toList();
  }
}
