package com.scholary.storage.service;

import java.util.List;

/**
 * Outcome of a sync run: the plan and one entry per attempted copy.
 *
 * @param cancelled whether the run stopped early on a cancellation signal
 */
public record SyncReport(
    SyncDirection direction, boolean dryRun, SyncPlan plan, boolean cancelled, List<Copy> copies) {

  public SyncReport {
    copies = List.copyOf(copies);
  }

  public enum Target {
    BACKUP,
    PRIMARY
  }

  /**
   * @param error sanitized failure reason, null on success
   */
  public record Copy(String key, Target target, boolean success, String error) {}

  public long succeeded() {
    return copies.stream().filter(Copy::success).count();
  }

  public long failed() {
    return copies.stream().filter(copy -> !copy.success()).count();
  }
}
