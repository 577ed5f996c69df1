package com.scholary.storage.service;

import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/** Pure comparison of two key-to-etag listings. */
public final class SyncPlanner {

  private SyncPlanner() {}

  /**
   * @param primary key to etag on the primary provider
   * @param backup key to etag on the backup provider
   */
  public static SyncPlan plan(
      Map<String, String> primary, Map<String, String> backup, SyncDirection direction) {
    TreeSet<String> toBackup = new TreeSet<>();
    TreeSet<String> toPrimary = new TreeSet<>();
    TreeSet<String> conflicts = new TreeSet<>();

    if (direction != SyncDirection.BACKUP_TO_PRIMARY) {
      for (String key : primary.keySet()) {
        if (!backup.containsKey(key)) {
          toBackup.add(key);
        }
      }
    }
    if (direction != SyncDirection.PRIMARY_TO_BACKUP) {
      for (String key : backup.keySet()) {
        if (!primary.containsKey(key)) {
          toPrimary.add(key);
        }
      }
    }
    if (direction == SyncDirection.BIDIRECTIONAL) {
      for (Map.Entry<String, String> entry : primary.entrySet()) {
        String other = backup.get(entry.getKey());
        if (other != null && entry.getValue() != null && !Objects.equals(entry.getValue(), other)) {
          conflicts.add(entry.getKey());
        }
      }
    }
    return new SyncPlan(toBackup, toPrimary, conflicts);
  }
}
