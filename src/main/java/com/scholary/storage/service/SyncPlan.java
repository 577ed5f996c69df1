package com.scholary.storage.service;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Keys to copy in each direction, plus keys that differ on both sides.
 *
 * <p>Conflicts are reported only; nothing is copied for them.
 */
public record SyncPlan(
    SortedSet<String> toBackup, SortedSet<String> toPrimary, SortedSet<String> conflicts) {

  public SyncPlan {
    toBackup = Collections.unmodifiableSortedSet(new TreeSet<>(toBackup));
    toPrimary = Collections.unmodifiableSortedSet(new TreeSet<>(toPrimary));
    conflicts = Collections.unmodifiableSortedSet(new TreeSet<>(conflicts));
  }

  public boolean isEmpty() {
    return toBackup.isEmpty() && toPrimary.isEmpty() && conflicts.isEmpty();
  }
}
