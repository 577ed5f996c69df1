package com.scholary.storage.service;

/**
 * Options of one sync run.
 *
 * @param direction which side receives copies
 * @param dryRun plan only
 * @param prefix restrict the listing to keys with this prefix; null for all
 * @param publicCopies give copied objects a public-read ACL
 */
public record SyncOptions(
    SyncDirection direction, boolean dryRun, String prefix, boolean publicCopies) {

  public SyncOptions {
    direction = direction != null ? direction : SyncDirection.PRIMARY_TO_BACKUP;
  }

  public static SyncOptions defaults() {
    return new SyncOptions(SyncDirection.PRIMARY_TO_BACKUP, false, null, false);
  }

  public static SyncOptions of(SyncDirection direction) {
    return new SyncOptions(direction, false, null, false);
  }

  public SyncOptions asDryRun() {
    return new SyncOptions(direction, true, prefix, publicCopies);
  }

  public SyncOptions withPrefix(String keyPrefix) {
    return new SyncOptions(direction, dryRun, keyPrefix, publicCopies);
  }
}
