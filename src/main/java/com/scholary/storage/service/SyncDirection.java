package com.scholary.storage.service;

public enum SyncDirection {
  PRIMARY_TO_BACKUP,
  BACKUP_TO_PRIMARY,
  BIDIRECTIONAL
}
