package com.scholary.storage.path;

/** How generated keys are grouped into folders. */
public enum FolderLayout {
  /** No folder. */
  FLAT,
  /** {@code yyyy/MM}. */
  DATE_BASED,
  /** One folder per {@link FileCategory}. */
  TYPE_BASED,
  /** {@code users/{uploaderId}}. */
  USER_BASED,
  /** Pattern with {@code {year} {month} {day} {type} {userId} {timestamp}} placeholders. */
  CUSTOM
}
