package com.scholary.storage.service;

/**
 * Outcome of a delete. {@code deleted=false} means the key did not exist on the primary provider.
 */
public record DeleteResult(
    String key, boolean deleted, String provider, boolean backup, String backupError) {}
