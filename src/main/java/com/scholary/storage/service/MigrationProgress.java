package com.scholary.storage.service;

/**
 * @param processed files handled so far, including skipped and failed ones
 * @param total files selected for migration
 * @param currentPath file that was just handled
 */
public record MigrationProgress(int processed, int total, String currentPath) {}
