package com.scholary.storage.service;

/**
 * A file offered for migration.
 *
 * @param path path relative to the source root, using {@code /} separators
 * @param mimeType MIME type, may be null
 * @param size size in bytes
 * @param isPublic whether the migrated object should be publicly readable
 */
public record LocalFile(String path, String mimeType, long size, boolean isPublic) {}
