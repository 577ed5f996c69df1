package com.scholary.storage.service;

import java.util.Map;

/**
 * Outcome of a successful upload.
 *
 * @param key object key on the primary provider
 * @param url public URL of the object
 * @param size bytes stored, after optimization
 * @param provider primary provider id
 * @param etag etag returned by the primary provider
 * @param optimized whether the image optimizer changed the content
 * @param backup whether the backup provider holds a copy
 * @param variantKeys rendition suffix to key, for image uploads with variants enabled
 * @param backupError sanitized reason when the backup write failed, otherwise null
 */
public record UploadResult(
    String key,
    String url,
    long size,
    String provider,
    String etag,
    boolean optimized,
    boolean backup,
    Map<String, String> variantKeys,
    String backupError) {

  public UploadResult {
    variantKeys = variantKeys != null ? Map.copyOf(variantKeys) : Map.of();
  }
}
