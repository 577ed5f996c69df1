package com.scholary.storage.provider;

import java.util.Map;

/**
 * Per-object options for an upload.
 *
 * @param contentType MIME type; null means {@code application/octet-stream}
 * @param metadata user metadata stored with the object
 * @param isPublic whether the object gets a public-read ACL where the provider supports ACLs
 * @param cacheControl Cache-Control header value
 * @param tags object tags
 */
public record UploadOptions(
    String contentType,
    Map<String, String> metadata,
    boolean isPublic,
    String cacheControl,
    Map<String, String> tags) {

  public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  public UploadOptions {
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    tags = tags != null ? Map.copyOf(tags) : Map.of();
  }

  public String effectiveContentType() {
    return contentType != null && !contentType.isBlank() ? contentType : DEFAULT_CONTENT_TYPE;
  }
}
