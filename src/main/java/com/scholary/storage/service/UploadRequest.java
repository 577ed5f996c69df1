package com.scholary.storage.service;

import java.util.Map;

/**
 * One upload, normalized at the boundary.
 *
 * @param data file content
 * @param originalName file name as supplied by the uploader
 * @param mimeType MIME type, may be null
 * @param isPublic whether the object should be publicly readable
 * @param uploaderId id of the uploading user, may be null
 * @param metadata extra user metadata stored with the object
 * @param tags extra object tags
 * @param targetKey explicit key; null lets the path manager generate one
 */
public record UploadRequest(
    byte[] data,
    String originalName,
    String mimeType,
    boolean isPublic,
    String uploaderId,
    Map<String, String> metadata,
    Map<String, String> tags,
    String targetKey) {

  public UploadRequest {
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    tags = tags != null ? Map.copyOf(tags) : Map.of();
  }

  /** Public upload with a generated key and no extra metadata. */
  public static UploadRequest of(byte[] data, String originalName, String mimeType) {
    return new UploadRequest(data, originalName, mimeType, true, null, Map.of(), Map.of(), null);
  }

  public UploadRequest withTargetKey(String key) {
    return new UploadRequest(
        data, originalName, mimeType, isPublic, uploaderId, metadata, tags, key);
  }

  public UploadRequest withUploader(String uploader) {
    return new UploadRequest(
        data, originalName, mimeType, isPublic, uploader, metadata, tags, targetKey);
  }

  public UploadRequest withMetadata(Map<String, String> extra) {
    return new UploadRequest(
        data, originalName, mimeType, isPublic, uploaderId, extra, tags, targetKey);
  }

  public UploadRequest asPrivate() {
    return new UploadRequest(
        data, originalName, mimeType, false, uploaderId, metadata, tags, targetKey);
  }

  public long size() {
    return data != null ? data.length : 0L;
  }
}
