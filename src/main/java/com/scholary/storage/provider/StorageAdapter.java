package com.scholary.storage.provider;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Abstraction over one object storage backend.
 *
 * <p>All providers implement every operation. Optional features (acceleration, versioning,
 * on-the-fly image transforms) are reported through {@link #capabilities()} so callers never
 * branch on the provider type.
 *
 * <p>Implementations must be safe for concurrent use once constructed. Failures are thrown as
 * {@link com.scholary.storage.error.StorageException} with a classified kind.
 */
public interface StorageAdapter extends AutoCloseable {

  /**
   * Store bytes under a key. Uploading to an existing key replaces the object.
   *
   * @param data object content
   * @param key object key
   * @param options content type, metadata, visibility, cache control and tags
   * @return where the object landed
   */
  AdapterUploadResult upload(byte[] data, String key, UploadOptions options);

  /**
   * Delete an object. Deleting a key that does not exist is not an error.
   *
   * @return outcome with {@code deleted=false} when the key was absent
   */
  DeleteOutcome delete(String key);

  boolean exists(String key);

  /**
   * Metadata of an object.
   *
   * @throws com.scholary.storage.error.StorageException with kind NOT_FOUND when absent
   */
  ObjectMetadata getMetadata(String key);

  /**
   * One page of a listing.
   *
   * @param prefix key prefix, null or empty for the whole bucket
   * @param maxKeys page size
   * @param continuationToken token from the previous page, null for the first one
   */
  ListPage list(String prefix, int maxKeys, String continuationToken);

  /** Read an object fully into memory. */
  StoredObject download(String key);

  /**
   * Time-limited URL signed with the provider credentials.
   *
   * @throws com.scholary.storage.error.StorageException with kind CONFIGURATION when the provider
   *     has no signing credentials
   */
  String generateSignedUrl(String key, SignedUrlRequest request);

  /** Unsigned URL, using the configured public base URL when there is one. */
  String generatePublicUrl(String key);

  /**
   * Cheap reachability check that never writes.
   *
   * @throws com.scholary.storage.error.StorageException with kind CONNECTION and a readable reason
   */
  void testConnection();

  ProviderCapabilities capabilities();

  ProviderType providerType();

  ProviderInfo info();

  default String providerId() {
    return providerType().id();
  }

  /**
   * Follow continuation tokens until {@code maxKeys} objects were collected or the listing ends.
   */
  default List<ObjectSummary> listAll(String prefix, int maxKeys) {
    List<ObjectSummary> objects = new ArrayList<>();
    if (maxKeys <= 0) {
      return objects;
    }
    String token = null;
    do {
      ListPage page = list(prefix, Math.min(1000, maxKeys - objects.size()), token);
      objects.addAll(page.objects());
      token = page.nextContinuationToken();
    } while (token != null && objects.size() < maxKeys);
    return objects.size() > maxKeys ? objects.subList(0, maxKeys) : objects;
  }

  /**
   * Add image transform parameters to a URL. The default appends every set parameter as a query
   * parameter. Only used when {@link ProviderCapabilities#supportsTransform()} is true.
   */
  default String applyTransform(String key, String url, ImageTransform transform) {
    Map<String, String> params = transform.queryParameters(false);
    if (params.isEmpty()) {
      return url;
    }
    String query =
        params.entrySet().stream()
            .map(
                e ->
                    URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                        + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    return url + (url.contains("?") ? "&" : "?") + query;
  }

  /** Release clients and connections. */
  @Override
  void close();

  /** Object metadata from a HEAD request. */
  record ObjectMetadata(
      long size,
      String contentType,
      String etag,
      Map<String, String> customMetadata,
      Instant lastModified) {}

  /** Entry of a listing. */
  record ObjectSummary(String key, long size, String etag, Instant lastModified) {}

  /** Page of a listing; the token is null on the last page. */
  record ListPage(List<ObjectSummary> objects, String nextContinuationToken) {}

  /** Downloaded object. */
  record StoredObject(
      byte[] data, String contentType, Map<String, String> metadata, String etag) {}

  /** Result of a delete call. */
  record DeleteOutcome(String key, boolean deleted) {}
}
