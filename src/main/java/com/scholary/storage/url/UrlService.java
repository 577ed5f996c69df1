package com.scholary.storage.url;

import com.scholary.storage.config.StorageProperties.UrlProperties;
import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import com.scholary.storage.path.ObjectKeys;
import com.scholary.storage.path.PathManager;
import com.scholary.storage.provider.ImageTransform;
import com.scholary.storage.provider.SignedUrlRequest;
import com.scholary.storage.provider.StorageAdapter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces public, signed, transformed and variant URLs for stored objects.
 *
 * <p>The cache is consulted before anything else, so a repeated request costs no provider call.
 * Signed URLs are used when the caller asks for one or when private-files mode is on. Transforms
 * are applied only by providers that report {@code supportsTransform}; elsewhere the URL is
 * returned unchanged.
 */
public class UrlService {

  private static final Logger LOGGER = LoggerFactory.getLogger(UrlService.class);

  private final StorageAdapter adapter;
  private final PathManager pathManager;
  private final UrlProperties properties;
  private final UrlCache cache;
  private final Executor executor;

  public UrlService(
      StorageAdapter adapter,
      PathManager pathManager,
      UrlProperties properties,
      UrlCache cache,
      Executor executor) {
    this.adapter = adapter;
    this.pathManager = pathManager;
    this.properties = properties;
    this.cache = cache;
    this.executor = executor;
  }

  /**
   * URL for viewing an object.
   *
   * @throws StorageException VALIDATION for bad keys, CONFIGURATION when signing is impossible
   */
  public String generateUrl(String key, UrlOptions options) {
    ObjectKeys.validate(key);
    boolean signed = properties.privateFiles() || Boolean.TRUE.equals(options.isPrivate());
    Duration expiresIn = expiresIn(options.expiresIn());
    ImageTransform transform = options.transform();
    boolean transformed =
        transform != null && !transform.isEmpty() && adapter.capabilities().supportsTransform();

    UrlCacheKey cacheKey =
        new UrlCacheKey(
            key,
            signed,
            expiresIn.toSeconds(),
            transformed ? transform.canonical() : null,
            options.variant(),
            "view");
    if (!options.forceRefresh()) {
      var cached = cache.get(cacheKey);
      if (cached.isPresent()) {
        return cached.get();
      }
    }

    String targetKey = resolveVariant(key, options.variant());
    String url =
        signed
            ? adapter.generateSignedUrl(targetKey, SignedUrlRequest.get(expiresIn))
            : adapter.generatePublicUrl(targetKey);
    if (transformed) {
      url = adapter.applyTransform(targetKey, url, transform);
    }

    cache.put(cacheKey, url, expiresIn);
    LOGGER.debug(
        "Generated URL: key={}, signed={}, transformed={}", targetKey, signed, transformed);
    return url;
  }

  /**
   * Signed URL that makes browsers save the object under the given file name.
   *
   * @param filename name offered to the user; quotes are replaced
   */
  public String generateDownloadUrl(String key, String filename, Duration expiresIn) {
    ObjectKeys.validate(key);
    Duration ttl = expiresIn(expiresIn);
    String safeName = filename != null && !filename.isBlank() ? filename : lastSegment(key);
    safeName = safeName.replace("\"", "'").replace("\r", "").replace("\n", "");

    UrlCacheKey cacheKey =
        new UrlCacheKey(key, true, ttl.toSeconds(), null, null, "download:" + safeName);
    var cached = cache.get(cacheKey);
    if (cached.isPresent()) {
      return cached.get();
    }

    SignedUrlRequest request =
        new SignedUrlRequest(
            ttl,
            SignedUrlRequest.SignedOperation.GET,
            null,
            Map.of(
                SignedUrlRequest.CONTENT_DISPOSITION,
                "attachment; filename=\"" + safeName + "\""));
    String url = adapter.generateSignedUrl(key, request);
    cache.put(cacheKey, url, ttl);
    return url;
  }

  /** Signed PUT URL for uploading directly from a client. Never cached. */
  public String generateUploadUrl(String key, String contentType, Duration expiresIn) {
    ObjectKeys.validate(key);
    return adapter.generateSignedUrl(key, SignedUrlRequest.put(expiresIn(expiresIn), contentType));
  }

  /**
   * URLs for many keys, generated concurrently. The result has one URL per key in input order. The
   * batch fails as a whole when any key fails.
   */
  public List<String> batchGenerateUrls(List<String> keys, UrlOptions options) {
    List<CompletableFuture<String>> futures = new ArrayList<>(keys.size());
    for (String key : keys) {
      futures.add(CompletableFuture.supplyAsync(() -> generateUrl(key, options), executor));
    }

    List<String> urls = new ArrayList<>(keys.size());
    try {
      for (CompletableFuture<String> future : futures) {
        urls.add(future.join());
      }
    } catch (CompletionException e) {
      futures.forEach(future -> future.cancel(false));
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof StorageException) {
        throw (StorageException) cause;
      }
      throw new StorageException(ErrorKind.STORAGE, "Batch URL generation failed", cause);
    }
    return urls;
  }

  public void evict(String key) {
    cache.evictObject(key);
  }

  public void clearCache() {
    cache.clear();
  }

  public UrlCache.Stats cacheStats() {
    return cache.stats();
  }

  /** Variant key when the rendition exists, otherwise the original key. */
  private String resolveVariant(String key, String variant) {
    if (variant == null || variant.isBlank()) {
      return key;
    }
    String variantKey = pathManager.variantKey(key, variant);
    try {
      if (adapter.exists(variantKey)) {
        return variantKey;
      }
      LOGGER.debug("Variant not found, using original: variant={}, key={}", variantKey, key);
    } catch (StorageException e) {
      LOGGER.warn("Variant lookup failed, using original: key={}, kind={}", variantKey, e.kind());
    }
    return key;
  }

  private Duration expiresIn(Duration requested) {
    return requested != null ? requested : properties.signedUrlExpiry();
  }

  private static String lastSegment(String key) {
    int slash = key.lastIndexOf('/');
    return slash >= 0 ? key.substring(slash + 1) : key;
  }
}
