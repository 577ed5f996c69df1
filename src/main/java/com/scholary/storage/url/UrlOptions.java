package com.scholary.storage.url;

import com.scholary.storage.provider.ImageTransform;
import java.time.Duration;

/**
 * Options of a URL request.
 *
 * @param isPrivate force a signed URL; null follows the global private-files setting
 * @param expiresIn signature and cache lifetime; null uses the configured default
 * @param transform image transform, ignored by providers that cannot transform
 * @param variant rendition suffix such as {@code thumbnail}, null for the original
 * @param forceRefresh bypass the cache for this call
 */
public record UrlOptions(
    Boolean isPrivate,
    Duration expiresIn,
    ImageTransform transform,
    String variant,
    boolean forceRefresh) {

  public static UrlOptions defaults() {
    return new UrlOptions(null, null, null, null, false);
  }

  public static UrlOptions signed(Duration expiresIn) {
    return new UrlOptions(true, expiresIn, null, null, false);
  }

  public UrlOptions withTransform(ImageTransform newTransform) {
    return new UrlOptions(isPrivate, expiresIn, newTransform, variant, forceRefresh);
  }

  public UrlOptions withVariant(String newVariant) {
    return new UrlOptions(isPrivate, expiresIn, transform, newVariant, forceRefresh);
  }

  public UrlOptions refreshed() {
    return new UrlOptions(isPrivate, expiresIn, transform, variant, true);
  }
}
