package com.scholary.storage.url;

/**
 * Canonical identity of a generated URL. Two requests that would produce the same URL map to equal
 * keys.
 */
public record UrlCacheKey(
    String objectKey,
    boolean signed,
    long expiresInSeconds,
    String transform,
    String variant,
    String purpose) {}
