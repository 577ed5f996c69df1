package com.scholary.storage.provider;

/** Optional features a provider supports. Callers check these instead of the provider type. */
public record ProviderCapabilities(
    boolean supportsAcceleration, boolean supportsVersioning, boolean supportsTransform) {

  public static ProviderCapabilities none() {
    return new ProviderCapabilities(false, false, false);
  }

  public ProviderCapabilities withTransform(boolean transform) {
    return new ProviderCapabilities(supportsAcceleration, supportsVersioning, transform);
  }
}
