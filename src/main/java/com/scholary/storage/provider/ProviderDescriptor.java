package com.scholary.storage.provider;

import java.util.List;
import java.util.function.Function;

/**
 * Static description of a provider family: what it needs to be configured and how to build it.
 *
 * @param type provider family
 * @param displayName human readable name
 * @param requiredFields settings that must be present and non-blank
 * @param defaultRegion region used when none is configured
 * @param regions regions offered in configuration screens
 * @param capabilities optional features before per-instance settings are applied
 * @param endpointRule endpoint pattern, {@code {region}} and {@code {accountId}} are substituted;
 *     null when the SDK resolves the endpoint itself
 * @param constructor adapter constructor
 */
public record ProviderDescriptor(
    ProviderType type,
    String displayName,
    List<String> requiredFields,
    String defaultRegion,
    List<String> regions,
    ProviderCapabilities capabilities,
    String endpointRule,
    Function<ProviderConfig, StorageAdapter> constructor) {

  public String id() {
    return type.id();
  }

  /** Endpoint for a region, or null when the provider has no fixed endpoint pattern. */
  public String endpointFor(String region, String accountId) {
    if (endpointRule == null) {
      return null;
    }
    String resolvedRegion = region != null ? region : defaultRegion;
    String endpoint =
        endpointRule.replace("{region}", resolvedRegion != null ? resolvedRegion : "");
    // left as a placeholder when unknown, e.g. for display before an account id is entered
    return accountId != null ? endpoint.replace("{accountId}", accountId) : endpoint;
  }

  public ProviderDescriptor withConstructor(Function<ProviderConfig, StorageAdapter> replacement) {
    return new ProviderDescriptor(
        type,
        displayName,
        requiredFields,
        defaultRegion,
        regions,
        capabilities,
        endpointRule,
        replacement);
  }
}
