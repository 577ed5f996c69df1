package com.scholary.storage.provider;

/** Non-secret description of a configured provider. */
public record ProviderInfo(
    String type,
    String name,
    String region,
    String bucket,
    String endpoint,
    ProviderCapabilities capabilities) {}
