package com.scholary.storage.service;

import com.scholary.storage.provider.ProviderInfo;
import com.scholary.storage.url.UrlCache;

/**
 * Counters plus the state of the configured providers and the URL cache.
 *
 * @param backup null when no backup provider is configured
 */
public record StorageStatistics(
    StorageCounters.Snapshot counters,
    ProviderInfo primary,
    ProviderInfo backup,
    UrlCache.Stats urlCache) {}
