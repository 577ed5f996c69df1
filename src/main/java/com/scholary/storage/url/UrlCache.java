package com.scholary.storage.url;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded cache of generated URLs using Caffeine.
 *
 * <p>Each entry lives exactly as long as the URL it holds is valid. Reads re-check the absolute
 * expiry so an entry is never handed out at or after that instant, even before Caffeine's own
 * cleanup has run. The size bound evicts the least useful entries when it is reached.
 *
 * <p>A side index from object key to cache keys lets {@link #evictObject(String)} touch only the
 * entries of one object. Caffeine's removal listener prunes the index when entries leave.
 */
public class UrlCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(UrlCache.class);

  record CachedUrl(String url, Instant expiresAt) {}

  /** Snapshot of cache statistics for monitoring. */
  public record Stats(long size, long hits, long misses, long evictions) {}

  private final Clock clock;
  private final Cache<UrlCacheKey, CachedUrl> cache;
  private final Map<String, Set<UrlCacheKey>> keysByObject = new ConcurrentHashMap<>();

  public UrlCache(long maxSize, Clock clock) {
    this(maxSize, clock, ForkJoinPool.commonPool());
  }

  UrlCache(long maxSize, Clock clock, Executor maintenanceExecutor) {
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .executor(maintenanceExecutor)
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .expireAfter(
                new Expiry<UrlCacheKey, CachedUrl>() {
                  @Override
                  public long expireAfterCreate(
                      UrlCacheKey key, CachedUrl value, long currentTime) {
                    return remainingNanos(value);
                  }

                  @Override
                  public long expireAfterUpdate(
                      UrlCacheKey key, CachedUrl value, long currentTime, long currentDuration) {
                    return remainingNanos(value);
                  }

                  @Override
                  public long expireAfterRead(
                      UrlCacheKey key, CachedUrl value, long currentTime, long currentDuration) {
                    return currentDuration;
                  }
                })
            .removalListener(
                (UrlCacheKey key, CachedUrl value, RemovalCause cause) -> {
                  if (key != null && cause != RemovalCause.REPLACED) {
                    unindex(key);
                  }
                })
            .recordStats()
            .build();

    LOGGER.info("Initialized URL cache: maxSize={}", maxSize);
  }

  public Optional<String> get(UrlCacheKey key) {
    CachedUrl entry = cache.getIfPresent(key);
    if (entry == null) {
      LOGGER.debug("Cache miss: key={}", key.objectKey());
      return Optional.empty();
    }
    if (!clock.instant().isBefore(entry.expiresAt())) {
      cache.invalidate(key);
      LOGGER.debug("Cache entry expired: key={}", key.objectKey());
      return Optional.empty();
    }
    LOGGER.debug("Cache hit: key={}", key.objectKey());
    return Optional.of(entry.url());
  }

  public void put(UrlCacheKey key, String url, Duration ttl) {
    if (ttl.isZero() || ttl.isNegative()) {
      return;
    }
    cache.put(key, new CachedUrl(url, clock.instant().plus(ttl)));
    keysByObject.compute(
        key.objectKey(),
        (objectKey, keys) -> {
          Set<UrlCacheKey> indexed = keys != null ? keys : ConcurrentHashMap.newKeySet();
          indexed.add(key);
          return indexed;
        });
  }

  /** Drop every entry for an object, e.g. after it was deleted or replaced. */
  public void evictObject(String objectKey) {
    Set<UrlCacheKey> keys = keysByObject.remove(objectKey);
    if (keys != null) {
      cache.invalidateAll(keys);
      LOGGER.debug("Evicted cached URLs: key={}, entries={}", objectKey, keys.size());
    }
  }

  public void clear() {
    cache.invalidateAll();
    keysByObject.clear();
    LOGGER.info("URL cache cleared");
  }

  public Stats stats() {
    var stats = cache.stats();
    return new Stats(
        cache.estimatedSize(), stats.hitCount(), stats.missCount(), stats.evictionCount());
  }

  void cleanUp() {
    cache.cleanUp();
  }

  int indexedObjects() {
    return keysByObject.size();
  }

  // Keeps the key while a newer entry for it is live.
  private void unindex(UrlCacheKey key) {
    keysByObject.computeIfPresent(
        key.objectKey(),
        (objectKey, keys) -> {
          if (!cache.asMap().containsKey(key)) {
            keys.remove(key);
          }
          return keys.isEmpty() ? null : keys;
        });
  }

  private long remainingNanos(CachedUrl value) {
    long millis = Duration.between(clock.instant(), value.expiresAt()).toMillis();
    return TimeUnit.MILLISECONDS.toNanos(Math.max(0, millis));
  }
}
