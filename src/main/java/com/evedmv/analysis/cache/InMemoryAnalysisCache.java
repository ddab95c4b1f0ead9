package com.evedmv.analysis.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory implementation of AnalysisCache using Caffeine.
 *
 * <p>Every entry carries its own TTL, supplied on {@link #put}. Cache size is bounded and the least
 * useful entries are evicted once the limit is reached.
 */
public class InMemoryAnalysisCache implements AnalysisCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAnalysisCache.class);

  private final Cache<String, Entry> cache;

  public InMemoryAnalysisCache(long maxSize) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new PerEntryExpiry())
            .build();

    LOGGER.info("Initialized analysis cache: maxSize={}", maxSize);
  }

  @Override
  public Optional<Object> get(String namespace, String key) {
    Entry entry = cache.getIfPresent(AnalysisCache.compositeKey(namespace, key));
    if (entry != null) {
      LOGGER.debug("Cache hit: namespace={}, key={}", namespace, key);
      return Optional.of(entry.value());
    } else {
      LOGGER.debug("Cache miss: namespace={}, key={}", namespace, key);
      return Optional.empty();
    }
  }

  @Override
  public void put(String namespace, String key, Object value, Duration ttl) {
    Objects.requireNonNull(value, "cached value must not be null");
    cache.put(AnalysisCache.compositeKey(namespace, key), new Entry(value, ttl));
    LOGGER.debug("Cached result: namespace={}, key={}, ttl={}", namespace, key, ttl);
  }

  private record Entry(Object value, Duration ttl) {}

  private static final class PerEntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry entry, long currentTime, long currentDuration) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
