package com.evedmv.analysis.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store for finished analysis results.
 *
 * <p>The worker pool reads it before admitting a synchronous job that carries a cache key, and
 * writes to it after a successful job with a cache key. Writes are plain assignments, so concurrent
 * jobs never need to coordinate on it.
 */
public interface AnalysisCache {

  /**
   * Look up a cached result.
   *
   * @param namespace logical cache area, e.g. {@code analysis}
   * @param key the entry key
   * @return the cached value, or empty on a miss
   */
  Optional<Object> get(String namespace, String key);

  /**
   * Store a result.
   *
   * @param namespace logical cache area
   * @param key the entry key
   * @param value the value to cache
   * @param ttl how long the entry stays valid
   */
  void put(String namespace, String key, Object value, Duration ttl);

  static String compositeKey(String namespace, String key) {
    return namespace + ":" + key;
  }
}
