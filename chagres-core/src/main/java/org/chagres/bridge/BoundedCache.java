package org.chagres.bridge;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A thread-safe bounded cache with LRU eviction.
 *
 * <p>Each runtime keeps its class and reflection lookups in instances of this cache, so a runtime
 * that loads many generated classes cannot grow its caches without bound. Entries are never
 * {@code null}; a loader returning {@code null} leaves the cache untouched.
 *
 * <p>Access-ordered {@link LinkedHashMap}s reorder themselves on {@code get}, so every access takes
 * the same exclusive lock. Loaders run outside the lock; two threads missing on the same key may
 * both load it, and the first stored value wins.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
final class BoundedCache<K, V> {

  /** Computes a missing value; may fail with a checked exception. */
  @FunctionalInterface
  interface Loader<K, V, E extends Exception> {
    V load(K key) throws E;
  }

  private final String name;
  private final int maxSize;
  private final LinkedHashMap<K, V> map;
  private final ReentrantLock lock = new ReentrantLock();

  private long hits = 0;
  private long misses = 0;
  private long evictions = 0;

  /**
   * @param name label used in {@link #getStats()}
   * @param maxSize maximum number of entries before eviction (must be > 0)
   */
  BoundedCache(String name, int maxSize) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }
    this.name = name;
    this.maxSize = maxSize;
    this.map =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            boolean shouldRemove = size() > BoundedCache.this.maxSize;
            if (shouldRemove) {
              evictions++;
            }
            return shouldRemove;
          }
        };
  }

  /** Returns the cached value, or {@code null} if absent. */
  V get(K key) {
    lock.lock();
    try {
      V value = map.get(key);
      if (value != null) {
        hits++;
      } else {
        misses++;
      }
      return value;
    } finally {
      lock.unlock();
    }
  }

  void put(K key, V value) {
    lock.lock();
    try {
      map.put(key, value);
    } finally {
      lock.unlock();
    }
  }

  /** Returns the cached value for {@code key}, loading and storing it on a miss. */
  <E extends Exception> V getOrLoad(K key, Loader<? super K, ? extends V, E> loader) throws E {
    V value = get(key);
    if (value != null) {
      return value;
    }
    V loaded = loader.load(key);
    if (loaded == null) {
      return null;
    }
    lock.lock();
    try {
      V raced = map.putIfAbsent(key, loaded);
      return raced != null ? raced : loaded;
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return map.size();
    } finally {
      lock.unlock();
    }
  }

  void clear() {
    lock.lock();
    try {
      map.clear();
    } finally {
      lock.unlock();
    }
  }

  long getHits() {
    lock.lock();
    try {
      return hits;
    } finally {
      lock.unlock();
    }
  }

  long getMisses() {
    lock.lock();
    try {
      return misses;
    } finally {
      lock.unlock();
    }
  }

  long getEvictions() {
    lock.lock();
    try {
      return evictions;
    } finally {
      lock.unlock();
    }
  }

  int getMaxSize() {
    return maxSize;
  }

  /** Cache statistics as a formatted string. */
  String getStats() {
    lock.lock();
    try {
      long total = hits + misses;
      double hitRate = total > 0 ? (100.0 * hits / total) : 0.0;
      return String.format(
          "%s: size=%d/%d hits=%d misses=%d evictions=%d hitRate=%.1f%%",
          name, map.size(), maxSize, hits, misses, evictions, hitRate);
    } finally {
      lock.unlock();
    }
  }
}
