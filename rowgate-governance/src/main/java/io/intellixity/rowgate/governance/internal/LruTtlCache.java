package io.intellixity.rowgate.governance.internal;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Synchronized LRU cache with expire-after-write.\n
 *
 * - LRU eviction: access-order LinkedHashMap\n
 * - TTL: expire-after-write; 0 disables expiry\n
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<K, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  private record Entry<V>(V value, long writeAt) {}

  public LruTtlCache(int maxEntries, long ttlMillis) {
    this(maxEntries, ttlMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    Entry<V> e = map.get(key);
    if (e == null) return null;
    if (isExpired(e, nowMillis.getAsLong())) {
      map.remove(key);
      return null;
    }
    return e.value();
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    store(key, value);
  }

  /** Keeps a live entry that is already present; returns whichever value ends up cached. */
  public synchronized V putIfAbsent(K key, V value) {
    V existing = get(key);
    if (existing != null) return existing;
    Objects.requireNonNull(value, "value");
    store(key, value);
    return value;
  }

  /**
   * The loader runs without the cache lock held, so a slow load never blocks other keys.
   * Two callers missing the same key may both load; the first value stored wins.
   * Loader failures propagate and nothing is cached.
   */
  public V getOrCompute(K key, Supplier<V> loader) {
    Objects.requireNonNull(loader, "loader");
    V existing = get(key);
    if (existing != null) return existing;
    return putIfAbsent(key, loader.get());
  }

  private void store(K key, V value) {
    map.put(key, new Entry<>(value, nowMillis.getAsLong()));
    while (map.size() > maxEntries) {
      Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
      it.next();
      it.remove();
    }
  }

  public synchronized void remove(K key) {
    map.remove(key);
  }

  public synchronized void clear() {
    map.clear();
  }

  public synchronized int size() {
    long now = nowMillis.getAsLong();
    map.values().removeIf(e -> isExpired(e, now));
    return map.size();
  }

  private boolean isExpired(Entry<V> e, long now) {
    return ttlMillis > 0 && (now - e.writeAt()) >= ttlMillis;
  }
}
