package io.bakky.persistence.cache;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * In-process cache keyed by nested key paths (e.g. {@code ["users", "42", "profile"]}).\n
 *
 * - LRU eviction once maxEntries is reached (access-order LinkedHashMap)\n
 * - expire-after-write TTL, per entry or the cache default\n
 *
 * Synchronized; intended for small hot sets, not as a shared store.
 */
public final class LocalTtlCache<V> {
  private final int maxEntries;
  private final long defaultTtlMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<List<String>, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  private static final class Entry<V> {
    final V value;
    final long expiresAt;

    Entry(V value, long expiresAt) {
      this.value = value;
      this.expiresAt = expiresAt;
    }
  }

  public LocalTtlCache(int maxEntries, long defaultTtlMillis) {
    this(maxEntries, defaultTtlMillis, System::currentTimeMillis);
  }

  public LocalTtlCache(int maxEntries, long defaultTtlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (defaultTtlMillis <= 0) throw new IllegalArgumentException("defaultTtlMillis must be > 0");
    this.maxEntries = maxEntries;
    this.defaultTtlMillis = defaultTtlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public V put(List<String> keys, V value) {
    return put(keys, value, defaultTtlMillis);
  }

  public synchronized V put(List<String> keys, V value, long ttlMillis) {
    List<String> k = key(keys);
    if (ttlMillis <= 0) throw new IllegalArgumentException("ttlMillis must be > 0");
    long now = nowMillis.getAsLong();
    Entry<V> prev = map.put(k, new Entry<>(value, now + ttlMillis));
    evictIfNeeded();
    return (prev == null || prev.expiresAt <= now) ? null : prev.value;
  }

  public synchronized V get(List<String> keys) {
    List<String> k = key(keys);
    Entry<V> e = map.get(k);
    if (e == null) return null;
    if (e.expiresAt <= nowMillis.getAsLong()) {
      map.remove(k);
      return null;
    }
    return e.value;
  }

  public V get(String... keys) {
    return get(List.of(keys));
  }

  public synchronized V getOrCompute(List<String> keys, Supplier<V> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    V existing = get(keys);
    if (existing != null) return existing;
    V created = supplier.get();
    if (created != null) put(keys, created);
    return created;
  }

  /** Removes the entry; returns true if a live entry was removed. */
  public synchronized boolean remove(List<String> keys) {
    Entry<V> e = map.remove(key(keys));
    return e != null && e.expiresAt > nowMillis.getAsLong();
  }

  /** Drops expired entries and returns how many were dropped. */
  public synchronized int cleanExpired() {
    long now = nowMillis.getAsLong();
    int removed = 0;
    Iterator<Map.Entry<List<String>, Entry<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      if (it.next().getValue().expiresAt <= now) {
        it.remove();
        removed++;
      }
    }
    return removed;
  }

  public synchronized void clear() {
    map.clear();
  }

  public synchronized int size() {
    cleanExpired();
    return map.size();
  }

  private static List<String> key(List<String> keys) {
    Objects.requireNonNull(keys, "keys");
    if (keys.isEmpty()) throw new IllegalArgumentException("keys must not be empty");
    return List.copyOf(keys);
  }

  private void evictIfNeeded() {
    while (map.size() > maxEntries) {
      Iterator<Map.Entry<List<String>, Entry<V>>> it = map.entrySet().iterator();
      if (!it.hasNext()) return;
      it.next();
      it.remove();
    }
  }
}
