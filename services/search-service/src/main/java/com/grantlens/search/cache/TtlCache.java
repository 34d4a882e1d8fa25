package com.grantlens.search.cache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.LongSupplier;

public class TtlCache<V> {
    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> insertionOrder = new ConcurrentLinkedQueue<>();
    private final int maxEntries;
    private final LongSupplier clock;

    public TtlCache(int maxEntries) {
        this(maxEntries, System::currentTimeMillis);
    }

    public TtlCache(int maxEntries, LongSupplier clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.getAsLong())) {
            if (entries.remove(key, entry)) {
                insertionOrder.remove(key);
            }
            return Optional.empty();
        }
        return Optional.of(entry.getValue());
    }

    public void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        CacheEntry<V> previous = entries.put(key, new CacheEntry<>(value, clock.getAsLong() + ttlMs));
        if (previous == null) {
            insertionOrder.add(key);
        }
        while (entries.size() > maxEntries) {
            String eldest = insertionOrder.poll();
            if (eldest == null) {
                break;
            }
            entries.remove(eldest);
        }
    }

    public int size() {
        return entries.size();
    }
}
