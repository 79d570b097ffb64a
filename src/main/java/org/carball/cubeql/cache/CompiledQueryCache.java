package org.carball.cubeql.cache;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.schema.SchemaRegistry;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Compiled queries by fingerprint. Entries are only ever served for the schema version that
 * produced them; a schema reload empties the cache.
 */
@Slf4j
public class CompiledQueryCache {

    private record Entry(QueryFingerprint fingerprint, CompiledQuery compiled) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public CompiledQueryCache(int maxEntries) {
        this.maxEntries = Math.max(1, maxEntries);
    }

    /**
     * Clears the cache whenever the registry swaps in a new schema.
     */
    public void bindTo(SchemaRegistry registry) {
        registry.addReloadListener(snapshot -> {
            log.debug("Schema version {} loaded, dropping {} cached queries", snapshot.getVersion(), entries.size());
            clear();
        });
    }

    public Optional<CompiledQuery> get(QueryFingerprint fingerprint) {
        Entry entry = entries.get(fingerprint.key());
        if (entry != null && entry.fingerprint().equals(fingerprint)) {
            hits.incrementAndGet();
            return Optional.of(entry.compiled());
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    /**
     * Returns the cached query or compiles and stores it. Failed compilations are not cached.
     */
    public CompiledQuery computeIfAbsent(QueryFingerprint fingerprint, Supplier<CompiledQuery> compiler) {
        Optional<CompiledQuery> cached = get(fingerprint);
        if (cached.isPresent()) {
            return cached.get();
        }
        CompiledQuery compiled = compiler.get();
        put(fingerprint, compiled);
        return compiled;
    }

    public void put(QueryFingerprint fingerprint, CompiledQuery compiled) {
        if (entries.size() >= maxEntries && !entries.containsKey(fingerprint.key())) {
            evictOne();
        }
        entries.put(fingerprint.key(), new Entry(fingerprint, compiled));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    private void evictOne() {
        Iterator<String> keys = entries.keySet().iterator();
        if (keys.hasNext()) {
            String evicted = keys.next();
            entries.remove(evicted);
            log.debug("Cache full ({} entries), evicted {}", maxEntries, evicted);
        }
    }
}
