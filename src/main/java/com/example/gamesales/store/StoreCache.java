package com.example.gamesales.store;

import com.example.gamesales.config.GameSalesConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Loads each source at most once and hands out the same immutable store
 * afterwards.
 *
 * <p>Keys are absolute, normalized paths. A failed load leaves no entry, so
 * the next call tries again. Access is serialized by the instance monitor;
 * the stores themselves need no locking.
 */
public final class StoreCache {

    private static final Logger log = LoggerFactory.getLogger(StoreCache.class);

    private final RecordStoreLoader loader;
    private final Map<Path, RecordStore> stores = new HashMap<>();

    public StoreCache(RecordStoreLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
    }

    /**
     * Process-wide cache, created on first use with the default configuration.
     */
    public static StoreCache shared() {
        return Holder.INSTANCE;
    }

    /**
     * Returns the store for a source, loading it on the first request.
     *
     * @throws DataLoadException if the source has not been loaded yet and cannot be
     */
    public synchronized RecordStore get(Path source) throws DataLoadException {
        Path key = source.toAbsolutePath().normalize();
        RecordStore store = stores.get(key);
        if (store != null) {
            log.debug("Store cache hit for {}", key);
            return store;
        }
        store = loader.load(key);
        stores.put(key, store);
        return store;
    }

    public synchronized boolean contains(Path source) {
        return stores.containsKey(source.toAbsolutePath().normalize());
    }

    public synchronized int size() {
        return stores.size();
    }

    private static final class Holder {
        static final StoreCache INSTANCE =
                new StoreCache(new RecordStoreLoader(GameSalesConfig.load().loadSettings()));
    }
}
