package tech.unifiedportal.sdk.client.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.unifiedportal.sdk.enums.CacheStrategy;
import tech.unifiedportal.sdk.exception.StorageException;
import tech.unifiedportal.sdk.storage.DurableStorage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-tier response cache.
 *
 * <p>Tier 1 is an in-process map bounded by {@code capacity}. Tier 2 mirrors
 * entries written with {@link CacheStrategy#DURABLE} into {@link DurableStorage}
 * so they survive a restart; it is loaded once at construction, dropping entries
 * that expired while the process was down.
 *
 * <p>Expiry is checked when an entry is read. There is no background sweeper.
 * When tier 1 grows past capacity the oldest entries by creation time are evicted,
 * at least 20% of the tier at a time.
 */
public class ResponseCache {

    private static final Logger LOG = Logger.getLogger(ResponseCache.class);

    static final String STORAGE_KEY = "unifiedportal_api_cache";
    private static final double EVICTION_FRACTION = 0.2;
    private static final TypeReference<List<CacheEntry>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final DurableStorage storage;
    private final ObjectMapper objectMapper;
    private final int capacity;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheEntry> volatileTier = new LinkedHashMap<>();
    private final Map<String, CacheEntry> durableTier = new LinkedHashMap<>();

    private long hits;
    private long misses;
    private long evictions;

    public ResponseCache(DurableStorage storage, ObjectMapper objectMapper, int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.capacity = capacity;
        this.clock = clock;
        loadDurableTier();
    }

    /**
     * Look up a cached payload.
     *
     * <p>{@link CacheStrategy#NO_CACHE} always misses without touching statistics.
     * A durable hit is promoted into tier 1. A stale entry is removed from both tiers
     * and counts as a miss.
     */
    public Optional<JsonNode> get(String key, CacheStrategy strategy) {
        if (strategy == CacheStrategy.NO_CACHE) {
            return Optional.empty();
        }

        lock.lock();
        try {
            Instant now = clock.instant();
            CacheEntry entry = volatileTier.get(key);
            boolean promoted = false;
            if (entry == null && strategy.usesDurableTier()) {
                entry = durableTier.get(key);
                promoted = entry != null;
            }

            if (entry == null) {
                misses++;
                return Optional.empty();
            }

            if (!entry.isValidAt(now)) {
                LOG.debugf("Cache entry [%s] expired", key);
                volatileTier.remove(key);
                if (durableTier.remove(key) != null) {
                    persistDurableTier();
                }
                misses++;
                return Optional.empty();
            }

            if (promoted) {
                volatileTier.put(key, entry);
                evictIfNeeded();
            }
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a payload. Last writer wins.
     */
    public void set(String key, JsonNode value, Duration ttl, CacheStrategy strategy) {
        if (strategy == CacheStrategy.NO_CACHE) {
            return;
        }

        lock.lock();
        try {
            CacheEntry entry = new CacheEntry(key, value, clock.instant(), ttl);
            // re-insert so the map keeps creation order
            volatileTier.remove(key);
            volatileTier.put(key, entry);

            if (strategy.usesDurableTier()) {
                durableTier.remove(key);
                durableTier.put(key, entry);
                persistDurableTier();
            }
            evictIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    public void delete(String key) {
        lock.lock();
        try {
            volatileTier.remove(key);
            if (durableTier.remove(key) != null) {
                persistDurableTier();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every entry from both tiers, including the durable snapshot.
     */
    public void clear() {
        lock.lock();
        try {
            volatileTier.clear();
            durableTier.clear();
            try {
                storage.remove(STORAGE_KEY);
            } catch (StorageException e) {
                LOG.warnf(e, "Failed to remove durable cache snapshot");
            }
            LOG.info("Response cache cleared");
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            long lookups = hits + misses;
            double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
            return new CacheStats(hits, misses, evictions, volatileTier.size(), durableTier.size(), hitRate);
        } finally {
            lock.unlock();
        }
    }

    private void evictIfNeeded() {
        int size = volatileTier.size();
        if (size <= capacity) {
            return;
        }

        int toEvict = Math.max((int) Math.floor(size * EVICTION_FRACTION), size - capacity);
        List<CacheEntry> oldest = new ArrayList<>(volatileTier.values());
        oldest.sort(Comparator.comparing(CacheEntry::createdAt));
        for (int i = 0; i < toEvict; i++) {
            volatileTier.remove(oldest.get(i).key());
        }
        evictions += toEvict;
        LOG.debugf("Evicted %d cache entries, %d remain", toEvict, volatileTier.size());
    }

    private void loadDurableTier() {
        try {
            Optional<String> snapshot = storage.read(STORAGE_KEY);
            if (snapshot.isEmpty()) {
                return;
            }
            Instant now = clock.instant();
            int expired = 0;
            for (CacheEntry entry : objectMapper.readValue(snapshot.get(), SNAPSHOT_TYPE)) {
                if (entry.isValidAt(now)) {
                    durableTier.put(entry.key(), entry);
                } else {
                    expired++;
                }
            }
            LOG.infof("Loaded %d durable cache entries, dropped %d expired", durableTier.size(), expired);
            if (expired > 0) {
                persistDurableTier();
            }
        } catch (StorageException | JsonProcessingException e) {
            LOG.warnf(e, "Durable cache snapshot unreadable, starting empty");
            durableTier.clear();
        }
    }

    private void persistDurableTier() {
        try {
            storage.write(STORAGE_KEY, objectMapper.writeValueAsString(new ArrayList<>(durableTier.values())));
        } catch (StorageException | JsonProcessingException e) {
            LOG.warnf(e, "Failed to persist durable cache tier");
        }
    }
}
