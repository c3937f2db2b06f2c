package tech.unifiedportal.sdk.storage;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Durable storage held in memory. Used when no storage directory is configured,
 * and in tests to simulate a restart by sharing one instance between clients.
 */
public class InMemoryDurableStorage implements DurableStorage {

    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> read(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void write(String key, String value) {
        entries.put(key, value);
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }
}
