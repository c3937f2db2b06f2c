package tech.unifiedportal.sdk.storage;

import java.util.Optional;

/**
 * Key/value storage that survives process restarts.
 *
 * <p>Backs the durable cache tier and the stored credentials. Implementations
 * signal failures with {@link tech.unifiedportal.sdk.exception.StorageException}.
 */
public interface DurableStorage {

    /**
     * Read a stored value.
     *
     * @param key The storage key
     * @return The value, or empty if nothing is stored under the key
     */
    Optional<String> read(String key);

    /**
     * Store a value, replacing any previous one.
     *
     * @param key The storage key
     * @param value The value to store
     */
    void write(String key, String value);

    /**
     * Remove a stored value. Removing an absent key is a no-op.
     *
     * @param key The storage key
     */
    void remove(String key);
}
