package tech.unifiedportal.sdk.exception;

/**
 * Durable storage could not be read or written.
 *
 * <p>Not part of the caller-facing taxonomy: the cache and credential manager
 * log it and keep working from memory.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StorageException readFailed(String key, Throwable cause) {
        return new StorageException("Failed to read durable entry [" + key + "]", cause);
    }

    public static StorageException writeFailed(String key, Throwable cause) {
        return new StorageException("Failed to write durable entry [" + key + "]", cause);
    }
}
