package tech.unifiedportal.sdk.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileDurableStorageTest {

    @TempDir
    Path directory;

    @Test
    void shouldPersistAcrossInstances() {
        new FileDurableStorage(directory).write("access_token", "abc123");

        FileDurableStorage reopened = new FileDurableStorage(directory);

        assertEquals("abc123", reopened.read("access_token").orElseThrow());
    }

    @Test
    void shouldOverwriteAndRemove() {
        FileDurableStorage storage = new FileDurableStorage(directory);
        storage.write("unifiedportal_api_cache", "[]");
        storage.write("unifiedportal_api_cache", "[{}]");

        assertEquals("[{}]", storage.read("unifiedportal_api_cache").orElseThrow());

        storage.remove("unifiedportal_api_cache");
        assertTrue(storage.read("unifiedportal_api_cache").isEmpty());
        assertDoesNotThrow(() -> storage.remove("unifiedportal_api_cache"));
    }

    @Test
    void shouldKeepKeysInsideDirectory() {
        FileDurableStorage storage = new FileDurableStorage(directory);

        storage.write("../escape", "value");

        assertEquals("value", storage.read("../escape").orElseThrow());
        assertFalse(directory.getParent().resolve("escape.json").toFile().exists());
    }
}
