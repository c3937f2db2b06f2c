package tech.unifiedportal.sdk.storage;

import org.jboss.logging.Logger;
import tech.unifiedportal.sdk.exception.StorageException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Durable storage with one file per key inside a directory.
 *
 * <p>Writes go to a temporary file that is then moved over the target, so a crash
 * mid-write never leaves a truncated entry behind.
 */
public class FileDurableStorage implements DurableStorage {

    private static final Logger LOG = Logger.getLogger(FileDurableStorage.class);

    private static final String SUFFIX = ".json";

    private final Path directory;

    public FileDurableStorage(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Failed to create storage directory " + directory, e);
        }
        LOG.infof("Durable storage at [%s]", directory.toAbsolutePath());
    }

    @Override
    public Optional<String> read(String key) {
        Path file = fileFor(key);
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw StorageException.readFailed(key, e);
        }
    }

    @Override
    public void write(String key, String value) {
        Path target = fileFor(key);
        try {
            Path temp = Files.createTempFile(directory, sanitize(key), ".tmp");
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw StorageException.writeFailed(key, e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw StorageException.writeFailed(key, e);
        }
    }

    private Path fileFor(String key) {
        return directory.resolve(sanitize(key) + SUFFIX);
    }

    private static String sanitize(String key) {
        return key.replaceAll("[^A-Za-z0-9_.-]", "_");
    }
}
