package com.autograder.adapters;

import com.autograder.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stores blobs as files below a root directory; storage keys are relative paths
 */
public class LocalFileStorage implements StorageAdapter {
    private static final Logger logger = LoggerFactory.getLogger(LocalFileStorage.class);

    private final Path root;

    public LocalFileStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public OutputStream openForWrite(String storageKey) throws StorageException {
        Path target = resolve(storageKey);
        try {
            Files.createDirectories(target.getParent());
            return Files.newOutputStream(target);
        } catch (IOException e) {
            throw new StorageException("Failed to open " + storageKey + " for writing", e);
        }
    }

    @Override
    public byte[] read(String storageKey) throws StorageException {
        try {
            return Files.readAllBytes(resolve(storageKey));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + storageKey, e);
        }
    }

    @Override
    public boolean delete(String storageKey) throws StorageException {
        try {
            boolean deleted = Files.deleteIfExists(resolve(storageKey));
            if (deleted) {
                logger.debug("Deleted blob {}", storageKey);
            }
            return deleted;
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + storageKey, e);
        }
    }

    @Override
    public boolean exists(String storageKey) {
        return Files.isRegularFile(resolve(storageKey));
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(String storageKey) {
        Path resolved = root.resolve(storageKey).normalize();
        if (!resolved.startsWith(root)) {
            throw new StorageException("Storage key escapes storage root: " + storageKey, null);
        }
        return resolved;
    }
}
