package com.autograder.adapters;

import com.autograder.exceptions.StorageException;

import java.io.OutputStream;

/**
 * Blob storage for uploaded answer files, addressed by storage key
 */
public interface StorageAdapter {

    /**
     * Opens a stream that creates or replaces the blob. The blob is complete once the stream is closed.
     */
    OutputStream openForWrite(String storageKey) throws StorageException;

    byte[] read(String storageKey) throws StorageException;

    /**
     * @return true if a blob was removed
     */
    boolean delete(String storageKey) throws StorageException;

    boolean exists(String storageKey);
}
