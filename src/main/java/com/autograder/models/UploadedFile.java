package com.autograder.models;

/**
 * Raw bytes of one uploaded answer file as received from the caller. A file the transport layer
 * could not decode carries a {@code rejection} reason instead of content and is reported as a
 * failed item of its batch.
 */
public record UploadedFile(String fileName, byte[] content, String rejection) {

    public UploadedFile(String fileName, byte[] content) {
        this(fileName, content, null);
    }

    public static UploadedFile rejected(String fileName, String reason) {
        return new UploadedFile(fileName, null, reason);
    }

    public boolean isRejected() {
        return rejection != null;
    }

    public long size() {
        return content == null ? 0 : content.length;
    }
}
