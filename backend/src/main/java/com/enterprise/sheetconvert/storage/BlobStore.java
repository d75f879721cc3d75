package com.enterprise.sheetconvert.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * Object storage for uploaded PDFs and generated workbooks.
 * Implementations throw {@link BlobStoreException} when the backing service fails.
 */
public interface BlobStore {

    /**
     * A URL the client can {@code PUT} the object to, restricted to {@code contentType}.
     */
    PresignedUrl issueUploadUrl(String key, String contentType, Duration ttl);

    PresignedUrl issueDownloadUrl(String key, Duration ttl);

    /**
     * Size in bytes, or empty when no object exists under {@code key}.
     */
    Optional<Long> sizeOf(String key);

    byte[] get(String key);

    void put(String key, byte[] content, String contentType);
}
