package app.slidecraft.pipeline.storage;

import java.time.Duration;

/**
 * Blob store for task artifacts and cached images. Keys are opaque; callers never share keys
 * across tasks except for the {@code cache/} namespace owned by the image cache.
 */
public interface ObjectStorage {
    String bucket();

    void putObject(String key, String contentType, byte[] content);

    byte[] getObject(String key);

    boolean exists(String key);

    void deleteObject(String key);

    PresignedUrl presignGet(String key, Duration ttl, String fileName);

    /**
     * Fully-qualified URL for a key, in the shape the storage provider hands out.
     */
    String objectUrl(String key);
}
