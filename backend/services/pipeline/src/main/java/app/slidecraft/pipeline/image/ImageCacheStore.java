package app.slidecraft.pipeline.image;

import app.slidecraft.pipeline.domain.model.ImageCacheEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Shared cache index. Entries are never edited in place: a newer entry for the same key
 * supersedes an expired one.
 */
public interface ImageCacheStore {

    /**
     * @return the entry for {@code cacheKey} unless it is missing or expired at {@code now}
     */
    Optional<ImageCacheEntry> find(String cacheKey, Instant now);

    /**
     * Records {@code entry}, superseding an expired entry under the same key. When a concurrent
     * writer already stored a live entry, that entry is returned instead.
     */
    ImageCacheEntry save(ImageCacheEntry entry);

    List<ImageCacheEntry> findExpired(Instant now, int limit);

    /**
     * Removes the entry only if it is still expired at {@code now}.
     */
    boolean deleteExpired(String cacheKey, Instant now);
}
