package app.slidecraft.pipeline.domain.model;

import java.time.Instant;

public record ImageCacheEntry(
        String cacheKey,
        String blobKey,
        boolean placeholder,
        Instant createdAt,
        Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
