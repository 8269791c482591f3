package app.slidecraft.pipeline.image;

import app.slidecraft.pipeline.domain.model.ImageCacheEntry;
import app.slidecraft.pipeline.storage.ObjectStorage;
import app.slidecraft.pipeline.support.SafeMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class ImageCacheJanitor {

    private static final Logger log = LoggerFactory.getLogger(ImageCacheJanitor.class);

    private final ImageCacheStore cacheStore;
    private final ObjectStorage storage;
    private final Clock clock;
    private final int batchSize;

    public ImageCacheJanitor(ImageCacheStore cacheStore,
                             ObjectStorage storage,
                             Clock clock,
                             @Value("${app.pipeline.images.janitor-batch-size:200}") int batchSize) {
        this.cacheStore = cacheStore;
        this.storage = storage;
        this.clock = clock;
        this.batchSize = Math.max(batchSize, 1);
    }

    @Scheduled(fixedDelayString = "${app.pipeline.images.janitor-interval-ms:600000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        List<ImageCacheEntry> expired = cacheStore.findExpired(now, batchSize);
        int removed = 0;
        for (ImageCacheEntry entry : expired) {
            if (!cacheStore.deleteExpired(entry.cacheKey(), now)) {
                continue;
            }
            try {
                storage.deleteObject(entry.blobKey());
            } catch (RuntimeException ex) {
                log.warn("Image cache blob delete failed cacheKey={} blobKey={} message={}",
                        entry.cacheKey(), entry.blobKey(), SafeMessages.of(ex));
            }
            removed++;
        }
        if (removed > 0) {
            log.info("Image cache purged entries={}", removed);
        }
    }
}
