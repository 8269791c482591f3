package app.slidecraft.pipeline.image;

import app.slidecraft.pipeline.config.ImageProps;
import app.slidecraft.pipeline.domain.model.ImageCacheEntry;
import app.slidecraft.pipeline.domain.type.PresentationStyle;
import app.slidecraft.pipeline.error.PipelineException;
import app.slidecraft.pipeline.provider.GeneratedImage;
import app.slidecraft.pipeline.provider.ImageGenerationEndpoint;
import app.slidecraft.pipeline.provider.ImagePrompt;
import app.slidecraft.pipeline.provider.RetryPolicy;
import app.slidecraft.pipeline.storage.ObjectStorage;
import app.slidecraft.pipeline.support.SafeMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cache-first image generation. A prompt that failed past the retry ceiling is cached as a
 * placeholder with a short TTL so it is not regenerated on every request.
 */
@Service
public class ImageGenerator {

    private static final Logger log = LoggerFactory.getLogger(ImageGenerator.class);
    private static final int LOCK_STRIPES = 64;

    private final ImageGenerationEndpoint endpoint;
    private final ImageCacheStore cacheStore;
    private final ObjectStorage storage;
    private final PlaceholderRenderer placeholderRenderer;
    private final ImageProps props;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public ImageGenerator(ImageGenerationEndpoint endpoint,
                          ImageCacheStore cacheStore,
                          ObjectStorage storage,
                          PlaceholderRenderer placeholderRenderer,
                          ImageProps props,
                          Clock clock) {
        this.endpoint = endpoint;
        this.cacheStore = cacheStore;
        this.storage = storage;
        this.placeholderRenderer = placeholderRenderer;
        this.props = props;
        this.clock = clock;
        this.retryPolicy = new RetryPolicy(props.maxAttempts(), props.backoffMs(), props.maxBackoffMs());
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public CachedImage getOrGenerateImage(String prompt, PresentationStyle style, String title) {
        PresentationStyle effectiveStyle = style == null ? PresentationStyle.DEFAULT : style;
        String cacheKey = ImageCacheKeys.compute(prompt, effectiveStyle, props.width(), props.height(), endpoint.model());
        ReentrantLock lock = locks[Math.floorMod(cacheKey.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            Optional<CachedImage> hit = lookup(cacheKey);
            if (hit.isPresent()) {
                return hit.get();
            }
            return generate(cacheKey, prompt, effectiveStyle, title);
        } finally {
            lock.unlock();
        }
    }

    public byte[] renderPlaceholder(String title, PresentationStyle style) {
        return placeholderRenderer.render(title, style, props.width(), props.height());
    }

    private Optional<CachedImage> lookup(String cacheKey) {
        Optional<ImageCacheEntry> entry = cacheStore.find(cacheKey, clock.instant());
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (!storage.exists(entry.get().blobKey())) {
            log.warn("Image cache entry has no blob, regenerating cacheKey={}", cacheKey);
            return Optional.empty();
        }
        return Optional.of(new CachedImage(entry.get().blobKey(), entry.get().placeholder(), true));
    }

    private CachedImage generate(String cacheKey, String prompt, PresentationStyle style, String title) {
        ImagePrompt request = new ImagePrompt(prompt, style.code(), props.width(), props.height());
        GeneratedImage image;
        try {
            image = retryPolicy.execute(endpoint.provider() + ".image", () -> endpoint.generate(request));
        } catch (PipelineException ex) {
            log.warn("Image generation failed, caching placeholder cacheKey={} kind={} message={}",
                    cacheKey, ex.kind().code(), SafeMessages.of(ex));
            return store(cacheKey, renderPlaceholder(title, style), "image/png", true);
        }
        return store(cacheKey, image.bytes(), image.mimeType(), false);
    }

    private CachedImage store(String cacheKey, byte[] bytes, String mimeType, boolean placeholder) {
        String blobKey = ImageCacheKeys.blobKey(cacheKey, extensionFor(mimeType));
        storage.putObject(blobKey, mimeType, bytes);
        Instant now = clock.instant();
        Instant expiresAt = now.plus(placeholder ? props.placeholderTtl() : props.cacheTtl());
        ImageCacheEntry saved = cacheStore.save(new ImageCacheEntry(cacheKey, blobKey, placeholder, now, expiresAt));
        log.info("Image cached cacheKey={} placeholder={} sizeBytes={}", cacheKey, saved.placeholder(), bytes.length);
        return new CachedImage(saved.blobKey(), saved.placeholder(), false);
    }

    private static String extensionFor(String mimeType) {
        if (mimeType == null) {
            return "png";
        }
        return switch (mimeType) {
            case "image/jpeg" -> "jpg";
            case "image/gif" -> "gif";
            case "image/webp" -> "webp";
            default -> "png";
        };
    }
}
