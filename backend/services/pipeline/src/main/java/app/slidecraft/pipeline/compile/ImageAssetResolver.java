package app.slidecraft.pipeline.compile;

import app.slidecraft.pipeline.config.ImageProps;
import app.slidecraft.pipeline.domain.model.SlideImage;
import app.slidecraft.pipeline.domain.type.PresentationStyle;
import app.slidecraft.pipeline.error.CompilationException;
import app.slidecraft.pipeline.error.PermanentUpstreamException;
import app.slidecraft.pipeline.error.ResolutionException;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import app.slidecraft.pipeline.image.ImageGenerator;
import app.slidecraft.pipeline.storage.ObjectStorage;
import app.slidecraft.pipeline.support.SafeMessages;
import jakarta.annotation.PreDestroy;
import org.apache.poi.sl.usermodel.PictureData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Loads slide image bytes for the compiler. Anything that cannot be resolved is replaced by a
 * placeholder; only transient storage errors escape so the stage can be retried.
 */
@Component
public class ImageAssetResolver {

    private static final Logger log = LoggerFactory.getLogger(ImageAssetResolver.class);

    private final StorageReferenceResolver referenceResolver;
    private final ObjectStorage storage;
    private final ImageGenerator imageGenerator;
    private final ExecutorService executor;

    public ImageAssetResolver(StorageReferenceResolver referenceResolver,
                              ObjectStorage storage,
                              ImageGenerator imageGenerator,
                              ImageProps props) {
        this.referenceResolver = referenceResolver;
        this.storage = storage;
        this.imageGenerator = imageGenerator;
        this.executor = Executors.newFixedThreadPool(
                Math.max(props.concurrency(), 1),
                new CustomizableThreadFactory("image-asset-")
        );
    }

    public record SlideRef(int order, String title, SlideImage image) {
    }

    public Map<Integer, ResolvedImage> resolveAll(List<SlideRef> slides, PresentationStyle style) {
        List<Future<ResolvedImage>> futures = new ArrayList<>(slides.size());
        for (SlideRef slide : slides) {
            futures.add(executor.submit(() -> resolve(slide.image(), slide.title(), style)));
        }
        Map<Integer, ResolvedImage> resolved = new LinkedHashMap<>();
        for (int i = 0; i < slides.size(); i++) {
            resolved.put(slides.get(i).order(), await(futures.get(i)));
        }
        return resolved;
    }

    public ResolvedImage resolve(SlideImage image, String title, PresentationStyle style) {
        if (image == null || image.imageRef() == null || image.imageRef().isBlank()) {
            return placeholder(title, style);
        }
        try {
            StorageLocation location = referenceResolver.resolve(image.imageRef());
            byte[] bytes = storage.getObject(location.key());
            PictureData.PictureType type = detectType(bytes);
            if (type == null) {
                throw new ResolutionException("Unsupported image format for key " + location.key());
            }
            return new ResolvedImage(bytes, type, image.placeholder());
        } catch (ResolutionException | PermanentUpstreamException ex) {
            log.warn("Slide image unresolved, using placeholder order={} kind={} message={}",
                    image.order(), ex.kind().code(), SafeMessages.of(ex));
            return placeholder(title, style);
        }
    }

    private ResolvedImage placeholder(String title, PresentationStyle style) {
        return new ResolvedImage(imageGenerator.renderPlaceholder(title, style), PictureData.PictureType.PNG, true);
    }

    private ResolvedImage await(Future<ResolvedImage> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RetryableUpstreamException("Interrupted while resolving slide images", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CompilationException("Slide image resolution failed", cause);
        }
    }

    static PictureData.PictureType detectType(byte[] bytes) {
        if (bytes == null || bytes.length < 4) {
            return null;
        }
        if ((bytes[0] & 0xFF) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G') {
            return PictureData.PictureType.PNG;
        }
        if ((bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xD8 && (bytes[2] & 0xFF) == 0xFF) {
            return PictureData.PictureType.JPEG;
        }
        if (bytes[0] == 'G' && bytes[1] == 'I' && bytes[2] == 'F' && bytes[3] == '8') {
            return PictureData.PictureType.GIF;
        }
        return null;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
