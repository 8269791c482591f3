package app.slidecraft.pipeline.stage;

import app.slidecraft.pipeline.config.ImageProps;
import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.model.DeckContent;
import app.slidecraft.pipeline.domain.model.ImageManifest;
import app.slidecraft.pipeline.domain.model.SlideContent;
import app.slidecraft.pipeline.domain.model.SlideImage;
import app.slidecraft.pipeline.domain.type.PresentationStyle;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import app.slidecraft.pipeline.image.CachedImage;
import app.slidecraft.pipeline.image.ImageGenerator;
import app.slidecraft.pipeline.storage.ObjectStorage;
import app.slidecraft.pipeline.storage.PresentationBlobs;
import app.slidecraft.pipeline.support.SafeMessages;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans slide image generation out over a bounded pool shared by all tasks. A slide whose call fails
 * or times out is recorded as a placeholder without a ref; its siblings are unaffected. The per-slide
 * timeout runs from the moment the call starts, so time spent queued behind other slides does not count.
 */
@Component
public class ImagesStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ImagesStage.class);
    private static final long START_POLL_MS = 100;

    private final ImageGenerator imageGenerator;
    private final ObjectStorage storage;
    private final PresentationBlobs blobs;
    private final ImageProps props;
    private final ExecutorService executor;

    public ImagesStage(ImageGenerator imageGenerator,
                       ObjectStorage storage,
                       PresentationBlobs blobs,
                       ImageProps props) {
        this.imageGenerator = imageGenerator;
        this.storage = storage;
        this.blobs = blobs;
        this.props = props;
        this.executor = Executors.newFixedThreadPool(
                Math.max(props.concurrency(), 1),
                new CustomizableThreadFactory("slide-image-")
        );
    }

    @Override
    public TaskStatus stage() {
        return TaskStatus.IMAGES;
    }

    @Override
    public void execute(PresentationTaskEntity task) {
        DeckContent content = blobs.readJson(StageSupport.requireRef(task.getContentRef(), "content", task), DeckContent.class);
        PresentationStyle style = StageSupport.styleOf(task);

        List<SlideCall> calls = new ArrayList<>(content.slides().size());
        for (SlideContent slide : content.slides()) {
            SlideCall call = new SlideCall(slide);
            call.future = executor.submit(() -> {
                call.markStarted();
                return imageGenerator.getOrGenerateImage(slide.imagePrompt(), style, slide.title());
            });
            calls.add(call);
        }

        List<SlideImage> images = new ArrayList<>(calls.size());
        for (SlideCall call : calls) {
            images.add(await(task, call));
        }
        ImageManifest manifest = new ImageManifest(images);
        task.setImagesRef(blobs.writeJson(PresentationBlobs.imagesKey(task.getTaskId(), UUID.randomUUID()), manifest));
        log.info("Slide images stored taskId={} slides={} placeholders={}",
                task.getTaskId(), images.size(), manifest.placeholderCount());
    }

    private SlideImage await(PresentationTaskEntity task, SlideCall call) {
        SlideContent slide = call.slide;
        Future<CachedImage> future = call.future;
        try {
            while (!call.started.await(START_POLL_MS, TimeUnit.MILLISECONDS) && !future.isDone()) {
                log.debug("Slide image still queued taskId={} order={}", task.getTaskId(), slide.order());
            }
            long remainingNanos = call.startedAtNanos + props.callTimeout().toNanos() - System.nanoTime();
            CachedImage image = future.get(Math.max(remainingNanos, 0L), TimeUnit.NANOSECONDS);
            return new SlideImage(slide.order(), storage.objectUrl(image.blobKey()), image.placeholder());
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Slide image timed out taskId={} order={}", task.getTaskId(), slide.order());
        } catch (CancellationException ex) {
            log.warn("Slide image cancelled taskId={} order={}", task.getTaskId(), slide.order());
        } catch (ExecutionException ex) {
            log.warn("Slide image failed taskId={} order={} errorType={} message={}",
                    task.getTaskId(), slide.order(), ex.getCause().getClass().getSimpleName(), SafeMessages.of(ex.getCause()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RetryableUpstreamException("Interrupted while generating slide images", ex);
        }
        return new SlideImage(slide.order(), null, true);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static final class SlideCall {

        private final SlideContent slide;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedAtNanos;
        private volatile Future<CachedImage> future;

        private SlideCall(SlideContent slide) {
            this.slide = slide;
        }

        private void markStarted() {
            startedAtNanos = System.nanoTime();
            started.countDown();
        }
    }
}
