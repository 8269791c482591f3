package app.slidecraft.pipeline.support;

import app.slidecraft.pipeline.compile.DeckCompiler;
import app.slidecraft.pipeline.compile.ImageAssetResolver;
import app.slidecraft.pipeline.compile.StorageReferenceResolver;
import app.slidecraft.pipeline.config.ContentProps;
import app.slidecraft.pipeline.config.ImageProps;
import app.slidecraft.pipeline.config.S3Props;
import app.slidecraft.pipeline.config.TaskProps;
import app.slidecraft.pipeline.content.ContentGenerator;
import app.slidecraft.pipeline.image.ImageGenerator;
import app.slidecraft.pipeline.image.PlaceholderRenderer;
import app.slidecraft.pipeline.provider.ImageGenerationEndpoint;
import app.slidecraft.pipeline.provider.TextGenerationEndpoint;
import app.slidecraft.pipeline.queue.ReceivedMessage;
import app.slidecraft.pipeline.queue.TaskMessageCodec;
import app.slidecraft.pipeline.service.PresentationTaskService;
import app.slidecraft.pipeline.service.TaskOrchestrator;
import app.slidecraft.pipeline.stage.CompileStage;
import app.slidecraft.pipeline.stage.ContentStage;
import app.slidecraft.pipeline.stage.ImagesStage;
import app.slidecraft.pipeline.stage.OutlineStage;
import app.slidecraft.pipeline.stage.PipelineStage;
import app.slidecraft.pipeline.storage.PresentationBlobs;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Wires the whole pipeline over in-memory infrastructure with zero backoff.
 */
public class PipelineFixture implements AutoCloseable {

    public static final String BUCKET = "slidecraft-test";

    public final ObjectMapper objectMapper = new ObjectMapper();
    public final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    public final InMemoryTaskStatusStore statusStore = new InMemoryTaskStatusStore();
    public final TaskMessageCodec codec = new TaskMessageCodec(objectMapper);
    public final InMemoryTaskQueue queue = new InMemoryTaskQueue(codec);
    public final InMemoryObjectStorage storage = new InMemoryObjectStorage(BUCKET);
    public final InMemoryImageCacheStore cacheStore = new InMemoryImageCacheStore();
    public final List<Object> events = new ArrayList<>();

    public final ContentGenerator contentGenerator;
    public final ImageGenerator imageGenerator;
    public final TaskOrchestrator orchestrator;
    public final PresentationTaskService service;

    private final ImagesStage imagesStage;
    private final ImageAssetResolver assetResolver;

    public PipelineFixture(TextGenerationEndpoint textEndpoint, ImageGenerationEndpoint imageEndpoint) {
        PresentationBlobs blobs = new PresentationBlobs(storage, objectMapper);
        ImageProps imageProps = imageProps();
        this.contentGenerator = new ContentGenerator(textEndpoint, contentProps(), objectMapper);
        this.imageGenerator = new ImageGenerator(
                imageEndpoint, cacheStore, storage, new PlaceholderRenderer(), imageProps, clock);
        this.imagesStage = new ImagesStage(imageGenerator, storage, blobs, imageProps);
        this.assetResolver = new ImageAssetResolver(
                new StorageReferenceResolver(BUCKET, null, List.of()), storage, imageGenerator, imageProps);
        List<PipelineStage> stages = List.of(
                new OutlineStage(contentGenerator, blobs),
                new ContentStage(contentGenerator, blobs),
                imagesStage,
                new CompileStage(new DeckCompiler(assetResolver, storage), blobs)
        );
        this.orchestrator = new TaskOrchestrator(
                statusStore, queue, codec, stages, events::add, taskProps(), clock);
        this.service = new PresentationTaskService(statusStore, queue, storage, contentProps(), s3Props(), clock);
    }

    /**
     * Delivers messages until the queue is empty or {@code maxDeliveries} is reached.
     *
     * @return the number of deliveries made
     */
    public int drain(int maxDeliveries) {
        int deliveries = 0;
        while (deliveries < maxDeliveries) {
            Optional<ReceivedMessage> message = queue.receive(Duration.ofSeconds(300));
            if (message.isEmpty()) {
                break;
            }
            orchestrator.handle(message.get());
            deliveries++;
        }
        return deliveries;
    }

    public static TaskProps taskProps() {
        return new TaskProps(3, 300, 0, 0, 1, 10, 30, "test-worker");
    }

    public static ContentProps contentProps() {
        return new ContentProps(3, 20, 200, 3, 5, 600, 3, 0, 0, 1024);
    }

    public static ImageProps imageProps() {
        return new ImageProps(64, 48, 2, 10, 2, 0, 0, 168, 60);
    }

    public static S3Props s3Props() {
        return new S3Props(BUCKET, "us-east-1", null, false, "key", "secret", 3600, 30, List.of());
    }

    @Override
    public void close() {
        orchestrator.shutdown();
        imagesStage.shutdown();
        assetResolver.shutdown();
    }
}
