package app.slidecraft.pipeline.image;

import app.slidecraft.pipeline.domain.type.PresentationStyle;
import app.slidecraft.pipeline.error.PermanentUpstreamException;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import app.slidecraft.pipeline.provider.GeneratedImage;
import app.slidecraft.pipeline.provider.stub.StubImageEndpoint;
import app.slidecraft.pipeline.support.InMemoryImageCacheStore;
import app.slidecraft.pipeline.support.InMemoryObjectStorage;
import app.slidecraft.pipeline.support.MutableClock;
import app.slidecraft.pipeline.support.PipelineFixture;
import app.slidecraft.pipeline.support.ScriptedImageEndpoint;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ImageGeneratorTest {

    private final InMemoryImageCacheStore cacheStore = new InMemoryImageCacheStore();
    private final InMemoryObjectStorage storage = new InMemoryObjectStorage(PipelineFixture.BUCKET);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final StubImageEndpoint stub = new StubImageEndpoint();

    private ImageGenerator generator(ScriptedImageEndpoint endpoint) {
        return new ImageGenerator(endpoint, cacheStore, storage, new PlaceholderRenderer(),
                PipelineFixture.imageProps(), clock);
    }

    @Test
    void secondIdenticalRequestIsServedFromCache() {
        ScriptedImageEndpoint endpoint = new ScriptedImageEndpoint(stub::generate);
        ImageGenerator generator = generator(endpoint);

        CachedImage first = generator.getOrGenerateImage("A robot arm", PresentationStyle.PROFESSIONAL, "Robots");
        CachedImage second = generator.getOrGenerateImage("  a ROBOT   arm ", PresentationStyle.PROFESSIONAL, "Robots");

        assertThat(endpoint.calls()).isEqualTo(1);
        assertThat(first.cacheHit()).isFalse();
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.blobKey()).isEqualTo(first.blobKey());
        assertThat(first.blobKey()).startsWith("cache/").endsWith(".png");
        assertThat(storage.contentType(first.blobKey())).isEqualTo("image/png");
    }

    @Test
    void concurrentSlidesWithTheSamePromptShareOneEndpointCall() throws Exception {
        ScriptedImageEndpoint endpoint = new ScriptedImageEndpoint(prompt -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return stub.generate(prompt);
        });
        ImageGenerator generator = generator(endpoint);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CachedImage>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return generator.getOrGenerateImage("A robot arm", PresentationStyle.PROFESSIONAL, "Robots");
                }));
            }
            start.countDown();

            Set<String> blobKeys = new HashSet<>();
            for (Future<CachedImage> result : results) {
                blobKeys.add(result.get(10, TimeUnit.SECONDS).blobKey());
            }
            assertThat(endpoint.calls()).isEqualTo(1);
            assertThat(blobKeys).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void styleIsPartOfTheCacheKey() {
        ScriptedImageEndpoint endpoint = new ScriptedImageEndpoint(stub::generate);
        ImageGenerator generator = generator(endpoint);

        generator.getOrGenerateImage("A robot arm", PresentationStyle.PROFESSIONAL, "Robots");
        generator.getOrGenerateImage("A robot arm", PresentationStyle.CREATIVE, "Robots");

        assertThat(endpoint.calls()).isEqualTo(2);
    }

    @Test
    void persistentFailureCachesAPlaceholder() {
        ScriptedImageEndpoint endpoint = new ScriptedImageEndpoint(prompt -> {
            throw new PermanentUpstreamException("content policy");
        });
        ImageGenerator generator = generator(endpoint);

        CachedImage first = generator.getOrGenerateImage("Forbidden", PresentationStyle.CASUAL, "Title");
        CachedImage second = generator.getOrGenerateImage("Forbidden", PresentationStyle.CASUAL, "Title");

        assertThat(first.placeholder()).isTrue();
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.placeholder()).isTrue();
        assertThat(endpoint.calls()).isEqualTo(2);
        byte[] png = storage.getObject(first.blobKey());
        assertThat(png).startsWith((byte) 0x89, (byte) 'P', (byte) 'N', (byte) 'G');
    }

    @Test
    void placeholderExpiresSoonerThanRealImages() {
        ScriptedImageEndpoint failing = new ScriptedImageEndpoint(prompt -> {
            throw new RetryableUpstreamException("429");
        });
        generator(failing).getOrGenerateImage("Flaky", PresentationStyle.PROFESSIONAL, "Title");

        clock.advance(Duration.ofMinutes(61));
        ScriptedImageEndpoint healthy = new ScriptedImageEndpoint(stub::generate);
        CachedImage regenerated = generator(healthy).getOrGenerateImage("Flaky", PresentationStyle.PROFESSIONAL, "Title");

        assertThat(healthy.calls()).isEqualTo(1);
        assertThat(regenerated.placeholder()).isFalse();
        assertThat(regenerated.cacheHit()).isFalse();
    }

    @Test
    void danglingEntryIsTreatedAsAMiss() {
        ScriptedImageEndpoint endpoint = new ScriptedImageEndpoint(stub::generate);
        ImageGenerator generator = generator(endpoint);
        CachedImage first = generator.getOrGenerateImage("Sunset", PresentationStyle.PROFESSIONAL, "Sunset");

        storage.deleteObject(first.blobKey());
        CachedImage second = generator.getOrGenerateImage("Sunset", PresentationStyle.PROFESSIONAL, "Sunset");

        assertThat(endpoint.calls()).isEqualTo(2);
        assertThat(storage.exists(second.blobKey())).isTrue();
    }

    @Test
    void janitorRemovesExpiredEntriesAndTheirBlobs() {
        ScriptedImageEndpoint endpoint = new ScriptedImageEndpoint(prompt ->
                new GeneratedImage(stub.generate(prompt).bytes(), "image/png", "scripted-model"));
        CachedImage image = generator(endpoint).getOrGenerateImage("Mountains", PresentationStyle.PROFESSIONAL, "Peaks");
        ImageCacheJanitor janitor = new ImageCacheJanitor(cacheStore, storage, clock, 10);

        janitor.purgeExpired();
        assertThat(cacheStore.size()).isEqualTo(1);

        clock.advance(Duration.ofHours(169));
        janitor.purgeExpired();

        assertThat(cacheStore.size()).isZero();
        assertThat(storage.exists(image.blobKey())).isFalse();
    }

    @Test
    void cacheKeyIgnoresWhitespaceAndCase() {
        String a = ImageCacheKeys.compute("Hello   World", PresentationStyle.PROFESSIONAL, 10, 10, "m");
        String b = ImageCacheKeys.compute(" hello world ", PresentationStyle.PROFESSIONAL, 10, 10, "m");
        String c = ImageCacheKeys.compute("hello world", PresentationStyle.PROFESSIONAL, 20, 10, "m");

        assertThat(a).isEqualTo(b).hasSize(64);
        assertThat(c).isNotEqualTo(a);
    }
}
