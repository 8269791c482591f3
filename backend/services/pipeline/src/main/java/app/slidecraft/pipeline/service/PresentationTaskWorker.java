package app.slidecraft.pipeline.service;

import app.slidecraft.pipeline.config.TaskProps;
import app.slidecraft.pipeline.queue.ReceivedMessage;
import app.slidecraft.pipeline.queue.TaskQueue;
import app.slidecraft.pipeline.support.SafeMessages;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Pulls one message per free slot and hands it to the orchestrator. While a message is being
 * processed its visibility is extended periodically so no other worker picks it up.
 */
@Service
public class PresentationTaskWorker {

    private static final Logger log = LoggerFactory.getLogger(PresentationTaskWorker.class);

    private final TaskQueue queue;
    private final TaskOrchestrator orchestrator;
    private final String workerId;
    private final Duration visibilityTimeout;
    private final Semaphore taskSlots;
    private final ExecutorService executor;
    private final ScheduledExecutorService heartbeatScheduler;

    public PresentationTaskWorker(TaskQueue queue, TaskOrchestrator orchestrator, TaskProps props) {
        this.queue = queue;
        this.orchestrator = orchestrator;
        this.workerId = (props.workerId() == null || props.workerId().isBlank()) ? defaultWorkerId() : props.workerId();
        this.visibilityTimeout = Duration.ofSeconds(Math.max(props.visibilityTimeoutSeconds(), 1));
        int concurrentTasks = Math.max(props.concurrentTasks(), 1);
        this.taskSlots = new Semaphore(concurrentTasks);
        this.executor = Executors.newFixedThreadPool(concurrentTasks, new CustomizableThreadFactory("presentation-worker-"));
        this.heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(
                new CustomizableThreadFactory("presentation-heartbeat-")
        );
    }

    @Scheduled(fixedDelayString = "${app.pipeline.tasks.poll-interval-ms:1000}")
    public void poll() {
        while (taskSlots.tryAcquire()) {
            Optional<ReceivedMessage> message = receive();
            if (message.isEmpty()) {
                taskSlots.release();
                return;
            }
            submit(message.get());
        }
    }

    private Optional<ReceivedMessage> receive() {
        try {
            return queue.receive(visibilityTimeout);
        } catch (RuntimeException ex) {
            log.warn("Task queue receive failed workerId={} message={}", workerId, SafeMessages.of(ex));
            return Optional.empty();
        }
    }

    private void submit(ReceivedMessage message) {
        try {
            executor.execute(() -> {
                try {
                    handle(message);
                } finally {
                    taskSlots.release();
                }
            });
        } catch (RejectedExecutionException ex) {
            taskSlots.release();
            log.warn("Task executor rejected messageId={}, leaving it for redelivery", message.messageId());
        }
    }

    private void handle(ReceivedMessage message) {
        ScheduledFuture<?> heartbeat = scheduleVisibilityHeartbeat(message.messageId());
        try {
            orchestrator.handle(message);
        } catch (RuntimeException ex) {
            // the message becomes visible again once the heartbeat stops
            log.warn("Task message handling failed messageId={} workerId={} errorType={} message={}",
                    message.messageId(), workerId, ex.getClass().getSimpleName(), SafeMessages.of(ex));
        } finally {
            heartbeat.cancel(false);
        }
    }

    private ScheduledFuture<?> scheduleVisibilityHeartbeat(UUID messageId) {
        long intervalMs = resolveHeartbeatIntervalMs();
        return heartbeatScheduler.scheduleAtFixedRate(
                () -> extendVisibility(messageId),
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS
        );
    }

    private long resolveHeartbeatIntervalMs() {
        long ttlMs = Math.max(visibilityTimeout.toMillis(), 1_000L);
        long intervalMs = ttlMs / 3L;
        if (intervalMs < 1_000L) {
            return 1_000L;
        }
        return Math.min(intervalMs, 30_000L);
    }

    private void extendVisibility(UUID messageId) {
        try {
            queue.extendVisibility(messageId, visibilityTimeout);
        } catch (RuntimeException ex) {
            log.warn("Visibility heartbeat failed messageId={} workerId={} message={}", messageId, workerId, SafeMessages.of(ex));
        }
    }

    private String defaultWorkerId() {
        String host = System.getenv("HOSTNAME");
        return (host == null || host.isBlank()) ? "presentation-worker" : host;
    }

    @PreDestroy
    public void shutdown() {
        heartbeatScheduler.shutdownNow();
        executor.shutdownNow();
    }
}
