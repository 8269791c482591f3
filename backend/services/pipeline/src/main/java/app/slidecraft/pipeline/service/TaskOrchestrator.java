package app.slidecraft.pipeline.service;

import app.slidecraft.pipeline.config.TaskProps;
import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.model.TaskError;
import app.slidecraft.pipeline.domain.type.TaskErrorKind;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import app.slidecraft.pipeline.error.PipelineException;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import app.slidecraft.pipeline.error.ValidationException;
import app.slidecraft.pipeline.queue.ReceivedMessage;
import app.slidecraft.pipeline.queue.TaskMessage;
import app.slidecraft.pipeline.queue.TaskMessageCodec;
import app.slidecraft.pipeline.queue.TaskQueue;
import app.slidecraft.pipeline.stage.PipelineStage;
import app.slidecraft.pipeline.support.SafeMessages;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one task through the stage sequence for a single queue delivery.
 * <p>
 * Every transition is a conditional write against the last status and version read, so a stale or
 * duplicate delivery can never move a task backwards. Retryable stage failures are counted per stage
 * and handed back to the queue with a delay until the ceiling is reached; every other failure is
 * terminal.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);
    private static final int MAX_FAIL_WRITE_ATTEMPTS = 5;

    private final TaskStatusStore statusStore;
    private final TaskQueue queue;
    private final TaskMessageCodec codec;
    private final Map<TaskStatus, PipelineStage> stages = new EnumMap<>(TaskStatus.class);
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final int maxStageAttempts;
    private final int maxReceives;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final Duration stageTimeout;
    private final ExecutorService stageExecutor;

    public TaskOrchestrator(TaskStatusStore statusStore,
                            TaskQueue queue,
                            TaskMessageCodec codec,
                            List<PipelineStage> stages,
                            ApplicationEventPublisher events,
                            TaskProps props,
                            Clock clock) {
        this.statusStore = statusStore;
        this.queue = queue;
        this.codec = codec;
        for (PipelineStage stage : stages) {
            this.stages.put(stage.stage(), stage);
        }
        for (TaskStatus stage : TaskStatus.STAGES) {
            if (!this.stages.containsKey(stage)) {
                throw new IllegalStateException("No handler for stage " + stage);
            }
        }
        this.events = events;
        this.clock = clock;
        this.maxStageAttempts = Math.max(props.maxStageAttempts(), 1);
        this.maxReceives = Math.max(props.maxReceives(), 1);
        this.baseBackoffMs = Math.max(props.backoffMs(), 0);
        this.maxBackoffMs = Math.max(props.maxBackoffMs(), this.baseBackoffMs);
        this.stageTimeout = Duration.ofSeconds(Math.max(props.stageTimeoutSeconds(), 1));
        this.stageExecutor = Executors.newCachedThreadPool(new CustomizableThreadFactory("pipeline-stage-"));
    }

    public void handle(ReceivedMessage message) {
        TaskMessage decoded;
        try {
            decoded = codec.decode(message.body());
        } catch (ValidationException ex) {
            queue.deadLetter(message.messageId(), "Malformed message: " + SafeMessages.of(ex));
            return;
        }

        UUID taskId = decoded.taskId();
        Optional<PresentationTaskEntity> loaded = statusStore.find(taskId);
        if (loaded.isEmpty()) {
            queue.deadLetter(message.messageId(), "Unknown task " + taskId);
            return;
        }
        PresentationTaskEntity task = loaded.get();
        if (task.getStatus().isTerminal()) {
            log.info("Duplicate delivery for finished task taskId={} status={}", taskId, task.getStatus());
            queue.ack(message.messageId());
            return;
        }
        if (message.receiveCount() > maxReceives) {
            if (fail(task, new TaskError(TaskErrorKind.INTERNAL, "Task message exceeded its delivery limit", stageOf(task)))) {
                queue.deadLetter(message.messageId(), "Delivery limit exceeded for task " + taskId);
            } else {
                queue.release(message.messageId(), Duration.ZERO);
            }
            return;
        }
        drive(message, task);
    }

    private void drive(ReceivedMessage message, PresentationTaskEntity initial) {
        PresentationTaskEntity task = initial;
        while (true) {
            if (task.getStatus().isTerminal()) {
                queue.ack(message.messageId());
                return;
            }
            if (task.getStatus() == TaskStatus.PENDING) {
                task = advance(task, null);
                continue;
            }

            TaskStatus stage = task.getStatus();
            PresentationTaskEntity working = task.copy();
            try {
                runStage(stages.get(stage), working);
            } catch (RetryableUpstreamException ex) {
                onRetryableFailure(message, task, stage, ex);
                return;
            } catch (PipelineException ex) {
                log.warn("Stage failed taskId={} stage={} kind={} message={}",
                        task.getTaskId(), stage, ex.kind().code(), SafeMessages.of(ex));
                settle(message, fail(task, new TaskError(ex.kind(), SafeMessages.of(ex), stage)));
                return;
            } catch (RuntimeException ex) {
                log.error("Stage crashed taskId={} stage={} errorType={} message={}",
                        task.getTaskId(), stage, ex.getClass().getSimpleName(), SafeMessages.of(ex), ex);
                settle(message, fail(task, new TaskError(
                        TaskErrorKind.INTERNAL, "Internal error during " + stage.name().toLowerCase(Locale.ROOT), stage)));
                return;
            }
            task = advance(task, working);
        }
    }

    /**
     * Moves {@code task} to its next status, carrying the refs produced into {@code produced}.
     * When the write loses, the persisted row is returned instead so the caller continues from there.
     */
    private PresentationTaskEntity advance(PresentationTaskEntity task, PresentationTaskEntity produced) {
        TaskStatus from = task.getStatus();
        TaskStatus next = from.next();
        Instant now = clock.instant();
        PresentationTaskEntity updated = produced == null ? task.copy() : produced;
        updated.setStatus(next);
        updated.setProgress(next.progress());
        updated.setUpdatedAt(now);
        if (next == TaskStatus.COMPLETED) {
            updated.setCompletedAt(now);
        }
        if (!statusStore.compareAndSet(updated, from, task.getVersion())) {
            log.info("Stale transition ignored taskId={} from={} to={}", task.getTaskId(), from, next);
            return reload(task);
        }
        log.info("Task advanced taskId={} from={} to={} progress={}", task.getTaskId(), from, next, next.progress());
        if (next == TaskStatus.COMPLETED) {
            publishFinished(updated);
        }
        return updated;
    }

    private void onRetryableFailure(ReceivedMessage message,
                                    PresentationTaskEntity task,
                                    TaskStatus stage,
                                    RetryableUpstreamException ex) {
        int attempts = task.attemptsFor(stage) + 1;
        PresentationTaskEntity updated = task.copy();
        updated.setAttemptsFor(stage, attempts);
        updated.setUpdatedAt(clock.instant());

        if (attempts >= maxStageAttempts) {
            log.warn("Stage retries exhausted taskId={} stage={} attempts={} message={}",
                    task.getTaskId(), stage, attempts, SafeMessages.of(ex));
            markFailed(updated, new TaskError(TaskErrorKind.RETRYABLE_UPSTREAM,
                    "Retries exhausted: " + SafeMessages.of(ex), stage));
            if (statusStore.compareAndSet(updated, stage, task.getVersion())) {
                publishFinished(updated);
                queue.ack(message.messageId());
                return;
            }
        } else if (statusStore.compareAndSet(updated, stage, task.getVersion())) {
            long delayMs = computeBackoff(attempts);
            log.info("Stage will be retried taskId={} stage={} attempts={} delayMs={} message={}",
                    task.getTaskId(), stage, attempts, delayMs, SafeMessages.of(ex));
            queue.release(message.messageId(), Duration.ofMillis(delayMs));
            return;
        }

        // another delivery moved the task meanwhile
        PresentationTaskEntity current = reload(task);
        if (current.getStatus().isTerminal()) {
            queue.ack(message.messageId());
        } else {
            queue.release(message.messageId(), Duration.ZERO);
        }
    }

    /**
     * Records {@code error} as the terminal outcome.
     *
     * @return {@code true} once the task is terminal, {@code false} if every conditional write lost
     */
    private boolean fail(PresentationTaskEntity task, TaskError error) {
        PresentationTaskEntity current = task;
        for (int i = 0; i < MAX_FAIL_WRITE_ATTEMPTS; i++) {
            if (current.getStatus().isTerminal()) {
                return true;
            }
            PresentationTaskEntity updated = current.copy();
            markFailed(updated, error);
            if (statusStore.compareAndSet(updated, current.getStatus(), current.getVersion())) {
                publishFinished(updated);
                return true;
            }
            current = reload(current);
        }
        log.error("Could not record failure taskId={} kind={}", task.getTaskId(), error.kind().code());
        return false;
    }

    private void settle(ReceivedMessage message, boolean terminal) {
        if (terminal) {
            queue.ack(message.messageId());
        } else {
            queue.release(message.messageId(), Duration.ZERO);
        }
    }

    private void markFailed(PresentationTaskEntity task, TaskError error) {
        Instant now = clock.instant();
        task.setStatus(TaskStatus.FAILED);
        task.setProgress(TaskStatus.FAILED.progress());
        task.setError(error);
        task.setUpdatedAt(now);
        task.setCompletedAt(now);
    }

    private void runStage(PipelineStage stage, PresentationTaskEntity task) {
        Future<?> future = stageExecutor.submit(() -> stage.execute(task));
        try {
            future.get(stageTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new RetryableUpstreamException(
                    "Stage " + stage.stage() + " timed out after " + stageTimeout.toSeconds() + "s", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RetryableUpstreamException("Interrupted while running stage " + stage.stage(), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Stage " + stage.stage() + " failed", cause);
        }
    }

    private PresentationTaskEntity reload(PresentationTaskEntity task) {
        return statusStore.find(task.getTaskId())
                .orElseThrow(() -> new IllegalStateException("Task disappeared: " + task.getTaskId()));
    }

    private void publishFinished(PresentationTaskEntity task) {
        events.publishEvent(new PresentationTaskFinishedEvent(
                task.getTaskId(),
                task.getStatus(),
                task.getArtifactRef(),
                task.error(),
                task.getCompletedAt()
        ));
    }

    private TaskStatus stageOf(PresentationTaskEntity task) {
        return task.getStatus().isStage() ? task.getStatus() : null;
    }

    private long computeBackoff(int attempts) {
        long multiplier = 1L << Math.min(Math.max(attempts - 1, 0), 30);
        long backoff = baseBackoffMs * multiplier;
        if (backoff < 0) {
            return maxBackoffMs;
        }
        return Math.min(backoff, maxBackoffMs);
    }

    @PreDestroy
    public void shutdown() {
        stageExecutor.shutdownNow();
    }
}
