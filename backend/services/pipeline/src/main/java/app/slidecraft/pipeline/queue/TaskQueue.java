package app.slidecraft.pipeline.queue;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * At-least-once task queue. A received message stays invisible for the visibility timeout and is
 * delivered again unless it is acknowledged, released or dead-lettered before then.
 */
public interface TaskQueue {

    UUID enqueue(TaskMessage message);

    Optional<ReceivedMessage> receive(Duration visibilityTimeout);

    void extendVisibility(UUID messageId, Duration visibilityTimeout);

    /**
     * Makes the message visible again after {@code delay}.
     */
    void release(UUID messageId, Duration delay);

    void ack(UUID messageId);

    void deadLetter(UUID messageId, String reason);
}
