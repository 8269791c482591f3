package app.slidecraft.pipeline.queue;

import java.util.UUID;

/**
 * One delivery of a queued message. {@code body} is the raw payload and has not been validated.
 */
public record ReceivedMessage(
        UUID messageId,
        String body,
        int receiveCount
) {
}
