package app.slidecraft.pipeline.service;

import app.slidecraft.pipeline.domain.model.TaskError;
import app.slidecraft.pipeline.domain.type.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once a task reaches COMPLETED or FAILED.
 */
public record PresentationTaskFinishedEvent(
        UUID taskId,
        TaskStatus status,
        String artifactRef,
        TaskError error,
        Instant finishedAt
) {
}
