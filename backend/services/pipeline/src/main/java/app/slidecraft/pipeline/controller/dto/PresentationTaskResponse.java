package app.slidecraft.pipeline.controller.dto;

import app.slidecraft.pipeline.domain.type.TaskStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record PresentationTaskResponse(
        UUID taskId,
        TaskStatus status,
        Integer progress,
        String topic,
        Integer pageCount,
        String style,
        String outlineRef,
        String contentRef,
        String artifactRef,
        TaskErrorResponse error,
        Map<TaskStatus, Integer> attempts,
        Instant createdAt,
        Instant updatedAt
) {
}
