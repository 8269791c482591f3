package app.slidecraft.pipeline.controller.dto;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;
import app.slidecraft.pipeline.domain.type.TaskStatus;

public record TaskErrorResponse(
        TaskErrorKind kind,
        String message,
        TaskStatus stage
) {
}
