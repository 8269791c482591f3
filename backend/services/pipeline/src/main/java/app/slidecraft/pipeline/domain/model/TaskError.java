package app.slidecraft.pipeline.domain.model;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;
import app.slidecraft.pipeline.domain.type.TaskStatus;

public record TaskError(
        TaskErrorKind kind,
        String message,
        TaskStatus stage
) {
}
