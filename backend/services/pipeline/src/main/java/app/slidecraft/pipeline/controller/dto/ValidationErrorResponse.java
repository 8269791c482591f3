package app.slidecraft.pipeline.controller.dto;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;

public record ValidationErrorResponse(
        TaskErrorKind kind,
        String field,
        String message
) {
}
