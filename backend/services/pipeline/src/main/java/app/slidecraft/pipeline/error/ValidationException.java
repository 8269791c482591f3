package app.slidecraft.pipeline.error;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;

public class ValidationException extends PipelineException {

    private final String field;

    public ValidationException(String field, String message) {
        super(TaskErrorKind.VALIDATION, message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
