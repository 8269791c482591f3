package app.slidecraft.pipeline.error;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;

/**
 * Root of the pipeline error taxonomy. Every failure that crosses a component boundary is one of
 * its subclasses, so callers only ever see a stable {@link TaskErrorKind} and a short message.
 */
public abstract class PipelineException extends RuntimeException {

    private final TaskErrorKind kind;

    protected PipelineException(TaskErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PipelineException(TaskErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public TaskErrorKind kind() {
        return kind;
    }
}
