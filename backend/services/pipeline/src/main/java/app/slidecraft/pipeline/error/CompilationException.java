package app.slidecraft.pipeline.error;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;

public class CompilationException extends PipelineException {

    public CompilationException(String message) {
        super(TaskErrorKind.COMPILATION, message);
    }

    public CompilationException(String message, Throwable cause) {
        super(TaskErrorKind.COMPILATION, message, cause);
    }
}
