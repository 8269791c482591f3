package app.slidecraft.pipeline.error;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;

public class ResolutionException extends PipelineException {

    public ResolutionException(String message) {
        super(TaskErrorKind.RESOLUTION, message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(TaskErrorKind.RESOLUTION, message, cause);
    }
}
