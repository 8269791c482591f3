package app.slidecraft.pipeline.error;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;

/**
 * Malformed request, auth failure or any upstream error that retrying will not fix.
 */
public class PermanentUpstreamException extends PipelineException {

    public PermanentUpstreamException(String message) {
        super(TaskErrorKind.PERMANENT_UPSTREAM, message);
    }

    public PermanentUpstreamException(String message, Throwable cause) {
        super(TaskErrorKind.PERMANENT_UPSTREAM, message, cause);
    }
}
