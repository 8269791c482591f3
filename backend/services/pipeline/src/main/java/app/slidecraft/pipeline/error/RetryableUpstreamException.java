package app.slidecraft.pipeline.error;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;

import java.time.Duration;

/**
 * Throttling, timeouts and transient 5xx responses from a generation endpoint or storage.
 */
public class RetryableUpstreamException extends PipelineException {

    private final Duration retryAfter;

    public RetryableUpstreamException(String message) {
        this(message, null, null);
    }

    public RetryableUpstreamException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public RetryableUpstreamException(String message, Throwable cause, Duration retryAfter) {
        super(TaskErrorKind.RETRYABLE_UPSTREAM, message, cause);
        this.retryAfter = retryAfter;
    }

    /**
     * Server-provided hint, or {@code null}.
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
