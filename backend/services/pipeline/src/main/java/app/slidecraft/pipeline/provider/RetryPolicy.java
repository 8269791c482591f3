package app.slidecraft.pipeline.provider;

import app.slidecraft.pipeline.error.PermanentUpstreamException;
import app.slidecraft.pipeline.error.PipelineException;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import app.slidecraft.pipeline.support.SafeMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Exponential backoff around a single endpoint call.
 * <ul>
 *     <li>retryable errors: up to {@code maxAttempts} attempts, then rethrown as exhausted</li>
 *     <li>permanent and unknown errors: one retry, then escalated</li>
 *     <li>other pipeline errors: never retried</li>
 * </ul>
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);
    private static final int NON_RETRYABLE_ATTEMPTS = 2;

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;

    public RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        this.maxAttempts = Math.max(maxAttempts, 1);
        this.baseBackoffMs = Math.max(baseBackoffMs, 0);
        this.maxBackoffMs = Math.max(maxBackoffMs, this.baseBackoffMs);
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            Duration hint = null;
            try {
                return call.get();
            } catch (RetryableUpstreamException ex) {
                if (attempt >= maxAttempts) {
                    throw new RetryableUpstreamException(
                            operation + " exhausted after " + attempt + " attempts: " + SafeMessages.of(ex), ex);
                }
                hint = ex.retryAfter();
                log.info("Retrying operation={} attempt={} reason=retryable message={}", operation, attempt, SafeMessages.of(ex));
            } catch (PermanentUpstreamException ex) {
                if (attempt >= Math.min(NON_RETRYABLE_ATTEMPTS, maxAttempts)) {
                    throw ex;
                }
                log.info("Retrying operation={} attempt={} reason=permanent message={}", operation, attempt, SafeMessages.of(ex));
            } catch (PipelineException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                if (attempt >= Math.min(NON_RETRYABLE_ATTEMPTS, maxAttempts)) {
                    throw new PermanentUpstreamException(
                            operation + " failed with " + ex.getClass().getSimpleName(), ex);
                }
                log.info("Retrying operation={} attempt={} reason=unknown errorType={}", operation, attempt, ex.getClass().getSimpleName());
            }
            sleep(operation, delayFor(attempt, hint));
        }
    }

    long delayFor(int attempt, Duration hint) {
        long backoff = computeBackoff(attempt);
        if (hint != null) {
            backoff = Math.max(backoff, hint.toMillis());
        }
        return Math.min(backoff, maxBackoffMs);
    }

    private long computeBackoff(int attempts) {
        long multiplier = 1L << Math.min(Math.max(attempts - 1, 0), 30);
        long backoff = baseBackoffMs * multiplier;
        if (backoff < 0) {
            return maxBackoffMs;
        }
        return Math.min(backoff, maxBackoffMs);
    }

    private void sleep(String operation, long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RetryableUpstreamException(operation + " interrupted during backoff", ex);
        }
    }
}
