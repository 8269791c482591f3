package app.slidecraft.pipeline.provider;

import app.slidecraft.pipeline.error.PermanentUpstreamException;
import app.slidecraft.pipeline.error.PipelineException;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps HTTP client failures of a generation endpoint into the pipeline taxonomy. Response bodies
 * are never copied into the message.
 */
public final class UpstreamErrors {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(408, 425, 429, 500, 502, 503, 504, 529);
    private static final Pattern RETRY_IN_PATTERN = Pattern.compile("retry in\\s+([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private UpstreamErrors() {
    }

    public static PipelineException map(String provider, RestClientException ex) {
        if (ex instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            String message = provider + " responded with status " + status;
            if (RETRYABLE_STATUSES.contains(status)) {
                return new RetryableUpstreamException(message, ex, retryAfter(response));
            }
            return new PermanentUpstreamException(message, ex);
        }
        if (ex instanceof ResourceAccessException) {
            return new RetryableUpstreamException(provider + " is unreachable or timed out", ex);
        }
        return new PermanentUpstreamException(provider + " call failed: " + ex.getClass().getSimpleName(), ex);
    }

    static Duration retryAfter(RestClientResponseException response) {
        HttpHeaders headers = response.getResponseHeaders();
        if (headers != null) {
            String header = headers.getFirst(HttpHeaders.RETRY_AFTER);
            Duration parsed = parseRetryAfterSeconds(header);
            if (parsed != null) {
                return parsed;
            }
        }
        Long millis = parseRetryAfterMessage(response.getStatusText());
        return millis == null ? null : Duration.ofMillis(millis);
    }

    static Duration parseRetryAfterSeconds(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    public static Long parseRetryAfterMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        Matcher matcher = RETRY_IN_PATTERN.matcher(message);
        if (!matcher.find()) {
            return null;
        }
        double seconds = Double.parseDouble(matcher.group(1));
        return Math.round(seconds * 1000);
    }
}
