package app.slidecraft.pipeline.provider.anthropic;

import app.slidecraft.pipeline.error.PermanentUpstreamException;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * Reads a Messages API body into the joined text of its text blocks. An error envelope returned
 * with a success status is mapped into the upstream error taxonomy.
 */
final class ClaudeResponseParser {

    private static final Set<String> RETRYABLE_ERROR_TYPES = Set.of("overloaded_error", "rate_limit_error", "api_error");

    record Reply(String text, String stopReason) {

        boolean truncated() {
            return "max_tokens".equals(stopReason);
        }
    }

    private ClaudeResponseParser() {
    }

    static Reply parse(JsonNode response) {
        if (response == null || response.isMissingNode() || response.isNull()) {
            throw new PermanentUpstreamException("Claude response is empty");
        }
        if ("error".equals(response.path("type").asText())) {
            String errorType = response.path("error").path("type").asText("unknown");
            String message = "Claude returned " + errorType;
            if (RETRYABLE_ERROR_TYPES.contains(errorType)) {
                throw new RetryableUpstreamException(message);
            }
            throw new PermanentUpstreamException(message);
        }

        StringBuilder joined = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if (!"text".equals(block.path("type").asText())) {
                continue;
            }
            String text = block.path("text").asText("");
            if (text.isBlank()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append('\n');
            }
            joined.append(text);
        }
        return new Reply(joined.toString(), response.path("stop_reason").asText(null));
    }
}
