package app.slidecraft.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.pipeline.images")
public record ImageProps(
        int width,
        int height,
        int concurrency,
        long callTimeoutSeconds,
        int maxAttempts,
        long backoffMs,
        long maxBackoffMs,
        long cacheTtlHours,
        long placeholderTtlMinutes
) {
    public Duration cacheTtl() {
        return Duration.ofHours(Math.max(cacheTtlHours, 1));
    }

    public Duration placeholderTtl() {
        return Duration.ofMinutes(Math.max(placeholderTtlMinutes, 1));
    }

    public Duration callTimeout() {
        return Duration.ofSeconds(Math.max(callTimeoutSeconds, 1));
    }
}
