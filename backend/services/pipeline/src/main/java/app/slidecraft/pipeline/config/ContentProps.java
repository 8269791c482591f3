package app.slidecraft.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.pipeline.content")
public record ContentProps(
        int minPageCount,
        int maxPageCount,
        int maxTopicLength,
        int minBullets,
        int maxBullets,
        int maxSpeakerNotesChars,
        int maxAttempts,
        long backoffMs,
        long maxBackoffMs,
        Integer maxOutputTokens
) {
}
