package app.slidecraft.pipeline.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app.s3")
public record S3Props(
        @NotBlank String bucket,
        @NotBlank String region,
        String endpoint,
        boolean pathStyleAccess,
        @NotBlank String accessKey,
        @NotBlank String secretKey,
        long presignTtlSeconds,
        long callTimeoutSeconds,
        List<String> accountQualifiers
) {
    public Duration presignTtl() {
        return Duration.ofSeconds(presignTtlSeconds > 0 ? presignTtlSeconds : 3600);
    }

    public Duration callTimeout() {
        return Duration.ofSeconds(callTimeoutSeconds > 0 ? callTimeoutSeconds : 30);
    }
}
