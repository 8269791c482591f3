package app.slidecraft.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.pipeline.tasks")
public record TaskProps(
        int maxStageAttempts,
        long visibilityTimeoutSeconds,
        long backoffMs,
        long maxBackoffMs,
        int concurrentTasks,
        int maxReceives,
        long stageTimeoutSeconds,
        String workerId
) {
}
