package app.slidecraft.pipeline.provider.anthropic;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.ai.anthropic")
public record ClaudeProps(
        String baseUrl,
        String apiVersion,
        String apiKey,
        String defaultModel,
        Integer defaultMaxTokens,
        Integer connectTimeoutMs,
        Integer readTimeoutMs
) {
}
