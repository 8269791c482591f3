package app.slidecraft.pipeline.provider.openai;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.ai.openai")
public record OpenAiProps(
        String baseUrl,
        String apiKey,
        String defaultImageModel,
        String defaultImageSize,
        String defaultImageQuality,
        String defaultImageFormat,
        Integer connectTimeoutMs,
        Integer readTimeoutMs
) {
}
