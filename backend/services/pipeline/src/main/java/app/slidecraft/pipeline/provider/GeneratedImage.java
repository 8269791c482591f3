package app.slidecraft.pipeline.provider;

public record GeneratedImage(
        byte[] bytes,
        String mimeType,
        String model
) {
}
