package app.slidecraft.pipeline.provider;

/**
 * Synchronous image generation with the same error contract as {@link TextGenerationEndpoint}.
 */
public interface ImageGenerationEndpoint {
    String provider();

    /**
     * Model identity, part of the image cache key.
     */
    String model();

    GeneratedImage generate(ImagePrompt prompt);
}
