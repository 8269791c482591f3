package app.slidecraft.pipeline.provider;

/**
 * Synchronous text generation. Implementations throw only
 * {@link app.slidecraft.pipeline.error.RetryableUpstreamException} or
 * {@link app.slidecraft.pipeline.error.PermanentUpstreamException}.
 */
public interface TextGenerationEndpoint {
    String provider();

    String complete(TextPrompt prompt);
}
