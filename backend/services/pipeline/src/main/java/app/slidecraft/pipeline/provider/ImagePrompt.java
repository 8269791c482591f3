package app.slidecraft.pipeline.provider;

public record ImagePrompt(
        String prompt,
        String style,
        int width,
        int height
) {
}
