package app.slidecraft.pipeline.provider;

import java.util.Map;

public record TextPrompt(
        Purpose purpose,
        String prompt,
        Integer maxOutputTokens,
        Map<String, String> hints
) {
    public enum Purpose {
        OUTLINE,
        SLIDE_CONTENT
    }

    public TextPrompt {
        hints = hints == null ? Map.of() : Map.copyOf(hints);
    }
}
