package app.slidecraft.pipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SlideContent(
        int order,
        String title,
        List<String> bullets,
        @JsonProperty("speaker_notes") String speakerNotes,
        @JsonProperty("image_prompt") String imagePrompt,
        boolean fallback
) {
    public SlideContent {
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
    }
}
