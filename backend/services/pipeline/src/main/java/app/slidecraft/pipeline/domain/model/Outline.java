package app.slidecraft.pipeline.domain.model;

import java.util.List;

public record Outline(
        String topic,
        List<SlideStub> slides,
        boolean fallback
) {
    public Outline {
        slides = slides == null ? List.of() : List.copyOf(slides);
    }

    public int size() {
        return slides.size();
    }
}
