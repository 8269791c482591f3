package app.slidecraft.pipeline.content;

import app.slidecraft.pipeline.domain.model.SlideStub;
import app.slidecraft.pipeline.domain.type.PresentationStyle;

final class ContentPrompts {

    private ContentPrompts() {
    }

    static String outline(String topic, int pageCount, PresentationStyle style) {
        return """
                Create an outline for a %s presentation about: %s
                The presentation must have exactly %d slides.
                Slide 1 is a title slide and slide %d is a summary slide.
                Respond with JSON only, in this shape:
                {"title": "...", "slides": [{"slide_number": 1, "title": "...", "brief": "..."}]}
                """.formatted(style.code(), topic, pageCount, pageCount);
    }

    static String slide(SlideStub stub, String topic, PresentationStyle style, int minBullets, int maxBullets) {
        return """
                Write slide %d of a %s presentation about: %s
                Slide title: %s
                Slide brief: %s
                Give %d to %d short bullet points, speaker notes of a few sentences and a one-line image prompt.
                Respond with JSON only, in this shape:
                {"title": "...", "bullet_points": ["..."], "speaker_notes": "...", "image_prompt": "..."}
                """.formatted(
                stub.order(),
                style.code(),
                topic,
                stub.title(),
                stub.brief() == null ? stub.title() : stub.brief(),
                minBullets,
                maxBullets
        );
    }
}
