package app.slidecraft.pipeline.domain.model;

import java.util.Comparator;
import java.util.List;

public record DeckContent(List<SlideContent> slides) {
    public DeckContent {
        slides = slides == null
                ? List.of()
                : slides.stream().sorted(Comparator.comparingInt(SlideContent::order)).toList();
    }
}
