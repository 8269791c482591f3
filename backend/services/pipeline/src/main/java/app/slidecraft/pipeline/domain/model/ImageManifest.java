package app.slidecraft.pipeline.domain.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public record ImageManifest(List<SlideImage> images) {
    public ImageManifest {
        images = images == null
                ? List.of()
                : images.stream().sorted(Comparator.comparingInt(SlideImage::order)).toList();
    }

    public Optional<SlideImage> forSlide(int order) {
        return images.stream().filter(image -> image.order() == order).findFirst();
    }

    public long placeholderCount() {
        return images.stream().filter(SlideImage::placeholder).count();
    }
}
