package app.slidecraft.pipeline.domain.model;

public record SlideImage(
        int order,
        String imageRef,
        boolean placeholder
) {
}
