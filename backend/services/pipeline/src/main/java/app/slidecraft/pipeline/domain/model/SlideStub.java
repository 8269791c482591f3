package app.slidecraft.pipeline.domain.model;

public record SlideStub(
        int order,
        String title,
        String brief
) {
}
