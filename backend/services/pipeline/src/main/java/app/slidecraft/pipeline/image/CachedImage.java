package app.slidecraft.pipeline.image;

public record CachedImage(
        String blobKey,
        boolean placeholder,
        boolean cacheHit
) {
}
