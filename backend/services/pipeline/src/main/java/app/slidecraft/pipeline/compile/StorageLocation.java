package app.slidecraft.pipeline.compile;

public record StorageLocation(
        String container,
        String key
) {
}
