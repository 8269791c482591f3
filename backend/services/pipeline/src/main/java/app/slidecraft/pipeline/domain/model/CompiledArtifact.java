package app.slidecraft.pipeline.domain.model;

import java.util.UUID;

public record CompiledArtifact(
        UUID taskId,
        String blobRef,
        long sizeBytes,
        int slideCount
) {
}
