package app.slidecraft.pipeline.controller.dto;

import java.time.Instant;
import java.util.UUID;

public record ArtifactLinkResponse(
        UUID taskId,
        String url,
        Instant expiresAt,
        Long sizeBytes,
        Integer slideCount
) {
}
