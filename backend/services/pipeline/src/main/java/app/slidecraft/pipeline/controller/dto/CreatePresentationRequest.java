package app.slidecraft.pipeline.controller.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

public record CreatePresentationRequest(
        String topic,
        @JsonAlias("page_count") Integer pageCount,
        String style
) {
}
