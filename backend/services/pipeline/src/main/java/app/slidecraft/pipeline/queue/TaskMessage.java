package app.slidecraft.pipeline.queue;

import java.util.UUID;

public record TaskMessage(
        String type,
        UUID taskId
) {
    public static final String GENERATE_PRESENTATION = "generate_presentation";

    public static TaskMessage generate(UUID taskId) {
        return new TaskMessage(GENERATE_PRESENTATION, taskId);
    }
}
