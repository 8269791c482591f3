package app.slidecraft.pipeline.stage;

import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.type.PresentationStyle;

final class StageSupport {

    private StageSupport() {
    }

    static PresentationStyle styleOf(PresentationTaskEntity task) {
        return PresentationStyle.parse(task.getStyle()).orElse(PresentationStyle.DEFAULT);
    }

    static String requireRef(String ref, String name, PresentationTaskEntity task) {
        if (ref == null || ref.isBlank()) {
            throw new IllegalStateException("Task " + task.getTaskId() + " has no " + name);
        }
        return ref;
    }
}
