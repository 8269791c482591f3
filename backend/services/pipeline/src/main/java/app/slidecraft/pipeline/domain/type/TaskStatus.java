package app.slidecraft.pipeline.domain.type;

import java.util.List;

/**
 * Lifecycle of a presentation task. A stage status means "this stage is the next one to run".
 * Order is significant: a task only ever moves to a status with a higher rank.
 */
public enum TaskStatus {
    PENDING(0),
    OUTLINE(10),
    CONTENT(30),
    IMAGES(55),
    COMPILE(85),
    COMPLETED(100),
    FAILED(100);

    public static final List<TaskStatus> STAGES = List.of(OUTLINE, CONTENT, IMAGES, COMPILE);

    private final int progress;

    TaskStatus(int progress) {
        this.progress = progress;
    }

    public int progress() {
        return progress;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isStage() {
        return STAGES.contains(this);
    }

    public TaskStatus next() {
        return switch (this) {
            case PENDING -> OUTLINE;
            case OUTLINE -> CONTENT;
            case CONTENT -> IMAGES;
            case IMAGES -> COMPILE;
            case COMPILE -> COMPLETED;
            case COMPLETED, FAILED -> throw new IllegalStateException("No transition leaves " + this);
        };
    }

    public boolean canTransitionTo(TaskStatus target) {
        if (isTerminal() || target == null) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        return target.ordinal() > ordinal();
    }
}
