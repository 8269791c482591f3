package app.slidecraft.pipeline.stage;

import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.type.TaskStatus;

/**
 * One step of the task state machine. Implementations read their inputs from the refs already on
 * {@code task}, write their output to task-scoped blob keys and record the new refs on {@code task}.
 * Re-running a stage overwrites the same keys.
 */
public interface PipelineStage {

    TaskStatus stage();

    void execute(PresentationTaskEntity task);
}
