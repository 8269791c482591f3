package app.slidecraft.pipeline.service;

import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import app.slidecraft.pipeline.repository.PresentationTaskRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Component
public class JdbcTaskStatusStore implements TaskStatusStore {

    private final JdbcTemplate jdbcTemplate;
    private final PresentationTaskRepository taskRepository;

    public JdbcTaskStatusStore(JdbcTemplate jdbcTemplate, PresentationTaskRepository taskRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.taskRepository = taskRepository;
    }

    @Override
    public void create(PresentationTaskEntity task) {
        taskRepository.save(task);
    }

    @Override
    public Optional<PresentationTaskEntity> find(UUID taskId) {
        return taskRepository.findById(taskId);
    }

    @Override
    public boolean compareAndSet(PresentationTaskEntity updated, TaskStatus expectedStatus, long expectedVersion) {
        requireForward(expectedStatus, updated.getStatus());
        int rows = jdbcTemplate.update(
                """
                update app_pipeline.presentation_tasks
                set status = ?,
                    progress = ?,
                    outline_ref = ?,
                    content_ref = ?,
                    images_ref = ?,
                    artifact_ref = ?,
                    artifact_size_bytes = ?,
                    artifact_slide_count = ?,
                    error_kind = ?,
                    error_message = ?,
                    error_stage = ?,
                    outline_attempts = ?,
                    content_attempts = ?,
                    images_attempts = ?,
                    compile_attempts = ?,
                    updated_at = ?,
                    completed_at = ?,
                    version = version + 1
                where task_id = ?
                  and status = ?
                  and version = ?
                  and status not in ('COMPLETED', 'FAILED')
                """,
                updated.getStatus().name(),
                updated.getProgress(),
                updated.getOutlineRef(),
                updated.getContentRef(),
                updated.getImagesRef(),
                updated.getArtifactRef(),
                updated.getArtifactSizeBytes(),
                updated.getArtifactSlideCount(),
                updated.getErrorKind() == null ? null : updated.getErrorKind().name(),
                updated.getErrorMessage(),
                updated.getErrorStage() == null ? null : updated.getErrorStage().name(),
                updated.getOutlineAttempts(),
                updated.getContentAttempts(),
                updated.getImagesAttempts(),
                updated.getCompileAttempts(),
                timestamp(updated.getUpdatedAt()),
                timestamp(updated.getCompletedAt()),
                updated.getTaskId(),
                expectedStatus.name(),
                expectedVersion
        );
        if (rows == 0) {
            return false;
        }
        updated.setVersion(expectedVersion + 1);
        return true;
    }

    static void requireForward(TaskStatus from, TaskStatus to) {
        if (to != from && !from.canTransitionTo(to)) {
            throw new IllegalArgumentException("Illegal status transition " + from + " -> " + to);
        }
    }

    private Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
