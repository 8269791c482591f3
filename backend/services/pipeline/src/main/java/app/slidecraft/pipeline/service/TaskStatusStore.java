package app.slidecraft.pipeline.service;

import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.type.TaskStatus;

import java.util.Optional;
import java.util.UUID;

/**
 * Status Table contract. Every mutation after creation goes through {@link #compareAndSet},
 * which only succeeds while the stored row still carries the expected status and version.
 */
public interface TaskStatusStore {

    void create(PresentationTaskEntity task);

    Optional<PresentationTaskEntity> find(UUID taskId);

    /**
     * Persists {@code updated} if the stored row is non-terminal and still at
     * {@code expectedStatus}/{@code expectedVersion}. On success the entity's version is bumped.
     *
     * @return {@code false} when another writer got there first
     * @throws IllegalArgumentException if the write would move the task backwards or out of a terminal status
     */
    boolean compareAndSet(PresentationTaskEntity updated, TaskStatus expectedStatus, long expectedVersion);
}
