package app.slidecraft.pipeline.repository;

import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PresentationTaskRepository extends JpaRepository<PresentationTaskEntity, UUID> {
    List<PresentationTaskEntity> findByStatus(TaskStatus status);
}
