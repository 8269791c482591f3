package app.slidecraft.pipeline.service;

import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.model.TaskError;
import app.slidecraft.pipeline.domain.type.TaskErrorKind;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import app.slidecraft.pipeline.support.PostgresIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
@ActiveProfiles("test")
class JdbcTaskStatusStoreIntegrationTest extends PostgresIntegrationTest {

    @Autowired
    JdbcTaskStatusStore statusStore;

    @MockitoBean
    PresentationTaskWorker worker;

    @Test
    void compareAndSetRequiresMatchingStatusAndVersion() {
        PresentationTaskEntity task = created();

        PresentationTaskEntity outline = task.copy();
        outline.setStatus(TaskStatus.OUTLINE);
        outline.setProgress(TaskStatus.OUTLINE.progress());
        assertThat(statusStore.compareAndSet(outline, TaskStatus.PENDING, 0L)).isTrue();
        assertThat(outline.getVersion()).isEqualTo(1L);

        PresentationTaskEntity stale = task.copy();
        stale.setStatus(TaskStatus.OUTLINE);
        assertThat(statusStore.compareAndSet(stale, TaskStatus.PENDING, 0L)).isFalse();

        PresentationTaskEntity stored = statusStore.find(task.getTaskId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.OUTLINE);
        assertThat(stored.getVersion()).isEqualTo(1L);
    }

    @Test
    void terminalRowIsNeverOverwritten() {
        PresentationTaskEntity task = created();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        PresentationTaskEntity failed = task.copy();
        failed.setStatus(TaskStatus.FAILED);
        failed.setProgress(100);
        failed.setError(new TaskError(TaskErrorKind.PERMANENT_UPSTREAM, "rejected", TaskStatus.OUTLINE));
        failed.setCompletedAt(now);
        assertThat(statusStore.compareAndSet(failed, TaskStatus.PENDING, 0L)).isTrue();

        PresentationTaskEntity late = task.copy();
        late.setStatus(TaskStatus.CONTENT);
        assertThat(statusStore.compareAndSet(late, TaskStatus.OUTLINE, failed.getVersion())).isFalse();

        PresentationTaskEntity revived = failed.copy();
        revived.setStatus(TaskStatus.CONTENT);
        assertThrows(IllegalArgumentException.class,
                () -> statusStore.compareAndSet(revived, TaskStatus.FAILED, failed.getVersion()));

        PresentationTaskEntity stored = statusStore.find(task.getTaskId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(stored.error()).isEqualTo(new TaskError(TaskErrorKind.PERMANENT_UPSTREAM, "rejected", TaskStatus.OUTLINE));
    }

    private PresentationTaskEntity created() {
        PresentationTaskEntity task = PresentationTaskEntity.pending(
                UUID.randomUUID(), "Integration topic", 5, "professional", Instant.now().truncatedTo(ChronoUnit.MILLIS));
        statusStore.create(task);
        return task;
    }
}
