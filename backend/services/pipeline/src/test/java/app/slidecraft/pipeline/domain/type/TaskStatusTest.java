package app.slidecraft.pipeline.domain.type;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaskStatusTest {

    @Test
    void stagesRunInFixedOrder() {
        TaskStatus status = TaskStatus.PENDING;
        StringBuilder path = new StringBuilder(status.name());
        while (!status.isTerminal()) {
            status = status.next();
            path.append(">").append(status.name());
        }
        assertThat(path.toString()).isEqualTo("PENDING>OUTLINE>CONTENT>IMAGES>COMPILE>COMPLETED");
    }

    @Test
    void progressIsMonotonicAcrossStages() {
        int previous = -1;
        for (TaskStatus status : new TaskStatus[]{TaskStatus.PENDING, TaskStatus.OUTLINE, TaskStatus.CONTENT,
                TaskStatus.IMAGES, TaskStatus.COMPILE, TaskStatus.COMPLETED}) {
            assertThat(status.progress()).isGreaterThan(previous);
            previous = status.progress();
        }
    }

    @Test
    void terminalStatusesAcceptNoTransition() {
        for (TaskStatus target : TaskStatus.values()) {
            assertThat(TaskStatus.COMPLETED.canTransitionTo(target)).isFalse();
            assertThat(TaskStatus.FAILED.canTransitionTo(target)).isFalse();
        }
        assertThrows(IllegalStateException.class, TaskStatus.FAILED::next);
    }

    @Test
    void failedIsReachableFromAnyActiveStatus() {
        assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED)).isTrue();
        assertThat(TaskStatus.IMAGES.canTransitionTo(TaskStatus.FAILED)).isTrue();
        assertThat(TaskStatus.IMAGES.canTransitionTo(TaskStatus.CONTENT)).isFalse();
    }

    @Test
    void errorKindsSerializeToStableCodes() {
        assertThat(TaskErrorKind.RETRYABLE_UPSTREAM.code()).isEqualTo("RetryableUpstreamError");
        assertThat(TaskErrorKind.fromCode("ValidationError")).isEqualTo(TaskErrorKind.VALIDATION);
    }

    @Test
    void styleParsingDefaultsAndRejectsUnknown() {
        assertThat(PresentationStyle.parse(null)).contains(PresentationStyle.PROFESSIONAL);
        assertThat(PresentationStyle.parse(" Academic ")).contains(PresentationStyle.ACADEMIC);
        assertThat(PresentationStyle.parse("baroque")).isEmpty();
    }
}
