package app.slidecraft.pipeline.queue;

import app.slidecraft.pipeline.service.PresentationTaskWorker;
import app.slidecraft.pipeline.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JdbcTaskQueueIntegrationTest extends PostgresIntegrationTest {

    @Autowired
    JdbcTaskQueue queue;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @MockitoBean
    PresentationTaskWorker worker;

    @BeforeEach
    void clean() {
        jdbcTemplate.update("delete from app_pipeline.task_messages");
    }

    @Test
    void receivedMessageIsInvisibleUntilReleased() {
        UUID taskId = UUID.randomUUID();
        UUID messageId = queue.enqueue(TaskMessage.generate(taskId));

        Optional<ReceivedMessage> first = queue.receive(Duration.ofSeconds(300));
        assertThat(first).isPresent();
        assertThat(first.get().messageId()).isEqualTo(messageId);
        assertThat(first.get().receiveCount()).isEqualTo(1);
        assertThat(first.get().body()).contains(taskId.toString());
        assertThat(queue.receive(Duration.ofSeconds(300))).isEmpty();

        queue.release(messageId, Duration.ZERO);

        Optional<ReceivedMessage> second = queue.receive(Duration.ofSeconds(300));
        assertThat(second).isPresent();
        assertThat(second.get().receiveCount()).isEqualTo(2);
    }

    @Test
    void expiredVisibilityMakesMessageDeliverableAgain() {
        UUID messageId = queue.enqueue(TaskMessage.generate(UUID.randomUUID()));

        assertThat(queue.receive(Duration.ZERO)).isPresent();

        Optional<ReceivedMessage> redelivered = queue.receive(Duration.ofSeconds(300));
        assertThat(redelivered).isPresent();
        assertThat(redelivered.get().messageId()).isEqualTo(messageId);
        assertThat(redelivered.get().receiveCount()).isEqualTo(2);
    }

    @Test
    void ackedAndDeadLetteredMessagesAreNeverDeliveredAgain() {
        UUID acked = queue.enqueue(TaskMessage.generate(UUID.randomUUID()));
        UUID dead = queue.enqueue(TaskMessage.generate(UUID.randomUUID()));

        queue.ack(acked);
        queue.deadLetter(dead, "Unknown task");

        assertThat(queue.receive(Duration.ZERO)).isEmpty();
        String reason = jdbcTemplate.queryForObject(
                "select dead_reason from app_pipeline.task_messages where message_id = ?", String.class, dead);
        assertThat(reason).isEqualTo("Unknown task");
    }
}
