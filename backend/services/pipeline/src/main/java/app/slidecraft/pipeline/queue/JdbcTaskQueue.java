package app.slidecraft.pipeline.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Postgres-backed queue. Consumers claim rows with {@code for update skip locked}, so concurrent
 * workers never receive the same visible message twice.
 */
@Component
public class JdbcTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskQueue.class);

    private final JdbcTemplate jdbcTemplate;
    private final TaskMessageCodec codec;

    public JdbcTaskQueue(JdbcTemplate jdbcTemplate, TaskMessageCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @Override
    public UUID enqueue(TaskMessage message) {
        UUID messageId = UUID.randomUUID();
        jdbcTemplate.update(
                """
                insert into app_pipeline.task_messages
                    (message_id, task_id, payload, state, receive_count, visible_at, created_at, updated_at)
                values (?, ?, cast(? as jsonb), 'queued', 0, now(), now(), now())
                """,
                messageId,
                message.taskId(),
                codec.encode(message)
        );
        return messageId;
    }

    @Override
    @Transactional
    public Optional<ReceivedMessage> receive(Duration visibilityTimeout) {
        ReceivedMessage received = jdbcTemplate.query(
                """
                with next_message as (
                    select message_id
                    from app_pipeline.task_messages
                    where state = 'queued'
                      and visible_at <= now()
                    order by visible_at asc
                    limit 1
                    for update skip locked
                )
                update app_pipeline.task_messages
                set receive_count = receive_count + 1,
                    visible_at = now() + (? * interval '1 second'),
                    updated_at = now()
                where message_id in (select message_id from next_message)
                returning message_id, payload::text as payload, receive_count
                """,
                rs -> rs.next()
                        ? new ReceivedMessage(
                                UUID.fromString(rs.getString("message_id")),
                                rs.getString("payload"),
                                rs.getInt("receive_count"))
                        : null,
                visibilityTimeout.getSeconds()
        );
        return Optional.ofNullable(received);
    }

    @Override
    public void extendVisibility(UUID messageId, Duration visibilityTimeout) {
        jdbcTemplate.update(
                """
                update app_pipeline.task_messages
                set visible_at = now() + (? * interval '1 second'),
                    updated_at = now()
                where message_id = ?
                  and state = 'queued'
                """,
                visibilityTimeout.getSeconds(),
                messageId
        );
    }

    @Override
    public void release(UUID messageId, Duration delay) {
        jdbcTemplate.update(
                """
                update app_pipeline.task_messages
                set visible_at = now() + (? * interval '1 millisecond'),
                    updated_at = now()
                where message_id = ?
                  and state = 'queued'
                """,
                Math.max(delay.toMillis(), 0L),
                messageId
        );
    }

    @Override
    public void ack(UUID messageId) {
        jdbcTemplate.update("delete from app_pipeline.task_messages where message_id = ?", messageId);
    }

    @Override
    public void deadLetter(UUID messageId, String reason) {
        int rows = jdbcTemplate.update(
                """
                update app_pipeline.task_messages
                set state = 'dead',
                    dead_reason = ?,
                    updated_at = now()
                where message_id = ?
                """,
                reason,
                messageId
        );
        if (rows > 0) {
            log.warn("Task message dead-lettered messageId={} reason={}", messageId, reason);
        }
    }
}
