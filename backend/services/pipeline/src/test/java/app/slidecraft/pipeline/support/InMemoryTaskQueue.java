package app.slidecraft.pipeline.support;

import app.slidecraft.pipeline.queue.ReceivedMessage;
import app.slidecraft.pipeline.queue.TaskMessage;
import app.slidecraft.pipeline.queue.TaskMessageCodec;
import app.slidecraft.pipeline.queue.TaskQueue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Queue fake without a clock: a received message stays in flight until it is released, acked or
 * dead-lettered, or {@link #expireVisibility} simulates the timeout running out.
 */
public class InMemoryTaskQueue implements TaskQueue {

    private final TaskMessageCodec codec;
    private final Map<UUID, Entry> entries = new LinkedHashMap<>();
    private final List<Duration> releaseDelays = new ArrayList<>();

    public InMemoryTaskQueue(TaskMessageCodec codec) {
        this.codec = codec;
    }

    @Override
    public synchronized UUID enqueue(TaskMessage message) {
        return enqueueRaw(codec.encode(message));
    }

    public synchronized UUID enqueueRaw(String body) {
        UUID id = UUID.randomUUID();
        entries.put(id, new Entry(body));
        return id;
    }

    @Override
    public synchronized Optional<ReceivedMessage> receive(Duration visibilityTimeout) {
        for (Map.Entry<UUID, Entry> item : entries.entrySet()) {
            Entry entry = item.getValue();
            if (!entry.dead && !entry.inFlight) {
                entry.inFlight = true;
                entry.receiveCount++;
                return Optional.of(new ReceivedMessage(item.getKey(), entry.body, entry.receiveCount));
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized void extendVisibility(UUID messageId, Duration visibilityTimeout) {
    }

    @Override
    public synchronized void release(UUID messageId, Duration delay) {
        Entry entry = entries.get(messageId);
        if (entry != null) {
            entry.inFlight = false;
            releaseDelays.add(delay);
        }
    }

    @Override
    public synchronized void ack(UUID messageId) {
        entries.remove(messageId);
    }

    @Override
    public synchronized void deadLetter(UUID messageId, String reason) {
        Entry entry = entries.get(messageId);
        if (entry != null) {
            entry.dead = true;
            entry.inFlight = false;
            entry.deadReason = reason;
        }
    }

    public synchronized void expireVisibility(UUID messageId) {
        Entry entry = entries.get(messageId);
        if (entry != null) {
            entry.inFlight = false;
        }
    }

    public synchronized int pendingCount() {
        return (int) entries.values().stream().filter(entry -> !entry.dead).count();
    }

    public synchronized List<String> deadReasons() {
        return entries.values().stream().filter(entry -> entry.dead).map(entry -> entry.deadReason).toList();
    }

    public synchronized List<Duration> releaseDelays() {
        return List.copyOf(releaseDelays);
    }

    private static final class Entry {
        private final String body;
        private int receiveCount;
        private boolean inFlight;
        private boolean dead;
        private String deadReason;

        private Entry(String body) {
            this.body = body;
        }
    }
}
