package app.slidecraft.pipeline.service;

import app.slidecraft.pipeline.config.ContentProps;
import app.slidecraft.pipeline.config.S3Props;
import app.slidecraft.pipeline.controller.dto.ArtifactLinkResponse;
import app.slidecraft.pipeline.controller.dto.CreatePresentationRequest;
import app.slidecraft.pipeline.controller.dto.PresentationTaskResponse;
import app.slidecraft.pipeline.controller.dto.TaskErrorResponse;
import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.model.TaskError;
import app.slidecraft.pipeline.domain.type.PresentationStyle;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import app.slidecraft.pipeline.error.ValidationException;
import app.slidecraft.pipeline.queue.TaskMessage;
import app.slidecraft.pipeline.queue.TaskQueue;
import app.slidecraft.pipeline.storage.ObjectStorage;
import app.slidecraft.pipeline.storage.PresignedUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

@Service
public class PresentationTaskService {

    private static final Logger log = LoggerFactory.getLogger(PresentationTaskService.class);

    private final TaskStatusStore statusStore;
    private final TaskQueue queue;
    private final ObjectStorage storage;
    private final ContentProps contentProps;
    private final S3Props s3Props;
    private final Clock clock;

    public PresentationTaskService(TaskStatusStore statusStore,
                                   TaskQueue queue,
                                   ObjectStorage storage,
                                   ContentProps contentProps,
                                   S3Props s3Props,
                                   Clock clock) {
        this.statusStore = statusStore;
        this.queue = queue;
        this.storage = storage;
        this.contentProps = contentProps;
        this.s3Props = s3Props;
        this.clock = clock;
    }

    @Transactional
    public PresentationTaskResponse submit(CreatePresentationRequest request) {
        if (request == null) {
            throw new ValidationException("body", "Request body is required");
        }
        String topic = validateTopic(request.topic());
        int pageCount = validatePageCount(request.pageCount());
        PresentationStyle style = PresentationStyle.parse(request.style())
                .orElseThrow(() -> new ValidationException("style", "Unsupported style: " + request.style()));

        PresentationTaskEntity task = PresentationTaskEntity.pending(
                UUID.randomUUID(), topic, pageCount, style.code(), clock.instant());
        statusStore.create(task);
        UUID messageId = queue.enqueue(TaskMessage.generate(task.getTaskId()));
        log.info("Presentation task submitted taskId={} messageId={} pageCount={} style={}",
                task.getTaskId(), messageId, pageCount, style.code());
        return toResponse(task);
    }

    @Transactional(readOnly = true)
    public PresentationTaskResponse getStatus(UUID taskId) {
        return toResponse(requireTask(taskId));
    }

    @Transactional(readOnly = true)
    public ArtifactLinkResponse getArtifact(UUID taskId) {
        PresentationTaskEntity task = requireTask(taskId);
        if (task.getStatus() != TaskStatus.COMPLETED || task.getArtifactRef() == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Presentation is not ready, status " + task.getStatus());
        }
        PresignedUrl url = storage.presignGet(task.getArtifactRef(), s3Props.presignTtl(), downloadName(task));
        return new ArtifactLinkResponse(
                task.getTaskId(),
                url.url(),
                url.expiresAt(),
                task.getArtifactSizeBytes(),
                task.getArtifactSlideCount()
        );
    }

    private String validateTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new ValidationException("topic", "topic must not be empty");
        }
        String trimmed = topic.trim();
        if (trimmed.length() > contentProps.maxTopicLength()) {
            throw new ValidationException("topic", "topic must be at most " + contentProps.maxTopicLength() + " characters");
        }
        return trimmed;
    }

    private int validatePageCount(Integer pageCount) {
        if (pageCount == null) {
            throw new ValidationException("page_count", "page_count is required");
        }
        if (pageCount < contentProps.minPageCount() || pageCount > contentProps.maxPageCount()) {
            throw new ValidationException("page_count",
                    "page_count must be between " + contentProps.minPageCount() + " and " + contentProps.maxPageCount());
        }
        return pageCount;
    }

    private PresentationTaskEntity requireTask(UUID taskId) {
        return statusStore.find(taskId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Presentation task not found"));
    }

    private String downloadName(PresentationTaskEntity task) {
        String slug = task.getTopic().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (slug.isEmpty()) {
            slug = "presentation";
        }
        if (slug.length() > 60) {
            slug = slug.substring(0, 60);
        }
        return slug + ".pptx";
    }

    private PresentationTaskResponse toResponse(PresentationTaskEntity task) {
        TaskError error = task.error();
        return new PresentationTaskResponse(
                task.getTaskId(),
                task.getStatus(),
                task.getProgress(),
                task.getTopic(),
                task.getPageCount(),
                task.getStyle(),
                task.getOutlineRef(),
                task.getContentRef(),
                task.getArtifactRef(),
                error == null ? null : new TaskErrorResponse(error.kind(), error.message(), error.stage()),
                task.attempts(),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }
}
