package app.slidecraft.pipeline.domain.entity;

import app.slidecraft.pipeline.domain.model.TaskError;
import app.slidecraft.pipeline.domain.type.TaskErrorKind;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "presentation_tasks", schema = "app_pipeline")
public class PresentationTaskEntity {

    @Id
    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private TaskStatus status;

    @Column(name = "topic", nullable = false)
    private String topic;

    @Column(name = "page_count", nullable = false)
    private Integer pageCount;

    @Column(name = "style", nullable = false)
    private String style;

    @Column(name = "progress", nullable = false)
    private Integer progress;

    @Column(name = "outline_ref")
    private String outlineRef;

    @Column(name = "content_ref")
    private String contentRef;

    @Column(name = "images_ref")
    private String imagesRef;

    @Column(name = "artifact_ref")
    private String artifactRef;

    @Column(name = "artifact_size_bytes")
    private Long artifactSizeBytes;

    @Column(name = "artifact_slide_count")
    private Integer artifactSlideCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind")
    private TaskErrorKind errorKind;

    @Column(name = "error_message")
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_stage")
    private TaskStatus errorStage;

    @Column(name = "outline_attempts", nullable = false)
    private Integer outlineAttempts;

    @Column(name = "content_attempts", nullable = false)
    private Integer contentAttempts;

    @Column(name = "images_attempts", nullable = false)
    private Integer imagesAttempts;

    @Column(name = "compile_attempts", nullable = false)
    private Integer compileAttempts;

    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public PresentationTaskEntity() {
    }

    public static PresentationTaskEntity pending(UUID taskId, String topic, int pageCount, String style, Instant now) {
        PresentationTaskEntity task = new PresentationTaskEntity();
        task.setTaskId(taskId);
        task.setStatus(TaskStatus.PENDING);
        task.setTopic(topic);
        task.setPageCount(pageCount);
        task.setStyle(style);
        task.setProgress(TaskStatus.PENDING.progress());
        task.setOutlineAttempts(0);
        task.setContentAttempts(0);
        task.setImagesAttempts(0);
        task.setCompileAttempts(0);
        task.setVersion(0L);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        return task;
    }

    public PresentationTaskEntity copy() {
        PresentationTaskEntity copy = new PresentationTaskEntity();
        copy.taskId = taskId;
        copy.status = status;
        copy.topic = topic;
        copy.pageCount = pageCount;
        copy.style = style;
        copy.progress = progress;
        copy.outlineRef = outlineRef;
        copy.contentRef = contentRef;
        copy.imagesRef = imagesRef;
        copy.artifactRef = artifactRef;
        copy.artifactSizeBytes = artifactSizeBytes;
        copy.artifactSlideCount = artifactSlideCount;
        copy.errorKind = errorKind;
        copy.errorMessage = errorMessage;
        copy.errorStage = errorStage;
        copy.outlineAttempts = outlineAttempts;
        copy.contentAttempts = contentAttempts;
        copy.imagesAttempts = imagesAttempts;
        copy.compileAttempts = compileAttempts;
        copy.version = version;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.completedAt = completedAt;
        return copy;
    }

    public int attemptsFor(TaskStatus stage) {
        Integer value = switch (stage) {
            case OUTLINE -> outlineAttempts;
            case CONTENT -> contentAttempts;
            case IMAGES -> imagesAttempts;
            case COMPILE -> compileAttempts;
            default -> throw new IllegalArgumentException("Not a stage: " + stage);
        };
        return value == null ? 0 : value;
    }

    public void setAttemptsFor(TaskStatus stage, int attempts) {
        switch (stage) {
            case OUTLINE -> outlineAttempts = attempts;
            case CONTENT -> contentAttempts = attempts;
            case IMAGES -> imagesAttempts = attempts;
            case COMPILE -> compileAttempts = attempts;
            default -> throw new IllegalArgumentException("Not a stage: " + stage);
        }
    }

    public Map<TaskStatus, Integer> attempts() {
        Map<TaskStatus, Integer> attempts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus stage : TaskStatus.STAGES) {
            attempts.put(stage, attemptsFor(stage));
        }
        return attempts;
    }

    public TaskError error() {
        if (errorKind == null) {
            return null;
        }
        return new TaskError(errorKind, errorMessage, errorStage);
    }

    public void setError(TaskError error) {
        this.errorKind = error == null ? null : error.kind();
        this.errorMessage = error == null ? null : error.message();
        this.errorStage = error == null ? null : error.stage();
    }

    public UUID getTaskId() {
        return taskId;
    }

    public void setTaskId(UUID taskId) {
        this.taskId = taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public Integer getPageCount() {
        return pageCount;
    }

    public void setPageCount(Integer pageCount) {
        this.pageCount = pageCount;
    }

    public String getStyle() {
        return style;
    }

    public void setStyle(String style) {
        this.style = style;
    }

    public Integer getProgress() {
        return progress;
    }

    public void setProgress(Integer progress) {
        this.progress = progress;
    }

    public String getOutlineRef() {
        return outlineRef;
    }

    public void setOutlineRef(String outlineRef) {
        this.outlineRef = outlineRef;
    }

    public String getContentRef() {
        return contentRef;
    }

    public void setContentRef(String contentRef) {
        this.contentRef = contentRef;
    }

    public String getImagesRef() {
        return imagesRef;
    }

    public void setImagesRef(String imagesRef) {
        this.imagesRef = imagesRef;
    }

    public String getArtifactRef() {
        return artifactRef;
    }

    public void setArtifactRef(String artifactRef) {
        this.artifactRef = artifactRef;
    }

    public Long getArtifactSizeBytes() {
        return artifactSizeBytes;
    }

    public void setArtifactSizeBytes(Long artifactSizeBytes) {
        this.artifactSizeBytes = artifactSizeBytes;
    }

    public Integer getArtifactSlideCount() {
        return artifactSlideCount;
    }

    public void setArtifactSlideCount(Integer artifactSlideCount) {
        this.artifactSlideCount = artifactSlideCount;
    }

    public TaskErrorKind getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(TaskErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public TaskStatus getErrorStage() {
        return errorStage;
    }

    public void setErrorStage(TaskStatus errorStage) {
        this.errorStage = errorStage;
    }

    public Integer getOutlineAttempts() {
        return outlineAttempts;
    }

    public void setOutlineAttempts(Integer outlineAttempts) {
        this.outlineAttempts = outlineAttempts;
    }

    public Integer getContentAttempts() {
        return contentAttempts;
    }

    public void setContentAttempts(Integer contentAttempts) {
        this.contentAttempts = contentAttempts;
    }

    public Integer getImagesAttempts() {
        return imagesAttempts;
    }

    public void setImagesAttempts(Integer imagesAttempts) {
        this.imagesAttempts = imagesAttempts;
    }

    public Integer getCompileAttempts() {
        return compileAttempts;
    }

    public void setCompileAttempts(Integer compileAttempts) {
        this.compileAttempts = compileAttempts;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
