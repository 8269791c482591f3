package app.slidecraft.pipeline.stage;

import app.slidecraft.pipeline.content.ContentGenerator;
import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.model.Outline;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import app.slidecraft.pipeline.storage.PresentationBlobs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class OutlineStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(OutlineStage.class);

    private final ContentGenerator contentGenerator;
    private final PresentationBlobs blobs;

    public OutlineStage(ContentGenerator contentGenerator, PresentationBlobs blobs) {
        this.contentGenerator = contentGenerator;
        this.blobs = blobs;
    }

    @Override
    public TaskStatus stage() {
        return TaskStatus.OUTLINE;
    }

    @Override
    public void execute(PresentationTaskEntity task) {
        Outline outline = contentGenerator.generateOutline(task.getTopic(), task.getPageCount(), StageSupport.styleOf(task));
        task.setOutlineRef(blobs.writeJson(PresentationBlobs.outlineKey(task.getTaskId(), UUID.randomUUID()), outline));
        log.info("Outline stored taskId={} slides={} fallback={}", task.getTaskId(), outline.size(), outline.fallback());
    }
}
