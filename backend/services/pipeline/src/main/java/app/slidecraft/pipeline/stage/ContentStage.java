package app.slidecraft.pipeline.stage;

import app.slidecraft.pipeline.content.ContentGenerator;
import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.model.DeckContent;
import app.slidecraft.pipeline.domain.model.Outline;
import app.slidecraft.pipeline.domain.model.SlideContent;
import app.slidecraft.pipeline.domain.model.SlideStub;
import app.slidecraft.pipeline.domain.type.PresentationStyle;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import app.slidecraft.pipeline.storage.PresentationBlobs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Component
public class ContentStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ContentStage.class);

    private final ContentGenerator contentGenerator;
    private final PresentationBlobs blobs;

    public ContentStage(ContentGenerator contentGenerator, PresentationBlobs blobs) {
        this.contentGenerator = contentGenerator;
        this.blobs = blobs;
    }

    @Override
    public TaskStatus stage() {
        return TaskStatus.CONTENT;
    }

    @Override
    public void execute(PresentationTaskEntity task) {
        Outline outline = blobs.readJson(StageSupport.requireRef(task.getOutlineRef(), "outline", task), Outline.class);
        PresentationStyle style = StageSupport.styleOf(task);
        List<SlideContent> slides = new ArrayList<>(outline.size());
        for (SlideStub stub : outline.slides()) {
            slides.add(contentGenerator.generateSlideContent(stub, outline.topic(), style));
        }
        DeckContent content = new DeckContent(slides);
        task.setContentRef(blobs.writeJson(PresentationBlobs.contentKey(task.getTaskId(), UUID.randomUUID()), content));
        long fallbacks = slides.stream().filter(SlideContent::fallback).count();
        log.info("Slide content stored taskId={} slides={} fallbacks={}", task.getTaskId(), slides.size(), fallbacks);
    }
}
