package app.slidecraft.pipeline.stage;

import app.slidecraft.pipeline.compile.DeckCompiler;
import app.slidecraft.pipeline.domain.entity.PresentationTaskEntity;
import app.slidecraft.pipeline.domain.model.CompiledArtifact;
import app.slidecraft.pipeline.domain.model.DeckContent;
import app.slidecraft.pipeline.domain.model.ImageManifest;
import app.slidecraft.pipeline.domain.model.Outline;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import app.slidecraft.pipeline.storage.PresentationBlobs;
import org.springframework.stereotype.Component;

@Component
public class CompileStage implements PipelineStage {

    private final DeckCompiler deckCompiler;
    private final PresentationBlobs blobs;

    public CompileStage(DeckCompiler deckCompiler, PresentationBlobs blobs) {
        this.deckCompiler = deckCompiler;
        this.blobs = blobs;
    }

    @Override
    public TaskStatus stage() {
        return TaskStatus.COMPILE;
    }

    @Override
    public void execute(PresentationTaskEntity task) {
        Outline outline = blobs.readJson(StageSupport.requireRef(task.getOutlineRef(), "outline", task), Outline.class);
        DeckContent content = blobs.readJson(StageSupport.requireRef(task.getContentRef(), "content", task), DeckContent.class);
        ImageManifest images = blobs.readJson(StageSupport.requireRef(task.getImagesRef(), "images", task), ImageManifest.class);

        CompiledArtifact artifact = deckCompiler.compile(task.getTaskId(), outline, content, images, StageSupport.styleOf(task));
        task.setArtifactRef(artifact.blobRef());
        task.setArtifactSizeBytes(artifact.sizeBytes());
        task.setArtifactSlideCount(artifact.slideCount());
    }
}
