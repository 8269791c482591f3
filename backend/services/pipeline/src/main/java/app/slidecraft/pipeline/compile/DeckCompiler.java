package app.slidecraft.pipeline.compile;

import app.slidecraft.pipeline.domain.model.CompiledArtifact;
import app.slidecraft.pipeline.domain.model.DeckContent;
import app.slidecraft.pipeline.domain.model.ImageManifest;
import app.slidecraft.pipeline.domain.model.Outline;
import app.slidecraft.pipeline.domain.model.SlideContent;
import app.slidecraft.pipeline.domain.model.SlideStub;
import app.slidecraft.pipeline.domain.type.PresentationStyle;
import app.slidecraft.pipeline.error.CompilationException;
import app.slidecraft.pipeline.storage.ObjectStorage;
import app.slidecraft.pipeline.storage.PresentationBlobs;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.sl.usermodel.ShapeType;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFAutoShape;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.geom.Rectangle2D;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Assembles a 16:9 .pptx from the stage outputs and uploads it under the task's output key.
 */
@Component
public class DeckCompiler {

    private static final Logger log = LoggerFactory.getLogger(DeckCompiler.class);

    private static final int PAGE_WIDTH = 960;
    private static final int PAGE_HEIGHT = 540;

    private final ImageAssetResolver assetResolver;
    private final ObjectStorage storage;

    public DeckCompiler(ImageAssetResolver assetResolver, ObjectStorage storage) {
        this.assetResolver = assetResolver;
        this.storage = storage;
    }

    public CompiledArtifact compile(UUID taskId,
                                    Outline outline,
                                    DeckContent content,
                                    ImageManifest images,
                                    PresentationStyle style) {
        if (outline.slides().isEmpty()) {
            throw new CompilationException("Outline has no slides");
        }
        Map<Integer, SlideContent> contentByOrder = content.slides().stream()
                .collect(Collectors.toMap(SlideContent::order, Function.identity(), (a, b) -> a));

        List<ImageAssetResolver.SlideRef> refs = new ArrayList<>();
        for (SlideStub stub : outline.slides()) {
            refs.add(new ImageAssetResolver.SlideRef(stub.order(), stub.title(), images.forSlide(stub.order()).orElse(null)));
        }
        Map<Integer, ResolvedImage> resolved = assetResolver.resolveAll(refs, style);

        byte[] bytes = render(outline, contentByOrder, resolved, style);
        String key = PresentationBlobs.artifactKey(taskId);
        storage.putObject(key, PresentationBlobs.PPTX_CONTENT_TYPE, bytes);

        long placeholders = resolved.values().stream().filter(ResolvedImage::placeholder).count();
        log.info("Presentation compiled taskId={} slides={} placeholders={} sizeBytes={}",
                taskId, outline.size(), placeholders, bytes.length);
        return new CompiledArtifact(taskId, key, bytes.length, outline.size());
    }

    private byte[] render(Outline outline,
                          Map<Integer, SlideContent> contentByOrder,
                          Map<Integer, ResolvedImage> images,
                          PresentationStyle style) {
        try (XMLSlideShow show = new XMLSlideShow();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            show.setPageSize(new Dimension(PAGE_WIDTH, PAGE_HEIGHT));
            boolean first = true;
            for (SlideStub stub : outline.slides()) {
                SlideContent slideContent = contentByOrder.get(stub.order());
                ResolvedImage image = images.get(stub.order());
                XSLFSlide slide = show.createSlide();
                slide.getBackground().setFillColor(style.background());
                if (first) {
                    renderTitleSlide(show, slide, outline, stub, image, style);
                    first = false;
                } else {
                    renderContentSlide(show, slide, stub, slideContent, image, style);
                }
                if (slideContent != null && slideContent.speakerNotes() != null) {
                    writeNotes(show, slide, slideContent.speakerNotes());
                }
            }
            show.write(out);
            return out.toByteArray();
        } catch (IOException ex) {
            throw new CompilationException("Failed to write presentation", ex);
        } catch (RuntimeException ex) {
            throw new CompilationException("Failed to assemble presentation: " + ex.getClass().getSimpleName(), ex);
        }
    }

    private void renderTitleSlide(XMLSlideShow show,
                                  XSLFSlide slide,
                                  Outline outline,
                                  SlideStub stub,
                                  ResolvedImage image,
                                  PresentationStyle style) {
        addBar(slide, new Rectangle2D.Double(0, 0, 16, PAGE_HEIGHT), style.accent());
        addText(slide, new Rectangle2D.Double(60, 170, 480, 120), stub.title(), 40.0, true, style.primary());
        String subtitle = stub.brief() == null || stub.brief().equals(stub.title()) ? outline.topic() : stub.brief();
        addText(slide, new Rectangle2D.Double(60, 300, 480, 80), subtitle, 20.0, false, style.primary());
        addPicture(show, slide, image, new Rectangle2D.Double(580, 150, 320, 240));
    }

    private void renderContentSlide(XMLSlideShow show,
                                    XSLFSlide slide,
                                    SlideStub stub,
                                    SlideContent content,
                                    ResolvedImage image,
                                    PresentationStyle style) {
        String title = content == null ? stub.title() : content.title();
        List<String> bullets = content == null || content.bullets().isEmpty()
                ? List.of(stub.brief() == null ? stub.title() : stub.brief())
                : content.bullets();

        addText(slide, new Rectangle2D.Double(40, 30, 880, 70), title, 30.0, true, style.primary());
        addBar(slide, new Rectangle2D.Double(40, 100, 120, 4), style.accent());

        XSLFTextBox body = slide.createTextBox();
        body.setAnchor(new Rectangle2D.Double(40, 120, 500, 380));
        body.clearText();
        for (String bullet : bullets) {
            XSLFTextParagraph paragraph = body.addNewTextParagraph();
            paragraph.setBullet(true);
            XSLFTextRun run = paragraph.addNewTextRun();
            run.setText(bullet);
            run.setFontSize(18.0);
            run.setFontColor(style.primary());
        }
        addPicture(show, slide, image, new Rectangle2D.Double(560, 140, 360, 270));
    }

    private void addText(XSLFSlide slide, Rectangle2D anchor, String text, double size, boolean bold, Color color) {
        XSLFTextBox box = slide.createTextBox();
        box.setAnchor(anchor);
        XSLFTextRun run = box.setText(text == null ? "" : text);
        run.setFontSize(size);
        run.setBold(bold);
        run.setFontColor(color);
    }

    private void addBar(XSLFSlide slide, Rectangle2D anchor, Color color) {
        XSLFAutoShape bar = slide.createAutoShape();
        bar.setShapeType(ShapeType.RECT);
        bar.setAnchor(anchor);
        bar.setFillColor(color);
        bar.setLineColor(color);
    }

    private void addPicture(XMLSlideShow show, XSLFSlide slide, ResolvedImage image, Rectangle2D anchor) {
        if (image == null) {
            return;
        }
        XSLFPictureData data = show.addPicture(image.bytes(), image.pictureType());
        XSLFPictureShape picture = slide.createPicture(data);
        picture.setAnchor(anchor);
    }

    private void writeNotes(XMLSlideShow show, XSLFSlide slide, String text) {
        XSLFNotes notes = show.getNotesSlide(slide);
        for (XSLFTextShape shape : notes.getPlaceholders()) {
            if (shape.getTextType() == Placeholder.BODY) {
                shape.setText(text);
                return;
            }
        }
    }
}
