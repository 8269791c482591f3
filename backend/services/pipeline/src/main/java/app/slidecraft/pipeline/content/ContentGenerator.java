package app.slidecraft.pipeline.content;

import app.slidecraft.pipeline.config.ContentProps;
import app.slidecraft.pipeline.domain.model.Outline;
import app.slidecraft.pipeline.domain.model.SlideContent;
import app.slidecraft.pipeline.domain.model.SlideStub;
import app.slidecraft.pipeline.domain.type.PresentationStyle;
import app.slidecraft.pipeline.error.ValidationException;
import app.slidecraft.pipeline.provider.RetryPolicy;
import app.slidecraft.pipeline.provider.TextGenerationEndpoint;
import app.slidecraft.pipeline.provider.TextPrompt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a topic into an outline and an outline entry into slide content. Malformed model output is
 * absorbed with a structurally valid fallback; exhausted upstream errors propagate to the caller.
 */
@Service
public class ContentGenerator {

    private static final Logger log = LoggerFactory.getLogger(ContentGenerator.class);

    private static final List<String> GENERIC_SECTIONS = List.of(
            "Overview",
            "Key Concepts",
            "How It Works",
            "Applications",
            "Challenges",
            "Best Practices",
            "Case Study",
            "Future Outlook"
    );

    private final TextGenerationEndpoint endpoint;
    private final ContentProps props;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    public ContentGenerator(TextGenerationEndpoint endpoint, ContentProps props, ObjectMapper objectMapper) {
        this.endpoint = endpoint;
        this.props = props;
        this.objectMapper = objectMapper;
        this.retryPolicy = new RetryPolicy(props.maxAttempts(), props.backoffMs(), props.maxBackoffMs());
    }

    public Outline generateOutline(String topic, int pageCount, PresentationStyle style) {
        validate(topic, pageCount);
        String normalizedTopic = topic.trim();
        TextPrompt prompt = new TextPrompt(
                TextPrompt.Purpose.OUTLINE,
                ContentPrompts.outline(normalizedTopic, pageCount, style),
                props.maxOutputTokens(),
                Map.of(
                        "topic", normalizedTopic,
                        "pageCount", String.valueOf(pageCount),
                        "style", style.code()
                )
        );
        String raw = retryPolicy.execute(endpoint.provider() + ".outline", () -> endpoint.complete(prompt));

        List<SlideStub> parsed = parseOutline(raw);
        if (parsed.isEmpty()) {
            log.warn("Outline output unusable, using fallback topicLength={} pageCount={}", normalizedTopic.length(), pageCount);
            return fallbackOutline(normalizedTopic, pageCount);
        }
        return new Outline(normalizedTopic, fitToPageCount(parsed, normalizedTopic, pageCount), false);
    }

    public SlideContent generateSlideContent(SlideStub stub, String topic, PresentationStyle style) {
        TextPrompt prompt = new TextPrompt(
                TextPrompt.Purpose.SLIDE_CONTENT,
                ContentPrompts.slide(stub, topic, style, props.minBullets(), props.maxBullets()),
                props.maxOutputTokens(),
                Map.of(
                        "topic", topic,
                        "title", stub.title(),
                        "brief", stub.brief() == null ? "" : stub.brief(),
                        "order", String.valueOf(stub.order()),
                        "style", style.code()
                )
        );
        String raw = retryPolicy.execute(endpoint.provider() + ".slide", () -> endpoint.complete(prompt));

        Optional<JsonNode> node = readJson(raw);
        if (node.isEmpty() || !node.get().isObject()) {
            log.warn("Slide output unusable, using fallback order={}", stub.order());
            return normalizeSlide(stub, style, null, List.of(), null, null, true);
        }
        JsonNode root = node.get();
        List<String> bullets = new ArrayList<>();
        JsonNode bulletNode = root.has("bullet_points") ? root.path("bullet_points") : root.path("bullets");
        if (bulletNode.isArray()) {
            for (JsonNode item : bulletNode) {
                String text = item.asText("").trim();
                if (!text.isEmpty()) {
                    bullets.add(text);
                }
            }
        }
        return normalizeSlide(
                stub,
                style,
                textOrNull(root, "title"),
                bullets,
                textOrNull(root, "speaker_notes"),
                textOrNull(root, "image_prompt"),
                false
        );
    }

    public Outline fallbackOutline(String topic, int pageCount) {
        List<SlideStub> slides = new ArrayList<>();
        slides.add(titleStub(topic));
        for (int i = 0; i < pageCount - 2; i++) {
            slides.add(genericStub(topic, slides.size() + 1, i));
        }
        slides.add(summaryStub(topic, pageCount));
        return new Outline(topic, slides, true);
    }

    private void validate(String topic, int pageCount) {
        if (topic == null || topic.isBlank()) {
            throw new ValidationException("topic", "topic must not be empty");
        }
        if (topic.trim().length() > props.maxTopicLength()) {
            throw new ValidationException("topic", "topic must be at most " + props.maxTopicLength() + " characters");
        }
        if (pageCount < props.minPageCount() || pageCount > props.maxPageCount()) {
            throw new ValidationException("page_count",
                    "page_count must be between " + props.minPageCount() + " and " + props.maxPageCount());
        }
    }

    private List<SlideStub> parseOutline(String raw) {
        Optional<JsonNode> node = readJson(raw);
        if (node.isEmpty()) {
            return List.of();
        }
        JsonNode slides = node.get().isArray() ? node.get() : node.get().path("slides");
        if (!slides.isArray()) {
            return List.of();
        }
        List<SlideStub> parsed = new ArrayList<>();
        int position = 0;
        for (JsonNode slide : slides) {
            position++;
            String title = textOrNull(slide, "title");
            if (title == null) {
                continue;
            }
            String brief = textOrNull(slide, "brief");
            if (brief == null) {
                brief = textOrNull(slide, "description");
            }
            int order = slide.path("slide_number").asInt(position);
            parsed.add(new SlideStub(order, title, brief == null ? title : brief));
        }
        parsed.sort(Comparator.comparingInt(SlideStub::order));
        return parsed;
    }

    private List<SlideStub> fitToPageCount(List<SlideStub> parsed, String topic, int pageCount) {
        List<SlideStub> slides;
        if (parsed.size() > pageCount) {
            // keep the closing slide, drop from the middle
            slides = new ArrayList<>(parsed.subList(0, pageCount - 1));
            slides.add(parsed.get(parsed.size() - 1));
        } else {
            slides = new ArrayList<>(parsed);
        }
        int generic = 0;
        while (slides.size() < pageCount) {
            SlideStub filler = genericStub(topic, 0, generic++);
            if (slides.size() >= 2) {
                slides.add(slides.size() - 1, filler);
            } else {
                slides.add(filler);
            }
        }
        List<SlideStub> ordered = new ArrayList<>(pageCount);
        for (int i = 0; i < slides.size(); i++) {
            SlideStub slide = slides.get(i);
            ordered.add(new SlideStub(i + 1, slide.title(), slide.brief()));
        }
        return ordered;
    }

    private SlideContent normalizeSlide(SlideStub stub,
                                        PresentationStyle style,
                                        String title,
                                        List<String> bullets,
                                        String notes,
                                        String imagePrompt,
                                        boolean fallback) {
        String slideTitle = title == null ? stub.title() : title;
        List<String> normalizedBullets = fitBullets(bullets, stub);
        String speakerNotes = notes == null
                ? synthesizeNotes(slideTitle, normalizedBullets)
                : notes.trim();
        speakerNotes = truncateAtWord(speakerNotes, props.maxSpeakerNotesChars());
        String prompt = imagePrompt == null
                ? deriveImagePrompt(slideTitle, normalizedBullets, style)
                : imagePrompt.trim();
        return new SlideContent(stub.order(), slideTitle, normalizedBullets, speakerNotes, prompt, fallback);
    }

    private List<String> fitBullets(List<String> bullets, SlideStub stub) {
        List<String> fitted = new ArrayList<>(bullets.subList(0, Math.min(bullets.size(), props.maxBullets())));
        List<String> padding = List.of(
                stub.brief() == null || stub.brief().isBlank() ? stub.title() : stub.brief(),
                "Why " + stub.title() + " matters",
                "Key takeaways on " + stub.title(),
                "Practical examples",
                "Questions to consider"
        );
        int next = 0;
        while (fitted.size() < props.minBullets() && next < padding.size()) {
            String candidate = padding.get(next++);
            if (!fitted.contains(candidate)) {
                fitted.add(candidate);
            }
        }
        return fitted;
    }

    private String synthesizeNotes(String title, List<String> bullets) {
        StringBuilder notes = new StringBuilder("This slide covers ").append(title).append('.');
        for (String bullet : bullets) {
            notes.append(' ').append(bullet);
            if (!bullet.endsWith(".")) {
                notes.append('.');
            }
        }
        return notes.toString();
    }

    private String deriveImagePrompt(String title, List<String> bullets, PresentationStyle style) {
        String context = String.join(", ", bullets.subList(0, Math.min(bullets.size(), 2)));
        return "A " + style.code() + " presentation illustration for \"" + title + "\": " + context;
    }

    static String truncateAtWord(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        int cut = text.lastIndexOf(' ', maxChars);
        if (cut <= 0) {
            cut = maxChars;
        }
        return text.substring(0, cut).trim();
    }

    private Optional<JsonNode> readJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String json = stripFences(raw);
        try {
            return Optional.ofNullable(objectMapper.readTree(json));
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }

    private String stripFences(String raw) {
        String trimmed = raw.trim();
        int objectStart = trimmed.indexOf('{');
        int arrayStart = trimmed.indexOf('[');
        int start = objectStart < 0 ? arrayStart : arrayStart < 0 ? objectStart : Math.min(objectStart, arrayStart);
        if (start < 0) {
            return trimmed;
        }
        char close = trimmed.charAt(start) == '{' ? '}' : ']';
        int end = trimmed.lastIndexOf(close);
        return end > start ? trimmed.substring(start, end + 1) : trimmed.substring(start);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static SlideStub titleStub(String topic) {
        return new SlideStub(1, topic, "Introduce " + topic + " and set expectations");
    }

    private static SlideStub summaryStub(String topic, int order) {
        return new SlideStub(order, "Summary", "Recap the key points of " + topic);
    }

    private static SlideStub genericStub(String topic, int order, int index) {
        String section = GENERIC_SECTIONS.get(index % GENERIC_SECTIONS.size());
        if (index >= GENERIC_SECTIONS.size()) {
            section = section + " " + (index / GENERIC_SECTIONS.size() + 1);
        }
        return new SlideStub(order, section, section + " of " + topic);
    }
}
