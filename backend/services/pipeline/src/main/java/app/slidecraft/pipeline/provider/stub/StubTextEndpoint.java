package app.slidecraft.pipeline.provider.stub;

import app.slidecraft.pipeline.provider.TextGenerationEndpoint;
import app.slidecraft.pipeline.provider.TextPrompt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Offline endpoint that answers with well-formed JSON built from the prompt hints.
 */
@Component
@ConditionalOnProperty(name = "app.pipeline.text-provider", havingValue = "stub", matchIfMissing = true)
public class StubTextEndpoint implements TextGenerationEndpoint {

    private final ObjectMapper objectMapper;

    public StubTextEndpoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String provider() {
        return "stub";
    }

    @Override
    public String complete(TextPrompt prompt) {
        ObjectNode response = prompt.purpose() == TextPrompt.Purpose.OUTLINE
                ? outline(prompt)
                : slide(prompt);
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render stub response", ex);
        }
    }

    private ObjectNode outline(TextPrompt prompt) {
        String topic = prompt.hints().getOrDefault("topic", "Untitled");
        int pageCount = Integer.parseInt(prompt.hints().getOrDefault("pageCount", "3"));
        ObjectNode root = objectMapper.createObjectNode();
        root.put("title", topic);
        ArrayNode slides = root.putArray("slides");
        for (int i = 1; i <= pageCount; i++) {
            ObjectNode slide = slides.addObject();
            slide.put("slide_number", i);
            if (i == 1) {
                slide.put("title", topic);
                slide.put("brief", "Introduce " + topic);
            } else if (i == pageCount) {
                slide.put("title", "Summary");
                slide.put("brief", "Recap the key points of " + topic);
            } else {
                slide.put("title", topic + ": part " + (i - 1));
                slide.put("brief", "Explain aspect " + (i - 1) + " of " + topic);
            }
        }
        return root;
    }

    private ObjectNode slide(TextPrompt prompt) {
        String title = prompt.hints().getOrDefault("title", "Slide");
        String brief = prompt.hints().getOrDefault("brief", title);
        ObjectNode root = objectMapper.createObjectNode();
        root.put("title", title);
        ArrayNode bullets = root.putArray("bullet_points");
        bullets.add(brief);
        bullets.add("Why " + title + " matters");
        bullets.add("How to apply " + title);
        root.put("speaker_notes", "Walk the audience through " + title + ". " + brief + ".");
        root.put("image_prompt", "Illustration of " + title);
        return root;
    }
}
