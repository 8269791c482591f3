package app.slidecraft.pipeline.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Task-scoped blob layout and JSON (de)serialization of the intermediate stage outputs.
 */
@Component
public class PresentationBlobs {

    public static final String PPTX_CONTENT_TYPE =
            "application/vnd.openxmlformats-officedocument.presentationml.presentation";

    private final ObjectStorage storage;
    private final ObjectMapper objectMapper;

    public PresentationBlobs(ObjectStorage storage, ObjectMapper objectMapper) {
        this.storage = storage;
        this.objectMapper = objectMapper;
    }

    /**
     * Each stage run writes under its own run id, so a stored ref is never rewritten by a later or
     * duplicate run of the same stage.
     */
    public static String outlineKey(UUID taskId, UUID runId) {
        return prefix(taskId) + "outline/" + runId + ".json";
    }

    public static String contentKey(UUID taskId, UUID runId) {
        return prefix(taskId) + "content/" + runId + ".json";
    }

    public static String imagesKey(UUID taskId, UUID runId) {
        return prefix(taskId) + "images/" + runId + ".json";
    }

    public static String artifactKey(UUID taskId) {
        return prefix(taskId) + "output/presentation.pptx";
    }

    public String writeJson(String key, Object value) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + key, ex);
        }
        storage.putObject(key, "application/json", bytes);
        return key;
    }

    public <T> T readJson(String key, Class<T> type) {
        byte[] bytes = storage.getObject(key);
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + key, ex);
        }
    }

    private static String prefix(UUID taskId) {
        return "presentations/" + taskId + "/";
    }
}
