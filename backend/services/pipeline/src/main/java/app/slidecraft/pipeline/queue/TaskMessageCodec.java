package app.slidecraft.pipeline.queue;

import app.slidecraft.pipeline.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class TaskMessageCodec {

    private final ObjectMapper objectMapper;

    public TaskMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public String encode(TaskMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode task message", ex);
        }
    }

    public TaskMessage decode(String body) {
        if (body == null || body.isBlank()) {
            throw new ValidationException("body", "Task message is empty");
        }
        TaskMessage message;
        try {
            message = objectMapper.readValue(body, TaskMessage.class);
        } catch (JsonProcessingException ex) {
            throw new ValidationException("body", "Task message is not valid JSON for the expected schema");
        }
        if (!TaskMessage.GENERATE_PRESENTATION.equals(message.type())) {
            throw new ValidationException("type", "Unsupported task message type: " + message.type());
        }
        if (message.taskId() == null) {
            throw new ValidationException("taskId", "taskId is required");
        }
        return message;
    }
}
