package app.slidecraft.pipeline.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskErrorKind {
    VALIDATION("ValidationError"),
    RETRYABLE_UPSTREAM("RetryableUpstreamError"),
    PERMANENT_UPSTREAM("PermanentUpstreamError"),
    RESOLUTION("ResolutionError"),
    COMPILATION("CompilationError"),
    INTERNAL("InternalError");

    private final String code;

    TaskErrorKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static TaskErrorKind fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskErrorKind kind : values()) {
            if (kind.code.equals(code) || kind.name().equalsIgnoreCase(code)) {
                return kind;
            }
        }
        return INTERNAL;
    }
}
