package app.slidecraft.pipeline.provider.anthropic;

import app.slidecraft.pipeline.error.PermanentUpstreamException;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ClaudeResponseParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void joinsTextBlocksAndSkipsOthers() throws Exception {
        ClaudeResponseParser.Reply reply = ClaudeResponseParser.parse(objectMapper.readTree("""
                {"type":"message","stop_reason":"end_turn","content":[
                  {"type":"text","text":"{\\"slides\\":"},
                  {"type":"tool_use","id":"x"},
                  {"type":"text","text":"[]}"}
                ]}
                """));

        assertThat(reply.text()).isEqualTo("{\"slides\":\n[]}");
        assertThat(reply.truncated()).isFalse();
    }

    @Test
    void flagsTokenLimitStop() throws Exception {
        ClaudeResponseParser.Reply reply = ClaudeResponseParser.parse(objectMapper.readTree(
                "{\"type\":\"message\",\"stop_reason\":\"max_tokens\",\"content\":[{\"type\":\"text\",\"text\":\"{\"}]}"));

        assertThat(reply.truncated()).isTrue();
    }

    @Test
    void mapsErrorEnvelopeByType() throws Exception {
        assertThrows(RetryableUpstreamException.class, () -> ClaudeResponseParser.parse(objectMapper.readTree(
                "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}")));
        assertThrows(PermanentUpstreamException.class, () -> ClaudeResponseParser.parse(objectMapper.readTree(
                "{\"type\":\"error\",\"error\":{\"type\":\"invalid_request_error\",\"message\":\"bad\"}}")));
        assertThrows(PermanentUpstreamException.class, () -> ClaudeResponseParser.parse(null));
    }
}
