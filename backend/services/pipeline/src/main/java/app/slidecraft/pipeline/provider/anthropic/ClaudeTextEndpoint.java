package app.slidecraft.pipeline.provider.anthropic;

import app.slidecraft.pipeline.error.PermanentUpstreamException;
import app.slidecraft.pipeline.provider.TextGenerationEndpoint;
import app.slidecraft.pipeline.provider.TextPrompt;
import app.slidecraft.pipeline.provider.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
@ConditionalOnProperty(name = "app.pipeline.text-provider", havingValue = "anthropic")
public class ClaudeTextEndpoint implements TextGenerationEndpoint {

    private static final Logger log = LoggerFactory.getLogger(ClaudeTextEndpoint.class);
    private static final String PROVIDER = "anthropic";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final ClaudeProps props;

    public ClaudeTextEndpoint(RestClient.Builder restClientBuilder,
                              ClaudeProps props,
                              ObjectMapper objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutOrDefault(props.connectTimeoutMs(), 5_000));
        requestFactory.setReadTimeout(timeoutOrDefault(props.readTimeoutMs(), 60_000));
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory)
                .build();
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public String complete(TextPrompt prompt) {
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            throw new PermanentUpstreamException("app.ai.anthropic.api-key is not configured");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", props.defaultModel());
        Integer maxTokens = prompt.maxOutputTokens() != null && prompt.maxOutputTokens() > 0
                ? prompt.maxOutputTokens()
                : props.defaultMaxTokens();
        if (maxTokens != null && maxTokens > 0) {
            payload.put("max_tokens", maxTokens);
        }

        ArrayNode messages = payload.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        ArrayNode content = user.putArray("content");
        ObjectNode text = content.addObject();
        text.put("type", "text");
        text.put("text", prompt.prompt());

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", props.apiKey())
                    .header("anthropic-version", props.apiVersion())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw UpstreamErrors.map(PROVIDER, ex);
        }

        ClaudeResponseParser.Reply reply = ClaudeResponseParser.parse(response);
        if (reply.truncated()) {
            log.warn("Claude output hit the token limit purpose={} maxTokens={}", prompt.purpose(), maxTokens);
        }
        return reply.text();
    }

    private int timeoutOrDefault(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
