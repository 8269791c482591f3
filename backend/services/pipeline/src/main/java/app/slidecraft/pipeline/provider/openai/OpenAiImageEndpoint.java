package app.slidecraft.pipeline.provider.openai;

import app.slidecraft.pipeline.error.PermanentUpstreamException;
import app.slidecraft.pipeline.provider.GeneratedImage;
import app.slidecraft.pipeline.provider.ImageGenerationEndpoint;
import app.slidecraft.pipeline.provider.ImagePrompt;
import app.slidecraft.pipeline.provider.UpstreamErrors;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Base64;
import java.util.Locale;

@Component
@ConditionalOnProperty(name = "app.pipeline.image-provider", havingValue = "openai")
public class OpenAiImageEndpoint implements ImageGenerationEndpoint {

    private static final String PROVIDER = "openai";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final OpenAiProps props;

    public OpenAiImageEndpoint(RestClient.Builder restClientBuilder,
                               OpenAiProps props,
                               ObjectMapper objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutOrDefault(props.connectTimeoutMs(), 5_000));
        requestFactory.setReadTimeout(timeoutOrDefault(props.readTimeoutMs(), 120_000));
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
    public String model() {
        return props.defaultImageModel();
    }

    @Override
    public GeneratedImage generate(ImagePrompt prompt) {
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            throw new PermanentUpstreamException("app.ai.openai.api-key is not configured");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", props.defaultImageModel());
        payload.put("prompt", prompt.prompt());
        payload.put("size", sizeFor(prompt, props.defaultImageSize()));
        if (props.defaultImageQuality() != null && !props.defaultImageQuality().isBlank()) {
            payload.put("quality", props.defaultImageQuality());
        }
        if (props.defaultImageFormat() != null && !props.defaultImageFormat().isBlank()) {
            payload.put("output_format", props.defaultImageFormat());
        }

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/images/generations")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw UpstreamErrors.map(PROVIDER, ex);
        }

        if (response == null) {
            throw new PermanentUpstreamException("OpenAI image response is empty");
        }
        JsonNode dataNode = response.path("data");
        if (!dataNode.isArray() || dataNode.isEmpty()) {
            throw new PermanentUpstreamException("OpenAI image response missing data");
        }
        String b64 = dataNode.get(0).path("b64_json").asText(null);
        if (b64 == null || b64.isBlank()) {
            throw new PermanentUpstreamException("OpenAI image response missing b64_json");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(b64);
        } catch (IllegalArgumentException ex) {
            throw new PermanentUpstreamException("OpenAI image payload is not valid base64", ex);
        }
        String model = response.path("model").asText(props.defaultImageModel());
        String outputFormat = response.path("output_format").asText(props.defaultImageFormat());
        return new GeneratedImage(bytes, resolveImageMimeType(outputFormat), model);
    }

    private String resolveImageMimeType(String format) {
        if (format == null || format.isBlank()) {
            return "image/png";
        }
        return switch (format.toLowerCase(Locale.ROOT)) {
            case "jpg", "jpeg" -> "image/jpeg";
            case "webp" -> "image/webp";
            default -> "image/png";
        };
    }

    // the requested size follows the cache key dimensions unless an override is configured
    static String sizeFor(ImagePrompt prompt, String configuredSize) {
        if (configuredSize != null && !configuredSize.isBlank()) {
            return configuredSize.trim();
        }
        return prompt.width() + "x" + prompt.height();
    }

    private int timeoutOrDefault(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
