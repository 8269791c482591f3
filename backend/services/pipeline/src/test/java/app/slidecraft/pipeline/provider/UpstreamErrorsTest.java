package app.slidecraft.pipeline.provider;

import app.slidecraft.pipeline.domain.type.TaskErrorKind;
import app.slidecraft.pipeline.error.PipelineException;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamErrorsTest {

    @Test
    void throttlingIsRetryableAndCarriesRetryAfter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "7");
        HttpClientErrorException ex = HttpClientErrorException.create(
                HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", headers, new byte[0], StandardCharsets.UTF_8);

        PipelineException mapped = UpstreamErrors.map("anthropic", ex);

        assertThat(mapped).isInstanceOf(RetryableUpstreamException.class);
        assertThat(((RetryableUpstreamException) mapped).retryAfter()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void overloadedAndUnavailableAreRetryable() {
        assertThat(UpstreamErrors.map("x", new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE)).kind())
                .isEqualTo(TaskErrorKind.RETRYABLE_UPSTREAM);
        assertThat(UpstreamErrors.map("x", new HttpServerErrorException(HttpStatusCode.valueOf(529), "Overloaded")).kind())
                .isEqualTo(TaskErrorKind.RETRYABLE_UPSTREAM);
        assertThat(UpstreamErrors.map("x", new ResourceAccessException("Read timed out")).kind())
                .isEqualTo(TaskErrorKind.RETRYABLE_UPSTREAM);
    }

    @Test
    void clientErrorsArePermanentAndHideTheBody() {
        HttpClientErrorException ex = HttpClientErrorException.create(
                HttpStatus.UNAUTHORIZED, "Unauthorized", new HttpHeaders(),
                "{\"error\":\"secret vendor detail\"}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

        PipelineException mapped = UpstreamErrors.map("openai", ex);

        assertThat(mapped.kind()).isEqualTo(TaskErrorKind.PERMANENT_UPSTREAM);
        assertThat(mapped.getMessage()).isEqualTo("openai responded with status 401");
    }

    @Test
    void parseRetryAfterMessageReadsSeconds() {
        assertThat(UpstreamErrors.parseRetryAfterMessage("Please retry in 12.5s.")).isEqualTo(12500L);
        assertThat(UpstreamErrors.parseRetryAfterMessage("No retry hint")).isNull();
        assertThat(UpstreamErrors.parseRetryAfterMessage(null)).isNull();
    }
}
