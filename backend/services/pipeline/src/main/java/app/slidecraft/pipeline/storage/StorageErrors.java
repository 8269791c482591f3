package app.slidecraft.pipeline.storage;

import app.slidecraft.pipeline.error.PermanentUpstreamException;
import app.slidecraft.pipeline.error.PipelineException;
import app.slidecraft.pipeline.error.ResolutionException;
import app.slidecraft.pipeline.error.RetryableUpstreamException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

final class StorageErrors {

    private StorageErrors() {
    }

    static PipelineException map(String operation, String key, SdkException ex) {
        String context = "Storage " + operation + " failed for key " + key;
        if (ex instanceof SdkClientException) {
            return new RetryableUpstreamException(context + ": client error", ex);
        }
        if (ex instanceof AwsServiceException service) {
            int status = service.statusCode();
            if (status == 404) {
                return new ResolutionException(context + ": object not found", ex);
            }
            if (status == 429 || status == 500 || status == 502 || status == 503 || status == 504 || service.isThrottlingException()) {
                return new RetryableUpstreamException(context + ": status " + status, ex);
            }
            return new PermanentUpstreamException(context + ": status " + status, ex);
        }
        return new PermanentUpstreamException(context, ex);
    }
}
