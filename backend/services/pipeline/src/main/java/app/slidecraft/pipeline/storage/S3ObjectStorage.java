package app.slidecraft.pipeline.storage;

import app.slidecraft.pipeline.config.S3Props;
import app.slidecraft.pipeline.error.PipelineException;
import app.slidecraft.pipeline.error.ResolutionException;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Component
public class S3ObjectStorage implements ObjectStorage {
    private static final String CACHE_CONTROL = "private, max-age=3600";

    private final S3Client s3Client;
    private final S3Presigner presigner;
    private final String bucket;
    private final Clock clock;

    public S3ObjectStorage(S3Client s3Client, S3Presigner presigner, S3Props props, Clock clock) {
        this.s3Client = s3Client;
        this.presigner = presigner;
        this.bucket = props.bucket();
        this.clock = clock;
    }

    @Override
    public String bucket() {
        return bucket;
    }

    @Override
    public void putObject(String key, String contentType, byte[] content) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) content.length)
                .cacheControl(CACHE_CONTROL)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException ex) {
            throw StorageErrors.map("put", key, ex);
        }
    }

    @Override
    public byte[] getObject(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            return s3Client.getObjectAsBytes(request).asByteArray();
        } catch (SdkException ex) {
            throw StorageErrors.map("get", key, ex);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            return true;
        } catch (NoSuchKeyException ex) {
            return false;
        } catch (SdkException ex) {
            PipelineException mapped = StorageErrors.map("head", key, ex);
            if (mapped instanceof ResolutionException) {
                return false;
            }
            throw mapped;
        }
    }

    @Override
    public void deleteObject(String key) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            s3Client.deleteObject(request);
        } catch (SdkException ex) {
            throw StorageErrors.map("delete", key, ex);
        }
    }

    @Override
    public PresignedUrl presignGet(String key, Duration ttl, String fileName) {
        GetObjectRequest.Builder request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key);
        if (fileName != null && !fileName.isBlank()) {
            request.responseContentDisposition("attachment; filename=\"" + fileName.replace("\"", "") + "\"");
        }

        GetObjectPresignRequest presign = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(request.build())
                .build();

        var presigned = presigner.presignGetObject(presign);
        Instant expiresAt = Instant.now(clock).plus(ttl);
        return new PresignedUrl(presigned.url().toString(), expiresAt);
    }

    @Override
    public String objectUrl(String key) {
        return s3Client.utilities()
                .getUrl(builder -> builder.bucket(bucket).key(key))
                .toExternalForm();
    }
}
