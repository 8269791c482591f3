package app.slidecraft.pipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

@Configuration
public class S3Config {

    @Bean
    public S3Client s3Client(S3Props p) {
        var creds = AwsBasicCredentials.create(p.accessKey(), p.secretKey());

        var s3Config = S3Configuration.builder()
                .pathStyleAccessEnabled(p.pathStyleAccess()) // MinIO and other local endpoints need path style
                .build();

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(p.region()))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .serviceConfiguration(s3Config)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(p.callTimeout())
                        .build());
        if (p.endpoint() != null && !p.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(p.endpoint()));
        }
        return builder.build();
    }

    @Bean
    public S3Presigner s3Presigner(S3Props p) {
        var creds = AwsBasicCredentials.create(p.accessKey(), p.secretKey());

        S3Presigner.Builder builder = S3Presigner.builder()
                .region(Region.of(p.region()))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(p.pathStyleAccess())
                        .build());
        if (p.endpoint() != null && !p.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(p.endpoint()));
        }
        return builder.build();
    }
}
