package com.williamcallahan.imagesearch.config;

import com.williamcallahan.imagesearch.service.blob.BlobStore;
import com.williamcallahan.imagesearch.service.blob.S3BlobStore;
import com.williamcallahan.imagesearch.support.RetryPolicy;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Blob store wiring for an S3-compatible endpoint with static credentials.
 */
@Configuration
public class S3ClientConfig {
    private static final Logger log = LoggerFactory.getLogger(S3ClientConfig.class);

    @Bean
    @DependsOn("requiredCredentialValidation")
    public S3Client s3Client(AppProperties appProperties) {
        AppProperties.S3 s3 = appProperties.getS3();
        log.info("[S3] Using bucket '{}' at {}", s3.getBucket(), s3.getEndpoint());
        return S3Client.builder()
                .endpointOverride(URI.create(s3.getEndpoint()))
                .region(Region.of(s3.getRegion()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(s3.getAccessKeyId(), s3.getSecretAccessKey())))
                .forcePathStyle(s3.isPathStyle())
                .build();
    }

    @Bean
    public BlobStore blobStore(S3Client s3Client, AppProperties appProperties, RetryPolicy retryPolicy) {
        AppProperties.S3 s3 = appProperties.getS3();
        return new S3BlobStore(s3Client, s3.getBucket(), s3.resolvePublicBaseUrl(), retryPolicy);
    }
}
