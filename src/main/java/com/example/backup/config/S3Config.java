package com.example.backup.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * S3 아카이브 클라이언트 (backup.transport.type=s3 인 경우)
 */
@Configuration
@ConditionalOnProperty(name = "backup.transport.type", havingValue = "s3")
@Slf4j
public class S3Config {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(BackupProperties properties) {
        BackupProperties.Transport transport = properties.getTransport();
        if (transport.getBucket() == null || transport.getBucket().isBlank()) {
            throw new IllegalStateException("backup.transport.bucket is required for the s3 transport");
        }

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(transport.getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create());

        if (transport.getEndpoint() != null && !transport.getEndpoint().isBlank()) {
            // S3 호환 스토리지 (MinIO 등)
            builder.endpointOverride(URI.create(transport.getEndpoint()))
                    .forcePathStyle(true);
        }

        log.info("S3 archive client initialized: bucket={}, region={}, endpoint={}",
                transport.getBucket(), transport.getRegion(), transport.getEndpoint());
        return builder.build();
    }
}
