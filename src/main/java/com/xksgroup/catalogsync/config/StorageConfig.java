package com.xksgroup.catalogsync.config;

import com.xksgroup.catalogsync.service.ObjectStore;
import com.xksgroup.catalogsync.service.S3ObjectStore;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.checksums.RequestChecksumCalculation;
import software.amazon.awssdk.core.checksums.ResponseChecksumValidation;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Duration;

/**
 * Object-storage clients. Both are lazy so a command that never touches a backend does not need its credentials.
 */
@Configuration
public class StorageConfig {

    @Bean
    @Lazy
    public S3Client ossClient(
            @Value("${storage.oss.access-key-id}") String accessKey,
            @Value("${storage.oss.secret-access-key}") String secret,
            @Value("${storage.oss.endpoint}") String endpoint,
            @Value("${storage.oss.region:oss-cn-hangzhou}") String region,
            @Value("${storage.oss.connect-timeout-seconds:60}") long connectTimeout,
            @Value("${storage.oss.readwrite-timeout-seconds:300}") long readWriteTimeout
    ) {
        // Aliyun OSS through its S3-compatible endpoint; virtual-hosted style only
        return S3Client.builder()
                .endpointOverride(URI.create(endpoint))
                .region(Region.of(region))
                .requestChecksumCalculation(RequestChecksumCalculation.WHEN_REQUIRED)
                .responseChecksumValidation(ResponseChecksumValidation.WHEN_REQUIRED)
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(false)
                        .chunkedEncodingEnabled(false)
                        .build())
                .httpClientBuilder(ApacheHttpClient.builder()
                        .maxConnections(100)
                        .connectionTimeout(Duration.ofSeconds(connectTimeout))
                        .socketTimeout(Duration.ofSeconds(readWriteTimeout)))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofSeconds(readWriteTimeout))
                        .build())
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKey.trim(), secret.trim())))
                .build();
    }

    @Bean
    @Lazy
    public S3Client s3Client(
            @Value("${storage.s3.region}") String region,
            @Value("${storage.s3.access-key-id}") String accessKey,
            @Value("${storage.s3.secret-access-key}") String secret,
            @Value("${storage.s3.connect-timeout-seconds:60}") long connectTimeout,
            @Value("${storage.s3.readwrite-timeout-seconds:300}") long readWriteTimeout
    ) {
        return S3Client.builder()
                .region(Region.of(region.trim()))
                .httpClientBuilder(ApacheHttpClient.builder()
                        .maxConnections(100)
                        .connectionTimeout(Duration.ofSeconds(connectTimeout))
                        .socketTimeout(Duration.ofSeconds(readWriteTimeout)))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKey.trim(), secret.trim())))
                .build();
    }

    @Bean
    public ObjectStore ossObjectStore(@Lazy @Qualifier("ossClient") S3Client ossClient,
                                      @Qualifier("originHttpClient") OkHttpClient originHttpClient,
                                      @Value("${storage.oss.bucket:}") String bucket,
                                      @Value("${storage.upload.max-attempts:3}") int maxAttempts,
                                      @Value("${storage.upload.delay-ms:1000}") long delayMs) {
        return new S3ObjectStore("oss", ossClient, originHttpClient, bucket, maxAttempts, delayMs);
    }

    @Bean
    public ObjectStore s3ObjectStore(@Lazy @Qualifier("s3Client") S3Client s3Client,
                                     @Qualifier("originHttpClient") OkHttpClient originHttpClient,
                                     @Value("${storage.s3.bucket:}") String bucket,
                                     @Value("${storage.upload.max-attempts:3}") int maxAttempts,
                                     @Value("${storage.upload.delay-ms:1000}") long delayMs) {
        return new S3ObjectStore("s3", s3Client, originHttpClient, bucket, maxAttempts, delayMs);
    }
}
