package com.xksgroup.catalogsync.config;

import com.xksgroup.catalogsync.service.helper.RetryInterceptor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One pooled OkHttp client per remote party, each with its own timeouts and retry ceiling.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient catalogHttpClient(
            @Value("${catalog.connect-timeout-seconds:30}") long connectTimeout,
            @Value("${catalog.read-timeout-seconds:300}") long readTimeout,
            @Value("${catalog.retry.max-attempts:3}") int maxAttempts,
            @Value("${catalog.retry.backoff-ms:1000}") long backoffMs
    ) {
        return build(20, connectTimeout, readTimeout, maxAttempts, backoffMs);
    }

    @Bean
    public OkHttpClient originHttpClient(
            @Value("${mirror.origin.connect-timeout-seconds:30}") long connectTimeout,
            @Value("${mirror.origin.read-timeout-seconds:60}") long readTimeout,
            @Value("${mirror.origin.retry.max-attempts:3}") int maxAttempts,
            @Value("${mirror.origin.retry.backoff-ms:1000}") long backoffMs
    ) {
        return build(20, connectTimeout, readTimeout, maxAttempts, backoffMs);
    }

    @Bean
    public OkHttpClient distributionHttpClient(
            @Value("${distribution.timeout-seconds:30}") long timeout,
            @Value("${distribution.retry.max-attempts:3}") int maxAttempts,
            @Value("${distribution.retry.backoff-ms:1000}") long backoffMs
    ) {
        return build(10, timeout, timeout, maxAttempts, backoffMs);
    }

    private static OkHttpClient build(int poolSize, long connectTimeout, long readTimeout, int maxAttempts, long backoffMs) {
        return new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(poolSize, 5, TimeUnit.MINUTES))
                .connectTimeout(Duration.ofSeconds(connectTimeout))
                .readTimeout(Duration.ofSeconds(readTimeout))
                .writeTimeout(Duration.ofSeconds(readTimeout))
                .retryOnConnectionFailure(false)
                .addInterceptor(new RetryInterceptor(maxAttempts, backoffMs))
                .build();
    }
}
