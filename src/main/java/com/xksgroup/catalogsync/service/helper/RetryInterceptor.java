package com.xksgroup.catalogsync.service.helper;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Set;

/**
 * Retries idempotent-enough calls on IO failures and transient status codes with exponential backoff.
 * The caller sees either the first non-transient response, the last transient one, or the last IO failure.
 */
@Slf4j
public class RetryInterceptor implements Interceptor {

    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final int maxAttempts;
    private final long backoffMs;

    public RetryInterceptor(int maxAttempts, long backoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        IOException lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Response response = chain.proceed(request);
                if (!RETRYABLE_STATUSES.contains(response.code()) || attempt == maxAttempts) {
                    return response;
                }
                log.warn("Attempt {} for {} {} returned HTTP {} - retrying", attempt, request.method(), request.url(), response.code());
                response.close();
            } catch (InterruptedIOException e) {
                // timeouts are transient; a thread interrupt is not
                if (Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                lastException = e;
                log.warn("Attempt {} for {} {} timed out: {}", attempt, request.method(), request.url(), e.getMessage());
            } catch (IOException e) {
                lastException = e;
                log.warn("Attempt {} for {} {} failed: {}", attempt, request.method(), request.url(), e.getMessage());
            }

            if (attempt < maxAttempts) {
                sleep(backoffMs * (1L << (attempt - 1)));
            }
        }

        throw lastException != null ? lastException : new IOException("Retries exhausted for " + request.url());
    }

    private static void sleep(long millis) throws IOException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Retry backoff interrupted");
        }
    }
}
