package com.xksgroup.catalogsync.service;

import com.xksgroup.catalogsync.exception.ObjectStoreException;
import com.xksgroup.catalogsync.exception.TransportException;
import com.xksgroup.catalogsync.service.helper.MediaDownloader;
import com.xksgroup.catalogsync.service.helper.PlaylistHelper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.charset.StandardCharsets;

/**
 * {@link ObjectStore} over any S3-compatible endpoint (AWS S3, Aliyun OSS).
 */
@Slf4j
public class S3ObjectStore implements ObjectStore {

    static final String PLAYLIST_CONTENT_TYPE = "application/vnd.apple.mpegurl";

    private final String name;
    private final S3Client s3;
    private final MediaDownloader downloader;
    private final String bucket;
    private final int maxRetryAttempts;
    private final long retryDelayMs;

    public S3ObjectStore(String name, S3Client s3, OkHttpClient originHttpClient,
                         String bucket, int maxRetryAttempts, long retryDelayMs) {
        this(name, s3, new MediaDownloader(originHttpClient), bucket, maxRetryAttempts, retryDelayMs);
    }

    S3ObjectStore(String name, S3Client s3, MediaDownloader downloader,
                  String bucket, int maxRetryAttempts, long retryDelayMs) {
        this.name = name;
        this.s3 = s3;
        this.downloader = downloader;
        this.bucket = bucket;
        this.maxRetryAttempts = Math.max(1, maxRetryAttempts);
        this.retryDelayMs = retryDelayMs;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean exists(String key) {
        try {
            s3.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            log.debug("[{}] Object exists: {}", name, key);
            return true;
        } catch (NoSuchKeyException e) {
            log.debug("[{}] Object not found: {}", name, key);
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                log.debug("[{}] Object not found: {}", name, key);
            } else {
                log.error("[{}] Existence check failed for {} (HTTP {}): {}", name, key, e.statusCode(), e.getMessage());
            }
            return false;
        } catch (Exception e) {
            log.error("[{}] Existence check failed for {}: {}", name, key, e.getMessage());
            return false;
        }
    }

    @Override
    public void putBlob(String key, byte[] bytes, String contentType) {
        uploadWithRetry(key, bytes, contentType);
        log.info("[{}] Uploaded {} ({} bytes)", name, key, bytes.length);
    }

    @Override
    public void putStream(String key, String sourceUrl) {
        log.info("[{}] Fetching playlist {}", name, sourceUrl);
        String content = downloader.download(sourceUrl).text();
        if (content.isBlank()) {
            throw new TransportException("Downloaded playlist is empty: " + sourceUrl);
        }

        String rewritten = PlaylistHelper.absolutizeSegments(content, sourceUrl);
        uploadWithRetry(key, rewritten.getBytes(StandardCharsets.UTF_8), PLAYLIST_CONTENT_TYPE);
        log.info("[{}] Uploaded playlist {}", name, key);
    }

    private void uploadWithRetry(String key, byte[] bytes, String contentType) {
        Exception lastException = null;

        for (int attempt = 1; attempt <= maxRetryAttempts; attempt++) {
            try {
                s3.putObject(PutObjectRequest.builder()
                        .bucket(bucket)
                        .key(key)
                        .contentType(contentType)
                        .cacheControl(cache(key))
                        .build(), RequestBody.fromBytes(bytes));
                return;

            } catch (Exception e) {
                lastException = e;
                if (attempt < maxRetryAttempts) {
                    log.warn("[{}] Upload attempt {} failed for key: {} - retrying in {}ms", name, attempt, key, retryDelayMs * attempt);
                    try {
                        Thread.sleep(retryDelayMs * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new ObjectStoreException("Upload interrupted: " + key, ie);
                    }
                }
            }
        }

        throw new ObjectStoreException("Failed to upload after " + maxRetryAttempts + " attempts: " + key, lastException);
    }

    private static String cache(String key) {
        return key.endsWith(".m3u8")
                ? "public, max-age=15, s-maxage=15, must-revalidate"
                : "public, max-age=3600, s-maxage=3600, immutable";
    }
}
