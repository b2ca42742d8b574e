package com.xksgroup.catalogsync.service.helper;

import com.xksgroup.catalogsync.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Fetches origin media (playlists, cover images) fully into memory.
 */
@Slf4j
public class MediaDownloader {

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    private final OkHttpClient client;

    public MediaDownloader(OkHttpClient client) {
        this.client = client;
    }

    public record Download(byte[] bytes, String contentType) {

        public String text() {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    public Download download(String url) {
        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .header("User-Agent", USER_AGENT)
                    .get()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid media URL: " + url, e);
        }

        log.debug("Downloading {}", url);
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new TransportException("Download failed with HTTP " + response.code() + ": " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransportException("Empty response body: " + url);
            }
            MediaType mediaType = body.contentType();
            byte[] bytes = body.bytes();
            return new Download(bytes, mediaType != null ? mediaType.toString() : null);
        } catch (IOException e) {
            throw new TransportException("Download failed: " + url, e);
        }
    }
}
