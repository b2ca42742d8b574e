package com.xksgroup.catalogsync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.catalogsync.exception.TransportException;
import com.xksgroup.catalogsync.model.VideoRecord;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pushes records to the site sync endpoint of every configured domain and triggers site cleanups.
 * <p>
 * The sync endpoint takes {@code {"videos_data": "<JSON array>"}} and answers with a JSON array of the ids
 * it rejected.
 */
@Slf4j
@Service
public class SiteDistributionClient implements DistributionClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int BLURB_LENGTH = 250;

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final List<String> domains;
    private final String apiToken;
    private final String syncEndpoint;
    private final String cleanEndpoint;

    public SiteDistributionClient(@Qualifier("distributionHttpClient") OkHttpClient http,
                                  ObjectMapper mapper,
                                  @Value("${distribution.domains:}") String domains,
                                  @Value("${distribution.api-token:}") String apiToken,
                                  @Value("${distribution.sync-endpoint:/api/sync}") String syncEndpoint,
                                  @Value("${distribution.clean-endpoint:/api/clean}") String cleanEndpoint) {
        this.http = http;
        this.mapper = mapper;
        this.domains = Arrays.stream(domains.split(","))
                .map(String::trim)
                .filter(d -> !d.isEmpty())
                .toList();
        this.apiToken = apiToken;
        this.syncEndpoint = syncEndpoint;
        this.cleanEndpoint = cleanEndpoint;
        log.info("SiteDistributionClient initialized with {} target domain(s)", this.domains.size());
    }

    @Override
    public List<String> domains() {
        return domains;
    }

    @Override
    public Set<String> push(List<VideoRecord> batch, String domain) {
        String url = endpoint(domain, syncEndpoint);
        log.info("Pushing {} record(s) to {}", batch.size(), domain);

        String videosData;
        try {
            videosData = mapper.writeValueAsString(batch.stream().map(this::toSitePayload).toList());
        } catch (JsonProcessingException e) {
            throw new TransportException("Cannot serialize batch for " + domain, e);
        }

        try (Response response = http.newCall(jsonPost(url, Map.of("videos_data", videosData))).execute()) {
            if (!response.isSuccessful()) {
                throw new TransportException("Push to " + domain + " failed with HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransportException("Push to " + domain + " returned no body");
            }

            JsonNode node = mapper.readTree(body.byteStream());
            if (node == null || !node.isArray()) {
                throw new TransportException("Push to " + domain + " returned an unexpected body");
            }

            Set<String> rejected = new LinkedHashSet<>();
            node.forEach(id -> rejected.add(id.asText()));
            if (rejected.isEmpty()) {
                log.info("{} accepted all {} record(s)", domain, batch.size());
            } else {
                log.warn("{} rejected {} of {} record(s): {}", domain, rejected.size(), batch.size(), rejected);
            }
            return rejected;

        } catch (IOException e) {
            log.error("Push to {} failed: {}", domain, e.getMessage());
            throw new TransportException("Push to " + domain + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean cleanup(String domain) {
        log.info("Cleaning site data on {}", domain);
        try (Response response = http.newCall(jsonPost(endpoint(domain, cleanEndpoint), Map.of())).execute()) {
            if (response.code() == 200) {
                log.info("{} cleanup succeeded", domain);
                return true;
            }
            log.error("{} cleanup failed with HTTP {}", domain, response.code());
            return false;
        } catch (Exception e) {
            log.error("{} cleanup failed: {}", domain, e.getMessage());
            return false;
        }
    }

    /**
     * Site-side shape of a record.
     */
    Map<String, Object> toSitePayload(VideoRecord record) {
        String description = record.getDescription() != null ? record.getDescription() : "";
        List<String> media = record.getMediaList() != null ? record.getMediaList() : new ArrayList<>();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("vod_douban_id", record.getExternalId());
        payload.put("vod_name", record.getTitle());
        payload.put("vod_pic", record.getCoverUrl());
        payload.put("vod_tag", record.getTags() != null ? String.join(",", record.getTags()) : "");
        payload.put("vod_total", record.getTotalEpisodes());
        payload.put("vod_trysee", record.getFreeEpisodes());
        payload.put("vod_play_url", String.join("#", media));
        payload.put("vod_down_url", record.getDownloadUrl());
        payload.put("vod_content", description);
        payload.put("vod_blurb", description.length() > BLURB_LENGTH ? description.substring(0, BLURB_LENGTH) : description);
        return payload;
    }

    private Request jsonPost(String url, Map<String, ?> payload) throws JsonProcessingException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(mapper.writeValueAsBytes(payload), JSON));
        if (apiToken != null && !apiToken.isBlank()) {
            builder.header("Authorization", "Bearer " + apiToken);
        }
        return builder.build();
    }

    private static String endpoint(String domain, String path) {
        HttpUrl base = HttpUrl.parse(domain);
        if (base == null) {
            throw new TransportException("Domain is not an http(s) URL: " + domain);
        }
        HttpUrl resolved = base.resolve(path);
        if (resolved == null) {
            throw new TransportException("Cannot resolve " + path + " against " + domain);
        }
        return resolved.toString();
    }
}
