package com.xksgroup.catalogsync.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.catalogsync.model.dto.CatalogItem;
import com.xksgroup.catalogsync.model.dto.CatalogResult;
import com.xksgroup.catalogsync.model.dto.VideoDetail;
import lombok.extern.slf4j.Slf4j;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-over-POST client for the remote catalog.
 * <p>
 * Every response is an envelope {@code {"code": int, "msg": string, "data": ...}}; code 0 is success and
 * code 402 means the session token is missing or expired.
 */
@Slf4j
@Service
public class CatalogApiClient implements CatalogClient {

    static final int CODE_OK = 0;
    static final int CODE_TOKEN_EXPIRED = 402;

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<List<CatalogItem>> ITEM_LIST = new TypeReference<>() {
    };

    private final OkHttpClient http;
    private final ObjectMapper mapper;

    private final String loginUrl;
    private final String listUrl;
    private final String detailUrl;
    private final String username;
    private final String password;
    private final String domain;
    private final String tokenHeader;
    private final String userAgent;
    private final String referer;
    private final String origin;
    private final int pageSize;

    public CatalogApiClient(@Qualifier("catalogHttpClient") OkHttpClient http,
                            ObjectMapper mapper,
                            @Value("${catalog.base-url}") String baseUrl,
                            @Value("${catalog.login-endpoint:/api/login}") String loginEndpoint,
                            @Value("${catalog.list-endpoint:/api/video/list}") String listEndpoint,
                            @Value("${catalog.detail-endpoint:/api/video/detail}") String detailEndpoint,
                            @Value("${catalog.username:}") String username,
                            @Value("${catalog.password:}") String password,
                            @Value("${catalog.domain:}") String domain,
                            @Value("${catalog.token-header:zq-os-token}") String tokenHeader,
                            @Value("${catalog.user-agent:Mozilla/5.0}") String userAgent,
                            @Value("${catalog.referer:}") String referer,
                            @Value("${catalog.origin:}") String origin,
                            @Value("${catalog.page-size:20}") int pageSize) {
        this.http = http;
        this.mapper = mapper;
        String base = baseUrl.replaceAll("/+$", "");
        this.loginUrl = base + loginEndpoint;
        this.listUrl = base + listEndpoint;
        this.detailUrl = base + detailEndpoint;
        this.username = username;
        this.password = password;
        this.domain = domain;
        this.tokenHeader = tokenHeader;
        this.userAgent = userAgent;
        this.referer = referer;
        this.origin = origin;
        this.pageSize = pageSize;
        log.info("CatalogApiClient initialized for {} (page size {})", base, pageSize);
    }

    @Override
    public int defaultPageSize() {
        return pageSize;
    }

    @Override
    public CatalogResult<String> authenticate() {
        log.info("Logging in to the catalog as '{}'", username);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_name", username);
        payload.put("password", password);
        payload.put("domain", domain);

        try {
            JsonNode body = post(loginUrl, payload, null);
            String token = body.path("data").path("token").asText(null);
            if (body.path("code").asInt(-1) == CODE_OK && token != null && !token.isBlank()) {
                log.info("Catalog login succeeded");
                return CatalogResult.ok(token);
            }
            String msg = body.path("msg").asText("unknown error");
            log.error("Catalog login rejected: {}", msg);
            return CatalogResult.fatal("login rejected: " + msg);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Catalog login request failed: {}", e.getMessage());
            return CatalogResult.fatal("login request failed: " + e.getMessage());
        }
    }

    @Override
    public CatalogResult<List<CatalogItem>> listPage(String token, int pageNumber, int size) {
        if (token == null || token.isBlank()) {
            log.warn("No session token, cannot list page {}", pageNumber);
            return CatalogResult.retryable("no session token");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("page", pageNumber);
        payload.put("page_size", size);

        try {
            log.info("Requesting catalog page {}", pageNumber);
            JsonNode body = post(listUrl, payload, token);
            int code = body.path("code").asInt(-1);

            if (code == CODE_OK) {
                JsonNode data = body.path("data");
                long total = data.path("total").asLong(0);
                log.info("Page {} ok. Total records: {}, total pages: {}", pageNumber, total,
                        size > 0 ? (total + size - 1) / size : 0);
                JsonNode list = data.path("list");
                if (list.isMissingNode() || list.isNull()) {
                    return CatalogResult.ok(List.of());
                }
                if (!list.isArray()) {
                    return CatalogResult.fatal("page " + pageNumber + ": data.list is not an array");
                }
                List<CatalogItem> items = mapper.convertValue(list, ITEM_LIST);
                return CatalogResult.ok(items);
            }
            if (code == CODE_TOKEN_EXPIRED) {
                log.warn("Session token expired while listing page {}", pageNumber);
                return CatalogResult.retryable("token expired");
            }
            String msg = body.path("msg").asText("unknown error");
            log.error("Catalog returned code {} for page {}: {}", code, pageNumber, msg);
            return CatalogResult.fatal("code " + code + ": " + msg);

        } catch (IOException | IllegalArgumentException e) {
            log.error("Listing page {} failed: {}", pageNumber, e.getMessage());
            return CatalogResult.fatal("page " + pageNumber + " request failed: " + e.getMessage());
        }
    }

    @Override
    public CatalogResult<VideoDetail> fetchDetail(String token, String externalId) {
        if (token == null || token.isBlank()) {
            log.warn("No session token, cannot fetch detail for {}", externalId);
            return CatalogResult.retryable("no session token");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", externalId);
        payload.put("lang_code", "en");

        try {
            log.info("Fetching detail (id: {})", externalId);
            JsonNode body = post(detailUrl, payload, token);
            int code = body.path("code").asInt(-1);

            if (code == CODE_OK) {
                JsonNode list = body.path("data").path("list");
                if (!list.isArray() || list.isEmpty() || list.get(0).isNull()) {
                    return CatalogResult.ok(null);
                }
                return CatalogResult.ok(mapper.convertValue(list.get(0), VideoDetail.class));
            }
            if (code == CODE_TOKEN_EXPIRED) {
                log.warn("Session token expired while fetching detail for {}", externalId);
                return CatalogResult.retryable("token expired");
            }
            String msg = body.path("msg").asText("unknown error");
            log.error("Catalog returned code {} for detail {}: {}", code, externalId, msg);
            return CatalogResult.fatal("code " + code + ": " + msg);

        } catch (IOException | IllegalArgumentException e) {
            log.error("Fetching detail for {} failed: {}", externalId, e.getMessage());
            return CatalogResult.fatal("detail request failed: " + e.getMessage());
        }
    }

    private JsonNode post(String url, Map<String, Object> payload, String token) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(RequestBody.create(mapper.writeValueAsBytes(payload), JSON));

        if (userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }
        if (referer != null && !referer.isBlank()) {
            builder.header("Referer", referer);
        }
        if (origin != null && !origin.isBlank()) {
            builder.header("Origin", origin);
        }
        if (token != null) {
            builder.header(tokenHeader, token);
        }

        try (Response response = http.newCall(builder.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty response from " + url);
            }
            JsonNode node = mapper.readTree(body.byteStream());
            if (node == null || !node.isObject()) {
                throw new IOException("Response from " + url + " is not a JSON object");
            }
            return node;
        }
    }
}
