package com.fluxreader.api;

import com.fluxreader.common.model.EntriesPage;
import com.fluxreader.common.model.Entry;
import com.fluxreader.common.util.HttpUtils;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link EntryGateway} against the Miniflux REST API (v1), token authenticated.
 */
public class MinifluxGateway implements EntryGateway {
    private static final Logger logger = LoggerFactory.getLogger(MinifluxGateway.class);
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private final String baseUrl;
    private final String apiToken;
    private final int timeoutMs;
    private final Gson gson = new Gson();

    public MinifluxGateway(String serverAddress, String apiToken, int timeoutMs) {
        this.baseUrl = normalizeBase(serverAddress);
        this.apiToken = apiToken;
        this.timeoutMs = timeoutMs;
    }

    static String normalizeBase(String serverAddress) {
        if (serverAddress == null) return "";
        String base = serverAddress.trim();
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        if (base.endsWith("/v1")) base = base.substring(0, base.length() - 3);
        return base;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public ApiResult<EntriesPage> getEntries(EntryQuery query) {
        String qs = query.toQueryString();
        return get("/v1/entries" + (qs.isEmpty() ? "" : "?" + qs), EntriesPage.class);
    }

    @Override
    public ApiResult<Entry> getEntry(long entryId) {
        if (entryId <= 0) return ApiResult.fail(ApiError.invalid("Invalid entry id: " + entryId));
        return get("/v1/entries/" + entryId, Entry.class);
    }

    @Override
    public ApiResult<Void> updateEntries(List<Long> entryIds, Map<String, Object> extraFields) {
        if (entryIds == null || entryIds.isEmpty()) {
            return ApiResult.fail(ApiError.invalid("No entry ids given"));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entry_ids", entryIds);
        if (extraFields != null) body.putAll(extraFields);
        return put("/v1/entries", gson.toJson(body));
    }

    @Override
    public ApiResult<Void> toggleBookmark(long entryId) {
        if (entryId <= 0) return ApiResult.fail(ApiError.invalid("Invalid entry id: " + entryId));
        return put("/v1/entries/" + entryId + "/bookmark", null);
    }

    @Override
    public ApiResult<Void> markFeedAsRead(long feedId) {
        if (feedId <= 0) return ApiResult.fail(ApiError.invalid("Invalid feed id: " + feedId));
        return put("/v1/feeds/" + feedId + "/mark-all-as-read", null);
    }

    @Override
    public ApiResult<Void> markCategoryAsRead(long categoryId) {
        if (categoryId <= 0) return ApiResult.fail(ApiError.invalid("Invalid category id: " + categoryId));
        return put("/v1/categories/" + categoryId + "/mark-all-as-read", null);
    }

    @Override
    public ApiResult<Map<String, Object>> getMe() {
        return get("/v1/me", MAP_TYPE);
    }

    private <T> ApiResult<T> get(String path, Type type) {
        ApiResult<String> raw = execute("GET", path, null);
        if (!raw.isOk()) return ApiResult.fail(raw.getError());
        try {
            T value = gson.fromJson(raw.getValue(), type);
            if (value == null) return ApiResult.fail(ApiError.invalid("Empty response for " + path));
            return ApiResult.ok(value);
        } catch (JsonParseException e) {
            logger.warn("Unparseable response for {}: {}", path, e.getMessage());
            return ApiResult.fail(ApiError.invalid("Invalid JSON response: " + e.getMessage()));
        }
    }

    private ApiResult<Void> put(String path, String jsonBody) {
        ApiResult<String> raw = execute("PUT", path, jsonBody == null ? "" : jsonBody);
        return raw.isOk() ? ApiResult.ok(null) : ApiResult.fail(raw.getError());
    }

    private ApiResult<String> execute(String method, String path, String jsonBody) {
        if (baseUrl.isEmpty() || apiToken == null || apiToken.isEmpty()) {
            return ApiResult.fail(ApiError.invalid("Server address or API token not configured"));
        }
        try {
            HttpUtils.Response response = HttpUtils.send(method, baseUrl + path,
                    Map.of("X-Auth-Token", apiToken), jsonBody, timeoutMs);
            if (response.isSuccess()) {
                return ApiResult.ok(response.body());
            }
            String message = extractErrorMessage(response.body());
            logger.warn("{} {} failed with HTTP {}: {}", method, path, response.status(), message);
            return ApiResult.fail(ApiError.http(response.status(), message));
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("{} {} failed: {}", method, path, e.getMessage());
            return ApiResult.fail(ApiError.transport(e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    private String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) return "No response body";
        try {
            Map<String, Object> parsed = gson.fromJson(body, MAP_TYPE);
            if (parsed != null && parsed.get("error_message") != null) {
                return String.valueOf(parsed.get("error_message"));
            }
        } catch (JsonParseException e) {
            logger.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
