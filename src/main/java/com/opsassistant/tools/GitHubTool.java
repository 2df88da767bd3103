package com.opsassistant.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repository search against the GitHub REST API ({@code GET /search/repositories}).
 */
@Component
public class GitHubTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(GitHubTool.class);

    private static final Set<String> SORT_FIELDS = Set.of("stars", "forks", "updated");
    private static final int MAX_LIMIT = 100;

    private final ToolProperties.GitHub config;
    private final ToolHttpClient http;

    public GitHubTool(ToolProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getGithub();
        this.http = new ToolHttpClient(properties, objectMapper);
    }

    @Override
    public ToolKind kind() {
        return ToolKind.GITHUB;
    }

    @Override
    public Object invoke(Map<String, Object> parameters) {
        String query = ToolParameters.requireString(parameters, "query");
        String sort = ToolParameters.optionalString(parameters, "sort", "stars").trim().toLowerCase();
        if (!SORT_FIELDS.contains(sort)) {
            log.warn("Unsupported sort '{}', falling back to stars", sort);
            sort = "stars";
        }
        int limit = ToolParameters.optionalInt(parameters, "limit", config.getDefaultLimit());
        if (limit < 1) {
            throw new ToolFaultException(FaultCode.INVALID_PARAMETERS, "limit must be at least 1, got " + limit);
        }
        limit = Math.min(limit, MAX_LIMIT);

        var params = new LinkedHashMap<String, String>();
        params.put("q", query);
        params.put("sort", sort);
        params.put("order", "desc");
        params.put("per_page", String.valueOf(limit));

        log.info("Searching GitHub repositories: '{}' (sort={}, limit={})", query, sort, limit);
        var response = http.get(config.getBaseUrl() + "/search/repositories?" + ToolHttpClient.queryString(params),
                headers());
        if (!ToolHttpClient.isSuccess(response)) {
            throw fault(response, "GitHub search for '" + query + "' failed");
        }

        JsonNode items = http.parse(response).path("items");
        List<Map<String, Object>> repositories = new ArrayList<>();
        for (JsonNode item : items) {
            repositories.add(toRepository(item));
        }
        log.info("GitHub search returned {} repositories", repositories.size());
        return repositories;
    }

    private Map<String, String> headers() {
        var headers = new LinkedHashMap<String, String>();
        headers.put("Accept", "application/vnd.github+json");
        headers.put("User-Agent", "ops-assistant");
        if (config.hasToken()) {
            headers.put("Authorization", "Bearer " + config.getToken());
        }
        return headers;
    }

    /**
     * GitHub signals an exhausted rate limit with 403 and a zero remaining quota.
     */
    static ToolFaultException fault(HttpResponse<String> response, String message) {
        int status = response.statusCode();
        if (status == 403) {
            String remaining = response.headers().firstValue("X-RateLimit-Remaining").orElse("");
            if ("0".equals(remaining.trim())) {
                String reset = response.headers().firstValue("X-RateLimit-Reset").orElse("unknown");
                return new ToolFaultException(FaultCode.RATE_LIMITED,
                        message + ": API rate limit exceeded (resets at epoch " + reset + ")");
            }
        }
        return ToolHttpClient.statusFault(status, message);
    }

    private static Map<String, Object> toRepository(JsonNode item) {
        var repo = new LinkedHashMap<String, Object>();
        repo.put("name", item.path("name").asText(""));
        repo.put("full_name", item.path("full_name").asText(""));
        repo.put("description", item.path("description").isNull() ? "" : item.path("description").asText(""));
        repo.put("stars", item.path("stargazers_count").asLong(0));
        repo.put("forks", item.path("forks_count").asLong(0));
        repo.put("language", item.path("language").isNull() ? "" : item.path("language").asText(""));
        repo.put("url", item.path("html_url").asText(""));
        repo.put("created_at", item.path("created_at").asText(""));
        repo.put("updated_at", item.path("updated_at").asText(""));
        return repo;
    }
}
