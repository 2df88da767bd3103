package com.opsassistant.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Article summaries from the Wikipedia REST API ({@code /api/rest_v1/page/summary}).
 * Not-found faults include a "did you mean" suggestion from the opensearch API
 * when one exists.
 */
@Component
public class WikipediaTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(WikipediaTool.class);

    private final ToolProperties.Wikipedia config;
    private final ToolHttpClient http;

    public WikipediaTool(ToolProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getWikipedia();
        this.http = new ToolHttpClient(properties, objectMapper);
    }

    @Override
    public ToolKind kind() {
        return ToolKind.WIKIPEDIA;
    }

    @Override
    public Object invoke(Map<String, Object> parameters) {
        String topic = ToolParameters.requireString(parameters, "topic");
        int sentences = Math.max(1, ToolParameters.optionalInt(parameters, "sentences", config.getDefaultSentences()));

        log.info("Fetching Wikipedia summary for '{}'", topic);
        String title = ToolHttpClient.encode(topic.replace(' ', '_')).replace("+", "%20");
        var response = http.get(config.getBaseUrl() + "/api/rest_v1/page/summary/" + title, headers());
        if (response.statusCode() == 404) {
            String hint = suggest(topic)
                    .map(s -> " Did you mean '" + s + "'?")
                    .orElse(" Check the spelling or try a different search term.");
            throw new ToolFaultException(FaultCode.NOT_FOUND, "Article '" + topic + "' not found." + hint);
        }
        if (!ToolHttpClient.isSuccess(response)) {
            throw ToolHttpClient.statusFault(response.statusCode(), "Wikipedia lookup for '" + topic + "' failed");
        }
        return toSummary(http.parse(response), sentences);
    }

    /**
     * Best-effort title suggestion; failures only cost the hint.
     */
    Optional<String> suggest(String topic) {
        var params = new LinkedHashMap<String, String>();
        params.put("action", "opensearch");
        params.put("search", topic);
        params.put("limit", "1");
        params.put("namespace", "0");
        params.put("format", "json");
        try {
            var response = http.get(config.getBaseUrl() + "/w/api.php?" + ToolHttpClient.queryString(params), headers());
            if (!ToolHttpClient.isSuccess(response)) {
                return Optional.empty();
            }
            JsonNode titles = http.parse(response).path(1);
            if (titles.isArray() && !titles.isEmpty()) {
                return Optional.of(titles.get(0).asText());
            }
        } catch (ToolFaultException e) {
            if (e.code() == FaultCode.CANCELLED) throw e;
            log.debug("Suggestion lookup for '{}' failed: {}", topic, e.getMessage());
        }
        return Optional.empty();
    }

    private Map<String, String> headers() {
        return Map.of("User-Agent", config.getUserAgent());
    }

    private static Map<String, Object> toSummary(JsonNode raw, int sentences) {
        String extract = raw.path("extract").asText("");
        var result = new LinkedHashMap<String, Object>();
        result.put("title", raw.path("title").asText(""));
        result.put("summary", extract);
        result.put("extract", firstSentences(extract, sentences));
        result.put("description", raw.path("description").asText(""));
        result.put("url", raw.path("content_urls").path("desktop").path("page").asText(""));
        JsonNode thumbnail = raw.path("thumbnail").path("source");
        result.put("thumbnail", thumbnail.isMissingNode() ? null : thumbnail.asText());
        result.put("type", raw.path("type").asText("standard"));
        return result;
    }

    static String firstSentences(String text, int count) {
        int end = 0;
        for (int i = 0; i < count; i++) {
            int next = text.indexOf(". ", end);
            if (next < 0) return text;
            end = next + 1;
        }
        return text.substring(0, end);
    }
}
