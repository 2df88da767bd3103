package com.opsassistant.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Thin JSON-over-HTTP client shared by the concrete tools.
 * <p>
 * Transport problems and non-2xx statuses are translated into
 * {@link ToolFaultException}s so that the step executor can classify them.
 */
class ToolHttpClient {

    private static final Logger log = LoggerFactory.getLogger(ToolHttpClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    ToolHttpClient(ToolProperties properties, ObjectMapper objectMapper) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = objectMapper;
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    /**
     * Issues a GET request and returns the raw response, whatever its status.
     */
    HttpResponse<String> get(String url, Map<String, String> headers) {
        var builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        headers.forEach(builder::header);

        log.debug("GET {}", redact(url));
        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ToolFaultException(FaultCode.TRANSIENT_NETWORK_ERROR,
                    "Request timed out after " + requestTimeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new ToolFaultException(FaultCode.TRANSIENT_NETWORK_ERROR,
                    "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolFaultException(FaultCode.CANCELLED, "Request interrupted", e);
        }
    }

    JsonNode parse(HttpResponse<String> response) {
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ToolFaultException(FaultCode.TRANSIENT_NETWORK_ERROR,
                    "Response was not valid JSON (HTTP " + response.statusCode() + ")", e);
        }
    }

    /**
     * Maps a non-2xx status to the corresponding fault. Tools with
     * provider-specific conventions check those before delegating here.
     */
    static ToolFaultException statusFault(int status, String message) {
        FaultCode code;
        if (status == 429) {
            code = FaultCode.RATE_LIMITED;
        } else if (status == 401 || status == 403) {
            code = FaultCode.UNAUTHORIZED;
        } else if (status == 404) {
            code = FaultCode.NOT_FOUND;
        } else if (status == 400 || status == 422) {
            code = FaultCode.INVALID_PARAMETERS;
        } else if (status >= 500) {
            code = FaultCode.TRANSIENT_NETWORK_ERROR;
        } else {
            code = FaultCode.INTERNAL_ERROR;
        }
        return new ToolFaultException(code, message + " (HTTP " + status + ")");
    }

    static boolean isSuccess(HttpResponse<?> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    static String queryString(Map<String, String> params) {
        var joiner = new StringJoiner("&");
        params.forEach((key, value) -> joiner.add(encode(key) + "=" + encode(value)));
        return joiner.toString();
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /** Strips credentials from URLs before they reach the logs. */
    static String redact(String url) {
        return url.replaceAll("(appid|api_key|token)=[^&]*", "$1=***");
    }
}
