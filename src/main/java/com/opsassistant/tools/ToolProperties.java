package com.opsassistant.tools;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Endpoints, credentials and timeouts for the data-fetching tools.
 * Bound from {@code ops.tools.*}.
 */
@Component
@ConfigurationProperties(prefix = "ops.tools")
public class ToolProperties {

    /** Per-request timeout in seconds. */
    private int requestTimeoutSeconds = 30;

    private int connectTimeoutSeconds = 10;

    private GitHub github = new GitHub();
    private Weather weather = new Weather();
    private Wikipedia wikipedia = new Wikipedia();

    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }

    public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }

    public GitHub getGithub() { return github; }
    public void setGithub(GitHub github) { this.github = github; }

    public Weather getWeather() { return weather; }
    public void setWeather(Weather weather) { this.weather = weather; }

    public Wikipedia getWikipedia() { return wikipedia; }
    public void setWikipedia(Wikipedia wikipedia) { this.wikipedia = wikipedia; }

    public static class GitHub {
        private String baseUrl = "https://api.github.com";
        /** Optional; unauthenticated requests get a much lower rate limit. */
        private String token = "";
        private int defaultLimit = 5;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public int getDefaultLimit() { return defaultLimit; }
        public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }

        public boolean hasToken() {
            return token != null && !token.isBlank();
        }
    }

    public static class Weather {
        private String baseUrl = "https://api.openweathermap.org/data/2.5";
        private String apiKey = "";
        private String defaultUnits = "metric";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getDefaultUnits() { return defaultUnits; }
        public void setDefaultUnits(String defaultUnits) { this.defaultUnits = defaultUnits; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class Wikipedia {
        private String baseUrl = "https://en.wikipedia.org";
        private String userAgent = "ops-assistant/0.1 (https://github.com/opsassistant)";
        private int defaultSentences = 3;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public int getDefaultSentences() { return defaultSentences; }
        public void setDefaultSentences(int defaultSentences) { this.defaultSentences = defaultSentences; }
    }
}
