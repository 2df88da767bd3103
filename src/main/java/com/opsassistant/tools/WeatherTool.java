package com.opsassistant.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Current weather from the OpenWeather API ({@code GET /weather}).
 * <p>
 * Accepts a single {@code city} or a {@code cities} list. With a list, cities
 * that cannot be fetched are reported through a partial fault carrying the
 * cities that were fetched.
 */
@Component
public class WeatherTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(WeatherTool.class);

    private static final Set<String> UNITS = Set.of("metric", "imperial", "standard");

    private final ToolProperties.Weather config;
    private final ToolHttpClient http;

    public WeatherTool(ToolProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getWeather();
        this.http = new ToolHttpClient(properties, objectMapper);
    }

    @Override
    public ToolKind kind() {
        return ToolKind.WEATHER;
    }

    @Override
    public Object invoke(Map<String, Object> parameters) {
        if (!config.hasApiKey()) {
            throw new ToolFaultException(FaultCode.UNAUTHORIZED,
                    "OpenWeather API key is not configured (set OPENWEATHER_API_KEY)");
        }
        String units = ToolParameters.optionalString(parameters, "units", config.getDefaultUnits()).trim().toLowerCase();
        if (!UNITS.contains(units)) {
            log.warn("Invalid units '{}', defaulting to metric", units);
            units = "metric";
        }

        List<String> cities = ToolParameters.optionalStringList(parameters, "cities");
        if (cities.isEmpty()) {
            return currentWeather(ToolParameters.requireString(parameters, "city"), units);
        }
        return compare(cities, units);
    }

    private List<Map<String, Object>> compare(List<String> cities, String units) {
        log.info("Comparing weather for {} cities", cities.size());
        List<Map<String, Object>> fetched = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        ToolFaultException firstFault = null;
        for (String city : cities) {
            try {
                fetched.add(currentWeather(city, units));
            } catch (ToolFaultException e) {
                if (e.code() == FaultCode.CANCELLED) throw e;
                log.warn("Failed to fetch weather for '{}': {}", city, e.getMessage());
                failures.add(city + " (" + e.code() + ": " + e.getMessage() + ")");
                if (firstFault == null) firstFault = e;
            }
        }
        if (firstFault == null) {
            return fetched;
        }
        String message = "Weather unavailable for " + String.join(", ", failures);
        if (fetched.isEmpty()) {
            throw new ToolFaultException(firstFault.code(), message, firstFault);
        }
        throw ToolFaultException.partial(firstFault.code(), message, fetched);
    }

    Map<String, Object> currentWeather(String city, String units) {
        var params = new LinkedHashMap<String, String>();
        params.put("q", city);
        params.put("appid", config.getApiKey());
        params.put("units", units);

        log.info("Fetching weather for '{}' ({})", city, units);
        var response = http.get(config.getBaseUrl() + "/weather?" + ToolHttpClient.queryString(params), Map.of());
        if (response.statusCode() == 404) {
            throw new ToolFaultException(FaultCode.NOT_FOUND, "City '" + city
                    + "' not found. Check the spelling or add a country code (e.g. 'London,GB')");
        }
        if (!ToolHttpClient.isSuccess(response)) {
            throw ToolHttpClient.statusFault(response.statusCode(), "Weather lookup for '" + city + "' failed");
        }
        return toWeather(http.parse(response), units);
    }

    private static Map<String, Object> toWeather(JsonNode raw, String units) {
        JsonNode main = raw.path("main");
        JsonNode weather = raw.path("weather").path(0);
        String description = weather.path("description").asText("");

        var result = new LinkedHashMap<String, Object>();
        result.put("city", raw.path("name").asText("Unknown"));
        result.put("country", raw.path("sys").path("country").asText("Unknown"));
        result.put("temperature", number(main.path("temp")));
        result.put("temperature_unit", switch (units) {
            case "imperial" -> "°F";
            case "standard" -> "K";
            default -> "°C";
        });
        result.put("feels_like", number(main.path("feels_like")));
        result.put("conditions", description.isEmpty() ? ""
                : Character.toUpperCase(description.charAt(0)) + description.substring(1));
        result.put("conditions_main", weather.path("main").asText(""));
        result.put("humidity", number(main.path("humidity")));
        result.put("wind_speed", number(raw.path("wind").path("speed")));
        result.put("wind_speed_unit", "imperial".equals(units) ? "mph" : "m/s");
        result.put("pressure", number(main.path("pressure")));
        result.put("cloudiness", number(raw.path("clouds").path("all")));
        result.put("timestamp", raw.path("dt").isMissingNode() ? null : raw.path("dt").asLong());
        result.put("units", units);
        return result;
    }

    private static Double number(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }
}
