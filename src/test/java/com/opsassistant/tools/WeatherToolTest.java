package com.opsassistant.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WeatherToolTest {

    private static final String LONDON = """
            {"name":"London","sys":{"country":"GB"},"main":{"temp":14.5,"feels_like":13.9,"humidity":72,"pressure":1012},
             "weather":[{"main":"Rain","description":"light rain"}],"wind":{"speed":4.1},"clouds":{"all":75},"dt":1700000000}
            """;

    private StubHttpServer server;
    private ToolProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubHttpServer();
        properties = new ToolProperties();
        properties.getWeather().setBaseUrl(server.baseUrl() + "/data/2.5");
        properties.getWeather().setApiKey("test-key");
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private WeatherTool tool() {
        return new WeatherTool(properties, new ObjectMapper());
    }

    @Test
    @DisplayName("maps the current weather response")
    void currentWeather() {
        server.route("/data/2.5/weather", StubHttpServer.Response.json(200, LONDON));

        @SuppressWarnings("unchecked")
        var result = (Map<String, Object>) tool().invoke(Map.of("city", "London"));

        assertEquals("London", result.get("city"));
        assertEquals("GB", result.get("country"));
        assertEquals(14.5, result.get("temperature"));
        assertEquals("°C", result.get("temperature_unit"));
        assertEquals("Light rain", result.get("conditions"));
        assertEquals(72.0, result.get("humidity"));
        assertEquals("m/s", result.get("wind_speed_unit"));
        String query = server.requests().get(0).query();
        assertTrue(query.contains("q=London"));
        assertTrue(query.contains("appid=test-key"));
        assertTrue(query.contains("units=metric"));
    }

    @Test
    @DisplayName("imperial units switch the unit labels")
    void imperialUnits() {
        server.route("/data/2.5/weather", StubHttpServer.Response.json(200, LONDON));

        @SuppressWarnings("unchecked")
        var result = (Map<String, Object>) tool().invoke(Map.of("city", "London", "units", "imperial"));

        assertEquals("°F", result.get("temperature_unit"));
        assertEquals("mph", result.get("wind_speed_unit"));
    }

    @Test
    @DisplayName("unknown city is NOT_FOUND with a country-code hint")
    void notFound() {
        server.route("/data/2.5/weather", StubHttpServer.Response.json(404, "{\"cod\":\"404\"}"));

        var e = assertThrows(ToolFaultException.class, () -> tool().invoke(Map.of("city", "Atlantis")));
        assertEquals(FaultCode.NOT_FOUND, e.code());
        assertTrue(e.getMessage().contains("country code"));
    }

    @Test
    @DisplayName("invalid key is UNAUTHORIZED, server errors are transient")
    void statusMapping() {
        server.route("/data/2.5/weather", StubHttpServer.Response.json(401, "{}"));
        assertEquals(FaultCode.UNAUTHORIZED,
                assertThrows(ToolFaultException.class, () -> tool().invoke(Map.of("city", "Paris"))).code());

        server.route("/data/2.5/weather", StubHttpServer.Response.json(503, "{}"));
        assertEquals(FaultCode.TRANSIENT_NETWORK_ERROR,
                assertThrows(ToolFaultException.class, () -> tool().invoke(Map.of("city", "Paris"))).code());

        server.route("/data/2.5/weather", StubHttpServer.Response.json(429, "{}"));
        assertEquals(FaultCode.RATE_LIMITED,
                assertThrows(ToolFaultException.class, () -> tool().invoke(Map.of("city", "Paris"))).code());
    }

    @Test
    @DisplayName("missing API key fails without a request")
    void missingKey() {
        properties.getWeather().setApiKey("");

        var e = assertThrows(ToolFaultException.class, () -> tool().invoke(Map.of("city", "London")));
        assertEquals(FaultCode.UNAUTHORIZED, e.code());
        assertTrue(server.requests().isEmpty());
    }

    @Test
    @DisplayName("a cities list where every city fails raises the first fault")
    void allCitiesFail() {
        var e = assertThrows(ToolFaultException.class,
                () -> tool().invoke(Map.of("cities", List.of("Atlantis", "El Dorado"))));
        assertEquals(FaultCode.NOT_FOUND, e.code());
        assertFalse(e.hasPartialData());
        assertEquals(2, server.requests().size());
    }

    @Test
    @DisplayName("a cities list with one unknown city yields partial data for the rest")
    void partialComparison() {
        server.route("/data/2.5/weather", "q=London", StubHttpServer.Response.json(200, LONDON));

        var e = assertThrows(ToolFaultException.class,
                () -> tool().invoke(Map.of("cities", "London;Atlantis")));

        assertEquals(FaultCode.NOT_FOUND, e.code());
        assertTrue(e.hasPartialData());
        assertEquals(1, ((List<?>) e.partialData()).size());
        assertTrue(e.getMessage().contains("Atlantis"));
    }

    @Test
    @DisplayName("missing city is INVALID_PARAMETERS")
    void missingCity() {
        var e = assertThrows(ToolFaultException.class, () -> tool().invoke(Map.of()));
        assertEquals(FaultCode.INVALID_PARAMETERS, e.code());
    }
}
