package com.opsassistant.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolHttpClientTest {

    @Test
    @DisplayName("statuses map to fault codes")
    void statusFault() {
        assertEquals(FaultCode.RATE_LIMITED, ToolHttpClient.statusFault(429, "x").code());
        assertEquals(FaultCode.UNAUTHORIZED, ToolHttpClient.statusFault(401, "x").code());
        assertEquals(FaultCode.UNAUTHORIZED, ToolHttpClient.statusFault(403, "x").code());
        assertEquals(FaultCode.NOT_FOUND, ToolHttpClient.statusFault(404, "x").code());
        assertEquals(FaultCode.INVALID_PARAMETERS, ToolHttpClient.statusFault(400, "x").code());
        assertEquals(FaultCode.TRANSIENT_NETWORK_ERROR, ToolHttpClient.statusFault(502, "x").code());
        assertEquals(FaultCode.INTERNAL_ERROR, ToolHttpClient.statusFault(302, "x").code());
        assertTrue(ToolHttpClient.statusFault(503, "Lookup failed").getMessage().endsWith("(HTTP 503)"));
    }

    @Test
    @DisplayName("credentials are redacted from logged URLs")
    void redact() {
        assertEquals("https://h/weather?q=Paris&appid=***&units=metric",
                ToolHttpClient.redact("https://h/weather?q=Paris&appid=secret&units=metric"));
        assertEquals("https://h/x?token=***", ToolHttpClient.redact("https://h/x?token=abc"));
    }

    @Test
    @DisplayName("query strings are form encoded in insertion order")
    void queryString() {
        var params = new LinkedHashMap<String, String>();
        params.put("q", "machine learning");
        params.put("sort", "stars");

        assertEquals("q=machine+learning&sort=stars", ToolHttpClient.queryString(params));
    }

    @Test
    @DisplayName("list parameters accept arrays and separated strings")
    void stringLists() {
        assertEquals(List.of("London", "Paris"),
                ToolParameters.optionalStringList(Map.of("cities", List.of("London", " ", "Paris")), "cities"));
        assertEquals(List.of("London", "Paris", "Berlin"),
                ToolParameters.optionalStringList(Map.of("cities", "London; Paris|Berlin"), "cities"));
        assertTrue(ToolParameters.optionalStringList(Map.of(), "cities").isEmpty());
    }

    @Test
    @DisplayName("malformed integers and structured strings are INVALID_PARAMETERS")
    void invalidParameters() {
        assertEquals(FaultCode.INVALID_PARAMETERS, assertThrows(ToolFaultException.class,
                () -> ToolParameters.optionalInt(Map.of("limit", "five"), "limit", 5)).code());
        assertEquals(FaultCode.INVALID_PARAMETERS, assertThrows(ToolFaultException.class,
                () -> ToolParameters.requireString(Map.of("query", List.of("a")), "query")).code());
        assertEquals(FaultCode.INVALID_PARAMETERS, assertThrows(ToolFaultException.class,
                () -> ToolParameters.requireString(Map.of("query", "  "), "query")).code());
        assertEquals(7, ToolParameters.optionalInt(Map.of("limit", " 7 "), "limit", 5));
    }
}
