package com.opsassistant.core.verification;

import com.opsassistant.core.model.ExecutionResult;
import com.opsassistant.core.model.StepResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Deterministic plausibility checks over step data.
 */
@Component
public class AnomalyDetector {

    static final double MIN_CELSIUS = -100.0;
    static final double MAX_CELSIUS = 60.0;

    public List<String> detect(ExecutionResult execution) {
        var anomalies = new ArrayList<String>();
        for (StepResult result : execution.results()) {
            if (result.isFailed()) continue;
            Object data = result.data();
            String prefix = "Step " + result.stepNumber() + ": ";
            if (data instanceof Collection<?> items) {
                if (items.isEmpty()) {
                    anomalies.add(prefix + "empty result set returned");
                }
                for (Object item : items) {
                    checkRecord(item, prefix, anomalies);
                }
            } else {
                checkRecord(data, prefix, anomalies);
            }
        }
        return anomalies;
    }

    private static void checkRecord(Object item, String prefix, List<String> anomalies) {
        if (!(item instanceof Map<?, ?> record)) return;
        String label = label(record);

        Double temperature = number(record.get("temperature"));
        if (temperature != null) {
            double celsius = toCelsius(temperature, record);
            if (celsius < MIN_CELSIUS || celsius > MAX_CELSIUS) {
                anomalies.add(prefix + "implausible temperature " + temperature + unitSuffix(record)
                        + " for " + label);
            }
        }
        Double humidity = number(record.get("humidity"));
        if (humidity != null && (humidity < 0 || humidity > 100)) {
            anomalies.add(prefix + "humidity " + humidity + "% outside 0-100 for " + label);
        }
        for (String field : List.of("wind_speed", "stars", "forks")) {
            Double value = number(record.get(field));
            if (value != null && value < 0) {
                anomalies.add(prefix + "negative " + field + " (" + value + ") for " + label);
            }
        }
    }

    static double toCelsius(double value, Map<?, ?> record) {
        String unit = String.valueOf(record.get("temperature_unit"));
        String units = String.valueOf(record.get("units"));
        if (unit.contains("F") || "imperial".equals(units)) {
            return (value - 32) * 5 / 9;
        }
        if ("K".equals(unit) || "standard".equals(units)) {
            return value - 273.15;
        }
        return value;
    }

    private static String unitSuffix(Map<?, ?> record) {
        Object unit = record.get("temperature_unit");
        return unit == null ? "" : unit.toString();
    }

    private static String label(Map<?, ?> record) {
        for (String key : List.of("city", "full_name", "name", "title")) {
            Object value = record.get(key);
            if (value != null && !value.toString().isBlank()) return value.toString();
        }
        return "result";
    }

    private static Double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }
}
