package com.opsassistant.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of tools a plan may reference.
 * <p>
 * Adding a tool means adding a constant here and registering an
 * implementation in {@link ToolRegistry}; the planner prompt and the plan
 * validator are derived from these definitions.
 */
public enum ToolKind {

    GITHUB("github",
            "Search GitHub repositories and return name, stars, forks, language and URL",
            Set.of("query"),
            List.of("query (required): search string, e.g. \"rust web framework\" or \"language:python stars:>1000\"",
                    "sort (optional): stars | forks | updated, default stars",
                    "limit (optional): number of results, default 5, max 100"),
            "{\"query\": \"rust web frameworks\", \"sort\": \"stars\", \"limit\": 5}",
            Map.of()),

    WEATHER("weather",
            "Fetch current weather (temperature, conditions, humidity, wind) for a city",
            Set.of("city"),
            List.of("city (required unless cities is given): city name, optionally with country code, e.g. \"London,GB\"",
                    "cities (optional): list of city names fetched in one step, e.g. [\"London\", \"Paris\"]; "
                            + "cities that cannot be fetched make the step partial",
                    "units (optional): metric | imperial | standard, default metric"),
            "{\"city\": \"London\", \"units\": \"metric\"}",
            Map.of("city", "cities")),

    WIKIPEDIA("wikipedia",
            "Fetch the summary of a Wikipedia article",
            Set.of("topic"),
            List.of("topic (required): article title, e.g. \"Python (programming language)\"",
                    "sentences (optional): number of sentences in the short extract, default 3"),
            "{\"topic\": \"Artificial intelligence\", \"sentences\": 3}",
            Map.of());

    private final String wireName;
    private final String purpose;
    private final Set<String> requiredParameters;
    private final List<String> parameterDocs;
    private final String example;
    /** Required parameter to the list parameter that can stand in for it. */
    private final Map<String, String> alternatives;

    ToolKind(String wireName, String purpose, Set<String> requiredParameters,
             List<String> parameterDocs, String example, Map<String, String> alternatives) {
        this.wireName = wireName;
        this.purpose = purpose;
        this.requiredParameters = requiredParameters;
        this.parameterDocs = parameterDocs;
        this.example = example;
        this.alternatives = alternatives;
    }

    public String wireName() { return wireName; }
    public String purpose() { return purpose; }
    public Set<String> requiredParameters() { return requiredParameters; }
    public List<String> parameterDocs() { return parameterDocs; }
    public String example() { return example; }

    /**
     * Required parameters that are absent or blank in the given parameters.
     * A required parameter whose list alternative (weather's {@code cities})
     * is non-empty counts as present.
     */
    public List<String> missingParameters(Map<String, Object> parameters) {
        List<String> missing = new ArrayList<>();
        for (String key : requiredParameters) {
            Object value = parameters.get(key);
            if (value != null && !(value instanceof String s && s.isBlank())) continue;
            String alternative = alternatives.get(key);
            if (alternative != null && !ToolParameters.optionalStringList(parameters, alternative).isEmpty()) continue;
            missing.add(key);
        }
        return missing;
    }

    public static Optional<ToolKind> fromWireName(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ToolKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
