package com.opsassistant.core.planner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and pattern based detection of comparison queries.
 * <p>
 * The result is passed to the model as a hint; it never overrides the plan.
 */
@Component
public class ComparisonDetector {

    private static final Logger log = LoggerFactory.getLogger(ComparisonDetector.class);

    private static final List<String> KEYWORDS = List.of(
            "compare", "comparison", "difference between", "differences between",
            "which is better", "better than", "contrast");

    private static final Pattern VERSUS = Pattern.compile("\\b(vs\\.?|versus)(?=\\s|$)", Pattern.CASE_INSENSITIVE);

    private static final Pattern CAPITALIZED = Pattern.compile(
            "\\b[A-Z][\\w.+#-]*(?:\\s+[A-Z][\\w.+#-]*)*");

    private static final Pattern LIST_JOINER = Pattern.compile(",|\\band\\b|\\bor\\b|\\bvs\\.?|\\bversus\\b");

    private static final Set<String> NOT_ENTITIES = Set.of(
            "I", "What", "Which", "Who", "How", "Show", "Find", "Get", "Tell", "Give", "List", "Compare",
            "Search", "Summarize", "Is", "Are", "The", "A", "An", "Please", "Fetch", "Look");

    public ComparisonHint detect(String query) {
        if (query == null || query.isBlank()) {
            return ComparisonHint.none();
        }
        String lower = query.toLowerCase(Locale.ROOT);
        List<String> entities = candidateEntities(query);

        for (String keyword : KEYWORDS) {
            if (lower.contains(keyword)) {
                log.debug("Comparison keyword detected: '{}'", keyword);
                return new ComparisonHint(true, keyword, entities);
            }
        }
        Matcher versus = VERSUS.matcher(query);
        if (versus.find()) {
            return new ComparisonHint(true, versus.group(1).toLowerCase(Locale.ROOT), entities);
        }
        if (entities.size() >= 2 && LIST_JOINER.matcher(query).find()) {
            log.debug("Entity list detected: {}", entities);
            return new ComparisonHint(true, "entity list", entities);
        }
        return new ComparisonHint(false, null, entities);
    }

    /**
     * Capitalized phrases that are not sentence-leading verbs or question words,
     * split on list separators.
     */
    List<String> candidateEntities(String query) {
        var found = new LinkedHashSet<String>();
        for (String segment : LIST_JOINER.split(query)) {
            Matcher m = CAPITALIZED.matcher(segment);
            while (m.find()) {
                List<String> words = new ArrayList<>(List.of(m.group().trim().split("\\s+")));
                while (!words.isEmpty() && NOT_ENTITIES.contains(words.get(0))) {
                    words.remove(0);
                }
                if (!words.isEmpty()) {
                    found.add(String.join(" ", words));
                }
            }
        }
        return List.copyOf(found);
    }
}
