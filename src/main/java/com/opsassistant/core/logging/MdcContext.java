package com.opsassistant.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * MDC keys used by the pipeline for log correlation: {@code queryId},
 * {@code stepNumber} and {@code tool}.
 */
public final class MdcContext {

    public static final String QUERY_ID = "queryId";
    public static final String STEP_NUMBER = "stepNumber";
    public static final String TOOL = "tool";

    private MdcContext() {}

    public static void setQuery(String queryId) {
        if (queryId != null) {
            MDC.put(QUERY_ID, queryId);
        }
    }

    public static void setStep(String queryId, int stepNumber, String tool) {
        setQuery(queryId);
        MDC.put(STEP_NUMBER, String.valueOf(stepNumber));
        MDC.put(TOOL, tool);
    }

    public static String currentQueryId() {
        return MDC.get(QUERY_ID);
    }

    /** Copy of the calling thread's MDC, for handing to worker threads. */
    public static Map<String, String> snapshot() {
        Map<String, String> copy = MDC.getCopyOfContextMap();
        return copy == null ? Map.of() : copy;
    }

    public static void restore(Map<String, String> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(snapshot);
        }
    }

    public static void clearStep() {
        MDC.remove(STEP_NUMBER);
        MDC.remove(TOOL);
    }

    public static void clear() {
        MDC.remove(QUERY_ID);
        clearStep();
    }
}
