package com.opsassistant.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setQuery puts queryId in MDC")
    void setQuery() {
        MdcContext.setQuery("OPS-2026-0001");
        assertEquals("OPS-2026-0001", MDC.get("queryId"));
        assertEquals("OPS-2026-0001", MdcContext.currentQueryId());
    }

    @Test
    @DisplayName("setStep puts queryId, stepNumber and tool in MDC")
    void setStep() {
        MdcContext.setStep("OPS-2026-0001", 2, "weather");
        assertEquals("OPS-2026-0001", MDC.get("queryId"));
        assertEquals("2", MDC.get("stepNumber"));
        assertEquals("weather", MDC.get("tool"));
    }

    @Test
    @DisplayName("clearStep keeps the query id")
    void clearStep() {
        MdcContext.setStep("OPS-2026-0001", 2, "weather");
        MdcContext.clearStep();
        assertEquals("OPS-2026-0001", MDC.get("queryId"));
        assertNull(MDC.get("stepNumber"));
        assertNull(MDC.get("tool"));
    }

    @Test
    @DisplayName("snapshot and restore carry the context to another thread")
    void snapshotRestore() throws InterruptedException {
        MdcContext.setQuery("OPS-2026-0007");
        Map<String, String> snapshot = MdcContext.snapshot();
        String[] seen = new String[1];

        Thread worker = new Thread(() -> {
            MdcContext.restore(snapshot);
            seen[0] = MdcContext.currentQueryId();
        });
        worker.start();
        worker.join();

        assertEquals("OPS-2026-0007", seen[0]);
    }

    @Test
    @DisplayName("restoring an empty snapshot clears the MDC")
    void restoreEmpty() {
        MdcContext.setStep("OPS-2026-0001", 1, "github");
        MdcContext.restore(Map.of());
        assertNull(MDC.get("queryId"));
        assertTrue(MdcContext.snapshot().isEmpty());
    }
}
