package com.lidm.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setQuery puts queryId in MDC")
    void setQuery() {
        MdcContext.setQuery("LIDM-2026-0001");
        assertEquals("LIDM-2026-0001", MDC.get("queryId"));
    }

    @Test
    @DisplayName("setSubtask puts queryId, subtaskId and tier in MDC")
    void setSubtask() {
        MdcContext.setSubtask("LIDM-2026-0001", "st_2", "heavy");
        assertEquals("LIDM-2026-0001", MDC.get("queryId"));
        assertEquals("st_2", MDC.get("subtaskId"));
        assertEquals("heavy", MDC.get("tier"));
    }

    @Test
    @DisplayName("clear removes all lidm MDC keys")
    void clear() {
        MdcContext.setSubtask("LIDM-2026-0001", "st_2", "heavy");
        MdcContext.setPhase("verify");
        MdcContext.clear();
        assertNull(MDC.get("queryId"));
        assertNull(MDC.get("subtaskId"));
        assertNull(MDC.get("tier"));
        assertNull(MDC.get("phase"));
    }

    @Test
    @DisplayName("propagate carries the caller's MDC to a pool thread and restores the worker's")
    void propagate() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            MdcContext.setQuery("LIDM-2026-0002");
            String seen = executor.submit(MdcContext.propagate(() -> MDC.get("queryId"))).get(5, TimeUnit.SECONDS);
            String after = executor.submit(() -> MDC.get("queryId")).get(5, TimeUnit.SECONDS);

            assertEquals("LIDM-2026-0002", seen);
            assertNull(after);
        } finally {
            executor.shutdownNow();
        }
    }
}
