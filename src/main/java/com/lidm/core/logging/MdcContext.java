package com.lidm.core.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Utility for managing LIDM-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setQuery(String queryId) {
        MDC.put("queryId", queryId);
    }

    public static void setSubtask(String queryId, String subtaskId, String tier) {
        MDC.put("queryId", queryId);
        MDC.put("subtaskId", subtaskId);
        MDC.put("tier", tier);
    }

    public static void setPhase(String phase) {
        MDC.put("phase", phase);
    }

    public static void clear() {
        MDC.remove("queryId");
        MDC.remove("subtaskId");
        MDC.remove("tier");
        MDC.remove("phase");
    }

    /**
     * Wraps {@code task} so it runs with the caller's MDC on a pool thread.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
