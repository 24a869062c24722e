package com.teamflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Teamflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setEpic(String epicId) {
        put("epicId", epicId);
    }

    public static void setIssue(String epicId, String issueId) {
        put("epicId", epicId);
        put("issueId", issueId);
    }

    public static void setClaim(String epicId, String issueId, String agentId) {
        put("epicId", epicId);
        put("issueId", issueId);
        put("agentId", agentId);
    }

    public static void clear() {
        MDC.remove("epicId");
        MDC.remove("issueId");
        MDC.remove("agentId");
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
