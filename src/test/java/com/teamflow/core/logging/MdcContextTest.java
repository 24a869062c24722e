package com.teamflow.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setClaim sets all three keys")
    void setClaim() {
        MdcContext.setClaim("epic-1", "issue-1", "agent-1");

        assertEquals("epic-1", MDC.get("epicId"));
        assertEquals("issue-1", MDC.get("issueId"));
        assertEquals("agent-1", MDC.get("agentId"));
    }

    @Test
    @DisplayName("null values remove the key")
    void nullRemoves() {
        MdcContext.setIssue("epic-1", "issue-1");
        MdcContext.setIssue("epic-1", null);

        assertEquals("epic-1", MDC.get("epicId"));
        assertNull(MDC.get("issueId"));
    }

    @Test
    @DisplayName("clear removes only the teamflow keys")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setClaim("epic-1", "issue-1", "agent-1");

        MdcContext.clear();

        assertNull(MDC.get("epicId"));
        assertNull(MDC.get("agentId"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
