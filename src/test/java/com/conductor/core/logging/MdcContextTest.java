package com.conductor.core.logging;

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
    @DisplayName("setJob puts jobId, project, and command in MDC")
    void setJob() {
        MdcContext.setJob("abcd1234", "alpha", "feat");
        assertEquals("abcd1234", MDC.get("jobId"));
        assertEquals("alpha", MDC.get("project"));
        assertEquals("feat", MDC.get("command"));
    }

    @Test
    @DisplayName("clear removes all conductor keys and leaves others alone")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setJob("abcd1234", "alpha", "feat");
        MdcContext.clear();
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("project"));
        assertNull(MDC.get("command"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
