package com.twinforge.core.logging;

import com.twinforge.core.model.Target;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setRun puts runId")
    void setRun() {
        MdcContext.setRun("TWF-2026-0001");
        assertEquals("TWF-2026-0001", MDC.get("runId"));
    }

    @Test
    @DisplayName("setTarget puts runId and the target wire name")
    void setTarget() {
        MdcContext.setTarget("TWF-2026-0001", Target.FRONTEND);
        assertEquals("TWF-2026-0001", MDC.get("runId"));
        assertEquals("frontend", MDC.get("target"));
    }

    @Test
    @DisplayName("setIteration puts the iteration number")
    void setIteration() {
        MdcContext.setIteration("TWF-2026-0001", 3);
        assertEquals("3", MDC.get("iteration"));
    }

    @Test
    @DisplayName("clearTarget keeps the run key")
    void clearTarget() {
        MdcContext.setTarget("TWF-2026-0001", Target.BACKEND);
        MdcContext.clearTarget();
        assertNull(MDC.get("target"));
        assertEquals("TWF-2026-0001", MDC.get("runId"));
    }

    @Test
    @DisplayName("clear removes every Twinforge key")
    void clear() {
        MdcContext.setTarget("TWF-2026-0001", Target.BACKEND);
        MdcContext.setIteration("TWF-2026-0001", 1);
        MDC.put("other", "kept");

        MdcContext.clear();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("target"));
        assertNull(MDC.get("iteration"));
        assertEquals("kept", MDC.get("other"));
    }
}
