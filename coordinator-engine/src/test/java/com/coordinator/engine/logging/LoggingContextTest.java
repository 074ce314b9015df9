package com.coordinator.engine.logging;

import com.coordinator.core.model.Stage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void clear() {
        LoggingContext.clearAll();
    }

    @Test
    void setsTaskAndStage() {
        try (var ctx = LoggingContext.forTask("PRP-1", Stage.DEVELOPMENT)) {
            assertThat(LoggingContext.getTaskId()).isEqualTo("PRP-1");
            assertThat(MDC.get(LoggingContext.STAGE)).isEqualTo("dev");
            assertThat(LoggingContext.getTraceId()).isNotBlank();
        }
        assertThat(LoggingContext.getTaskId()).isNull();
        assertThat(MDC.get(LoggingContext.STAGE)).isNull();
    }

    @Test
    void nestedContextsRestoreOuterValues() {
        try (var agent = LoggingContext.forAgent("dev-1")) {
            try (var task = LoggingContext.forTask("PRP-1", Stage.VALIDATION)) {
                assertThat(MDC.get(LoggingContext.AGENT_ID)).isEqualTo("dev-1");
                try (var inner = LoggingContext.forTask("PRP-2")) {
                    assertThat(LoggingContext.getTaskId()).isEqualTo("PRP-2");
                    assertThat(MDC.get(LoggingContext.STAGE)).isEqualTo("validation");
                }
                assertThat(LoggingContext.getTaskId()).isEqualTo("PRP-1");
            }
            assertThat(LoggingContext.getTaskId()).isNull();
            assertThat(MDC.get(LoggingContext.AGENT_ID)).isEqualTo("dev-1");
        }
        assertThat(MDC.get(LoggingContext.AGENT_ID)).isNull();
    }

    @Test
    void traceIdSurvivesClose() {
        String traceId;
        try (var ctx = LoggingContext.forNotification("n-1")) {
            traceId = LoggingContext.getTraceId();
        }
        assertThat(LoggingContext.getTraceId()).isEqualTo(traceId);
    }
}
