package com.coordinator.notifier;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LoggingOperatorConsoleTest {

    @Test
    void submitFlushesTypedText() {
        LoggingOperatorConsole console = new LoggingOperatorConsole();

        console.writeLine("[SYSTEM] hello");
        assertThat(console.buffered()).isEqualTo("[SYSTEM] hello");

        console.submit();
        assertThat(console.buffered()).isEmpty();
    }

    @Test
    void submitWithoutTextIsHarmless() {
        LoggingOperatorConsole console = new LoggingOperatorConsole();

        assertThatCode(console::submit).doesNotThrowAnyException();
    }
}
