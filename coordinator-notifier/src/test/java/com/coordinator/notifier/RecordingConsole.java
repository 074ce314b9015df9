package com.coordinator.notifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Console that remembers what was submitted, and can be told to go away.
 */
class RecordingConsole implements OperatorConsole {

    final List<String> submitted = new ArrayList<>();
    final List<String> calls = new ArrayList<>();
    private final StringBuilder typed = new StringBuilder();
    private int failAfterSubmits = -1;

    /**
     * Fail every call once this many submissions have succeeded.
     */
    void failAfter(int submits) {
        this.failAfterSubmits = submits;
    }

    void recover() {
        this.failAfterSubmits = -1;
    }

    @Override
    public void writeLine(String text) {
        checkAvailable();
        calls.add("write");
        typed.append(text);
    }

    @Override
    public void submit() {
        checkAvailable();
        calls.add("submit");
        submitted.add(typed.toString());
        typed.setLength(0);
    }

    private void checkAvailable() {
        if (failAfterSubmits >= 0 && submitted.size() >= failAfterSubmits) {
            throw new OperatorConsoleException("console gone");
        }
    }
}
