package com.bko.readiness.engine.app;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-fatal notes collected while evaluating a day, returned with the report.
 */
class ReportNotes {
    private final List<String> messages = new ArrayList<>();

    void info(String message) {
        messages.add(message);
    }

    void warn(String message) {
        messages.add("WARN: " + message);
    }

    List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }
}
