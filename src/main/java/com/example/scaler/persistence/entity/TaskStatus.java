package com.example.scaler.persistence.entity;

import java.util.Arrays;
import java.util.List;

public enum TaskStatus {
    ENQUEUED(false),
    PENDING(false),
    SUCCESS(true),
    ERROR(true),
    CANCELLED(true),
    MAX_RECOVERY_ATTEMPTS_EXCEEDED(true);

    private final boolean terminal;

    TaskStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Names of the statuses counted as backlog: waiting in a queue or executing.
     */
    public static List<String> nonTerminalNames() {
        return Arrays.stream(values())
                .filter(s -> !s.terminal)
                .map(Enum::name)
                .toList();
    }
}
