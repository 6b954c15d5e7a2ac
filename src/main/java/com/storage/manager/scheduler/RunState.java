package com.storage.manager.scheduler;

import com.storage.manager.core.model.CleanupStatus;

/**
 * Scheduler-side state of a registration. A terminal state means the key is idle and
 * shows how its latest run ended.
 */
public enum RunState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public static RunState of(CleanupStatus status) {
        return switch (status) {
            case COMPLETED -> COMPLETED;
            case FAILED -> FAILED;
            case TIMED_OUT -> TIMED_OUT;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }
}
