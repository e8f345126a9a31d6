package com.forecastplatform.common.model;

/**
 * Per-node expansion lifecycle. Transitions only move forward:
 * {@code PENDING → PROCESSING → COMPLETED | FAILED}.
 */
public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(ProcessingStatus next) {
        return switch (this) {
            case PENDING    -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
