package com.forecastplatform.engine.session;

/**
 * Generation session lifecycle: {@code RUNNING → COMPLETED | CANCELLED | FAILED}.
 * {@code FAILED} is reserved for tree-store corruption; per-node failures never fail
 * the session.
 */
public enum SessionStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isFinished() {
        return this != RUNNING;
    }
}
