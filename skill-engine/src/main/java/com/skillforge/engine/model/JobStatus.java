package com.skillforge.engine.model;

/**
 * Job lifecycle:
 *
 *   PENDING ──► RUNNING ──► COMPLETED
 *                   └─────► FAILED
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
