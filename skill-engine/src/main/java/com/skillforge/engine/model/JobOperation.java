package com.skillforge.engine.model;

import java.util.Arrays;
import java.util.Optional;

/** Lifecycle operations the orchestrator can run. */
public enum JobOperation {
    SETUP("setup"),
    TEARDOWN("teardown"),
    UPDATE_SKILLS("update-skills");

    private final String wireName;

    JobOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public static Optional<JobOperation> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(op -> op.wireName.equalsIgnoreCase(value.strip()))
                .findFirst();
    }
}
