package com.dcruver.gitpet.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status category of a single health check.
 * The lowercase labels are what other subsystems match on.
 */
public enum HealthStatus {
    GREAT("great"),
    OK("ok"),
    WARNING("warning"),
    BAD("bad");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
