package com.demo.degree.model;

/**
 * Lifecycle of a registered degree. A degree starts {@link #ACTIVE} on submission and the
 * only transition is ACTIVE → REVOKED. {@link #REVOKED} is terminal.
 */
public enum DegreeStatus {
    ACTIVE,
    REVOKED;

    public boolean isTerminal() {
        return this == REVOKED;
    }

    public boolean canTransitionTo(DegreeStatus target) {
        return this == ACTIVE && target == REVOKED;
    }
}
