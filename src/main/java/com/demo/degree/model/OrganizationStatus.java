package com.demo.degree.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Enrollment status of an organization.
 *
 * <pre>
 * PENDING ──approve──▶ ACTIVE ◀──approve── SUSPENDED
 *                        │ └─────suspend─────▶ ▲
 *   (any non-terminal) ──blacklist──▶ BLACKLISTED
 * </pre>
 * BLACKLISTED is terminal.
 */
public enum OrganizationStatus {
    PENDING,
    ACTIVE,
    SUSPENDED,
    BLACKLISTED;

    public boolean isTerminal() {
        return this == BLACKLISTED;
    }

    public boolean canIssue() {
        return this == ACTIVE;
    }

    public boolean canTransitionTo(OrganizationStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<OrganizationStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(ACTIVE, BLACKLISTED);
            case ACTIVE -> EnumSet.of(SUSPENDED, BLACKLISTED);
            case SUSPENDED -> EnumSet.of(ACTIVE, BLACKLISTED);
            case BLACKLISTED -> EnumSet.noneOf(OrganizationStatus.class);
        };
    }
}
