package com.demo.degree.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Organization(
        String orgId,
        OrganizationProfile profile,
        OrganizationStatus status,
        BigDecimal stake,
        String statusReason,   // null unless suspended/blacklisted
        long degreesIssued,
        Instant registeredAt,
        Instant updatedAt
) {

    public static Organization enroll(String orgId, OrganizationProfile profile, BigDecimal stake, Instant now) {
        return new Organization(orgId, profile, OrganizationStatus.PENDING, stake, null, 0L, now, now);
    }

    public Organization withStatus(OrganizationStatus next, String reason, Instant now) {
        return new Organization(orgId, profile, next, stake, reason, degreesIssued, registeredAt, now);
    }

    public Organization withIssuance(Instant now) {
        return new Organization(orgId, profile, status, stake, statusReason, degreesIssued + 1, registeredAt, now);
    }
}
