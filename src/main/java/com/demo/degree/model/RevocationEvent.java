package com.demo.degree.model;

import java.time.Instant;

public record RevocationEvent(
        String eventId,
        String degreeId,
        String certificateHash,
        String reason,
        String actingOrgId,
        Instant timestamp
) {}
