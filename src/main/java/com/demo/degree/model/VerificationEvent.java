package com.demo.degree.model;

import java.time.Instant;

public record VerificationEvent(
        String eventId,
        String degreeId,
        String verifierOrgId,
        VerificationMethod method,
        double confidence,
        String extractedHash,
        Instant timestamp
) {}
