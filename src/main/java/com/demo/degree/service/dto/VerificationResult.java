package com.demo.degree.service.dto;

import com.demo.degree.model.VerificationMethod;

public record VerificationResult(
        boolean verified,
        double confidence,
        String degreeId,   // null when the hash is unknown
        VerificationMethod method,
        String message
) {

    public static VerificationResult notFound() {
        return new VerificationResult(false, 0.0, null, VerificationMethod.HASH_NOT_FOUND,
                "No degree registered for this certificate hash");
    }

    public static VerificationResult revoked(String degreeId) {
        return new VerificationResult(false, 0.0, degreeId, VerificationMethod.DEGREE_REVOKED,
                "Degree has been revoked");
    }
}
