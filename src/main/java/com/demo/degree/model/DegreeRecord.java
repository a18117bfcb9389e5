package com.demo.degree.model;

import com.demo.degree.exception.BusinessException;
import com.demo.degree.exception.ErrorCode;

import java.time.Instant;
import java.util.Map;

/**
 * Registry entry for one issued certificate. Instances are immutable snapshots; every
 * change produces a new record that the registry swaps in with compare-and-set.
 */
public record DegreeRecord(
        String degreeId,
        String certificateHash,   // 64 lowercase hex, never changes
        String issuerOrgId,
        SubjectFields subjectFields,
        DegreeStatus status,
        long verificationCount,
        Instant lastVerifiedAt,   // null until first successful verification
        Instant submittedAt,
        String revocationReason,  // set on revocation
        Instant revokedAt,
        String revokedBy
) {

    public static DegreeRecord issue(String degreeId, String certificateHash, String issuerOrgId,
                                     SubjectFields subjectFields, Instant now) {
        return new DegreeRecord(degreeId, certificateHash, issuerOrgId,
                subjectFields == null ? SubjectFields.empty() : subjectFields,
                DegreeStatus.ACTIVE, 0L, null, now, null, null, null);
    }

    public boolean isRevoked() {
        return status == DegreeStatus.REVOKED;
    }

    public DegreeRecord revoke(String reason, String actingOrgId, Instant now) {
        if (!status.canTransitionTo(DegreeStatus.REVOKED)) {
            throw new BusinessException(ErrorCode.ALREADY_REVOKED,
                    "Degree already revoked: " + degreeId, Map.of("degreeId", degreeId));
        }
        return new DegreeRecord(degreeId, certificateHash, issuerOrgId, subjectFields,
                DegreeStatus.REVOKED, verificationCount, lastVerifiedAt, submittedAt,
                reason, now, actingOrgId);
    }

    public DegreeRecord withVerification(Instant now) {
        return new DegreeRecord(degreeId, certificateHash, issuerOrgId, subjectFields,
                status, verificationCount + 1, now, submittedAt,
                revocationReason, revokedAt, revokedBy);
    }
}
