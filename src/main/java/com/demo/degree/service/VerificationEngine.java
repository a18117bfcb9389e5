package com.demo.degree.service;

import com.demo.degree.config.AttestationProperties;
import com.demo.degree.model.DegreeRecord;
import com.demo.degree.model.SubjectFields;
import com.demo.degree.model.VerificationEvent;
import com.demo.degree.model.VerificationMethod;
import com.demo.degree.service.dto.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Decides whether a presented certificate is authentic.
 * <ol>
 *   <li>unknown hash → not verified, nothing recorded</li>
 *   <li>revoked degree → not verified, confidence 0, audited</li>
 *   <li>otherwise the hash match (1.0) is blended with the fuzzy field score, if any field
 *       is comparable, using the configured {@link ConfidencePolicy}</li>
 * </ol>
 * The engine never changes a degree's status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationEngine {

    public static final double VERIFIED_THRESHOLD = 0.8;
    private static final double HASH_MATCH = 1.0;

    private final CertificateRegistry registry;
    private final AuditTrail auditTrail;
    private final AttestationProperties props;
    private final Clock clock;

    public VerificationResult verify(String certificateHash, SubjectFields ocrFields, String verifierOrgId) {
        String hash = HashUtil.canonical(certificateHash);

        Optional<DegreeRecord> found = registry.lookup(hash);
        if (found.isEmpty()) {
            log.info("Verification by {}: hash {} not found", verifierOrgId, hash);
            return VerificationResult.notFound();
        }
        DegreeRecord degree = found.get();

        OptionalDouble fieldScore = FieldSimilarity.fieldConfidence(degree.subjectFields(), ocrFields);
        VerificationMethod method;
        double confidence;
        if (fieldScore.isPresent()) {
            method = VerificationMethod.HASH_AND_FIELDS;
            confidence = clamp(props.getConfidencePolicy().combine(HASH_MATCH, fieldScore.getAsDouble()));
        } else {
            method = VerificationMethod.HASH_ONLY;
            confidence = HASH_MATCH;
        }
        boolean verified = confidence >= VERIFIED_THRESHOLD;

        // the status seen above may be stale; the registry settles it under the degree lock
        DegreeRecord settled = registry.recordVerification(degree.degreeId(), current -> {
            if (current.isRevoked()) {
                audit(current.degreeId(), verifierOrgId, VerificationMethod.DEGREE_REVOKED, 0.0, hash,
                        clock.instant());
            } else {
                audit(current.degreeId(), verifierOrgId, method, confidence, hash, current.lastVerifiedAt());
            }
        });

        if (settled.isRevoked()) {
            log.info("Verification by {}: degree {} is revoked", verifierOrgId, settled.degreeId());
            return VerificationResult.revoked(settled.degreeId());
        }
        log.info("Verification by {}: degree {} method={} confidence={} verified={}",
                verifierOrgId, degree.degreeId(), method, confidence, verified);
        return new VerificationResult(verified, confidence, degree.degreeId(), method,
                verified ? "Certificate verified" : "Presented fields do not match the registered degree");
    }

    private void audit(String degreeId, String verifierOrgId, VerificationMethod method,
                       double confidence, String extractedHash, Instant at) {
        auditTrail.append(new VerificationEvent(UUID.randomUUID().toString(), degreeId, verifierOrgId,
                method, confidence, extractedHash, at));
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
