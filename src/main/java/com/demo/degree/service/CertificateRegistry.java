package com.demo.degree.service;

import com.demo.degree.exception.BusinessException;
import com.demo.degree.exception.ErrorCode;
import com.demo.degree.model.DegreeRecord;
import com.demo.degree.model.RevocationEvent;
import com.demo.degree.model.SubjectFields;
import com.demo.degree.repository.KeyValueStore;
import com.demo.degree.repository.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Canonical store of issued degrees, indexed by degree id and by certificate hash.
 * <p>
 * Mutations on the same hash or degree id are serialized through {@link KeyedLocks};
 * reads go straight to the stores and see the latest committed snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CertificateRegistry {

    private static final String HASH_KEY = "hash:";
    private static final String DEGREE_KEY = "degree:";

    private final KeyValueStore<DegreeRecord> degreeStore;
    private final KeyValueStore<String> hashIndex;
    private final OrganizationDirectory directory;
    private final AuditTrail auditTrail;
    private final KeyedLocks locks;
    private final Clock clock;

    public String submit(String issuerOrgId, String certificateHash, SubjectFields subjectFields) {
        if (!directory.isEligibleIssuer(issuerOrgId)) {
            log.warn("Submit rejected: issuer {} not eligible", issuerOrgId);
            throw BusinessException.of(ErrorCode.ISSUER_NOT_ELIGIBLE, "issuerOrgId", issuerOrgId);
        }
        String hash = HashUtil.canonical(certificateHash);

        String degreeId = locks.withLock(HASH_KEY + hash, () -> insert(issuerOrgId, hash, subjectFields));
        try {
            directory.recordIssuance(issuerOrgId);
        } catch (StoreException ex) {
            // statistics only; the degree itself is committed
            log.error("[{}] Degree {} stored but issuance counter of {} not updated",
                    ex.getErrorCode().getCode(), degreeId, issuerOrgId, ex);
        }
        log.info("Degree {} submitted by {} (hash={})", degreeId, issuerOrgId, hash);
        return degreeId;
    }

    // the index claim is the uniqueness guard; the record is written only after winning it
    private String insert(String issuerOrgId, String hash, SubjectFields subjectFields) {
        String degreeId = UUID.randomUUID().toString();
        if (!hashIndex.putIfAbsent(hash, degreeId)) {
            log.warn("Submit rejected: duplicate certificate hash {}", hash);
            throw BusinessException.of(ErrorCode.DUPLICATE_CERTIFICATE, "certificateHash", hash);
        }
        DegreeRecord record = DegreeRecord.issue(degreeId, hash, issuerOrgId, subjectFields, clock.instant());
        try {
            if (!degreeStore.putIfAbsent(degreeId, record)) {
                throw new StoreException("degree id collision: " + degreeId);
            }
        } catch (RuntimeException ex) {
            hashIndex.remove(hash);
            log.error("Submit of hash {} failed, index claim rolled back", hash, ex);
            throw ex;
        }
        return degreeId;
    }

    public Optional<DegreeRecord> lookup(String certificateHash) {
        String hash = HashUtil.canonical(certificateHash);
        return hashIndex.get(hash).flatMap(degreeStore::get);
    }

    public Optional<DegreeRecord> getById(String degreeId) {
        return degreeId == null ? Optional.empty() : degreeStore.get(degreeId);
    }

    public DegreeRecord revoke(String degreeId, String reason, String actingOrgId) {
        directory.requireAuthority(actingOrgId, "revoke");
        if (reason == null || reason.isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "reason required",
                    Map.of("field", "reason", "degreeId", String.valueOf(degreeId)));
        }

        DegreeRecord revoked = locks.withLock(DEGREE_KEY + degreeId, () -> {
            DegreeRecord current = requireDegree(degreeId);
            DegreeRecord next = current.revoke(reason, actingOrgId, clock.instant());
            swap(current, next);
            auditTrail.appendRevocation(new RevocationEvent(UUID.randomUUID().toString(), degreeId,
                    next.certificateHash(), reason, actingOrgId, next.revokedAt()));
            return next;
        });

        log.info("Degree {} revoked by {}: {}", degreeId, actingOrgId, reason);
        return revoked;
    }

    /**
     * Bookkeeping for a verification attempt; only the verification engine calls this.
     * <p>
     * The degree is re-read under its lock. A degree revoked since the caller looked it up is
     * returned unchanged, otherwise its counter is bumped. {@code onSettled} receives the
     * resulting snapshot while the lock is still held, so its audit entry cannot interleave
     * with a revocation.
     */
    DegreeRecord recordVerification(String degreeId, Consumer<DegreeRecord> onSettled) {
        return locks.withLock(DEGREE_KEY + degreeId, () -> {
            DegreeRecord current = requireDegree(degreeId);
            DegreeRecord settled = current;
            if (!current.isRevoked()) {
                settled = current.withVerification(clock.instant());
                swap(current, settled);
            }
            onSettled.accept(settled);
            return settled;
        });
    }

    private DegreeRecord requireDegree(String degreeId) {
        return getById(degreeId)
                .orElseThrow(() -> BusinessException.of(ErrorCode.DEGREE_NOT_FOUND, "degreeId", degreeId));
    }

    // under the degree lock no other writer exists, so a failed swap means the store misbehaved
    private void swap(DegreeRecord current, DegreeRecord next) {
        if (!degreeStore.compareAndSet(current.degreeId(), current, next)) {
            throw new StoreException("concurrent modification of degree " + current.degreeId());
        }
    }
}
