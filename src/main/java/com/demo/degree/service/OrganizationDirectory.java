package com.demo.degree.service;

import com.demo.degree.config.AttestationProperties;
import com.demo.degree.exception.BusinessException;
import com.demo.degree.exception.ErrorCode;
import com.demo.degree.model.Organization;
import com.demo.degree.model.OrganizationProfile;
import com.demo.degree.model.OrganizationStatus;
import com.demo.degree.repository.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrganizationDirectory {

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9+_.-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private final KeyValueStore<Organization> organizationStore;
    private final AttestationProperties props;
    private final Clock clock;

    public Organization register(String orgId, OrganizationProfile profile, BigDecimal stake) {
        requireNonBlank("orgId", orgId);
        if (profile == null) throw validation("profile", null, "profile required");
        requireNonBlank("name", profile.name());
        if (profile.contactEmail() != null && !EMAIL.matcher(profile.contactEmail()).matches()) {
            throw validation("contactEmail", profile.contactEmail(), "Invalid email format");
        }
        if (stake == null || stake.compareTo(props.getMinimumStake()) < 0) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_STAKE,
                    "Minimum stake is " + props.getMinimumStake() + ", got " + stake,
                    Map.of("orgId", orgId, "stake", String.valueOf(stake)));
        }

        Organization org = Organization.enroll(orgId, profile, stake, clock.instant());
        if (!organizationStore.putIfAbsent(orgId, org)) {
            throw BusinessException.of(ErrorCode.DUPLICATE_ORGANIZATION, "orgId", orgId);
        }
        log.info("Organization {} registered (stake={}), pending approval", orgId, stake);
        return org;
    }

    public Organization approve(String orgId, String actingOrgId) {
        return transition(orgId, OrganizationStatus.ACTIVE, null, actingOrgId, "approveOrganization");
    }

    public Organization suspend(String orgId, String reason, String actingOrgId) {
        requireNonBlank("reason", reason);
        return transition(orgId, OrganizationStatus.SUSPENDED, reason, actingOrgId, "suspendOrganization");
    }

    /** Existing degrees of the organization stay ACTIVE; they must be revoked one by one. */
    public Organization blacklist(String orgId, String reason, String actingOrgId) {
        requireNonBlank("reason", reason);
        return transition(orgId, OrganizationStatus.BLACKLISTED, reason, actingOrgId, "blacklistOrganization");
    }

    public boolean isEligibleIssuer(String orgId) {
        if (orgId == null) return false;
        return organizationStore.get(orgId).map(o -> o.status().canIssue()).orElse(false);
    }

    public boolean isAuthority(String orgId) {
        return props.getAuthorityOrgId().equals(orgId);
    }

    public void requireAuthority(String actingOrgId, String operation) {
        if (!isAuthority(actingOrgId)) {
            log.warn("Rejected {} by non-authority {}", operation, actingOrgId);
            throw new BusinessException(ErrorCode.UNAUTHORIZED,
                    operation + " requires attestation authority",
                    Map.of("actingOrgId", String.valueOf(actingOrgId), "operation", operation));
        }
    }

    public Optional<Organization> find(String orgId) {
        return orgId == null ? Optional.empty() : organizationStore.get(orgId);
    }

    /** Every enrolled organization, authority included, ordered by id. */
    public List<Organization> list() {
        return organizationStore.values().stream()
                .sorted(Comparator.comparing(Organization::orgId))
                .toList();
    }

    /** Bumps the issuer's degree counter; a lost race is retried against the fresh snapshot. */
    void recordIssuance(String orgId) {
        while (true) {
            Organization current = organizationStore.get(orgId)
                    .orElseThrow(() -> BusinessException.of(ErrorCode.ORGANIZATION_NOT_FOUND, "orgId", orgId));
            if (organizationStore.compareAndSet(orgId, current, current.withIssuance(clock.instant()))) return;
        }
    }

    /** Idempotent: creates the authority as an ACTIVE organization with zero stake. */
    public Organization enrollAuthority() {
        String id = props.getAuthorityOrgId();
        Organization authority = Organization
                .enroll(id, new OrganizationProfile(props.getAuthorityName(), null, null), BigDecimal.ZERO, clock.instant())
                .withStatus(OrganizationStatus.ACTIVE, null, clock.instant());
        if (organizationStore.putIfAbsent(id, authority)) {
            log.info("Attestation authority {} enrolled", id);
            return authority;
        }
        return organizationStore.get(id).orElse(authority);
    }

    private Organization transition(String orgId, OrganizationStatus target, String reason,
                                    String actingOrgId, String operation) {
        requireAuthority(actingOrgId, operation);
        if (isAuthority(orgId)) {
            log.warn("Rejected {} targeting the attestation authority itself", operation);
            throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                    "Status of the attestation authority cannot change",
                    Map.of("orgId", orgId, "operation", operation));
        }
        while (true) {
            Organization current = find(orgId)
                    .orElseThrow(() -> BusinessException.of(ErrorCode.ORGANIZATION_NOT_FOUND, "orgId", orgId));
            if (!current.status().canTransitionTo(target)) {
                throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                        "Organization " + orgId + " cannot move from " + current.status() + " to " + target,
                        Map.of("orgId", orgId, "from", current.status().name(), "to", target.name()));
            }
            Organization next = current.withStatus(target, reason, clock.instant());
            // lost the race (e.g. an issuance bump): re-validate against the fresh record
            if (organizationStore.compareAndSet(orgId, current, next)) {
                log.info("Organization {} {} -> {} by {}", orgId, current.status(), target, actingOrgId);
                return next;
            }
        }
    }

    private static void requireNonBlank(String field, String v) {
        if (v == null || v.isBlank()) throw validation(field, v, field + " required");
    }

    private static BusinessException validation(String field, String value, String message) {
        return new BusinessException(ErrorCode.VALIDATION_ERROR, message,
                Map.of("field", field, "value", String.valueOf(value)));
    }
}
