package com.demo.degree.service;

import com.demo.degree.exception.BusinessException;
import com.demo.degree.exception.ErrorCode;
import com.demo.degree.model.DegreeRecord;
import com.demo.degree.model.Organization;
import com.demo.degree.model.OrganizationProfile;
import com.demo.degree.model.SubjectFields;
import com.demo.degree.model.VerificationEvent;
import com.demo.degree.service.dto.VerificationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the application layer. Caller identity ({@code actingOrgId},
 * {@code verifierOrgId}) comes from the authentication collaborator.
 */
@Service
@RequiredArgsConstructor
public class DegreeAttestationService {

    private final OrganizationDirectory directory;
    private final CertificateRegistry registry;
    private final VerificationEngine engine;
    private final AuditTrail auditTrail;

    public String submitDegree(String issuerOrgId, String certificateHash, SubjectFields subjectFields) {
        return registry.submit(issuerOrgId, certificateHash, subjectFields);
    }

    public VerificationResult verify(String certificateHash, SubjectFields ocrFields, String verifierOrgId) {
        return engine.verify(certificateHash, ocrFields, verifierOrgId);
    }

    /** Verifies with the raw field map produced by certificate-image extraction. */
    public VerificationResult verifyExtracted(String certificateHash, Map<String, String> ocrFields,
                                              String verifierOrgId) {
        return engine.verify(certificateHash, SubjectFields.fromMap(ocrFields), verifierOrgId);
    }

    public DegreeRecord revoke(String degreeId, String reason, String actingOrgId) {
        return registry.revoke(degreeId, reason, actingOrgId);
    }

    public DegreeRecord getDegree(String degreeId) {
        return registry.getById(degreeId)
                .orElseThrow(() -> BusinessException.of(ErrorCode.DEGREE_NOT_FOUND, "degreeId", degreeId));
    }

    public DegreeRecord getDegreeByHash(String certificateHash) {
        return registry.lookup(certificateHash)
                .orElseThrow(() -> BusinessException.of(ErrorCode.DEGREE_NOT_FOUND, "certificateHash", certificateHash));
    }

    public List<VerificationEvent> getVerificationHistory(String degreeId) {
        getDegree(degreeId);
        return auditTrail.queryByDegree(degreeId).toList();
    }

    public Organization registerOrganization(String orgId, OrganizationProfile profile, BigDecimal stake) {
        return directory.register(orgId, profile, stake);
    }

    public Organization approveOrganization(String orgId, String actingOrgId) {
        return directory.approve(orgId, actingOrgId);
    }

    public Organization suspendOrganization(String orgId, String reason, String actingOrgId) {
        return directory.suspend(orgId, reason, actingOrgId);
    }

    public Organization blacklistOrganization(String orgId, String reason, String actingOrgId) {
        return directory.blacklist(orgId, reason, actingOrgId);
    }

    public List<Organization> listOrganizations() {
        return directory.list();
    }

    public Organization getOrganization(String orgId) {
        return directory.find(orgId)
                .orElseThrow(() -> BusinessException.of(ErrorCode.ORGANIZATION_NOT_FOUND, "orgId", orgId));
    }
}
