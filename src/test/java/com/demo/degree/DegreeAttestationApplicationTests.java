package com.demo.degree;

import com.demo.degree.config.AttestationProperties;
import com.demo.degree.model.OrganizationProfile;
import com.demo.degree.model.OrganizationStatus;
import com.demo.degree.model.SubjectFields;
import com.demo.degree.service.ConfidencePolicy;
import com.demo.degree.service.DegreeAttestationService;
import com.demo.degree.service.dto.VerificationResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class DegreeAttestationApplicationTests {

    @Autowired
    private DegreeAttestationService service;

    @Autowired
    private AttestationProperties props;

    @Test
    void contextLoadsWithAuthorityEnrolled() {
        assertThat(props.getMinimumStake()).isEqualByComparingTo("1000");
        assertThat(props.getConfidencePolicy()).isEqualTo(ConfidencePolicy.SIMPLE_AVERAGE);
        assertThat(service.getOrganization(props.getAuthorityOrgId()).status())
                .isEqualTo(OrganizationStatus.ACTIVE);
    }

    @Test
    void issuesAndVerifiesThroughWiredComponents() {
        String authority = props.getAuthorityOrgId();
        service.registerOrganization("UNIBEN", new OrganizationProfile("University of Benin", "NG",
                "registry@uniben.edu"), new BigDecimal("2500"));
        service.approveOrganization("UNIBEN", authority);

        String hash = "0123456789abcdef".repeat(4);
        String degreeId = service.submitDegree("UNIBEN", hash,
                SubjectFields.builder().studentName("Osaro Igbinedion").degreeName("MSc Chemistry").build());

        VerificationResult result = service.verify(hash.toUpperCase(),
                SubjectFields.builder().studentName("osaro igbinedion").build(), "EMPLOYER_1");

        assertThat(result.verified()).isTrue();
        assertThat(result.degreeId()).isEqualTo(degreeId);
        assertThat(service.getVerificationHistory(degreeId)).hasSize(1);
        assertThat(service.getDegree(degreeId).verificationCount()).isEqualTo(1);
    }
}
