package com.demo.degree.config;

import com.demo.degree.service.ConfidencePolicy;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Data
@Validated
@ConfigurationProperties(prefix = "attestation")
public class AttestationProperties {

    /** Organization allowed to revoke degrees and administer other organizations. */
    @NotBlank
    private String authorityOrgId = "ATTESTATION_AUTHORITY";

    @NotBlank
    private String authorityName = "Degree Attestation Authority";

    @NotNull
    @DecimalMin("0")
    private BigDecimal minimumStake = new BigDecimal("1000");

    @NotNull
    private ConfidencePolicy confidencePolicy = ConfidencePolicy.SIMPLE_AVERAGE;

    @Min(1)
    private int lockStripes = 64;
}
