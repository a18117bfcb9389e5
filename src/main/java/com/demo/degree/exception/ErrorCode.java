package com.demo.degree.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_001", "Input validation failed"),
    INVALID_HASH("VALIDATION_002", "Certificate hash must be 64 hexadecimal characters"),

    ORGANIZATION_NOT_FOUND("ORG_001", "Organization not found"),
    DUPLICATE_ORGANIZATION("ORG_002", "Organization already registered"),
    INSUFFICIENT_STAKE("ORG_003", "Insufficient stake amount"),
    INVALID_STATUS_TRANSITION("ORG_004", "Status transition not allowed"),
    ISSUER_NOT_ELIGIBLE("ORG_005", "Issuer is not an active organization"),

    DEGREE_NOT_FOUND("DEGREE_001", "Degree not found"),
    DUPLICATE_CERTIFICATE("DEGREE_002", "Certificate hash already registered"),
    ALREADY_REVOKED("DEGREE_003", "Degree already revoked"),

    UNAUTHORIZED("AUTH_001", "Operation requires attestation authority"),

    INTERNAL_ERROR("SYSTEM_001", "Backing store failure");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
