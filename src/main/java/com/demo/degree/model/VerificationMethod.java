package com.demo.degree.model;

public enum VerificationMethod {
    HASH_NOT_FOUND,
    DEGREE_REVOKED,
    HASH_ONLY,
    HASH_AND_FIELDS
}
