package com.demo.degree.model;

import java.util.Arrays;
import java.util.Optional;

/** Key fields printed on a certificate; the only fields compared during verification. */
public enum SubjectField {
    STUDENT_NAME("studentName"),
    DEGREE_NAME("degreeName"),
    INSTITUTION_NAME("institutionName"),
    ISSUANCE_DATE("issuanceDate"),
    CERTIFICATE_NUMBER("certificateNumber");

    private final String key;

    SubjectField(String key) { this.key = key; }

    public String key() { return key; }

    public static Optional<SubjectField> fromKey(String key) {
        return Arrays.stream(values()).filter(f -> f.key.equals(key)).findFirst();
    }
}
