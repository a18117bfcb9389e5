package com.demo.degree.model;

import com.demo.degree.exception.BusinessException;
import com.demo.degree.exception.ErrorCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of named optional certificate fields. A field is present when its value
 * is non-null; an empty string is a present (empty) value.
 */
public final class SubjectFields {

    private static final SubjectFields EMPTY = new SubjectFields(new EnumMap<>(SubjectField.class));

    private final EnumMap<SubjectField, String> values;

    private SubjectFields(EnumMap<SubjectField, String> values) {
        this.values = values;
    }

    public static SubjectFields empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Converts a loosely-typed field map (e.g. an OCR extraction result) keyed by
     * {@link SubjectField#key()}. Unknown keys are rejected; null values are skipped.
     */
    public static SubjectFields fromMap(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;
        Builder b = builder();
        for (var e : raw.entrySet()) {
            SubjectField field = SubjectField.fromKey(e.getKey())
                    .orElseThrow(() -> new BusinessException(ErrorCode.VALIDATION_ERROR,
                            "Unknown subject field: " + e.getKey(), Map.of("field", String.valueOf(e.getKey()))));
            b.put(field, e.getValue());
        }
        return b.build();
    }

    public Optional<String> get(SubjectField field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean has(SubjectField field) {
        return values.containsKey(field);
    }

    public Set<SubjectField> present() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, String> toMap() {
        Map<String, String> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k.key(), v));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SubjectFields other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SubjectFields" + toMap();
    }

    public static final class Builder {
        private final EnumMap<SubjectField, String> values = new EnumMap<>(SubjectField.class);

        private Builder() {}

        public Builder put(SubjectField field, String value) {
            if (value != null) values.put(field, value);
            return this;
        }

        public Builder studentName(String v)       { return put(SubjectField.STUDENT_NAME, v); }
        public Builder degreeName(String v)        { return put(SubjectField.DEGREE_NAME, v); }
        public Builder institutionName(String v)   { return put(SubjectField.INSTITUTION_NAME, v); }
        public Builder issuanceDate(String v)      { return put(SubjectField.ISSUANCE_DATE, v); }
        public Builder certificateNumber(String v) { return put(SubjectField.CERTIFICATE_NUMBER, v); }

        public SubjectFields build() {
            return values.isEmpty() ? EMPTY : new SubjectFields(new EnumMap<>(values));
        }
    }
}
