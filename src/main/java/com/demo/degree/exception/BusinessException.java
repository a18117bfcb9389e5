package com.demo.degree.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejection of a request by a business rule. Never retried and never used for
 * backing-store failures, see {@link com.demo.degree.repository.StoreException}.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, ?> details) {
        super(message != null ? message : errorCode.getDefaultMessage());
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static BusinessException of(ErrorCode errorCode, String key, Object value) {
        return new BusinessException(errorCode, errorCode.getDefaultMessage() + ": " + key + "=" + value,
                Map.of(key, String.valueOf(value)));
    }

    @Override
    public String toString() {
        return "BusinessException(code=" + errorCode.getCode() + ", message='" + getMessage()
                + "', details=" + details + ")";
    }
}
