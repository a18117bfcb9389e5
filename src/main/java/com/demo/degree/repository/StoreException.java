package com.demo.degree.repository;

import com.demo.degree.exception.ErrorCode;

/**
 * Failure of the backing key-value or log store. Maps to {@link ErrorCode#INTERNAL_ERROR}.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorCode getErrorCode() {
        return ErrorCode.INTERNAL_ERROR;
    }
}
