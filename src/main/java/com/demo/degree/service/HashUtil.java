package com.demo.degree.service;

import com.demo.degree.exception.BusinessException;
import com.demo.degree.exception.ErrorCode;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public final class HashUtil {

    public static final int HEX_LENGTH = 64;
    private static final Pattern HEX = Pattern.compile("[0-9a-f]{" + HEX_LENGTH + "}");

    private HashUtil() {}

    /** Trims and lower-cases a SHA-256 hex digest, rejecting anything that is not 64 hex chars. */
    public static String canonical(String hash) {
        if (hash == null || hash.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_HASH, "certificateHash required",
                    Map.of("certificateHash", String.valueOf(hash)));
        }
        String s = hash.trim().toLowerCase(Locale.ROOT);
        if (!HEX.matcher(s).matches()) {
            throw new BusinessException(ErrorCode.INVALID_HASH,
                    "certificateHash must be " + HEX_LENGTH + " hex characters: " + hash,
                    Map.of("certificateHash", hash));
        }
        return s;
    }
}
