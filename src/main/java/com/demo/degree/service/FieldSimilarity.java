package com.demo.degree.service;

import com.demo.degree.model.SubjectField;
import com.demo.degree.model.SubjectFields;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Fuzzy comparison of certificate fields, tolerant of OCR noise.
 */
public final class FieldSimilarity {

    /** A field only earns credit when its similarity is strictly above this value. */
    public static final double CREDIT_THRESHOLD = 0.8;

    private FieldSimilarity() {}

    /**
     * Mean credit over the key fields present on both sides, or empty when no field is comparable.
     */
    public static OptionalDouble fieldConfidence(SubjectFields stored, SubjectFields presented) {
        if (stored == null || presented == null) return OptionalDouble.empty();
        double sum = 0;
        int compared = 0;
        for (SubjectField field : stored.present()) {
            if (!presented.has(field)) continue;
            sum += credit(stored.get(field).orElseThrow(), presented.get(field).orElseThrow());
            compared++;
        }
        return compared == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / compared);
    }

    static double credit(String a, String b) {
        double s = similarity(a, b);
        if (s == 1.0) return 1.0;
        return s > CREDIT_THRESHOLD ? s : 0.0;
    }

    /** 1 − lev(a, b) / max(|a|, |b|) after trimming and case folding. */
    public static double similarity(String a, String b) {
        String x = normalize(a);
        String y = normalize(b);
        if (x.equals(y)) return 1.0;
        int longest = Math.max(x.length(), y.length());
        return 1.0 - (double) editDistance(x, y) / longest;
    }

    static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    /** Levenshtein distance, unit cost for insert, delete and substitute. */
    public static int editDistance(String a, String b) {
        if (a.isEmpty()) return b.length();
        if (b.isEmpty()) return a.length();

        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] t = prev; prev = curr; curr = t;
        }
        return prev[b.length()];
    }
}
