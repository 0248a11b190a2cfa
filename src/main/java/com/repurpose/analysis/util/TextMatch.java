package com.repurpose.analysis.util;

import java.util.Locale;

/**
 * Small string helpers shared by collectors and the reference dataset.
 *
 * <p>Matching uses lowercase + trim normalization and a Levenshtein based
 * similarity ratio on a 0-100 scale.
 */
public final class TextMatch {
    private TextMatch() {}

    /** Trimmed lowercase form; {@code null} becomes an empty string. */
    public static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Strips characters that would break quoted upstream search terms.
     */
    public static String sanitizeQuery(String s) {
        if (s == null) return "";
        return s.trim().replace("\"", "").replace("'", "");
    }

    /**
     * Similarity of two strings in [0,100]: 100 for equal strings (after normalization),
     * decreasing with edit distance relative to the combined length.
     */
    public static int similarity(String a, String b) {
        String x = normalize(a);
        String y = normalize(b);
        if (x.isEmpty() && y.isEmpty()) return 100;
        if (x.isEmpty() || y.isEmpty()) return 0;
        int total = x.length() + y.length();
        int distance = levenshtein(x, y);
        return (int) Math.round(100.0 * (total - distance) / total);
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /** Truncates to at most {@code max} characters. */
    public static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
