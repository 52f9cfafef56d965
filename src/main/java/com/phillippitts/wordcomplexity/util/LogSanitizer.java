package com.phillippitts.wordcomplexity.util;

import java.util.List;

/** Keeps phoneme sequences and request values short and single-line in log output. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters, marking the cut with "...";
     * returns "" for null. Line breaks are flattened to spaces.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        if (flat.length() <= max) {
            return flat;
        }
        if (max <= ELLIPSIS.length()) {
            return flat.substring(0, max);
        }
        return flat.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }

    /** Space-joined symbols, truncated like {@link #truncate(String, int)}. */
    public static String phonemes(List<String> symbols, int max) {
        if (symbols == null) {
            return "";
        }
        return truncate(String.join(" ", symbols), max);
    }
}
