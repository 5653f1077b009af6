package com.phillippitts.wfmparity.util;

/** Compact, bounded descriptions of failures for storage alongside jobs. */
public final class ErrorDetails {

    public static final int MAX_MESSAGE = 1000;
    public static final int MAX_DETAIL = 4000;

    private ErrorDetails() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    public static String message(Throwable t) {
        if (t == null) {
            return "";
        }
        String m = t.getMessage();
        return truncate(m == null ? t.getClass().getSimpleName() : m, MAX_MESSAGE);
    }

    /**
     * Cause chain as {@code Type: message <- Type: message}, bounded to {@link #MAX_DETAIL}.
     */
    public static String describe(Throwable t) {
        StringBuilder sb = new StringBuilder();
        Throwable cur = t;
        int depth = 0;
        while (cur != null && depth < 8) {
            if (depth > 0) {
                sb.append(" <- ");
            }
            sb.append(cur.getClass().getSimpleName());
            if (cur.getMessage() != null) {
                sb.append(": ").append(cur.getMessage());
            }
            cur = cur.getCause() == cur ? null : cur.getCause();
            depth++;
        }
        return truncate(sb.toString(), MAX_DETAIL);
    }
}
