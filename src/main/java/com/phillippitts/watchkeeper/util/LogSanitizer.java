package com.phillippitts.watchkeeper.util;

/** Utility for making untrusted child output safe to put in a log line. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Replaces control characters (except tab) with '?' and truncates to {@code max}
     * characters, appending an ellipsis marker when cut.
     */
    public static String clean(String s, int max) {
        String cut = truncate(s, max);
        StringBuilder sb = null;
        for (int i = 0; i < cut.length(); i++) {
            char c = cut.charAt(i);
            if (Character.isISOControl(c) && c != '\t') {
                if (sb == null) {
                    sb = new StringBuilder(cut.length());
                    sb.append(cut, 0, i);
                }
                sb.append('?');
            } else if (sb != null) {
                sb.append(c);
            }
        }
        String out = sb == null ? cut : sb.toString();
        return (s != null && s.length() > max && max > 0) ? out + "..." : out;
    }
}
