package org.tabula.util;

import java.util.List;

/**
 * Makes free text safe to embed in output file names.
 */
public final class NameSanitizer {

    public static final int MAX_SUFFIX_LENGTH = 50;

    private NameSanitizer() {
    }

    /**
     * Joins header-block lines with underscores, maps every char outside {@code [A-Za-z0-9_-]} to '_',
     * truncates to {@link #MAX_SUFFIX_LENGTH} and strips leading and trailing '_' and '-'.
     *
     * @return the suffix, empty when nothing usable remains
     */
    public static String headerSuffix(final List<String> headerData) {
        if (headerData == null || headerData.isEmpty()) return "";
        String joined = String.join("_", headerData);
        StringBuilder sb = new StringBuilder(joined.length());
        for (int i = 0; i < joined.length(); i++) {
            char c = joined.charAt(i);
            sb.append(isSafe(c) ? c : '_');
        }
        String suffix = sb.length() > MAX_SUFFIX_LENGTH ? sb.substring(0, MAX_SUFFIX_LENGTH) : sb.toString();
        return strip(suffix);
    }

    /**
     * Replaces path separators, characters reserved by common file systems and control characters with '_'.
     */
    public static String tableName(final String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(c < 0x20 || "/\\:*?\"<>|".indexOf(c) >= 0 ? '_' : c);
        }
        return sb.toString();
    }

    private static boolean isSafe(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }

    private static String strip(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == '_' || s.charAt(start) == '-')) start++;
        while (end > start && (s.charAt(end - 1) == '_' || s.charAt(end - 1) == '-')) end--;
        return s.substring(start, end);
    }
}
