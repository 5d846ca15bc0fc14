package com.classengage.backend.global.common.text;

/**
 * Strips leading and trailing whitespace, counting every Unicode space separator (including
 * no-break spaces, which {@link String#strip()} keeps) as whitespace.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    public static String strip(String value) {
        if (value == null) {
            return null;
        }
        int start = 0;
        int end = value.length();
        while (start < end && isBlankChar(value.charAt(start))) {
            start++;
        }
        while (end > start && isBlankChar(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isBlankChar(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
