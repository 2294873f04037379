package com.cfgsketch.engine.flow_analysis;

/**
 * Brace and string-literal scanning helpers. Braces inside quoted strings
 * and after a line comment do not count.
 */
final class Braces {

    private Braces() {}

    /** Braces of the line in order: +1 for '{', -1 for '}'. */
    static int[] sequence(String text) {
        int[] buf = new int[text.length()];
        int n = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (isQuote(text, i)) {
                quote = c;
            } else if (isLineComment(text, i)) {
                break;
            } else if (c == '{') {
                buf[n++] = 1;
            } else if (c == '}') {
                buf[n++] = -1;
            }
        }
        int[] out = new int[n];
        System.arraycopy(buf, 0, out, 0, n);
        return out;
    }

    static boolean hasOpening(String text) {
        for (int b : sequence(text)) {
            if (b > 0) return true;
        }
        return false;
    }

    static String stripLeadingClosers(String text) {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == '}' || Character.isWhitespace(text.charAt(i)))) {
            i++;
        }
        return text.substring(i);
    }

    /** Replaces the contents of string literals with spaces, keeping the quotes. */
    static String maskStrings(String text) {
        StringBuilder out = new StringBuilder(text.length());
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && i + 1 < text.length()) {
                    out.append("  ");
                    i++;
                } else if (c == quote) {
                    quote = 0;
                    out.append(c);
                } else {
                    out.append(' ');
                }
                continue;
            }
            if (isQuote(text, i)) {
                quote = c;
            }
            out.append(c);
        }
        return out.toString();
    }

    static boolean isQuote(String text, int i) {
        char c = text.charAt(i);
        if (c == '"' || c == '`') {
            return true;
        }
        // A lone apostrophe (Rust lifetime 'a, English prose) never closes, so it is no string.
        return c == '\'' && text.indexOf('\'', i + 1) > i;
    }

    static boolean isLineComment(String text, int i) {
        return text.charAt(i) == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/';
    }
}
