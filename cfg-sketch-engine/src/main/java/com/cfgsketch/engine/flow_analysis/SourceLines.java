package com.cfgsketch.engine.flow_analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Logical lines of one source text.
 *
 * Control-construct lines that carry a whole block inline, such as
 * {@code if (x > 0) { return 1 } else { return -1 }}, are split at their braces
 * into several logical lines sharing the original line number.
 */
public final class SourceLines {

    private static final Pattern CONTROL_HEADER = Pattern.compile(
            "^(?:}\\s*)?(?:if|else|elif|for|foreach|while|do|try|catch|finally|switch|when|loop|repeat|guard|unless|until|match)\\b");

    private static final Pattern PAREN_HEADER = Pattern.compile(
            "^(?:}\\s*)?(?:(?:else\\s+)?if|while|for|foreach|elif)\\s*\\(");
    private static final Pattern COLON_HEADER = Pattern.compile(
            "^(?:if|elif|else|while|for|try|except|finally)\\b");
    private static final Pattern BARE_ELSE = Pattern.compile("^((?:}\\s*)?else)\\s+(?!if\\b)");
    private static final Pattern OPERATOR_WORD = Pattern.compile("^(?:and|or|not|in|is)\\b");

    private final List<SourceLine> lines;

    private SourceLines(List<SourceLine> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    public static SourceLines of(String source, int indentWidth) {
        String text = source == null ? "" : source;
        String[] rawLines = text.split("\\r?\\n", -1);
        List<SourceLine> result = new ArrayList<>(rawLines.length);
        for (int i = 0; i < rawLines.length; i++) {
            String raw = rawLines[i];
            String trimmed = raw.trim();
            int indent = indentLevel(raw, indentWidth);
            List<String> pieces = new ArrayList<>();
            if (CONTROL_HEADER.matcher(trimmed).find()) {
                for (String piece : splitInlineBlocks(trimmed)) {
                    pieces.addAll(splitInlineBody(piece));
                }
            } else {
                pieces.add(trimmed);
            }
            if (pieces.size() <= 1) {
                result.add(new SourceLine(i + 1, raw, trimmed, indent));
                continue;
            }
            String leading = raw.substring(0, raw.length() - raw.stripLeading().length());
            String unit = " ".repeat(Math.max(indentWidth, 1));
            for (int p = 0; p < pieces.size(); p++) {
                String piece = pieces.get(p);
                boolean inner = p > 0 && !piece.startsWith("}");
                result.add(new SourceLine(i + 1,
                        leading + (inner ? unit : "") + piece,
                        piece,
                        inner ? indent + 1 : indent));
            }
        }
        return new SourceLines(result);
    }

    public int size() {
        return lines.size();
    }

    public SourceLine get(int index) {
        return lines.get(index);
    }

    public List<SourceLine> all() {
        return lines;
    }

    public int lastIndex() {
        return lines.size() - 1;
    }

    /** Indentation level: leading whitespace with a tab counted as two spaces, divided by the width. */
    static int indentLevel(String raw, int indentWidth) {
        int spaces = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ') {
                spaces++;
            } else if (c == '\t') {
                spaces += 2;
            } else {
                break;
            }
        }
        return spaces / Math.max(indentWidth, 1);
    }

    static List<String> splitInlineBlocks(String text) {
        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (Braces.isQuote(text, i)) {
                quote = c;
                current.append(c);
            } else if (Braces.isLineComment(text, i)) {
                current.append(text, i, text.length());
                break;
            } else if (c == '{') {
                current.append(c);
                emit(pieces, current);
            } else if (c == '}') {
                emit(pieces, current);
                current.append(c);
            } else {
                current.append(c);
            }
        }
        emit(pieces, current);
        return pieces;
    }

    /**
     * Splits a brace-less control header from a statement on the same line:
     * {@code if (x) return 1;}, {@code else return -1;}, {@code if x: return}.
     */
    static List<String> splitInlineBody(String piece) {
        Matcher m = PAREN_HEADER.matcher(piece);
        if (m.find()) {
            int close = closingParen(piece, m.end() - 1);
            if (close < 0) return List.of(piece);
            String header = piece.substring(0, close + 1);
            String rest = piece.substring(close + 1).trim();
            if (rest.startsWith(":")) {
                header = header + ":";
                rest = rest.substring(1).trim();
            }
            return isInlineStatement(rest) ? List.of(header, rest) : List.of(piece);
        }
        m = BARE_ELSE.matcher(piece);
        if (m.find()) {
            String rest = piece.substring(m.end()).trim();
            return isInlineStatement(rest) ? List.of(m.group(1), rest) : List.of(piece);
        }
        if (COLON_HEADER.matcher(piece).find()) {
            int colon = topLevelColon(piece);
            if (colon > 0 && colon < piece.length() - 1) {
                String rest = piece.substring(colon + 1).trim();
                if (isInlineStatement(rest)) {
                    return List.of(piece.substring(0, colon + 1), rest);
                }
            }
        }
        return List.of(piece);
    }

    private static boolean isInlineStatement(String rest) {
        if (rest.isEmpty() || rest.endsWith("{") || rest.endsWith(":")) return false;
        char first = rest.charAt(0);
        if (!Character.isLetter(first) && first != '_' && first != '$') return false;
        return !OPERATOR_WORD.matcher(rest).find();
    }

    private static int closingParen(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (Braces.isQuote(text, i)) quote = c;
            else if (c == '(') depth++;
            else if (c == ')' && --depth == 0) return i;
        }
        return -1;
    }

    private static int topLevelColon(String text) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (Braces.isQuote(text, i)) quote = c;
            else if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == ':' && depth == 0) return i;
        }
        return -1;
    }

    private static void emit(List<String> pieces, StringBuilder current) {
        String piece = current.toString().trim();
        if (!piece.isEmpty()) {
            pieces.add(piece);
        }
        current.setLength(0);
    }
}
