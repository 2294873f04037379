package com.cfgsketch.engine.flow_analysis;

import java.util.regex.Pattern;

/**
 * Locates where a block opened by a header line ends, and which line (if any)
 * continues the construct afterwards ({@code else}, {@code catch}, ...).
 *
 * Brace-delimited blocks end where the running brace depth first returns to zero.
 * Headers that open no brace block end before the first following non-blank line
 * indented no deeper than the header. Unmatched braces run to {@code limit}.
 */
public final class BlockScanner {

    public static final Pattern ELSE_CONTINUATION = Pattern.compile("^(?:else|elif|elsif)\\b");
    public static final Pattern HANDLER_CONTINUATION = Pattern.compile("^(?:catch|except|rescue|finally|ensure)\\b");

    private final SourceLines lines;
    private final Language language;

    public BlockScanner(SourceLines lines, Language language) {
        this.lines = lines;
        this.language = language;
    }

    /**
     * @param header index of the header line
     * @param limit  last index the block may extend to
     * @return index of the block's last line, never less than {@code header}
     */
    public int findBlockEnd(int header, int limit) {
        int max = Math.min(limit, lines.lastIndex());
        if (header >= max) {
            return Math.max(header, max);
        }
        String headerText = lines.get(header).withoutLeadingCloser();
        if (!language.isIndentationBased()) {
            if (Braces.hasOpening(headerText)) {
                return braceEnd(header, headerText, max);
            }
            int next = nextNonBlank(header + 1, max);
            if (!headerText.endsWith(":") && next >= 0 && lines.get(next).text().startsWith("{")) {
                return braceEnd(next, lines.get(next).text(), max);
            }
        }
        return indentationEnd(header, max);
    }

    /** True when the header opens a brace block on its own line or on the next one. */
    public boolean opensBraceBlock(int header) {
        if (language.isIndentationBased()) {
            return false;
        }
        String headerText = lines.get(header).withoutLeadingCloser();
        if (Braces.hasOpening(headerText)) {
            return true;
        }
        int next = nextNonBlank(header + 1, lines.lastIndex());
        return !headerText.endsWith(":") && next >= 0 && lines.get(next).text().startsWith("{");
    }

    /**
     * Finds the line continuing a construct whose block ended at {@code blockEnd}:
     * either the closing line itself ("} else {") or the next non-blank line at the
     * header's indentation.
     *
     * @return the continuation line index, or -1
     */
    public int findContinuation(int blockEnd, int limit, int headerIndent, Pattern keywords) {
        SourceLine endLine = lines.get(blockEnd);
        if (endLine.text().startsWith("}") && keywords.matcher(endLine.withoutLeadingCloser()).find()) {
            return blockEnd;
        }
        int next = nextNonBlank(blockEnd + 1, Math.min(limit, lines.lastIndex()));
        if (next < 0) {
            return -1;
        }
        SourceLine candidate = lines.get(next);
        if (candidate.indent() == headerIndent && keywords.matcher(candidate.withoutLeadingCloser()).find()) {
            return next;
        }
        return -1;
    }

    int nextNonBlank(int from, int limit) {
        for (int j = from; j <= limit; j++) {
            if (!lines.get(j).isBlank()) {
                return j;
            }
        }
        return -1;
    }

    private int braceEnd(int start, String firstText, int max) {
        int depth = 0;
        boolean opened = false;
        for (int j = start; j <= max; j++) {
            String text = j == start ? firstText : lines.get(j).text();
            for (int brace : Braces.sequence(text)) {
                depth += brace;
                if (brace > 0) {
                    opened = true;
                } else if (opened && depth <= 0) {
                    return j;
                }
            }
        }
        return max;
    }

    private int indentationEnd(int header, int max) {
        int base = lines.get(header).indent();
        int last = header;
        for (int j = header + 1; j <= max; j++) {
            SourceLine line = lines.get(j);
            if (line.isBlank()) {
                continue;
            }
            if (line.indent() <= base) {
                return last;
            }
            last = j;
        }
        return last;
    }
}
