package com.cfgsketch.engine.flow_analysis;

/**
 * One logical line of input.
 *
 * @param number 1-based line number in the original text
 * @param raw    line text including indentation
 * @param text   trimmed text
 * @param indent indentation level
 */
public record SourceLine(int number, String raw, String text, int indent) {

    public boolean isBlank() {
        return text.isEmpty();
    }

    /** Text with any leading closing braces removed, e.g. "} else {" becomes "else {". */
    public String withoutLeadingCloser() {
        return Braces.stripLeadingClosers(text);
    }
}
