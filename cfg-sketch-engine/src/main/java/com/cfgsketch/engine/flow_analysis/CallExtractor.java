package com.cfgsketch.engine.flow_analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds callee names on a line: every identifier directly followed by an opening
 * parenthesis, minus control-flow keywords. String literal contents are ignored.
 */
public final class CallExtractor {

    static final Set<String> EXCLUDED = Set.of(
            "if", "for", "while", "switch", "catch", "function", "return", "throw",
            "new", "typeof", "instanceof");

    private static final Pattern CALL = Pattern.compile("\\b([A-Za-z_$][\\w$]*)\\s*\\(");

    private CallExtractor() {}

    /** Distinct callee names in order of first appearance. */
    public static List<String> extract(String line) {
        Set<String> calls = new LinkedHashSet<>();
        Matcher m = CALL.matcher(Braces.maskStrings(line));
        while (m.find()) {
            String name = m.group(1);
            if (!EXCLUDED.contains(name)) {
                calls.add(name);
            }
        }
        return new ArrayList<>(calls);
    }

    /** True when {@code text} contains a call to {@code name}. */
    public static boolean mentionsCall(String text, String name) {
        if (text == null) {
            return false;
        }
        return Pattern.compile("(?<![\\w$])" + Pattern.quote(name) + "\\s*\\(")
                .matcher(Braces.maskStrings(text))
                .find();
    }
}
