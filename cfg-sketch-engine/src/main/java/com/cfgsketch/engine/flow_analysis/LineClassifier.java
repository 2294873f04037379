package com.cfgsketch.engine.flow_analysis;

import com.cfgsketch.engine.config.ExtractorConfig;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides what a single line of source does. Rules are tried in order and the first
 * match wins: conditionals, loops, terminal flow, exception blocks, switch/case,
 * async and declarations, calls, assertions and logging, then a plain statement.
 */
public class LineClassifier {

    private static final Pattern IF = Pattern.compile("^(else\\s+if|elif|elsif|if|unless)(?=[\\s(])(.*)$");
    private static final Pattern GUARD = Pattern.compile("^guard\\s+(.+?)\\s+else\\b");
    private static final Pattern WHEN = Pattern.compile("^when\\s*(?:\\(([^)]*)\\))?\\s*\\{");
    private static final Pattern ELSE = Pattern.compile("^else\\s*[{:]?$");
    private static final Pattern NON_TERNARY_START = Pattern.compile("^(?:return|throw|yield|for|while)\\b");
    private static final Pattern TERNARY = Pattern.compile("\\s\\?\\s+.+?\\s:\\s*\\S");

    private static final Pattern FOR_C_STYLE = Pattern.compile("^for\\s*\\(([^;]*);([^;]*);([^)]*)\\)");
    private static final Pattern FOR_PAREN = Pattern.compile("^for\\s*\\((.+)\\)");
    private static final Pattern FOR_IN = Pattern.compile("^for\\s+(\\w+)\\s+in\\s+([^:{]+)");
    private static final Pattern FOR_ANY = Pattern.compile("^for\\b\\s*(.*?)\\s*\\{?$");
    private static final Pattern FOREACH = Pattern.compile("^foreach\\s*\\((.+)\\)");
    private static final Pattern WHILE = Pattern.compile("^(while|until)(?=[\\s({])(.*)$");
    private static final Pattern DO = Pattern.compile("^do\\s*\\{?$");
    private static final Pattern REPEAT = Pattern.compile("^repeat\\s*\\{?$");
    private static final Pattern ITERATION = Pattern.compile(
            "\\.(forEach|map|filter|reduce|flatMap|compactMap|some|every|find|findIndex|each)\\s*[({]");
    private static final Pattern RUST_LOOP = Pattern.compile("^loop\\s*\\{");

    private static final Pattern RETURN = Pattern.compile("^return\\b\\s*(.*)$");
    private static final Pattern THROW = Pattern.compile("^(throw|raise)\\b\\s*(.*)$");
    private static final Pattern YIELD = Pattern.compile("^yield\\b\\s*(.*)$");
    private static final Pattern BREAK = Pattern.compile("^break\\b(?:\\s+(\\w+))?");
    private static final Pattern CONTINUE = Pattern.compile("^continue\\b(?:\\s+(\\w+))?");

    private static final Pattern TRY = Pattern.compile("^(?:try|begin)\\s*(?:\\{.*|:)?$");
    private static final Pattern CATCH = Pattern.compile("^(catch|except|rescue)\\b\\s*(.*)$");
    private static final Pattern FINALLY = Pattern.compile("^(?:finally\\s*[{:]?|ensure)$");
    private static final Pattern DEFER = Pattern.compile("^defer\\s*\\{");

    private static final Pattern SWITCH = Pattern.compile("^(?:switch(?=\\s*[({])|match(?=\\s))\\s*(.*)$");
    private static final Pattern CASE = Pattern.compile("^(?:case|is)\\s+([^:]+)");
    private static final Pattern DEFAULT = Pattern.compile("^(?:default\\s*:|else\\s*->)");

    private static final Pattern AWAIT = Pattern.compile("^(?:const|let|var|val)?\\s*\\w*\\s*=?\\s*await\\b\\s*(.*)$");
    private static final Pattern ASYNC_LET = Pattern.compile("^async\\s+let\\s+(\\w+)");
    private static final Pattern DECLARATION = Pattern.compile("^(?:const|let|var|val|final)\\s+(\\w+)\\s*[:=]");
    private static final Pattern PROPERTY = Pattern.compile("^(?:private\\s+|public\\s+|protected\\s+|internal\\s+)?(?:var|val|let)\\s+(\\w+)");
    private static final Pattern FIRST_CALL = Pattern.compile("([A-Za-z_$][\\w$]*)\\s*\\(");

    private static final Pattern BARE_CALL = Pattern.compile("^(\\w+)\\s*\\(");
    private static final Pattern MEMBER_CALL = Pattern.compile("^((?:\\w+\\s*\\.\\s*)+)(\\w+)\\s*\\(");
    private static final Pattern ASSERTION = Pattern.compile("^(?:assert|require|check|precondition)\\b\\s*[({]?\\s*(.*?)[)}]?;?$");
    private static final Pattern LOG = Pattern.compile("^(?:print|println|console\\.|Log\\.|NSLog|debugPrint|puts|echo|fmt\\.Print)");

    private static final Pattern BLOCK_END = Pattern.compile("^[}\\])]");

    /** Names that start a control construct and therefore never count as a bare call. */
    static final Set<String> NON_CALL_HEADS = Set.of(
            "if", "for", "while", "switch", "catch", "function", "func", "def", "fn", "elif", "foreach");

    private final int labelMax;
    private final int detailMax;

    public LineClassifier() {
        this(ExtractorConfig.defaults());
    }

    public LineClassifier(ExtractorConfig config) {
        this.labelMax = config.getLabelMaxLength();
        this.detailMax = config.getDetailMaxLength();
    }

    public LineAnalysis classify(String rawLine, String trimmedLine, Language language) {
        boolean blockEnd = BLOCK_END.matcher(trimmedLine).find() || trimmedLine.endsWith("}");
        String line = Braces.stripLeadingClosers(trimmedLine);
        String masked = Braces.maskStrings(line);
        Matcher m;

        // --- Conditionals ---
        if ((m = IF.matcher(line)).find()) {
            String keyword = m.group(1).equals("unless") ? "unless" : "if";
            return LineAnalysis.of(LineKind.IF, keyword + " (" + detail(conditionText(m.group(2))) + ")", true, blockEnd);
        }
        if ((m = GUARD.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.GUARD, "guard " + detail(m.group(1)), true, blockEnd);
        }
        if ((m = WHEN.matcher(line)).find()) {
            String subject = m.group(1);
            return LineAnalysis.of(LineKind.WHEN, subject == null ? "when" : "when (" + detail(subject.trim()) + ")", true, blockEnd);
        }
        if (ELSE.matcher(line).find()) {
            return LineAnalysis.of(LineKind.ELSE, "else", true, blockEnd);
        }
        if (!NON_TERNARY_START.matcher(line).find() && !line.startsWith("?") && TERNARY.matcher(masked).find()) {
            return LineAnalysis.of(LineKind.TERNARY, "conditional expression", false, blockEnd);
        }

        // --- Loops ---
        if ((m = FOR_C_STYLE.matcher(line)).find()) {
            String test = m.group(2).trim();
            return LineAnalysis.of(LineKind.LOOP, "for (" + (test.isEmpty() ? "..." : detail(test)) + ")", true, blockEnd);
        }
        if ((m = FOR_PAREN.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.LOOP, "for (" + detail(m.group(1).trim()) + ")", true, blockEnd);
        }
        if ((m = FOR_IN.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.LOOP, "for " + m.group(1) + " in " + detail(m.group(2).trim()), true, blockEnd);
        }
        if ((m = FOREACH.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.LOOP, "foreach (" + detail(m.group(1).trim()) + ")", true, blockEnd);
        }
        if ((m = FOR_ANY.matcher(line)).find()) {
            String header = m.group(1);
            return LineAnalysis.of(LineKind.LOOP, header.isEmpty() ? "for" : "for " + detail(header), true, blockEnd);
        }
        if ((m = WHILE.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.LOOP, m.group(1) + " (" + detail(conditionText(m.group(2))) + ")", true, blockEnd);
        }
        if (DO.matcher(line).find()) {
            return LineAnalysis.of(LineKind.LOOP, "do", true, blockEnd);
        }
        if (REPEAT.matcher(line).find()) {
            return LineAnalysis.of(LineKind.LOOP, "repeat", true, blockEnd);
        }
        if ((m = ITERATION.matcher(masked)).find()) {
            String method = m.group(1);
            return LineAnalysis.call(LineKind.ITERATION, "." + method + "(...)", blockEnd, method);
        }
        if (RUST_LOOP.matcher(line).find()) {
            return LineAnalysis.of(LineKind.LOOP, "loop", true, blockEnd);
        }

        // --- Terminal flow ---
        if ((m = RETURN.matcher(line)).find()) {
            String value = stripSemicolon(m.group(1));
            return LineAnalysis.of(LineKind.RETURN, value.isEmpty() ? "return" : "return " + detail(value), false, blockEnd);
        }
        if ((m = THROW.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.THROW, m.group(1) + " " + detail(stripSemicolon(m.group(2))), false, blockEnd);
        }
        if ((m = YIELD.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.YIELD, "yield " + detail(stripSemicolon(m.group(1))), false, blockEnd);
        }
        if ((m = BREAK.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.BREAK, m.group(1) != null ? "break " + m.group(1) : "break", false, blockEnd);
        }
        if ((m = CONTINUE.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.CONTINUE, m.group(1) != null ? "continue " + m.group(1) : "continue", false, blockEnd);
        }

        // --- Exception handling ---
        if (TRY.matcher(line).find()) {
            return LineAnalysis.of(LineKind.TRY, "try", true, blockEnd);
        }
        if ((m = CATCH.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.CATCH, "catch (" + detail(catchParameter(m.group(2))) + ")", true, blockEnd);
        }
        if (FINALLY.matcher(line).find()) {
            return LineAnalysis.of(LineKind.FINALLY, "finally", true, blockEnd);
        }
        if (DEFER.matcher(line).find()) {
            return LineAnalysis.of(LineKind.FINALLY, "defer", true, blockEnd);
        }

        // --- Switch / match ---
        if ((m = SWITCH.matcher(line)).find()) {
            String subject = conditionText(m.group(1));
            return LineAnalysis.of(LineKind.SWITCH, subject.isEmpty() ? "switch" : "switch (" + detail(subject) + ")", true, blockEnd);
        }
        if ((m = CASE.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.CASE, "case " + detail(m.group(1).trim()), false, blockEnd);
        }
        if (DEFAULT.matcher(line).find()) {
            return LineAnalysis.of(LineKind.DEFAULT, "default", false, blockEnd);
        }

        // --- Async / declarations ---
        if ((m = AWAIT.matcher(line)).find()) {
            String awaited = stripSemicolon(m.group(1));
            return LineAnalysis.call(LineKind.AWAIT, "await " + (awaited.isEmpty() ? "..." : detail(awaited)),
                    blockEnd, firstCall(awaited));
        }
        if ((m = ASYNC_LET.matcher(line)).find()) {
            return LineAnalysis.declaration("async let " + m.group(1), blockEnd, m.group(1));
        }
        if ((m = DECLARATION.matcher(line)).find() || (m = PROPERTY.matcher(line)).find()) {
            String name = m.group(1);
            String calledName = firstCall(masked.substring(m.end()));
            return new LineAnalysis(LineKind.DECLARATION, name + " = ...", false, blockEnd,
                    calledName != null, calledName, true, name);
        }

        // --- Calls ---
        if ((m = BARE_CALL.matcher(line)).find() && !NON_CALL_HEADS.contains(m.group(1))) {
            return LineAnalysis.call(LineKind.CALL, m.group(1) + "(...)", blockEnd, m.group(1));
        }
        if ((m = MEMBER_CALL.matcher(line)).find()) {
            String receiver = m.group(1).replaceAll("\\s+", "");
            return LineAnalysis.call(LineKind.CALL, truncate(receiver + m.group(2), labelMax) + "(...)", blockEnd, m.group(2));
        }

        // --- Assertions / logging ---
        if ((m = ASSERTION.matcher(line)).find()) {
            return LineAnalysis.of(LineKind.ASSERTION, "assert (" + detail(m.group(1)) + ")", false, blockEnd);
        }
        if (LOG.matcher(line).find()) {
            return new LineAnalysis(LineKind.LOG, "log(...)", false, blockEnd, true, null, false, null);
        }

        return LineAnalysis.of(LineKind.STATEMENT, truncate(line, labelMax), false, blockEnd);
    }

    /** Cuts {@code text} to {@code max} characters, marking the cut with "...". */
    public static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }

    private String detail(String text) {
        return truncate(text, detailMax);
    }

    /** Condition text without the trailing block opener and one pair of wrapping parentheses. */
    static String conditionText(String rest) {
        String text = rest.trim();
        text = text.replaceAll("\\s*(?:\\{|:|\\bthen|\\bdo)$", "").trim();
        if (text.startsWith("(") && closingParen(text, 0) == text.length() - 1) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return text;
    }

    private static int closingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static String catchParameter(String rest) {
        String text = conditionText(rest);
        return text.isEmpty() ? "error" : text;
    }

    private static String stripSemicolon(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
    }

    private static String firstCall(String text) {
        Matcher m = FIRST_CALL.matcher(text);
        while (m.find()) {
            if (!CallExtractor.EXCLUDED.contains(m.group(1))) {
                return m.group(1);
            }
        }
        return null;
    }
}
