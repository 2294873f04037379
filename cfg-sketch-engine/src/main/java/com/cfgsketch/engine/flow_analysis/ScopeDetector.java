package com.cfgsketch.engine.flow_analysis;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single scan over the source lines that finds classes and functions.
 *
 * Header patterns are tried in order and the first match wins. Block ends come from
 * {@link BlockScanner}: brace depth where the header opens a brace block, indentation
 * otherwise. When no function is found the whole input becomes an implicit {@code main}.
 */
public class ScopeDetector {

    public static final String IMPLICIT_MAIN = "main";

    private static final String CLASS_MODIFIERS =
            "^(?:(?:export|default|public|private|protected|internal|abstract|final|open|data|sealed|static|pub|partial|inner)\\s+)*";
    private static final String FUNCTION_MODIFIERS =
            "^(?:@\\w+(?:\\([^)]*\\))?\\s+)*(?:(?:export|default|public|private|protected|internal|fileprivate|static|final|abstract"
                    + "|override|open|virtual|async|suspend|inline|pub(?:\\([^)]*\\))?|unsafe|extern|synchronized|native|operator|infix"
                    + "|tailrec|mutating|class)\\s+)*";

    private static final List<Pattern> CLASS_PATTERNS = List.of(
            // Kotlin primary constructor followed by the supertype
            Pattern.compile(CLASS_MODIFIERS + "class\\s+(\\w+)\\s*(?:<[^>]*>)?\\s*\\([^)]*\\)\\s*:\\s*(\\w+)"),
            Pattern.compile(CLASS_MODIFIERS + "class\\s+(\\w+)\\s*(?:<[^>]*>)?\\s+extends\\s+(\\w+)"),
            Pattern.compile(CLASS_MODIFIERS + "class\\s+(\\w+)\\s*(?:<[^>]*>)?\\s*:\\s*(?:public\\s+|private\\s+|protected\\s+)?(\\w+)"),
            Pattern.compile("^class\\s+(\\w+)\\s*\\(\\s*(\\w+)"),
            Pattern.compile("^class\\s+(\\w+)\\s*<\\s*(\\w+)"),
            Pattern.compile(CLASS_MODIFIERS + "class\\s+(\\w+)"),
            Pattern.compile(CLASS_MODIFIERS + "struct\\s+(\\w+)"),
            Pattern.compile("^type\\s+(\\w+)\\s+struct\\b")
    );

    private static final List<FunctionPattern> FUNCTION_PATTERNS = List.of(
            new FunctionPattern(Pattern.compile(
                    "^(?:(?:public|private|protected)\\s+)?(?<name>constructor)\\s*\\((?<params>[^)]*)\\)"), true, false),
            new FunctionPattern(Pattern.compile(
                    "^(?:async\\s+)?def\\s+(?<name>__init__)\\s*\\((?<params>[^)]*)\\)"), true, false),
            new FunctionPattern(Pattern.compile(
                    "^(?:(?:public|private|internal|fileprivate|convenience|required|override)\\s+)*(?<name>init)\\??\\s*\\((?<params>[^)]*)\\)"),
                    true, false),
            new FunctionPattern(Pattern.compile(
                    "^(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(?<name>[A-Za-z_$][\\w$]*)\\s*\\((?<params>[^)]*)\\)"),
                    false, false),
            new FunctionPattern(Pattern.compile(
                    "^(?:export\\s+)?(?:const|let|var)\\s+(?<name>[A-Za-z_$][\\w$]*)\\s*(?::[^=]+)?=\\s*(?:async\\s+)?"
                            + "(?<params>\\([^)]*\\)|[A-Za-z_$][\\w$]*)\\s*(?::\\s*[^=]+?)?=>"), false, false),
            // class field holding an arrow function: handle = (event) => {
            new FunctionPattern(Pattern.compile(
                    "^(?:(?:public|private|protected|static|readonly)\\s+)*(?<name>[A-Za-z_$][\\w$]*)\\s*=\\s*(?:async\\s+)?"
                            + "(?<params>\\([^)]*\\)|[A-Za-z_$][\\w$]*)\\s*=>"), false, false),
            new FunctionPattern(Pattern.compile(
                    FUNCTION_MODIFIERS + "fun\\s+(?:<[^>]*>\\s*)?(?:[\\w.]+\\.)?(?<name>\\w+)\\s*\\((?<params>[^)]*)\\)"), false, false),
            new FunctionPattern(Pattern.compile(
                    FUNCTION_MODIFIERS + "func\\s+(?<name>\\w+)\\s*(?:<[^>]*>)?\\s*\\((?<params>[^)]*)\\)"), false, false),
            new FunctionPattern(Pattern.compile(
                    FUNCTION_MODIFIERS + "def\\s+(?:self\\.)?(?<name>\\w+[?!]?)\\s*(?:\\[[^\\]]*\\]\\s*)?\\((?<params>[^)]*)\\)"), false, false),
            // Ruby def without parentheses
            new FunctionPattern(Pattern.compile(
                    "^def\\s+(?:self\\.)?(?<name>\\w+[?!]?)(?<params>\\s+[^=:]*)?$"), false, false),
            // Go method with receiver
            new FunctionPattern(Pattern.compile(
                    "^func\\s*\\([^)]*\\)\\s*(?<name>\\w+)\\s*\\((?<params>[^)]*)\\)"), false, false),
            new FunctionPattern(Pattern.compile(
                    FUNCTION_MODIFIERS + "fn\\s+(?<name>\\w+)\\s*(?:<[^>]*>)?\\s*\\((?<params>[^)]*)\\)"), false, false),
            // JS/TS class method: name(args) {
            new FunctionPattern(Pattern.compile(
                    "^(?:(?:static|async|get|set|public|private|protected|override|readonly)\\s+)*\\*?(?<name>[A-Za-z_$][\\w$]*)\\s*"
                            + "\\((?<params>[^)]*)\\)\\s*(?::\\s*[^{]+)?\\{\\s*$"), false, true,
                    EnumSet.of(Language.JAVASCRIPT, Language.TYPESCRIPT)),
            // Java / C# constructor: no return type, name checked against the class later
            new FunctionPattern(Pattern.compile(
                    "^(?:@\\w+(?:\\([^)]*\\))?\\s+)*(?:public|private|protected|internal)\\s+(?<name>[A-Z]\\w*)\\s*"
                            + "\\((?<params>[^)]*)\\)\\s*(?:throws\\s+[\\w.,\\s]+?)?\\s*\\{?\\s*$"), false, true),
            // Java / C# / C++ typed method
            new FunctionPattern(Pattern.compile(
                    FUNCTION_MODIFIERS + "(?:<[^>]*>\\s*)?[\\w.<>\\[\\],?*&:]+(?:\\s*<[^>]*>)?(?:\\[\\])*\\s+[*&]?(?<name>\\w+)\\s*"
                            + "\\((?<params>[^)]*)\\)\\s*(?:const\\s*)?(?:throws\\s+[\\w.,\\s]+?)?\\s*(?:noexcept\\s*)?\\{?\\s*$"),
                    false, true)
    );

    private static final Pattern CONTROL_START = Pattern.compile(
            "^(?:if|for|while|switch|catch|return|else|do|try|throw|new|await|yield)\\b");

    static final Set<String> RESERVED_NAMES = Set.of(
            "if", "for", "while", "switch", "catch", "return", "else", "do", "try", "throw", "new", "await",
            "yield", "when", "match", "elif", "foreach", "with", "using", "lock", "synchronized", "function",
            "class", "guard", "unless", "until", "loop", "repeat", "sizeof", "typeof", "super", "this");

    private static final Pattern ASYNC_MARKER = Pattern.compile("\\b(?:async|suspend)\\b");

    private static final Pattern KEYWORD_PROPERTY = Pattern.compile(
            "^(?:(?:private|public|protected|internal|static|final|readonly|open|override|lateinit|weak|lazy)\\s+)*"
                    + "(?:var|val|let|const)\\s+(\\w+)");
    private static final Pattern TYPED_PROPERTY = Pattern.compile(
            "^(?:(?:private|public|protected|internal|static|final|readonly|volatile|transient|const)\\s+)*"
                    + "[\\w.<>\\[\\],?]+(?:<[^>]*>)?\\s+(\\w+)\\s*(?:=[^=].*)?;$");
    private static final Pattern ASSIGNED_PROPERTY = Pattern.compile(
            "^(?:(?:private|public|protected|static|readonly)\\s+)*([A-Za-z_$][\\w$]*)\\s*(?::\\s*[\\w\\[\\]<>, .|]+)?=\\s*[^=>]");
    private static final Set<Language> ASSIGNMENT_PROPERTY_LANGUAGES = EnumSet.of(
            Language.PYTHON, Language.RUBY, Language.JAVASCRIPT, Language.TYPESCRIPT);
    private static final Pattern GO_FIELD = Pattern.compile("^([A-Za-z_]\\w*)\\s+[\\w.*\\[\\]]+(?:\\s+`.*`)?$");

    private record FunctionPattern(Pattern pattern, boolean constructor, boolean needsBraceBlock, Set<Language> only) {
        FunctionPattern(Pattern pattern, boolean constructor, boolean needsBraceBlock) {
            this(pattern, constructor, needsBraceBlock, Set.of());
        }

        boolean appliesTo(Language language) {
            return only.isEmpty() || only.contains(language);
        }
    }

    private final SourceLines lines;
    private final Language language;
    private final BlockScanner scanner;

    public ScopeDetector(SourceLines lines, Language language) {
        this(lines, language, new BlockScanner(lines, language));
    }

    public ScopeDetector(SourceLines lines, Language language, BlockScanner scanner) {
        this.lines = lines;
        this.language = language;
        this.scanner = scanner;
    }

    public Scopes detect() {
        // 1. Headers in source order
        List<ClassScope> classes = new ArrayList<>();
        List<FunctionScope> functions = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            SourceLine line = lines.get(i);
            if (line.isBlank() || isComment(line.text())) continue;
            String text = line.withoutLeadingCloser();
            ClassScope cls = matchClass(text, i);
            if (cls != null) {
                classes.add(cls);
                continue;
            }
            FunctionScope fn = matchFunction(text, i);
            if (fn != null) functions.add(fn);
        }

        // 2. Owning class, constructor flag, nesting depth; headers arrive in source order,
        //    so the functions still open at a header are exactly the ones enclosing it
        Deque<FunctionScope> open = new ArrayDeque<>();
        for (FunctionScope fn : functions) {
            ClassScope owner = innermostClass(classes, fn.getHeader());
            if (owner != null) {
                fn.setClassName(owner.getName());
                owner.addMethod(fn);
                if (fn.getName().equals(owner.getName())) fn.setConstructor(true);
            }
            while (!open.isEmpty() && open.peek().getEnd() < fn.getHeader()) open.pop();
            fn.setDepth((owner != null ? 1 : 0) + open.size());
            open.push(fn);
        }

        // 3. Unique keys; overloads get the header's line number
        Set<String> seen = new HashSet<>();
        for (FunctionScope fn : functions) {
            String key = fn.getClassName() != null ? fn.getClassName() + "." + fn.getName() : fn.getName();
            if (!seen.add(key)) {
                key = key + "@" + lines.get(fn.getHeader()).number();
                seen.add(key);
            }
            fn.setKey(key);
        }

        // 4. Class-body declarations outside any method
        for (ClassScope cls : classes) {
            collectProperties(cls, classes, functions);
        }

        if (functions.isEmpty()) {
            int last = Math.max(lines.lastIndex(), 0);
            functions.add(new FunctionScope(IMPLICIT_MAIN, 0, 0, last, false, false,
                    List.of(), callsIn(0, last)));
        }
        return new Scopes(classes, functions);
    }

    private ClassScope matchClass(String text, int index) {
        for (Pattern pattern : CLASS_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) continue;
            int end = scanner.findBlockEnd(index, lines.lastIndex());
            if (end <= index) return null;
            String parent = m.groupCount() >= 2 ? m.group(2) : null;
            return new ClassScope(m.group(1), index, end, parent);
        }
        return null;
    }

    private FunctionScope matchFunction(String text, int index) {
        if (CONTROL_START.matcher(text).find()) return null;
        for (FunctionPattern fp : FUNCTION_PATTERNS) {
            if (!fp.appliesTo(language)) continue;
            Matcher m = fp.pattern().matcher(text);
            if (!m.find()) continue;
            String name = m.group("name");
            if (RESERVED_NAMES.contains(name)) return null;
            if (fp.needsBraceBlock() && !scanner.opensBraceBlock(index)) continue;
            int end = scanner.findBlockEnd(index, lines.lastIndex());
            boolean async = ASYNC_MARKER.matcher(text.substring(0, m.start("name"))).find();
            return new FunctionScope(name, index, index + 1, end, fp.constructor(), async,
                    parseParameters(m.group("params")), callsIn(index + 1, end));
        }
        return null;
    }

    /**
     * Parameter names with default values, type annotations and type prefixes removed.
     * Go declares the name first ({@code id int}); everywhere else the name is the last word
     * before any {@code :} annotation. Receivers ({@code self}) are dropped.
     */
    List<String> parseParameters(String params) {
        if (params == null) return List.of();
        String text = params.trim();
        if (text.startsWith("(") && text.endsWith(")")) {
            text = text.substring(1, text.length() - 1).trim();
        }
        if (text.isEmpty()) return List.of();

        List<String> names = new ArrayList<>();
        for (String part : splitTopLevel(text)) {
            String p = part.trim();
            int eq = p.indexOf('=');
            if (eq >= 0) p = p.substring(0, eq).trim();
            if (language != Language.GO) {
                int colon = p.indexOf(':');
                if (colon >= 0) p = p.substring(0, colon).trim();
            }
            if (p.isEmpty()) continue;
            String[] words = p.split("\\s+");
            String name = language == Language.GO ? words[0] : words[words.length - 1];
            name = name.replaceAll("[*&.$@]", "");
            if (name.isEmpty() || name.equals("self") || name.equals("cls")) continue;
            names.add(name);
        }
        return names;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int from = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<' || c == '(' || c == '[' || c == '{') depth++;
            else if ((c == '>' && i > 0 && text.charAt(i - 1) != '=') || c == ')' || c == ']' || c == '}') depth--;
            else if (c == ',' && depth <= 0) {
                parts.add(text.substring(from, i));
                from = i + 1;
            }
        }
        parts.add(text.substring(from));
        return parts;
    }

    private List<String> callsIn(int from, int to) {
        Set<String> calls = new LinkedHashSet<>();
        for (int j = from; j <= to && j < lines.size(); j++) {
            SourceLine line = lines.get(j);
            if (line.isBlank() || isComment(line.text())) continue;
            calls.addAll(CallExtractor.extract(line.text()));
        }
        return new ArrayList<>(calls);
    }

    private void collectProperties(ClassScope cls, List<ClassScope> classes, List<FunctionScope> functions) {
        for (int j = cls.getStart() + 1; j <= cls.getEnd(); j++) {
            SourceLine line = lines.get(j);
            if (line.isBlank() || isComment(line.text())) continue;
            if (innermostClass(classes, j) != cls || isClassHeader(classes, j)) continue;
            boolean inFunction = false;
            for (FunctionScope fn : functions) {
                if (fn.encloses(j)) {
                    inFunction = true;
                    break;
                }
            }
            if (inFunction) continue;
            String name = propertyName(line.text());
            if (name != null) cls.addProperty(new ClassScope.Property(j, name));
        }
    }

    private String propertyName(String text) {
        Matcher m = KEYWORD_PROPERTY.matcher(text);
        if (m.find()) return m.group(1);
        m = TYPED_PROPERTY.matcher(text);
        if (m.find() && !RESERVED_NAMES.contains(m.group(1)) && !text.startsWith("return")) return m.group(1);
        if (ASSIGNMENT_PROPERTY_LANGUAGES.contains(language)) {
            m = ASSIGNED_PROPERTY.matcher(text);
            if (m.find()) return m.group(1);
        }
        if (language == Language.GO) {
            m = GO_FIELD.matcher(text);
            if (m.find()) return m.group(1);
        }
        return null;
    }

    private static boolean isClassHeader(List<ClassScope> classes, int index) {
        for (ClassScope c : classes) {
            if (c.getStart() == index) return true;
        }
        return false;
    }

    static ClassScope innermostClass(List<ClassScope> classes, int index) {
        ClassScope best = null;
        for (ClassScope c : classes) {
            if (c.contains(index) && (best == null || c.getStart() > best.getStart())) {
                best = c;
            }
        }
        return best;
    }

    /** Line comments, block comment openers and the {@code * } continuation lines inside a block comment. */
    static boolean isComment(String text) {
        return text.startsWith("//") || text.startsWith("/*") || text.startsWith("#")
                || text.equals("*") || text.startsWith("* ") || text.startsWith("*/");
    }
}
