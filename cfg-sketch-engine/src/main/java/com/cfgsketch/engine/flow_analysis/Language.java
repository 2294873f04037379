package com.cfgsketch.engine.flow_analysis;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed vocabulary of language tags accepted by the extractor.
 * The tag itself comes from an external language-identification step.
 */
public enum Language {
    JAVASCRIPT("javascript"),
    TYPESCRIPT("typescript"),
    PYTHON("python"),
    JAVA("java"),
    KOTLIN("kotlin"),
    SWIFT("swift"),
    CPP("cpp"),
    CSHARP("csharp"),
    GO("go"),
    RUST("rust"),
    PHP("php"),
    RUBY("ruby"),
    DART("dart"),
    SCALA("scala");

    private final String tag;

    Language(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /** Languages whose blocks are delimited by indentation rather than braces. */
    public boolean isIndentationBased() {
        return this == PYTHON;
    }

    /**
     * @throws IllegalArgumentException if the tag is not part of the vocabulary
     */
    public static Language fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (Language language : values()) {
                if (language.tag.equals(normalized)) {
                    return language;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported language tag: " + tag + " (expected one of "
                + Arrays.stream(values()).map(Language::tag).collect(Collectors.joining(", ")) + ")");
    }
}
