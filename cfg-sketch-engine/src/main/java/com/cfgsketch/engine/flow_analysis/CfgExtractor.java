package com.cfgsketch.engine.flow_analysis;

import com.cfgsketch.engine.config.ExtractorConfig;
import com.cfgsketch.engine.graph.ControlFlowGraph;

/**
 * Orchestrates one extraction pass: source text and language tag in,
 * immutable {@link ControlFlowGraph} out.
 *
 * Never throws on malformed input. Unknown syntax becomes statement nodes,
 * unmatched braces run to the end of the enclosing range.
 * Instances hold only configuration and may be shared between threads.
 */
public class CfgExtractor {

    private final ExtractorConfig config;
    private final LineClassifier classifier;

    public CfgExtractor() {
        this(ExtractorConfig.defaults());
    }

    public CfgExtractor(ExtractorConfig config) {
        this.config = config;
        this.classifier = new LineClassifier(config);
    }

    public ControlFlowGraph extract(String source, Language language) {
        // 1. Split into logical lines
        SourceLines lines = SourceLines.of(source, config.getIndentWidth());

        // 2. Find classes and functions
        BlockScanner scanner = new BlockScanner(lines, language);
        Scopes scopes = new ScopeDetector(lines, language, scanner).detect();

        // 3. Build per-function CFGs into a fresh arena and package the result
        BuildContext ctx = new BuildContext(lines, language, classifier, scanner, scopes, config.isResolveCalls());
        return new GraphAssembler(ctx, config.getLabelMaxLength()).assemble();
    }

    /** Convenience overload taking the language tag as produced by language identification. */
    public ControlFlowGraph extract(String source, String languageTag) {
        return extract(source, Language.fromTag(languageTag));
    }
}
