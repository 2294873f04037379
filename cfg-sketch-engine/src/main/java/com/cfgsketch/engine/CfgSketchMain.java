package com.cfgsketch.engine;

import com.cfgsketch.engine.config.ConfigReader;
import com.cfgsketch.engine.config.ExtractorConfig;
import com.cfgsketch.engine.flow_analysis.CfgExtractor;
import com.cfgsketch.engine.flow_analysis.Language;
import com.cfgsketch.engine.graph.CfgSerializer;
import com.cfgsketch.engine.graph.ControlFlowGraph;
import com.cfgsketch.engine.graph.LayoutCalculator.LayoutOptions;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar cfg-sketch-engine.jar extract \
 *     --source   <source-file> \
 *     --output   <output-dir> \
 *     [--language <tag>] [--config <config.json>] [--layout]
 */
public class CfgSketchMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[cfg-sketch] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar cfg-sketch-engine.jar extract " +
                               "--source <file> --output <dir> [--language <tag>] [--config <path>] [--layout]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[cfg-sketch] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("extract")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String sourcePath = null;
        String outputDir = null;
        String languageTag = null;
        String configPath = null;
        boolean layout = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--source"   -> sourcePath  = requireNext(args, i++, "--source");
                case "--output"   -> outputDir   = requireNext(args, i++, "--output");
                case "--language" -> languageTag = requireNext(args, i++, "--language");
                case "--config"   -> configPath  = requireNext(args, i++, "--config");
                case "--layout"   -> layout = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (sourcePath == null) throw new UsageException("--source is required");
        if (outputDir == null)  throw new UsageException("--output is required");

        Path source = Paths.get(sourcePath);
        Path output = Paths.get(outputDir);
        if (!Files.isRegularFile(source)) {
            throw new UsageException("Source file not found: " + source);
        }

        // 1. Read config
        ExtractorConfig config = ExtractorConfig.defaults();
        if (configPath != null) {
            System.err.println("[cfg-sketch] Reading config: " + configPath);
            config = new ConfigReader().read(Paths.get(configPath));
        }

        // CLI tag wins over the config default
        Language language;
        try {
            language = Language.fromTag(languageTag != null ? languageTag : config.getDefaultLanguage());
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }

        // 2. Extract
        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read source: " + source, e);
        }
        System.err.println("[cfg-sketch] Extracting " + language.tag() + " CFG from: " + source);
        ControlFlowGraph graph = new CfgExtractor(config).extract(text, language);
        System.err.println("[cfg-sketch] Extraction complete: "
                + graph.nodes().size() + " nodes, "
                + graph.edges().size() + " edges, "
                + graph.functions().size() + " functions");

        // 3. Serialize
        System.err.println("[cfg-sketch] Writing output to: " + output);
        new CfgSerializer().write(graph, output, source.getFileName().toString(), language.tag(),
                layout ? LayoutOptions.from(config.getLayout()) : null);

        System.err.println("[cfg-sketch] Done.");
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
