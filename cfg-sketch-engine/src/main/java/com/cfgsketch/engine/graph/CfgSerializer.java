package com.cfgsketch.engine.graph;

import com.cfgsketch.engine.graph.CfgModel.EdgeCondition;
import com.cfgsketch.engine.graph.CfgModel.NodeKind;
import com.cfgsketch.engine.graph.CfgModel.NodeMetadata;
import com.cfgsketch.engine.graph.CfgTreeExporter.CfgTreeNode;
import com.cfgsketch.engine.graph.LayoutCalculator.LayoutOptions;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Writes an extracted graph and its derived views as JSON:
 * cfg.json, cfg_tree.json, call_graph.json, metadata.json and, when layout
 * options are given, layout.json.
 *
 * Node and edge order is the allocation order of the extraction, which is
 * already deterministic, so nothing is re-sorted here.
 */
public class CfgSerializer {

    public static final String ENGINE_VERSION = "0.1.0";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    // The tree nests once per node on its longest path, so it is written without indentation
    private final Gson treeGson = new GsonBuilder()
            .registerTypeAdapter(CfgTreeNode.class, new CfgTreeAdapter(gson))
            .create();

    /**
     * @param graph      extracted graph
     * @param outputDir  directory to write into (created if absent)
     * @param sourceName name of the analysed source, recorded in metadata.json
     * @param language   language tag, recorded in metadata.json
     * @param layout     layout geometry, or null to skip layout.json
     */
    public void write(ControlFlowGraph graph, Path outputDir, String sourceName, String language, LayoutOptions layout) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        writeJson(outputDir.resolve("cfg.json"), graph);
        writeJson(outputDir.resolve("cfg_tree.json"), treeGson, new CfgTreeExporter().export(graph).orElse(null));
        writeJson(outputDir.resolve("call_graph.json"), new CallGraphExporter().export(graph));
        if (layout != null) {
            writeJson(outputDir.resolve("layout.json"), new LayoutCalculator(layout).calculate(graph));
        }

        var meta = new Metadata(sourceName, language, ENGINE_VERSION, Instant.now().toString(),
                graph.nodes().size(), graph.edges().size(), graph.functions().size());
        writeJson(outputDir.resolve("metadata.json"), meta);
    }

    /** Serializes the graph alone, as it appears in cfg.json. */
    public String toJson(ControlFlowGraph graph) {
        return gson.toJson(graph);
    }

    private void writeJson(Path path, Object value) {
        writeJson(path, gson, value);
    }

    private void writeJson(Path path, Gson writer, Object value) {
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.toJson(value, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + path.getFileName() + ": " + e.getMessage(), e);
        }
        System.err.println("[cfg-sketch] " + path.getFileName() + " written: " + path);
    }

    /** Simple metadata record for Gson serialization. */
    private record Metadata(
            String sourceName,
            String language,
            String engineVersion,
            String timestamp,
            int nodeCount,
            int edgeCount,
            int functionCount
    ) {}

    /**
     * Streams a {@link CfgTreeNode} with an explicit stack instead of Gson's reflective
     * adapter, which recurses once per nesting level. Field names match the record's
     * {@code @SerializedName} values; children are written last.
     */
    static final class CfgTreeAdapter extends TypeAdapter<CfgTreeNode> {

        private final TypeAdapter<NodeKind> kinds;
        private final TypeAdapter<EdgeCondition> conditions;
        private final TypeAdapter<NodeMetadata> metadata;

        CfgTreeAdapter(Gson gson) {
            this.kinds = gson.getAdapter(NodeKind.class);
            this.conditions = gson.getAdapter(EdgeCondition.class);
            this.metadata = gson.getAdapter(NodeMetadata.class);
        }

        @Override
        public void write(JsonWriter out, CfgTreeNode root) throws IOException {
            if (root == null) {
                out.nullValue();
                return;
            }
            Deque<Iterator<CfgTreeNode>> stack = new ArrayDeque<>();
            openNode(out, root);
            stack.push(root.children().iterator());
            while (!stack.isEmpty()) {
                Iterator<CfgTreeNode> siblings = stack.peek();
                if (siblings.hasNext()) {
                    CfgTreeNode child = siblings.next();
                    openNode(out, child);
                    stack.push(child.children().iterator());
                } else {
                    stack.pop();
                    out.endArray();
                    out.endObject();
                }
            }
        }

        /** Writes every field but the children, then opens the children array. */
        private void openNode(JsonWriter out, CfgTreeNode node) throws IOException {
            out.beginObject();
            out.name("id").value(node.id());
            out.name("label").value(node.label());
            out.name("kind");
            kinds.write(out, node.kind());
            if (node.line() != null) out.name("line").value(node.line());
            out.name("is_conditional").value(node.conditional());
            if (node.branchType() != null) {
                out.name("branch_type");
                conditions.write(out, node.branchType());
            }
            if (node.metadata() != null) {
                out.name("metadata");
                metadata.write(out, node.metadata());
            }
            out.name("children").beginArray();
        }

        @Override
        public CfgTreeNode read(JsonReader in) {
            throw new UnsupportedOperationException("cfg_tree.json is an output-only view");
        }
    }
}
