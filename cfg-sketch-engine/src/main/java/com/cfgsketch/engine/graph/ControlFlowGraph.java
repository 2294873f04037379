package com.cfgsketch.engine.graph;

import com.cfgsketch.engine.graph.CfgModel.CfgEdge;
import com.cfgsketch.engine.graph.CfgModel.CfgNode;
import com.cfgsketch.engine.graph.CfgModel.ClassDescriptor;
import com.cfgsketch.engine.graph.CfgModel.FunctionDescriptor;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Finished result of one extraction. Immutable; lists keep allocation order.
 */
public record ControlFlowGraph(
        @SerializedName("nodes")      List<CfgNode> nodes,
        @SerializedName("edges")      List<CfgEdge> edges,
        @SerializedName("entry_node") String entryNode,
        @SerializedName("exit_nodes") List<String> exitNodes,
        @SerializedName("classes")    List<ClassDescriptor> classes,
        @SerializedName("functions")  List<FunctionDescriptor> functions,
        @SerializedName("call_graph") Map<String, List<String>> callGraph
) {
    public ControlFlowGraph {
        Objects.requireNonNull(entryNode, "entryNode");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        exitNodes = List.copyOf(exitNodes);
        classes = List.copyOf(classes);
        functions = List.copyOf(functions);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        callGraph.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        callGraph = Collections.unmodifiableMap(copy);
    }

    public Optional<CfgNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public List<CfgEdge> outgoing(String nodeId) {
        return edges.stream().filter(e -> e.from().equals(nodeId)).toList();
    }

    public List<CfgEdge> incoming(String nodeId) {
        return edges.stream().filter(e -> e.to().equals(nodeId)).toList();
    }

    public Optional<FunctionDescriptor> function(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
