package com.cfgsketch.engine.graph;

import com.cfgsketch.engine.graph.CfgModel.*;
import com.google.gson.annotations.SerializedName;

import java.util.*;

/**
 * Re-derives a tree view from a finished graph: a depth-first walk over the
 * non-call edges from the entry node. Every node appears at most once, so
 * back-edges and merge points are cut.
 */
public class CfgTreeExporter {

    public record CfgTreeNode(
            @SerializedName("id")             String id,
            @SerializedName("label")          String label,
            @SerializedName("kind")           NodeKind kind,
            @SerializedName("line")           Integer line,
            @SerializedName("children")       List<CfgTreeNode> children,
            @SerializedName("is_conditional") boolean conditional,
            @SerializedName("branch_type")    EdgeCondition branchType,
            @SerializedName("metadata")       NodeMetadata metadata
    ) {
        public CfgTreeNode {
            children = List.copyOf(children);
        }
    }

    /** @return the tree rooted at the entry node, or empty when the graph has no nodes */
    public Optional<CfgTreeNode> export(ControlFlowGraph graph) {
        if (graph.nodes().isEmpty()) return Optional.empty();

        Map<String, CfgNode> byId = new HashMap<>();
        for (CfgNode n : graph.nodes()) byId.put(n.id(), n);
        Map<String, List<CfgEdge>> outgoing = new HashMap<>();
        for (CfgEdge e : graph.edges()) {
            if (!e.isCall()) outgoing.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(e);
        }
        Set<String> visited = new HashSet<>();
        Frame root = open(graph.entryNode(), null, byId, outgoing, visited);
        if (root == null) return Optional.empty();

        // Explicit stack: straight-line functions make the walk as deep as the function is long
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(root);
        CfgTreeNode tree = null;
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next < top.edges.size()) {
                CfgEdge edge = top.edges.get(top.next++);
                Frame child = open(edge.to(), edge.condition(), byId, outgoing, visited);
                if (child != null) stack.push(child);
                continue;
            }
            stack.pop();
            CfgTreeNode done = top.toTreeNode();
            if (stack.isEmpty()) {
                tree = done;
            } else {
                stack.peek().children.add(done);
            }
        }
        return Optional.of(tree);
    }

    private static Frame open(String nodeId, EdgeCondition reachedBy, Map<String, CfgNode> byId,
                              Map<String, List<CfgEdge>> outgoing, Set<String> visited) {
        if (!visited.add(nodeId)) return null;
        CfgNode node = byId.get(nodeId);
        if (node == null) return null;
        return new Frame(node, reachedBy, outgoing.getOrDefault(nodeId, List.of()));
    }

    /** A node whose outgoing edges are still being walked. */
    private static final class Frame {
        final CfgNode node;
        final EdgeCondition reachedBy;
        final List<CfgEdge> edges;
        final List<CfgTreeNode> children = new ArrayList<>();
        int next;

        Frame(CfgNode node, EdgeCondition reachedBy, List<CfgEdge> edges) {
            this.node = node;
            this.reachedBy = reachedBy;
            this.edges = edges;
        }

        CfgTreeNode toTreeNode() {
            boolean conditional = node.kind() == NodeKind.CONDITION || node.kind() == NodeKind.LOOP;
            EdgeCondition branch = reachedBy == EdgeCondition.TRUE || reachedBy == EdgeCondition.FALSE ? reachedBy : null;
            return new CfgTreeNode(node.id(), node.label(), node.kind(), node.line(), children, conditional,
                    branch, node.metadata());
        }
    }
}
