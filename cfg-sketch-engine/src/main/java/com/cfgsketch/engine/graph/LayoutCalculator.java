package com.cfgsketch.engine.graph;

import com.cfgsketch.engine.config.ExtractorConfig;
import com.cfgsketch.engine.graph.CfgModel.*;
import com.google.gson.annotations.SerializedName;

import java.util.*;

/**
 * Fallback tree layout for renderers that bring none of their own.
 *
 * Levels come from a breadth-first walk over non-call edges starting at the entry node.
 * Each node is centred over its children, which share the horizontal space in proportion
 * to their subtree widths. Nodes the walk never reaches are stacked in a side column.
 */
public class LayoutCalculator {

    public enum Branch {
        @SerializedName("left")   LEFT,
        @SerializedName("right")  RIGHT,
        @SerializedName("center") CENTER
    }

    public record NodePosition(
            @SerializedName("x")      double x,
            @SerializedName("y")      double y,
            @SerializedName("level")  int level,
            @SerializedName("branch") Branch branch
    ) {}

    public record LayoutOptions(int nodeWidth, int nodeHeight, int horizontalGap, int verticalGap, int disconnectedX) {

        public static LayoutOptions defaults() {
            return from(new ExtractorConfig.LayoutSettings());
        }

        public static LayoutOptions from(ExtractorConfig.LayoutSettings settings) {
            return new LayoutOptions(settings.getNodeWidth(), settings.getNodeHeight(),
                    settings.getHorizontalGap(), settings.getVerticalGap(), settings.getDisconnectedX());
        }
    }

    private final LayoutOptions options;

    public LayoutCalculator() {
        this(LayoutOptions.defaults());
    }

    public LayoutCalculator(LayoutOptions options) {
        this.options = options;
    }

    /** Positions keyed by node id, in node order. */
    public Map<String, NodePosition> calculate(ControlFlowGraph graph) {
        Map<String, NodePosition> positions = new LinkedHashMap<>();
        if (graph.nodes().isEmpty()) return positions;

        // 1. Adjacency over non-call edges, children in edge order without duplicates
        Map<String, List<String>> children = new HashMap<>();
        for (CfgNode n : graph.nodes()) children.put(n.id(), new ArrayList<>());
        for (CfgEdge e : graph.edges()) {
            if (e.isCall()) continue;
            List<String> list = children.computeIfAbsent(e.from(), k -> new ArrayList<>());
            if (!list.contains(e.to())) list.add(e.to());
        }

        // 2. BFS levels; unreached nodes sit on level 0
        Map<String, Integer> levels = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(graph.entryNode());
        levels.put(graph.entryNode(), 0);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            int level = levels.get(id);
            for (String child : children.getOrDefault(id, List.of())) {
                if (!levels.containsKey(child)) {
                    levels.put(child, level + 1);
                    queue.add(child);
                }
            }
        }

        // 3. Subtree widths, then placement; both walks keep their own stack
        Map<String, Double> widths = subtreeWidths(graph.entryNode(), children);
        place(graph.entryNode(), children, widths, levels, positions);

        // 4. Side column for everything not placed
        double y = 0;
        for (CfgNode n : graph.nodes()) {
            if (!positions.containsKey(n.id())) {
                positions.put(n.id(), new NodePosition(options.disconnectedX(), y, 0, Branch.CENTER));
                y += options.nodeHeight() + options.verticalGap();
            }
        }

        Map<String, NodePosition> ordered = new LinkedHashMap<>();
        for (CfgNode n : graph.nodes()) ordered.put(n.id(), positions.get(n.id()));
        return ordered;
    }

    /** Post-order widths; a node met again on its own path counts as a single node. */
    private Map<String, Double> subtreeWidths(String rootId, Map<String, List<String>> children) {
        Map<String, Double> widths = new HashMap<>();
        Set<String> path = new HashSet<>();
        if (knownWidth(rootId, children, widths, path) != null) return widths;

        Deque<WidthFrame> stack = new ArrayDeque<>();
        path.add(rootId);
        stack.push(new WidthFrame(rootId, children.get(rootId)));
        while (!stack.isEmpty()) {
            WidthFrame top = stack.peek();
            if (top.next < top.kids.size()) {
                String kid = top.kids.get(top.next++);
                Double width = knownWidth(kid, children, widths, path);
                if (width != null) {
                    top.add(width);
                } else {
                    path.add(kid);
                    stack.push(new WidthFrame(kid, children.get(kid)));
                }
                continue;
            }
            stack.pop();
            path.remove(top.id);
            double width = Math.max(options.nodeWidth(), top.total);
            widths.put(top.id, width);
            if (!stack.isEmpty()) stack.peek().add(width);
        }
        return widths;
    }

    /** Width that needs no walk below the node, or null when its children still have to be measured. */
    private Double knownWidth(String id, Map<String, List<String>> children, Map<String, Double> widths,
                              Set<String> path) {
        if (path.contains(id)) return (double) options.nodeWidth();
        Double known = widths.get(id);
        if (known != null) return known;
        if (children.getOrDefault(id, List.of()).isEmpty()) {
            widths.put(id, (double) options.nodeWidth());
            return (double) options.nodeWidth();
        }
        return null;
    }

    private final class WidthFrame {
        final String id;
        final List<String> kids;
        int next;
        double total;

        WidthFrame(String id, List<String> kids) {
            this.id = id;
            this.kids = kids;
        }

        void add(double width) {
            total += width;
            if (next < kids.size()) total += options.horizontalGap();
        }
    }

    private record Placement(String id, double x, double y, Branch branch) {}

    /** Pre-order placement; the first parent to reach a node decides where it goes. */
    private void place(String rootId, Map<String, List<String>> children, Map<String, Double> widths,
                       Map<String, Integer> levels, Map<String, NodePosition> positions) {
        Deque<Placement> stack = new ArrayDeque<>();
        stack.push(new Placement(rootId, 0, 0, Branch.CENTER));
        while (!stack.isEmpty()) {
            Placement p = stack.pop();
            if (positions.containsKey(p.id())) continue;
            positions.put(p.id(), new NodePosition(p.x(), p.y(), levels.getOrDefault(p.id(), 0), p.branch()));

            List<String> kids = children.getOrDefault(p.id(), List.of());
            if (kids.isEmpty()) continue;

            double total = 0;
            for (int i = 0; i < kids.size(); i++) {
                total += widths.getOrDefault(kids.get(i), (double) options.nodeWidth());
                if (i < kids.size() - 1) total += options.horizontalGap();
            }
            double childX = p.x() - total / 2;
            double childY = p.y() + options.nodeHeight() + options.verticalGap();
            List<Placement> row = new ArrayList<>(kids.size());
            for (int i = 0; i < kids.size(); i++) {
                String child = kids.get(i);
                double width = widths.getOrDefault(child, (double) options.nodeWidth());
                row.add(new Placement(child, childX + width / 2, childY, branchOf(i, kids.size())));
                childX += width + options.horizontalGap();
            }
            // pushed in reverse so the leftmost child is placed first
            for (int i = row.size() - 1; i >= 0; i--) stack.push(row.get(i));
        }
    }

    private static Branch branchOf(int index, int count) {
        if (count < 2) return Branch.CENTER;
        if (index == 0) return Branch.LEFT;
        if (index == count - 1) return Branch.RIGHT;
        return Branch.CENTER;
    }
}
