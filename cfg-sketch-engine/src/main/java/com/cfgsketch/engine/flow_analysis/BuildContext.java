package com.cfgsketch.engine.flow_analysis;

import com.cfgsketch.engine.graph.CfgModel.*;

import java.util.*;

/**
 * Mutable arena for a single extraction: node counter, nodes, edges and the scope
 * lookups. Created fresh per request and discarded once the graph is packaged.
 */
final class BuildContext {

    private final SourceLines lines;
    private final Language language;
    private final LineClassifier classifier;
    private final BlockScanner scanner;
    private final Scopes scopes;
    private final boolean resolveCalls;

    private final Map<Integer, FunctionScope> functionsByHeader = new HashMap<>();
    private final Map<Integer, ClassScope> classesByStart = new HashMap<>();
    private final Map<String, FunctionScope> builtFunctions = new LinkedHashMap<>();

    private final Map<String, CfgNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> children = new LinkedHashMap<>();
    private final List<CfgEdge> edges = new ArrayList<>();
    private final Set<String> edgeKeys = new HashSet<>();
    private final Set<String> edgeSources = new HashSet<>();
    private int counter;

    BuildContext(SourceLines lines, Language language, LineClassifier classifier, BlockScanner scanner, Scopes scopes,
                 boolean resolveCalls) {
        this.lines = lines;
        this.language = language;
        this.classifier = classifier;
        this.scanner = scanner;
        this.scopes = scopes;
        this.resolveCalls = resolveCalls;
        for (FunctionScope fn : scopes.functions()) functionsByHeader.putIfAbsent(fn.getHeader(), fn);
        for (ClassScope cls : scopes.classes()) classesByStart.putIfAbsent(cls.getStart(), cls);
    }

    SourceLines lines()          { return lines; }
    Language language()          { return language; }
    LineClassifier classifier()  { return classifier; }
    BlockScanner scanner()       { return scanner; }
    Scopes scopes()              { return scopes; }
    boolean resolveCalls()       { return resolveCalls; }

    FunctionScope functionAt(int index) { return functionsByHeader.get(index); }
    ClassScope classAt(int index)       { return classesByStart.get(index); }

    void markBuilt(FunctionScope fn) {
        builtFunctions.putIfAbsent(fn.getName(), fn);
    }

    /** A function whose entry node already exists, looked up by plain name. */
    FunctionScope builtFunction(String name) {
        return name == null ? null : builtFunctions.get(name);
    }

    String addNode(NodeKind kind, String label, Integer line, String code, String parentId,
                   int depth, String group, NodeMetadata metadata) {
        String id = "node_" + counter++;
        nodes.put(id, new CfgNode(id, kind, label, line, code, parentId, depth, group, metadata, null));
        if (parentId != null) {
            children.computeIfAbsent(parentId, k -> new ArrayList<>()).add(id);
        }
        return id;
    }

    /** Adds an edge unless one with the same (from, to, condition) exists. */
    boolean addEdge(String from, String to, EdgeCondition condition, String label, EdgeCategory category) {
        String key = from + "->" + to + ":" + condition;
        if (!edgeKeys.add(key)) return false;
        edges.add(new CfgEdge(from, to, condition, label, category));
        edgeSources.add(from);
        return true;
    }

    boolean addEdge(String from, String to, EdgeCondition condition, String label) {
        return addEdge(from, to, condition, label, EdgeCategory.CONTROL);
    }

    boolean addEdge(PendingEdge pending, String to) {
        return addEdge(pending.from(), to, pending.condition(), pending.label());
    }

    boolean hasOutgoing(String nodeId) {
        return edgeSources.contains(nodeId);
    }

    CfgNode node(String id) {
        return nodes.get(id);
    }

    /** Nodes in allocation order, each carrying the ids of the nodes parented to it. */
    List<CfgNode> nodes() {
        List<CfgNode> result = new ArrayList<>(nodes.size());
        for (CfgNode n : nodes.values()) {
            List<String> kids = children.get(n.id());
            result.add(kids == null ? n : n.withChildren(kids));
        }
        return result;
    }

    List<CfgEdge> edges() {
        return Collections.unmodifiableList(edges);
    }
}
