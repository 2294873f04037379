package com.cfgsketch.engine.flow_analysis;

import com.cfgsketch.engine.graph.CfgModel.*;
import com.cfgsketch.engine.graph.ControlFlowGraph;

import java.util.*;

/**
 * Turns detected scopes into the finished graph: class containers and their
 * properties, one entry/exit pair and block CFG per function, then the
 * inter-function call edges.
 */
class GraphAssembler {

    private final BuildContext ctx;
    private final BlockCfgBuilder builder;
    private final int labelMax;

    GraphAssembler(BuildContext ctx, int labelMax) {
        this.ctx = ctx;
        this.builder = new BlockCfgBuilder(ctx);
        this.labelMax = labelMax;
    }

    ControlFlowGraph assemble() {
        Scopes scopes = ctx.scopes();

        // 1. Class containers, inheritance and properties
        Map<String, String> classNodes = new LinkedHashMap<>();
        Map<ClassScope, List<String>> propertyNodes = new LinkedHashMap<>();
        for (ClassScope cls : scopes.classes()) {
            SourceLine header = ctx.lines().get(cls.getStart());
            String id = ctx.addNode(NodeKind.CLASS, cls.getName(), header.number(), header.text(), null, 0,
                    cls.getName(), NodeMetadata.forClass(cls.getName()));
            classNodes.putIfAbsent(cls.getName(), id);
        }
        for (ClassScope cls : scopes.classes()) {
            String id = classNodes.get(cls.getName());
            String parentId = cls.getParentClass() == null ? null : classNodes.get(cls.getParentClass());
            if (parentId != null && !parentId.equals(id)) {
                ctx.addEdge(id, parentId, EdgeCondition.INHERITS, "extends", EdgeCategory.HIERARCHY);
            }
            List<String> props = new ArrayList<>();
            for (ClassScope.Property property : cls.getProperties()) {
                SourceLine line = ctx.lines().get(property.index());
                String propId = ctx.addNode(NodeKind.PROPERTY, LineClassifier.truncate(property.name(), labelMax),
                        line.number(), line.text(), id, 1, cls.getName(), NodeMetadata.forClass(cls.getName()));
                ctx.addEdge(id, propId, EdgeCondition.CONTAINS, "contains", EdgeCategory.HIERARCHY);
                props.add(propId);
            }
            propertyNodes.put(cls, props);
        }

        // 2. One entry/exit pair and block CFG per function
        for (FunctionScope fn : scopes.functions()) {
            buildFunction(fn, classNodes.get(fn.getClassName()));
        }

        // 3. Inter-function call edges
        if (ctx.resolveCalls()) {
            addCallEdges(scopes.functions());
        }

        // 4. Package
        List<CfgNode> nodes = ctx.nodes();
        String entryNode;
        if (nodes.isEmpty()) {
            entryNode = ctx.addNode(NodeKind.ENTRY, "start", 1, null, null, 0, null, null);
            String exit = ctx.addNode(NodeKind.EXIT, "end", Math.max(ctx.lines().size(), 1), null, null, 0, null, null);
            ctx.addEdge(entryNode, exit, null, null);
            nodes = ctx.nodes();
        } else {
            entryNode = nodes.get(0).id();
        }
        List<String> exitNodes = new ArrayList<>();
        for (CfgNode n : nodes) {
            if (n.kind() == NodeKind.EXIT) exitNodes.add(n.id());
        }

        List<ClassDescriptor> classes = new ArrayList<>();
        for (ClassScope cls : scopes.classes()) {
            List<String> methods = new ArrayList<>();
            for (FunctionScope m : cls.getMethods()) methods.add(m.getEntryNodeId());
            classes.add(new ClassDescriptor("class_" + cls.getName(), cls.getName(), cls.getParentClass(),
                    methods, propertyNodes.get(cls), classNodes.get(cls.getName())));
        }
        List<FunctionDescriptor> functions = new ArrayList<>();
        Map<String, List<String>> callGraph = new LinkedHashMap<>();
        for (FunctionScope fn : scopes.functions()) {
            functions.add(new FunctionDescriptor(FunctionDescriptor.ID_PREFIX + fn.getKey(), fn.getName(),
                    fn.getClassName(), fn.getEntryNodeId(), fn.getExitNodeId(), fn.getCalls()));
            callGraph.put(fn.getKey(), fn.getCalls());
        }

        return new ControlFlowGraph(nodes, ctx.edges(), entryNode, exitNodes, classes, functions, callGraph);
    }

    private void buildFunction(FunctionScope fn, String classNodeId) {
        NodeKind kind = fn.isConstructor() ? NodeKind.CONSTRUCTOR
                : fn.isMethod() ? NodeKind.METHOD
                : NodeKind.FUNCTION;
        SourceLine header = ctx.lines().get(fn.getHeader());
        NodeMetadata metadata = new NodeMetadata(
                fn.isAsync() ? Boolean.TRUE : null,
                fn.isConstructor() ? Boolean.TRUE : null,
                fn.getParameters(),
                fn.getClassName(),
                fn.getName());
        String entryId = ctx.addNode(kind, entryLabel(fn), header.number(), header.text(), classNodeId,
                fn.getDepth(), fn.getKey(), metadata);
        fn.setEntryNodeId(entryId);
        if (classNodeId != null) {
            ctx.addEdge(classNodeId, entryId, EdgeCondition.CONTAINS, "contains", EdgeCategory.HIERARCHY);
        }

        int endLine = ctx.lines().get(fn.getEnd()).number();
        String exitId = ctx.addNode(NodeKind.EXIT, "return", endLine + 1, null, entryId, fn.getDepth() + 1,
                fn.getKey(), null);
        fn.setExitNodeId(exitId);

        BlockResult result = builder.buildBlock(fn, fn.getBodyStart(), fn.getEnd(),
                List.of(PendingEdge.plain(entryId)), exitId, fn.getDepth() + 1, List.of());
        for (PendingEdge p : result.pending()) {
            ctx.addEdge(p, exitId);
        }
        for (String b : result.breaks()) {
            ctx.addEdge(b, exitId, EdgeCondition.BREAK, "break");
        }
        if (!ctx.hasOutgoing(entryId)) {
            ctx.addEdge(entryId, exitId, null, null);
        }
        ctx.markBuilt(fn);
    }

    /** {@code name(a, b...)}: at most two parameters are shown. */
    private String entryLabel(FunctionScope fn) {
        List<String> params = fn.getParameters();
        String shown = String.join(", ", params.subList(0, Math.min(2, params.size())));
        String label = fn.getName() + "(" + shown + (params.size() > 2 ? "..." : "") + ")";
        return LineClassifier.truncate(label, labelMax);
    }

    private void addCallEdges(List<FunctionScope> functions) {
        // 1. Statement nodes per function key, and functions per plain name
        Map<String, List<CfgNode>> statements = new HashMap<>();
        for (CfgNode node : ctx.nodes()) {
            if (node.kind() == NodeKind.STATEMENT && node.group() != null) {
                statements.computeIfAbsent(node.group(), k -> new ArrayList<>()).add(node);
            }
        }
        Map<String, List<FunctionScope>> byName = new HashMap<>();
        for (FunctionScope fn : functions) {
            byName.computeIfAbsent(fn.getName(), k -> new ArrayList<>()).add(fn);
        }

        // 2. Link each call site to the resolved callee's entry
        for (FunctionScope caller : functions) {
            List<CfgNode> sites = statements.getOrDefault(caller.getKey(), List.of());
            for (String callName : caller.getCalls()) {
                FunctionScope callee = resolveCallee(byName.getOrDefault(callName, List.of()), caller.getClassName());
                if (callee == null || callee.getEntryNodeId() == null) continue;
                for (CfgNode node : sites) {
                    if (CallExtractor.mentionsCall(node.code(), callName)) {
                        ctx.addEdge(node.id(), callee.getEntryNodeId(), EdgeCondition.CALL, "calls", EdgeCategory.CALL);
                    }
                }
            }
        }
    }

    /** First candidate declared in the caller's own class, else the first candidate. */
    private static FunctionScope resolveCallee(List<FunctionScope> candidates, String callerClass) {
        for (FunctionScope fn : candidates) {
            if (Objects.equals(fn.getClassName(), callerClass)) return fn;
        }
        return candidates.isEmpty() ? null : candidates.get(0);
    }
}
