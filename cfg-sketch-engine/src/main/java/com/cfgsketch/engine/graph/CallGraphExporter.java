package com.cfgsketch.engine.graph;

import com.cfgsketch.engine.graph.CfgModel.*;
import com.google.gson.annotations.SerializedName;

import java.util.*;

/**
 * Re-derives the function-level call graph from a finished graph.
 * A function's body is everything reachable from its entry over non-call edges,
 * stopping at exit nodes; call edges leaving the body are its outgoing calls.
 */
public class CallGraphExporter {

    public record CallGraphEntry(
            @SerializedName("name")       String name,
            @SerializedName("calls")      List<String> calls,
            @SerializedName("called_by")  List<String> calledBy,
            @SerializedName("is_method")  boolean method,
            @SerializedName("class_name") String className
    ) {}

    /** Entries keyed by function key, in function order. */
    public Map<String, CallGraphEntry> export(ControlFlowGraph graph) {
        Map<String, CfgNode> byId = new HashMap<>();
        for (CfgNode n : graph.nodes()) byId.put(n.id(), n);
        Map<String, List<CfgEdge>> control = new HashMap<>();
        List<CfgEdge> callEdges = new ArrayList<>();
        Map<String, List<Integer>> callsFrom = new HashMap<>();
        for (CfgEdge e : graph.edges()) {
            if (e.isCall()) {
                callsFrom.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(callEdges.size());
                callEdges.add(e);
            } else {
                control.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(e);
            }
        }
        Map<String, String> keyByEntry = new HashMap<>();
        for (FunctionDescriptor fn : graph.functions()) keyByEntry.put(fn.nodeId(), fn.key());

        Map<String, LinkedHashSet<String>> calls = new LinkedHashMap<>();
        Map<String, LinkedHashSet<String>> calledBy = new LinkedHashMap<>();
        for (FunctionDescriptor fn : graph.functions()) {
            calls.put(fn.key(), new LinkedHashSet<>());
            calledBy.put(fn.key(), new LinkedHashSet<>());
        }

        for (FunctionDescriptor fn : graph.functions()) {
            // call sites inside the body, in edge order
            List<Integer> sites = new ArrayList<>();
            for (String id : body(fn.nodeId(), byId, control)) {
                sites.addAll(callsFrom.getOrDefault(id, List.of()));
            }
            Collections.sort(sites);
            for (int index : sites) {
                CfgEdge e = callEdges.get(index);
                String callee = keyByEntry.get(e.to());
                if (callee == null) continue;
                calls.get(fn.key()).add(callee);
                calledBy.get(callee).add(fn.key());
            }
        }

        Map<String, CallGraphEntry> result = new LinkedHashMap<>();
        for (FunctionDescriptor fn : graph.functions()) {
            result.put(fn.key(), new CallGraphEntry(fn.name(),
                    new ArrayList<>(calls.get(fn.key())),
                    new ArrayList<>(calledBy.get(fn.key())),
                    fn.className() != null,
                    fn.className()));
        }
        return result;
    }

    private static Set<String> body(String entryId, Map<String, CfgNode> byId, Map<String, List<CfgEdge>> control) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(entryId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) continue;
            CfgNode node = byId.get(current);
            if (node == null || node.kind() == NodeKind.EXIT) continue;
            for (CfgEdge e : control.getOrDefault(current, List.of())) {
                if (!visited.contains(e.to())) queue.add(e.to());
            }
        }
        return visited;
    }
}
