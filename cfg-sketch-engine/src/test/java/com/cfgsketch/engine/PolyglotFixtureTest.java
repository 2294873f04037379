package com.cfgsketch.engine;

import com.cfgsketch.engine.flow_analysis.CfgExtractor;
import com.cfgsketch.engine.flow_analysis.Language;
import com.cfgsketch.engine.graph.CfgModel.*;
import com.cfgsketch.engine.graph.ControlFlowGraph;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test: extracts graphs from the polyglot fixture sources.
 */
class PolyglotFixtureTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/polyglot");

    private static final Set<NodeKind> ROOT_KINDS =
        EnumSet.of(NodeKind.CLASS, NodeKind.FUNCTION, NodeKind.METHOD, NodeKind.CONSTRUCTOR, NodeKind.ENTRY);

    private static ControlFlowGraph js;
    private static ControlFlowGraph python;
    private static ControlFlowGraph kotlin;
    private static ControlFlowGraph java;
    private static ControlFlowGraph go;

    @BeforeAll
    static void extractAll() throws IOException {
        CfgExtractor extractor = new CfgExtractor();
        js = extractor.extract(read("orders.js"), Language.JAVASCRIPT);
        python = extractor.extract(read("inventory.py"), Language.PYTHON);
        kotlin = extractor.extract(read("Session.kt"), Language.KOTLIN);
        java = extractor.extract(read("StripeOrderService.java"), Language.JAVA);
        go = extractor.extract(read("server.go"), Language.GO);
    }

    private static String read(String name) throws IOException {
        return Files.readString(FIXTURE_ROOT.resolve(name));
    }

    private static List<ControlFlowGraph> all() {
        return List.of(js, python, kotlin, java, go);
    }

    private static List<String> functionKeys(ControlFlowGraph graph) {
        return graph.functions().stream().map(FunctionDescriptor::key).collect(Collectors.toList());
    }

    private static CfgNode node(ControlFlowGraph graph, String group, String label) {
        return graph.nodes().stream()
            .filter(n -> Objects.equals(n.group(), group) && n.label().equals(label))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No node " + label + " in " + group));
    }

    private static CfgNode entry(ControlFlowGraph graph, String key) {
        FunctionDescriptor fn = graph.functions().stream()
            .filter(f -> f.key().equals(key))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No function " + key));
        return graph.node(fn.nodeId()).orElseThrow();
    }

    private static Optional<CfgEdge> edge(ControlFlowGraph graph, CfgNode from, CfgNode to) {
        return graph.edges().stream()
            .filter(e -> e.from().equals(from.id()) && e.to().equals(to.id()))
            .findFirst();
    }

    // --- Graph-wide invariants ---

    @Test
    void nodeIdsAreUnique() {
        for (ControlFlowGraph graph : all()) {
            Set<String> ids = new HashSet<>();
            for (CfgNode n : graph.nodes()) {
                assertTrue(ids.add(n.id()), "Duplicate node id: " + n.id());
            }
        }
    }

    @Test
    void noDuplicateEdges() {
        for (ControlFlowGraph graph : all()) {
            Set<String> keys = new HashSet<>();
            for (CfgEdge e : graph.edges()) {
                assertTrue(keys.add(e.from() + "->" + e.to() + ":" + e.condition()), "Duplicate edge: " + e);
            }
        }
    }

    @Test
    void edgeEndpointsExist() {
        for (ControlFlowGraph graph : all()) {
            for (CfgEdge e : graph.edges()) {
                assertTrue(graph.node(e.from()).isPresent(), "Dangling source: " + e);
                assertTrue(graph.node(e.to()).isPresent(), "Dangling target: " + e);
            }
        }
    }

    @Test
    void everyFunctionReachesItsExit() {
        for (ControlFlowGraph graph : all()) {
            for (FunctionDescriptor fn : graph.functions()) {
                assertTrue(graph.exitNodes().contains(fn.exitNodeId()), "Exit not listed: " + fn.id());
                Set<String> seen = new HashSet<>();
                Deque<String> queue = new ArrayDeque<>(List.of(fn.nodeId()));
                while (!queue.isEmpty()) {
                    String id = queue.poll();
                    if (!seen.add(id)) continue;
                    for (CfgEdge e : graph.outgoing(id)) {
                        if (!e.isCall()) queue.add(e.to());
                    }
                }
                assertTrue(seen.contains(fn.exitNodeId()), "Exit unreachable in " + fn.id());
            }
        }
    }

    @Test
    void everyInnerNodeHasAPredecessor() {
        for (ControlFlowGraph graph : all()) {
            for (CfgNode n : graph.nodes()) {
                if (ROOT_KINDS.contains(n.kind())) continue;
                assertFalse(graph.incoming(n.id()).isEmpty(), "No incoming edge: " + n.label() + " (" + n.id() + ")");
            }
        }
    }

    @Test
    void loopsHaveAtMostOneIterateEdge() {
        for (ControlFlowGraph graph : all()) {
            for (CfgNode n : graph.nodes()) {
                if (n.kind() != NodeKind.LOOP) continue;
                long iterates = graph.incoming(n.id()).stream()
                    .filter(e -> e.condition() == EdgeCondition.ITERATE)
                    .count();
                assertTrue(iterates <= 1, "Loop " + n.label() + " has " + iterates + " iterate edges");
            }
        }
    }

    @Test
    void conditionEdgesAreOneTrueAndOneFalseAtMost() {
        for (ControlFlowGraph graph : all()) {
            for (CfgNode n : graph.nodes()) {
                if (n.kind() != NodeKind.CONDITION) continue;
                List<EdgeCondition> conditions = graph.outgoing(n.id()).stream()
                    .map(CfgEdge::condition)
                    .collect(Collectors.toList());
                for (EdgeCondition c : conditions) {
                    assertTrue(c == EdgeCondition.TRUE || c == EdgeCondition.FALSE,
                        "Condition " + n.label() + " has a " + c + " edge");
                }
                assertTrue(Collections.frequency(conditions, EdgeCondition.TRUE) <= 1, "Two true edges on " + n.label());
                assertTrue(Collections.frequency(conditions, EdgeCondition.FALSE) <= 1, "Two false edges on " + n.label());
            }
        }
    }

    @Test
    void returnsAndThrowsGoStraightToTheirExit() {
        for (ControlFlowGraph graph : all()) {
            Map<String, String> exitByKey = new HashMap<>();
            for (FunctionDescriptor fn : graph.functions()) exitByKey.put(fn.key(), fn.exitNodeId());
            for (CfgNode n : graph.nodes()) {
                if (n.kind() != NodeKind.RETURN && n.kind() != NodeKind.THROW) continue;
                List<CfgEdge> out = graph.outgoing(n.id());
                assertEquals(1, out.size(), n.label() + " has " + out.size() + " outgoing edges");
                assertEquals(exitByKey.get(n.group()), out.get(0).to(), n.label() + " does not reach its own exit");
            }
        }
    }

    @Test
    void loopsHaveABodyEdge() {
        for (ControlFlowGraph graph : all()) {
            for (CfgNode n : graph.nodes()) {
                if (n.kind() != NodeKind.LOOP) continue;
                assertTrue(graph.outgoing(n.id()).stream().anyMatch(e -> e.condition() == EdgeCondition.TRUE),
                    "Loop " + n.label() + " has no body edge");
            }
        }
    }

    @Test
    void childrenMirrorParentIds() {
        for (ControlFlowGraph graph : all()) {
            for (CfgNode n : graph.nodes()) {
                if (n.parentId() == null) continue;
                CfgNode parent = graph.node(n.parentId()).orElseThrow();
                assertTrue(parent.children().contains(n.id()), n.id() + " missing from children of " + parent.id());
            }
        }
    }

    // --- JavaScript ---

    @Test
    void jsClassesAndInheritance() {
        assertEquals(List.of("OrderService", "BaseService"),
            js.classes().stream().map(ClassDescriptor::name).collect(Collectors.toList()));
        ClassDescriptor orders = js.classes().get(0);
        ClassDescriptor base = js.classes().get(1);
        assertEquals("BaseService", orders.parentClass());
        assertEquals(3, orders.methods().size());

        CfgEdge inherits = js.edges().stream()
            .filter(e -> e.condition() == EdgeCondition.INHERITS)
            .findFirst()
            .orElseThrow();
        assertEquals(orders.nodeId(), inherits.from());
        assertEquals(base.nodeId(), inherits.to());
        assertEquals(EdgeCategory.HIERARCHY, inherits.category());
    }

    @Test
    void jsFunctionsAndEntryKinds() {
        assertEquals(List.of("OrderService.constructor", "OrderService.placeOrder", "OrderService.reserve",
                "BaseService.describe", "logError"), functionKeys(js));

        assertEquals(NodeKind.CONSTRUCTOR, entry(js, "OrderService.constructor").kind());
        CfgNode placeOrder = entry(js, "OrderService.placeOrder");
        assertEquals(NodeKind.METHOD, placeOrder.kind());
        assertEquals(Boolean.TRUE, placeOrder.metadata().async());
        assertEquals("OrderService", placeOrder.metadata().className());
        assertEquals(NodeKind.FUNCTION, entry(js, "logError").kind());

        CfgNode classNode = js.node(js.classes().get(0).nodeId()).orElseThrow();
        assertEquals(EdgeCondition.CONTAINS, edge(js, classNode, placeOrder).orElseThrow().condition());
    }

    @Test
    void jsControlFlowInPlaceOrder() {
        String group = "OrderService.placeOrder";
        CfgNode thrown = node(js, group, "throw new Error('empty order')");
        assertEquals(NodeKind.THROW, thrown.kind());
        assertTrue(edge(js, thrown, js.node(js.function("placeOrder").orElseThrow().exitNodeId()).orElseThrow()).isPresent());

        CfgNode loop = node(js, group, "for (const item of order.items)");
        CfgNode cont = node(js, group, "continue");
        assertEquals(EdgeCondition.CONTINUE, edge(js, cont, loop).orElseThrow().condition());

        CfgNode reserveCall = node(js, group, "this.reserve(...)");
        assertEquals(EdgeCondition.ITERATE, edge(js, reserveCall, loop).orElseThrow().condition());
        assertEquals(EdgeCondition.CALL, edge(js, reserveCall, entry(js, "OrderService.reserve")).orElseThrow().condition());

        CfgNode tryNode = node(js, group, "try");
        CfgNode catchNode = node(js, group, "catch (err)");
        assertEquals(EdgeCondition.EXCEPTION, edge(js, tryNode, catchNode).orElseThrow().condition());

        CfgNode logCall = node(js, group, "logError(...)");
        assertTrue(edge(js, logCall, entry(js, "logError")).isPresent());
    }

    // --- Python ---

    @Test
    void pythonClassAndProperty() {
        ClassDescriptor inventory = python.classes().get(0);
        assertEquals("Inventory", inventory.name());
        assertEquals("BaseStore", inventory.parentClass());
        assertTrue(python.edges().stream().noneMatch(e -> e.condition() == EdgeCondition.INHERITS));

        assertEquals(1, inventory.properties().size());
        CfgNode capacity = python.node(inventory.properties().get(0)).orElseThrow();
        assertEquals(NodeKind.PROPERTY, capacity.kind());
        assertEquals("capacity", capacity.label());
        CfgNode classNode = python.node(inventory.nodeId()).orElseThrow();
        assertEquals(EdgeCondition.CONTAINS, edge(python, classNode, capacity).orElseThrow().condition());
    }

    @Test
    void pythonFunctionsAndParameters() {
        assertEquals(List.of("Inventory.__init__", "Inventory.restock", "Inventory.drain", "Inventory.pop_one", "report"),
            functionKeys(python));
        CfgNode init = entry(python, "Inventory.__init__");
        assertEquals(NodeKind.CONSTRUCTOR, init.kind());
        assertEquals(List.of("items"), init.metadata().parameters());
        assertEquals(List.of("sku", "qty"), entry(python, "Inventory.restock").metadata().parameters());
    }

    @Test
    void pythonElifChainMergesIntoReturn() {
        String group = "Inventory.restock";
        CfgNode first = node(python, group, "if (qty <= 0)");
        CfgNode second = node(python, group, "if (sku not in self.items)");
        assertEquals(EdgeCondition.FALSE, edge(python, first, second).orElseThrow().condition());

        CfgNode ret = node(python, group, "return self.items[sku]");
        assertEquals(2, python.incoming(ret.id()).size());
    }

    @Test
    void pythonWhileWithBreak() {
        String group = "Inventory.drain";
        CfgNode loop = node(python, group, "while (self.items)");
        CfgNode brk = node(python, group, "break");
        CfgNode ret = node(python, group, "return len(self.items)");
        assertEquals(EdgeCondition.BREAK, edge(python, brk, ret).orElseThrow().condition());
        assertEquals(EdgeCondition.FALSE, edge(python, loop, ret).orElseThrow().condition());

        CfgNode pop = node(python, group, "sku = self.pop_one()");
        assertEquals(EdgeCondition.CALL, edge(python, pop, entry(python, "Inventory.pop_one")).orElseThrow().condition());
    }

    @Test
    void pythonTryExceptAndForIn() {
        CfgNode tryNode = node(python, "Inventory.pop_one", "try");
        CfgNode except = node(python, "Inventory.pop_one", "catch (KeyError)");
        assertEquals(EdgeCondition.EXCEPTION, edge(python, tryNode, except).orElseThrow().condition());

        CfgNode loop = node(python, "report", "for sku in inventory.items");
        CfgNode print = node(python, "report", "print(...)");
        assertEquals(EdgeCondition.ITERATE, edge(python, print, loop).orElseThrow().condition());
    }

    // --- Kotlin ---

    @Test
    void kotlinClassWithoutBodyIsSkipped() {
        assertEquals(List.of("SessionManager"),
            kotlin.classes().stream().map(ClassDescriptor::name).collect(Collectors.toList()));
        ClassDescriptor manager = kotlin.classes().get(0);
        assertEquals("BaseManager", manager.parentClass());
        assertEquals("active", kotlin.node(manager.properties().get(0)).orElseThrow().label());
    }

    @Test
    void kotlinSuspendFunctionAndWhen() {
        assertEquals(List.of("SessionManager.refresh", "SessionManager.revokeAll", "now"), functionKeys(kotlin));
        CfgNode refresh = entry(kotlin, "SessionManager.refresh");
        assertEquals(Boolean.TRUE, refresh.metadata().async());
        assertEquals(List.of("userId"), refresh.metadata().parameters());

        CfgNode when = node(kotlin, "SessionManager.refresh", "when");
        CfgNode otherwise = node(kotlin, "SessionManager.refresh", "default");
        assertTrue(edge(kotlin, when, otherwise).isPresent());

        CfgNode now = entry(kotlin, "now");
        assertTrue(kotlin.incoming(now.id()).stream().anyMatch(CfgEdge::isCall));
        CfgNode nowExit = kotlin.node(kotlin.function("now").orElseThrow().exitNodeId()).orElseThrow();
        assertTrue(edge(kotlin, now, nowExit).isPresent(), "empty body wires entry straight to exit");
    }

    // --- Java ---

    @Test
    void javaHierarchyAndProperties() {
        ClassDescriptor stripe = java.classes().get(0);
        ClassDescriptor base = java.classes().get(1);
        assertEquals("StripeOrderService", stripe.name());
        assertEquals("AbstractOrderService", base.name());
        assertTrue(base.methods().isEmpty());

        CfgEdge inherits = java.edges().stream()
            .filter(e -> e.condition() == EdgeCondition.INHERITS)
            .findFirst()
            .orElseThrow();
        assertEquals(stripe.nodeId(), inherits.from());
        assertEquals(base.nodeId(), inherits.to());

        List<String> props = stripe.properties().stream()
            .map(id -> java.node(id).orElseThrow().label())
            .collect(Collectors.toList());
        assertEquals(List.of("paymentService", "attempts"), props);
    }

    @Test
    void javaConstructorAndCallEdge() {
        CfgNode ctor = entry(java, "StripeOrderService.StripeOrderService");
        assertEquals(NodeKind.CONSTRUCTOR, ctor.kind());
        assertEquals(Boolean.TRUE, ctor.metadata().constructor());
        assertEquals(List.of("paymentService"), ctor.metadata().parameters());

        CfgNode charge = node(java, "StripeOrderService.createOrder", "PaymentResult result = charge(request);");
        assertTrue(edge(java, charge, entry(java, "StripeOrderService.charge")).isPresent());
    }

    @Test
    void javaSwitchCasesAndBreak() {
        String group = "StripeOrderService.describe";
        CfgNode sw = node(java, group, "switch (status)");
        for (String label : List.of("case 1", "case 2", "default")) {
            assertTrue(edge(java, sw, node(java, group, label)).isPresent(), "switch -> " + label);
        }
        CfgNode brk = node(java, group, "break");
        CfgNode other = node(java, group, "return \"other\"");
        assertEquals(EdgeCondition.BREAK, edge(java, brk, other).orElseThrow().condition());
        assertTrue(edge(java, node(java, group, "log(...)"), entry(java, "StripeOrderService.log")).isPresent());
    }

    // --- Go ---

    @Test
    void goStructAndFunctions() {
        ClassDescriptor server = go.classes().get(0);
        assertEquals("Server", server.name());
        assertEquals(2, server.properties().size());
        assertEquals(List.of("Start", "listen", "main"), functionKeys(go));
        assertTrue(go.functions().stream().allMatch(f -> f.className() == null));
    }

    @Test
    void goForLoopWithConditionalBody() {
        CfgNode loop = node(go, "Start", "for i := 0; i < s.retries; i++");
        CfgNode cond = node(go, "Start", "if (err := s.listen(); err == nil)");
        assertEquals(EdgeCondition.TRUE, edge(go, loop, cond).orElseThrow().condition());
        assertEquals(EdgeCondition.FALSE, edge(go, cond, loop).orElseThrow().condition());
    }
}
