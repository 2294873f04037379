package com.cfgsketch.engine;

import com.cfgsketch.engine.config.ExtractorConfig;
import com.cfgsketch.engine.flow_analysis.CfgExtractor;
import com.cfgsketch.engine.flow_analysis.Language;
import com.cfgsketch.engine.graph.CfgModel.*;
import com.cfgsketch.engine.graph.CfgSerializer;
import com.cfgsketch.engine.graph.ControlFlowGraph;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CfgExtractorTest {

    private final CfgExtractor extractor = new CfgExtractor();

    private static CfgNode byLabel(ControlFlowGraph graph, String label) {
        return graph.nodes().stream()
                .filter(n -> n.label().equals(label))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No node labelled " + label));
    }

    private static Optional<CfgEdge> edge(ControlFlowGraph graph, CfgNode from, CfgNode to) {
        return graph.edges().stream()
                .filter(e -> e.from().equals(from.id()) && e.to().equals(to.id()))
                .findFirst();
    }

    private static CfgNode byCode(ControlFlowGraph graph, String code) {
        return graph.nodes().stream()
                .filter(n -> code.equals(n.code()))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No node for " + code));
    }

    private static List<CfgNode> ofKind(ControlFlowGraph graph, NodeKind kind) {
        return graph.nodes().stream().filter(n -> n.kind() == kind).collect(Collectors.toList());
    }

    private static List<CfgEdge> callEdges(ControlFlowGraph graph) {
        return graph.edges().stream().filter(CfgEdge::isCall).collect(Collectors.toList());
    }

    @Test
    void emptyInputYieldsSingleEntryExitPair() {
        ControlFlowGraph graph = extractor.extract("", Language.JAVASCRIPT);
        assertEquals(2, graph.nodes().size());
        assertEquals(1, graph.edges().size());
        CfgEdge only = graph.edges().get(0);
        assertEquals(graph.entryNode(), only.from());
        assertEquals(graph.exitNodes().get(0), only.to());
    }

    @Test
    void inlineIfElseReturnsBothReachExit() {
        ControlFlowGraph graph = extractor.extract("""
                function f(x) {
                  if (x>0) { return 1 } else { return -1 }
                }""", Language.JAVASCRIPT);

        assertEquals(5, graph.nodes().size());
        assertEquals(5, graph.edges().size());

        CfgNode entry = graph.node(graph.entryNode()).orElseThrow();
        assertEquals(NodeKind.FUNCTION, entry.kind());
        assertEquals("f(x)", entry.label());

        CfgNode cond = byLabel(graph, "if (x>0)");
        CfgNode pos = byLabel(graph, "return 1");
        CfgNode neg = byLabel(graph, "return -1");
        CfgNode exit = graph.node(graph.exitNodes().get(0)).orElseThrow();

        assertTrue(edge(graph, entry, cond).isPresent());
        CfgEdge thenEdge = edge(graph, cond, pos).orElseThrow();
        assertEquals(EdgeCondition.TRUE, thenEdge.condition());
        assertEquals("then", thenEdge.label());
        CfgEdge elseEdge = edge(graph, cond, neg).orElseThrow();
        assertEquals(EdgeCondition.FALSE, elseEdge.condition());
        assertEquals("else", elseEdge.label());
        assertTrue(edge(graph, pos, exit).isPresent());
        assertTrue(edge(graph, neg, exit).isPresent());
    }

    @Test
    void whileLoopHasBodyIterateAndExitEdges() {
        ControlFlowGraph graph = extractor.extract("""
                function g(x) {
                  while (x<10) { x = x+1 }
                  return x
                }""", Language.JAVASCRIPT);

        CfgNode loop = byLabel(graph, "while (x<10)");
        assertEquals(NodeKind.LOOP, loop.kind());
        CfgNode body = byLabel(graph, "x = x+1");
        CfgNode ret = byLabel(graph, "return x");

        assertEquals(EdgeCondition.TRUE, edge(graph, loop, body).orElseThrow().condition());
        CfgEdge back = edge(graph, body, loop).orElseThrow();
        assertEquals(EdgeCondition.ITERATE, back.condition());
        assertEquals("iterate", back.label());
        CfgEdge exit = edge(graph, loop, ret).orElseThrow();
        assertEquals(EdgeCondition.FALSE, exit.condition());
        assertEquals(5, graph.edges().size());
    }

    @Test
    void nestedFunctionsGetTheirOwnEntryExitPairs() {
        ControlFlowGraph graph = extractor.extract("""
                function outer() {
                  function inner() {
                    return 1;
                  }
                  return inner();
                }""", Language.JAVASCRIPT);

        assertEquals(2, graph.functions().size());
        assertEquals(2, ofKind(graph, NodeKind.EXIT).size());
        assertEquals(2, graph.exitNodes().size());

        CfgNode innerEntry = byLabel(graph, "inner()");
        assertEquals(1, innerEntry.depth());
        assertEquals("outer", byLabel(graph, "return inner()").group());
        assertEquals("inner", byLabel(graph, "return 1").group());
    }

    @Test
    void callToEarlierFunctionGetsOneCallEdge() {
        ControlFlowGraph graph = extractor.extract("""
                function helper() {
                  return 1;
                }
                function main() {
                  helper();
                }""", Language.JAVASCRIPT);

        List<CfgEdge> calls = callEdges(graph);
        assertEquals(1, calls.size());
        CfgEdge call = calls.get(0);
        assertEquals(EdgeCategory.CALL, call.category());
        assertEquals("calls", call.label());
        assertEquals(byLabel(graph, "helper(...)").id(), call.from());
        assertEquals(graph.function("helper").orElseThrow().nodeId(), call.to());
    }

    @Test
    void callToLaterFunctionResolvedInSecondPass() {
        ControlFlowGraph graph = extractor.extract("""
                function main() {
                  helper();
                }
                function helper() {
                  return 1;
                }""", Language.JAVASCRIPT);

        List<CfgEdge> calls = callEdges(graph);
        assertEquals(1, calls.size());
        assertEquals(graph.function("helper").orElseThrow().nodeId(), calls.get(0).to());
        assertEquals(List.of("helper"), graph.callGraph().get("main"));
    }

    @Test
    void callResolutionCanBeSwitchedOff() {
        CfgExtractor noCalls = new CfgExtractor(ExtractorConfig.defaults().withResolveCalls(false));
        ControlFlowGraph graph = noCalls.extract("""
                function helper() {
                  return 1;
                }
                function main() {
                  helper();
                }""", Language.JAVASCRIPT);
        assertTrue(callEdges(graph).isEmpty());
    }

    @Test
    void guardElseIsFailurePath() {
        ControlFlowGraph graph = extractor.extract("""
                func load(id: Int) {
                    guard let user = find(id) else {
                        return
                    }
                    show(user)
                }""", Language.SWIFT);

        CfgNode guard = byLabel(graph, "guard let user = find(id)");
        assertEquals(NodeKind.CONDITION, guard.kind());
        CfgNode early = ofKind(graph, NodeKind.RETURN).get(0);
        assertEquals(EdgeCondition.FALSE, edge(graph, guard, early).orElseThrow().condition());
        assertEquals(EdgeCondition.TRUE, edge(graph, guard, byLabel(graph, "show(...)")).orElseThrow().condition());
    }

    @Test
    void tryCatchFinallyWiring() {
        ControlFlowGraph graph = extractor.extract("""
                function run() {
                  try {
                    work();
                  } catch (e) {
                    recover();
                  } finally {
                    cleanup();
                  }
                  done();
                }""", Language.JAVASCRIPT);

        CfgNode tryNode = byLabel(graph, "try");
        CfgNode catchNode = byLabel(graph, "catch (e)");
        CfgNode finallyNode = byLabel(graph, "finally");

        CfgEdge handler = edge(graph, tryNode, catchNode).orElseThrow();
        assertEquals(EdgeCondition.EXCEPTION, handler.condition());
        assertTrue(edge(graph, byLabel(graph, "work(...)"), finallyNode).isPresent());
        assertTrue(edge(graph, byLabel(graph, "recover(...)"), finallyNode).isPresent());
        assertTrue(edge(graph, byLabel(graph, "cleanup(...)"), byLabel(graph, "done(...)")).isPresent());
    }

    @Test
    void breakLeavesLoopAndJoinsExitPath() {
        ControlFlowGraph graph = extractor.extract("""
                function scan(items) {
                  for (const item of items) {
                    if (item.bad) {
                      break;
                    }
                    check(item);
                  }
                  finish();
                }""", Language.JAVASCRIPT);

        CfgNode loop = byLabel(graph, "for (const item of items)");
        CfgNode brk = byLabel(graph, "break");
        CfgNode check = byLabel(graph, "check(...)");
        CfgNode finish = byLabel(graph, "finish(...)");

        assertEquals(EdgeCondition.BREAK, edge(graph, brk, finish).orElseThrow().condition());
        assertEquals(EdgeCondition.FALSE, edge(graph, loop, finish).orElseThrow().condition());
        assertEquals(EdgeCondition.ITERATE, edge(graph, check, loop).orElseThrow().condition());
        assertTrue(edge(graph, brk, loop).isEmpty());
    }

    @Test
    void nestedLoopExitClosesOuterLoop() {
        ControlFlowGraph graph = extractor.extract("""
                function scan(rows) {
                  for (const row of rows) {
                    while (row.busy) {
                      row.step();
                    }
                  }
                  done();
                }""", Language.JAVASCRIPT);

        CfgNode outer = byLabel(graph, "for (const row of rows)");
        CfgNode inner = byLabel(graph, "while (row.busy)");
        CfgNode step = byCode(graph, "row.step();");

        assertEquals(EdgeCondition.ITERATE, edge(graph, step, inner).orElseThrow().condition());
        assertEquals(EdgeCondition.ITERATE, edge(graph, inner, outer).orElseThrow().condition());
        assertEquals(EdgeCondition.FALSE, edge(graph, outer, byCode(graph, "done();")).orElseThrow().condition());
    }

    @Test
    void conditionAtLoopEndKeepsBranchTags() {
        ControlFlowGraph graph = extractor.extract("""
                function poll(items) {
                  for (const item of items) {
                    if (item.ready) {
                    }
                  }
                }""", Language.JAVASCRIPT);

        CfgNode loop = byLabel(graph, "for (const item of items)");
        CfgNode cond = byLabel(graph, "if (item.ready)");
        assertEquals(EdgeCondition.TRUE, edge(graph, loop, cond).orElseThrow().condition());
        List<EdgeCondition> back = graph.outgoing(cond.id()).stream()
                .map(CfgEdge::condition)
                .collect(Collectors.toList());
        assertEquals(List.of(EdgeCondition.TRUE, EdgeCondition.FALSE), back);
        assertTrue(graph.outgoing(cond.id()).stream().allMatch(e -> e.to().equals(loop.id())));
    }

    @Test
    void dereferenceStatementIsNotAComment() {
        ControlFlowGraph graph = extractor.extract("""
                /*
                 * Clears the target.
                 */
                void reset(int *ptr) {
                  *ptr = 0;
                }""", Language.CPP);

        assertTrue(graph.function("reset").isPresent());
        CfgNode deref = byCode(graph, "*ptr = 0;");
        assertEquals("reset", deref.group());
        assertTrue(graph.nodes().stream().noneMatch(n -> n.code() != null && n.code().startsWith("* Clears")));
    }

    @Test
    void manyFunctionsLinkEveryCall() {
        int count = 3000;
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < count; i++) {
            source.append("function f").append(i).append("() {\n");
            if (i + 1 < count) source.append("  f").append(i + 1).append("();\n");
            source.append("}\n");
        }

        ControlFlowGraph graph = assertTimeout(Duration.ofSeconds(30),
                () -> extractor.extract(source.toString(), Language.JAVASCRIPT));

        assertEquals(count, graph.functions().size());
        List<CfgEdge> calls = callEdges(graph);
        assertEquals(count - 1, calls.size());
        CfgEdge first = calls.get(0);
        assertEquals(byCode(graph, "f1();").id(), first.from());
        assertEquals(graph.function("f1").orElseThrow().nodeId(), first.to());
    }

    @Test
    void entryLabelShowsAtMostTwoParameters() {
        ControlFlowGraph graph = extractor.extract("function many(a, b, c) {\n  go();\n}", Language.JAVASCRIPT);
        CfgNode entry = graph.node(graph.entryNode()).orElseThrow();
        assertEquals("many(a, b...)", entry.label());
        assertEquals(List.of("a", "b", "c"), entry.metadata().parameters());
    }

    @Test
    void topLevelCodeBecomesImplicitMain() {
        ControlFlowGraph graph = extractor.extract("x = 1\nprint(x)\n", Language.PYTHON);
        assertEquals(1, graph.functions().size());
        assertEquals("main", graph.functions().get(0).name());
        assertTrue(graph.nodes().stream().anyMatch(n -> n.label().equals("print(...)")));
    }

    @Test
    void unmatchedBracesDoNotThrow() {
        ControlFlowGraph graph = assertDoesNotThrow(() ->
                extractor.extract("function f() {\n  if (x) {\n    a();", Language.JAVASCRIPT));
        assertTrue(graph.function("f").isPresent());
        assertTrue(graph.nodes().stream().anyMatch(n -> n.label().equals("a(...)")));
    }

    @Test
    void unknownLanguageTagIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> extractor.extract("x", "cobol"));
        assertDoesNotThrow(() -> extractor.extract("x", "Kotlin"));
    }

    @Test
    void extractionIsDeterministic() {
        String source = """
                class A {
                  run(items) {
                    for (const i of items) {
                      if (i) { this.go(i) } else { skip() }
                    }
                  }
                  go(i) {
                    return i;
                  }
                }""";
        CfgSerializer serializer = new CfgSerializer();
        String first = serializer.toJson(extractor.extract(source, Language.JAVASCRIPT));
        String second = serializer.toJson(extractor.extract(source, Language.JAVASCRIPT));
        assertEquals(first, second);
    }

    @Test
    void nodeIdsFollowAllocationOrder() {
        ControlFlowGraph graph = extractor.extract("function f() {\n  a();\n  b();\n}", Language.JAVASCRIPT);
        for (int i = 0; i < graph.nodes().size(); i++) {
            assertEquals("node_" + i, graph.nodes().get(i).id());
        }
    }
}
