package com.cfgsketch.engine.flow_analysis;

import com.cfgsketch.engine.graph.CfgModel.*;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Recursive core of the extractor: turns a range of lines inside one function into
 * nodes and edges.
 *
 * Each call keeps a frontier of {@link PendingEdge}s. Every emitted node is wired from
 * all frontier entries, after which the frontier is just that node. Branches, loops and
 * handlers build their bodies with a recursive call and merge the returned frontiers.
 * Enclosing loops and switches travel down as an immutable list of frames, innermost
 * first, so break and continue can find their targets.
 */
class BlockCfgBuilder {

    /** An enclosing loop or switch. */
    record Frame(String nodeId, boolean loop) {}

    private static final Pattern ORPHAN_CONTINUATION = Pattern.compile("^(?:else|elif|elsif)\\b(?!\\s*->)");
    private static final Pattern IMPORT = Pattern.compile(
            "^(?:import\\s|from\\s+\\S+\\s+import\\s|package\\s|using\\s|#include\\b|require\\s*\\(|(?:const|let|var)\\s+.+=\\s*require\\s*\\()");
    private static final Pattern ANNOTATION = Pattern.compile("^@[\\w.]+(?:\\(.*\\))?$");
    private static final Set<String> PUNCTUATION = Set.of("{", "}", "};", "},", ")", ");", "]", "];", "(", "end", "end)");

    private final BuildContext ctx;

    BlockCfgBuilder(BuildContext ctx) {
        this.ctx = ctx;
    }

    /** Mutable per-call state. */
    private static final class BlockState {
        List<PendingEdge> frontier;
        final List<String> breaks = new ArrayList<>();
        boolean hasReturn;
        String lastNode;

        BlockState(List<PendingEdge> inbound) {
            this.frontier = new ArrayList<>(inbound);
        }

        BlockResult toResult() {
            return new BlockResult(lastNode, frontier, breaks, hasReturn);
        }
    }

    BlockResult buildBlock(FunctionScope fn, int start, int end, List<PendingEdge> inbound,
                           String exitId, int depth, List<Frame> frames) {
        BlockState state = new BlockState(inbound);
        int limit = Math.min(end, ctx.lines().lastIndex());
        int i = start;
        while (i <= limit) {
            FunctionScope nested = ctx.functionAt(i);
            if (nested != null && nested != fn) {
                i = Math.max(nested.getEnd(), i) + 1;
                continue;
            }
            ClassScope nestedClass = ctx.classAt(i);
            if (nestedClass != null) {
                i = Math.max(nestedClass.getEnd(), i) + 1;
                continue;
            }
            SourceLine line = ctx.lines().get(i);
            if (isSkippable(line)) {
                i++;
                continue;
            }
            LineAnalysis analysis = ctx.classifier().classify(line.raw(), line.text(), ctx.language());
            i = dispatch(fn, i, limit, line, analysis, state, exitId, depth, frames);
        }
        return state.toResult();
    }

    private int dispatch(FunctionScope fn, int i, int limit, SourceLine line, LineAnalysis analysis,
                         BlockState state, String exitId, int depth, List<Frame> frames) {
        switch (analysis.kind()) {
            case IF:
                return handleConditional(fn, i, limit, analysis, state, exitId, depth, frames);
            case GUARD:
                return handleGuard(fn, i, limit, analysis, state, exitId, depth, frames);
            case LOOP:
                return handleLoop(fn, i, limit, analysis, state, exitId, depth, frames);
            case ITERATION:
                if (ctx.scanner().findBlockEnd(i, limit) > i) {
                    return handleLoop(fn, i, limit, analysis, state, exitId, depth, frames);
                }
                emitStatement(fn, line, analysis, state, depth);
                return i + 1;
            case TRY:
                return handleTry(fn, i, limit, analysis, state, exitId, depth, frames);
            case SWITCH:
            case WHEN:
                return handleSwitch(fn, i, limit, analysis, state, exitId, depth, frames);
            case CASE:
            case DEFAULT:
                // every case label is also reachable straight from its switch
                if (!frames.isEmpty() && !frames.get(0).loop()) {
                    PendingEdge fromSwitch = PendingEdge.plain(frames.get(0).nodeId());
                    if (!state.frontier.contains(fromSwitch)) state.frontier.add(fromSwitch);
                }
                emitStatement(fn, line, analysis, state, depth);
                return i + 1;
            case RETURN:
            case THROW: {
                String id = emit(fn, analysis.kind().nodeKind(), analysis.label(), line, state, depth, null);
                ctx.addEdge(id, exitId, null, null);
                state.frontier = new ArrayList<>();
                state.hasReturn = true;
                return i + 1;
            }
            case BREAK:
                if (frames.isEmpty()) {
                    emitStatement(fn, line, analysis, state, depth);
                } else {
                    String id = emit(fn, NodeKind.STATEMENT, analysis.label(), line, state, depth, null);
                    state.breaks.add(id);
                    state.frontier = new ArrayList<>();
                }
                return i + 1;
            case CONTINUE: {
                Frame loop = innermostLoop(frames);
                if (loop == null) {
                    emitStatement(fn, line, analysis, state, depth);
                } else {
                    String id = emit(fn, NodeKind.STATEMENT, analysis.label(), line, state, depth, null);
                    ctx.addEdge(id, loop.nodeId(), EdgeCondition.CONTINUE, "continue");
                    state.frontier = new ArrayList<>();
                }
                return i + 1;
            }
            default:
                emitStatement(fn, line, analysis, state, depth);
                return i + 1;
        }
    }

    private int handleConditional(FunctionScope fn, int i, int limit, LineAnalysis analysis, BlockState state,
                                  String exitId, int depth, List<Frame> frames) {
        SourceLine header = ctx.lines().get(i);
        String condId = emit(fn, NodeKind.CONDITION, analysis.label(), header, state, depth, null);

        int thenEnd = ctx.scanner().findBlockEnd(i, limit);
        BlockResult then = buildBlock(fn, i + 1, thenEnd,
                List.of(new PendingEdge(condId, EdgeCondition.TRUE, "then")), exitId, depth + 1, frames);
        List<PendingEdge> merged = new ArrayList<>(then.pending());
        state.breaks.addAll(then.breaks());
        state.hasReturn |= then.hasReturn();

        int next = thenEnd + 1;
        PendingEdge elseEdge = new PendingEdge(condId, EdgeCondition.FALSE, "else");
        int cont = ctx.scanner().findContinuation(thenEnd, limit, header.indent(), BlockScanner.ELSE_CONTINUATION);
        if (cont >= 0) {
            SourceLine contLine = ctx.lines().get(cont);
            LineAnalysis contAnalysis = ctx.classifier().classify(contLine.raw(), contLine.text(), ctx.language());
            if (contAnalysis.kind() == LineKind.IF) {
                BlockState chain = new BlockState(List.of(elseEdge));
                next = handleConditional(fn, cont, limit, contAnalysis, chain, exitId, depth, frames);
                merged.addAll(chain.frontier);
                state.breaks.addAll(chain.breaks);
                state.hasReturn |= chain.hasReturn;
            } else {
                int elseEnd = ctx.scanner().findBlockEnd(cont, limit);
                BlockResult otherwise = buildBlock(fn, cont + 1, elseEnd, List.of(elseEdge), exitId, depth + 1, frames);
                merged.addAll(otherwise.pending());
                state.breaks.addAll(otherwise.breaks());
                state.hasReturn |= otherwise.hasReturn();
                next = elseEnd + 1;
            }
        } else {
            merged.add(elseEdge);
        }

        state.frontier = merged;
        state.lastNode = merged.isEmpty() ? condId : merged.get(0).from();
        return next;
    }

    /** {@code guard c else { ... }}: the block is the failure path, the true edge continues. */
    private int handleGuard(FunctionScope fn, int i, int limit, LineAnalysis analysis, BlockState state,
                            String exitId, int depth, List<Frame> frames) {
        String condId = emit(fn, NodeKind.CONDITION, analysis.label(), ctx.lines().get(i), state, depth, null);
        int elseEnd = ctx.scanner().findBlockEnd(i, limit);
        BlockResult otherwise = buildBlock(fn, i + 1, elseEnd,
                List.of(new PendingEdge(condId, EdgeCondition.FALSE, "else")), exitId, depth + 1, frames);

        List<PendingEdge> merged = new ArrayList<>();
        merged.add(new PendingEdge(condId, EdgeCondition.TRUE, "then"));
        merged.addAll(otherwise.pending());
        state.frontier = merged;
        state.breaks.addAll(otherwise.breaks());
        state.hasReturn |= otherwise.hasReturn();
        state.lastNode = condId;
        return elseEnd + 1;
    }

    private int handleLoop(FunctionScope fn, int i, int limit, LineAnalysis analysis, BlockState state,
                           String exitId, int depth, List<Frame> frames) {
        int bodyEnd = ctx.scanner().findBlockEnd(i, limit);
        SourceLine header = ctx.lines().get(i);

        // do { ... } catch { ... } is a handler block, not a loop
        if (analysis.label().equals("do")
                && ctx.scanner().findContinuation(bodyEnd, limit, header.indent(), BlockScanner.HANDLER_CONTINUATION) >= 0) {
            return handleTry(fn, i, limit, analysis, state, exitId, depth, frames);
        }

        String loopId = emit(fn, NodeKind.LOOP, analysis.label(), header, state, depth,
                analysis.call() ? NodeMetadata.forCall(analysis.calledName()) : null);
        BlockResult body = buildBlock(fn, i + 1, bodyEnd,
                List.of(new PendingEdge(loopId, EdgeCondition.TRUE, "body")), exitId, depth + 1,
                push(frames, new Frame(loopId, true)));

        // The back-edge leaves the first plain fall-through, else the exit path of a nested loop.
        // A condition node's true/false edges keep their tags.
        PendingEdge closing = null;
        for (PendingEdge p : body.pending()) {
            if (p.isPlain()) {
                closing = p;
                break;
            }
        }
        if (closing == null) {
            for (PendingEdge p : body.pending()) {
                if (p.condition() == EdgeCondition.FALSE && ctx.node(p.from()).kind() == NodeKind.LOOP) {
                    closing = p;
                    break;
                }
            }
        }
        for (PendingEdge p : body.pending()) {
            if (p == closing) {
                ctx.addEdge(p.from(), loopId, EdgeCondition.ITERATE, "iterate");
            } else {
                ctx.addEdge(p, loopId);
            }
        }

        List<PendingEdge> after = new ArrayList<>();
        after.add(new PendingEdge(loopId, EdgeCondition.FALSE, "exit"));
        for (String b : body.breaks()) {
            after.add(new PendingEdge(b, EdgeCondition.BREAK, "break"));
        }
        state.frontier = after;
        state.hasReturn |= body.hasReturn();
        state.lastNode = loopId;
        return bodyEnd + 1;
    }

    private int handleTry(FunctionScope fn, int i, int limit, LineAnalysis analysis, BlockState state,
                          String exitId, int depth, List<Frame> frames) {
        SourceLine header = ctx.lines().get(i);
        String tryId = emit(fn, NodeKind.STATEMENT, "try", header, state, depth, null);
        int tryEnd = ctx.scanner().findBlockEnd(i, limit);
        BlockResult body = buildBlock(fn, i + 1, tryEnd, List.of(PendingEdge.plain(tryId)), exitId, depth + 1, frames);
        List<PendingEdge> merged = new ArrayList<>(body.pending());
        state.breaks.addAll(body.breaks());
        state.hasReturn |= body.hasReturn();

        int last = tryEnd;
        int cont;
        while ((cont = ctx.scanner().findContinuation(last, limit, header.indent(), BlockScanner.HANDLER_CONTINUATION)) >= 0) {
            SourceLine clause = ctx.lines().get(cont);
            LineAnalysis clauseAnalysis = ctx.classifier().classify(clause.raw(), clause.text(), ctx.language());
            int clauseEnd = ctx.scanner().findBlockEnd(cont, limit);
            if (clauseAnalysis.kind() == LineKind.CATCH) {
                BlockState handler = new BlockState(List.of());
                String catchId = emit(fn, NodeKind.STATEMENT, clauseAnalysis.label(), clause, handler, depth, null);
                ctx.addEdge(tryId, catchId, EdgeCondition.EXCEPTION, "catch");
                BlockResult handled = buildBlock(fn, cont + 1, clauseEnd, List.of(PendingEdge.plain(catchId)),
                        exitId, depth + 1, frames);
                merged.addAll(handled.pending());
                state.breaks.addAll(handled.breaks());
                state.hasReturn |= handled.hasReturn();
            } else {
                BlockState cleanup = new BlockState(merged.isEmpty()
                        ? List.of(new PendingEdge(tryId, EdgeCondition.EXCEPTION, "finally"))
                        : merged);
                String finallyId = emit(fn, NodeKind.STATEMENT, clauseAnalysis.label(), clause, cleanup, depth, null);
                BlockResult cleaned = buildBlock(fn, cont + 1, clauseEnd, List.of(PendingEdge.plain(finallyId)),
                        exitId, depth + 1, frames);
                merged = new ArrayList<>(cleaned.pending());
                state.breaks.addAll(cleaned.breaks());
                state.hasReturn |= cleaned.hasReturn();
            }
            if (clauseEnd <= last) break;
            last = clauseEnd;
        }

        state.frontier = merged;
        state.lastNode = merged.isEmpty() ? tryId : merged.get(0).from();
        return last + 1;
    }

    private int handleSwitch(FunctionScope fn, int i, int limit, LineAnalysis analysis, BlockState state,
                             String exitId, int depth, List<Frame> frames) {
        String switchId = emit(fn, NodeKind.STATEMENT, analysis.label(), ctx.lines().get(i), state, depth, null);
        int bodyEnd = ctx.scanner().findBlockEnd(i, limit);
        BlockResult body = buildBlock(fn, i + 1, bodyEnd, List.of(PendingEdge.plain(switchId)), exitId, depth + 1,
                push(frames, new Frame(switchId, false)));

        List<PendingEdge> after = new ArrayList<>(body.pending());
        for (String b : body.breaks()) {
            after.add(new PendingEdge(b, EdgeCondition.BREAK, "break"));
        }
        state.frontier = after;
        state.hasReturn |= body.hasReturn();
        state.lastNode = switchId;
        return bodyEnd + 1;
    }

    private void emitStatement(FunctionScope fn, SourceLine line, LineAnalysis analysis, BlockState state, int depth) {
        NodeKind kind = analysis.kind().nodeKind() == NodeKind.LOOP ? NodeKind.STATEMENT : analysis.kind().nodeKind();
        if (kind == NodeKind.CONDITION) kind = NodeKind.STATEMENT;
        NodeMetadata metadata = analysis.call() && analysis.calledName() != null
                ? NodeMetadata.forCall(analysis.calledName())
                : null;
        String id = emit(fn, kind, analysis.label(), line, state, depth, metadata);

        FunctionScope callee = ctx.resolveCalls() ? ctx.builtFunction(analysis.calledName()) : null;
        if (analysis.call() && callee != null && callee != fn && callee.getEntryNodeId() != null) {
            ctx.addEdge(id, callee.getEntryNodeId(), EdgeCondition.CALL, "calls", EdgeCategory.CALL);
        }
    }

    /** Creates a node, wires it from the whole frontier and makes it the only frontier entry. */
    private String emit(FunctionScope fn, NodeKind kind, String label, SourceLine line, BlockState state,
                        int depth, NodeMetadata metadata) {
        String id = ctx.addNode(kind, label, line.number(), line.text(), fn.getEntryNodeId(), depth, fn.getKey(), metadata);
        for (PendingEdge p : state.frontier) {
            ctx.addEdge(p, id);
        }
        state.frontier = new ArrayList<>(List.of(PendingEdge.plain(id)));
        state.lastNode = id;
        return id;
    }

    private static List<Frame> push(List<Frame> frames, Frame frame) {
        List<Frame> result = new ArrayList<>(frames.size() + 1);
        result.add(frame);
        result.addAll(frames);
        return List.copyOf(result);
    }

    private static Frame innermostLoop(List<Frame> frames) {
        for (Frame f : frames) {
            if (f.loop()) return f;
        }
        return null;
    }

    static boolean isSkippable(SourceLine line) {
        String text = line.text();
        if (text.isEmpty() || text.startsWith("}") || PUNCTUATION.contains(text)) return true;
        if (ScopeDetector.isComment(text)) return true;
        if (text.startsWith("\"\"\"") || text.startsWith("'''")) return true;
        if (IMPORT.matcher(text).find() || ANNOTATION.matcher(text).find()) return true;
        return ORPHAN_CONTINUATION.matcher(text).find();
    }
}
