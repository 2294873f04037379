package com.cfgsketch.engine.flow_analysis;

import java.util.List;

/**
 * Outcome of building one line range.
 *
 * @param lastNode  last node emitted in the range, or null if none
 * @param pending   fall-through edges still waiting for a successor
 * @param breaks    break nodes waiting for the end of their enclosing loop or switch
 * @param hasReturn whether a return or throw occurred anywhere in the range
 */
public record BlockResult(String lastNode, List<PendingEdge> pending, List<String> breaks, boolean hasReturn) {

    public BlockResult {
        pending = List.copyOf(pending);
        breaks = List.copyOf(breaks);
    }
}
