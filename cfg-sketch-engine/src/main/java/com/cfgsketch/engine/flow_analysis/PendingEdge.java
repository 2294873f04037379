package com.cfgsketch.engine.flow_analysis;

import com.cfgsketch.engine.graph.CfgModel.EdgeCondition;

/**
 * An edge whose source is known but whose target is the next node still to be emitted.
 * The condition and label travel with it so a branch keeps its true/false tag
 * across the merge point.
 */
public record PendingEdge(String from, EdgeCondition condition, String label) {

    public static PendingEdge plain(String from) {
        return new PendingEdge(from, null, null);
    }

    public boolean isPlain() {
        return condition == null;
    }
}
