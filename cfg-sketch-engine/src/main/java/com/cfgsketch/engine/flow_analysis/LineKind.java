package com.cfgsketch.engine.flow_analysis;

import com.cfgsketch.engine.graph.CfgModel.NodeKind;

/**
 * Semantic kind of a single source line, as decided by {@link LineClassifier}.
 */
public enum LineKind {
    IF(NodeKind.CONDITION),
    GUARD(NodeKind.CONDITION),
    WHEN(NodeKind.CONDITION),
    ELSE(NodeKind.CONDITION),
    TERNARY(NodeKind.CONDITION),
    LOOP(NodeKind.LOOP),
    ITERATION(NodeKind.LOOP),
    RETURN(NodeKind.RETURN),
    THROW(NodeKind.THROW),
    YIELD(NodeKind.STATEMENT),
    BREAK(NodeKind.STATEMENT),
    CONTINUE(NodeKind.STATEMENT),
    TRY(NodeKind.STATEMENT),
    CATCH(NodeKind.CONDITION),
    FINALLY(NodeKind.STATEMENT),
    SWITCH(NodeKind.CONDITION),
    CASE(NodeKind.CONDITION),
    DEFAULT(NodeKind.CONDITION),
    AWAIT(NodeKind.STATEMENT),
    DECLARATION(NodeKind.STATEMENT),
    CALL(NodeKind.STATEMENT),
    ASSERTION(NodeKind.CONDITION),
    LOG(NodeKind.STATEMENT),
    STATEMENT(NodeKind.STATEMENT);

    private final NodeKind nodeKind;

    LineKind(NodeKind nodeKind) {
        this.nodeKind = nodeKind;
    }

    /** The node kind this line would carry in a graph. */
    public NodeKind nodeKind() {
        return nodeKind;
    }
}
