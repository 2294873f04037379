package com.cfgsketch.engine.flow_analysis;

import java.util.List;

/**
 * Result of one {@link ScopeDetector} scan. Both lists are in source order.
 */
public record Scopes(List<ClassScope> classes, List<FunctionScope> functions) {

    public Scopes {
        classes = List.copyOf(classes);
        functions = List.copyOf(functions);
    }
}
