package com.cfgsketch.engine.flow_analysis;

/**
 * Classification of one line.
 *
 * @param calledName   callee name when {@code call} is set and a name could be read
 * @param declaredName variable name when {@code declaration} is set
 */
public record LineAnalysis(
        LineKind kind,
        String label,
        boolean blockStart,
        boolean blockEnd,
        boolean call,
        String calledName,
        boolean declaration,
        String declaredName
) {
    static LineAnalysis of(LineKind kind, String label, boolean blockStart, boolean blockEnd) {
        return new LineAnalysis(kind, label, blockStart, blockEnd, false, null, false, null);
    }

    static LineAnalysis call(LineKind kind, String label, boolean blockEnd, String calledName) {
        return new LineAnalysis(kind, label, false, blockEnd, true, calledName, false, null);
    }

    static LineAnalysis declaration(String label, boolean blockEnd, String name) {
        return new LineAnalysis(LineKind.DECLARATION, label, false, blockEnd, false, null, true, name);
    }
}
