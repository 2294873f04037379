package com.cfgsketch.engine.flow_analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A class, struct or Go struct type found by {@link ScopeDetector}. Line indices are
 * 0-based positions in {@link SourceLines}.
 */
public final class ClassScope {

    /** A declaration in the class body outside any method. */
    public record Property(int index, String name) {}

    private final String name;
    private final int start;
    private final int end;
    private final String parentClass;
    private final List<FunctionScope> methods = new ArrayList<>();
    private final List<Property> properties = new ArrayList<>();

    ClassScope(String name, int start, int end, String parentClass) {
        this.name = name;
        this.start = start;
        this.end = end;
        this.parentClass = parentClass;
    }

    public String getName() { return name; }
    public int getStart() { return start; }
    public int getEnd() { return end; }
    public String getParentClass() { return parentClass; }
    public List<FunctionScope> getMethods() { return Collections.unmodifiableList(methods); }
    public List<Property> getProperties() { return Collections.unmodifiableList(properties); }

    boolean contains(int index) {
        return index > start && index <= end;
    }

    void addMethod(FunctionScope method) {
        methods.add(method);
    }

    void addProperty(Property property) {
        properties.add(property);
    }
}
