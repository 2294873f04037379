package com.cfgsketch.engine.flow_analysis;

import java.util.List;

/**
 * A function, method or constructor found by {@link ScopeDetector}.
 * The key, owning class, depth and node ids are filled in after the initial scan.
 */
public final class FunctionScope {

    private final String name;
    private final int header;
    private final int bodyStart;
    private final int end;
    private final boolean async;
    private final List<String> parameters;
    private final List<String> calls;

    private String key;
    private String className;
    private boolean constructor;
    private int depth;
    private String entryNodeId;
    private String exitNodeId;

    FunctionScope(String name, int header, int bodyStart, int end, boolean constructor, boolean async,
                  List<String> parameters, List<String> calls) {
        this.name = name;
        this.key = name;
        this.header = header;
        this.bodyStart = bodyStart;
        this.end = end;
        this.constructor = constructor;
        this.async = async;
        this.parameters = List.copyOf(parameters);
        this.calls = List.copyOf(calls);
    }

    public String getName() { return name; }
    public String getKey() { return key; }
    public int getHeader() { return header; }
    public int getBodyStart() { return bodyStart; }
    public int getEnd() { return end; }
    public String getClassName() { return className; }
    public boolean isConstructor() { return constructor; }
    public boolean isAsync() { return async; }
    public List<String> getParameters() { return parameters; }
    public List<String> getCalls() { return calls; }
    public int getDepth() { return depth; }
    public String getEntryNodeId() { return entryNodeId; }
    public String getExitNodeId() { return exitNodeId; }

    public boolean isMethod() {
        return className != null;
    }

    /** True when {@code index} lies inside this function's header..end range. */
    boolean encloses(int index) {
        return index >= header && index <= end;
    }

    void setKey(String key) { this.key = key; }
    void setClassName(String className) { this.className = className; }
    void setConstructor(boolean constructor) { this.constructor = constructor; }
    void setDepth(int depth) { this.depth = depth; }
    void setEntryNodeId(String entryNodeId) { this.entryNodeId = entryNodeId; }
    void setExitNodeId(String exitNodeId) { this.exitNodeId = exitNodeId; }

    @Override
    public String toString() {
        return "FunctionScope{" + key + " @" + header + ".." + end + "}";
    }
}
