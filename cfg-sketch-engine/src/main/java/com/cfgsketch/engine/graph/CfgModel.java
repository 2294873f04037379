package com.cfgsketch.engine.graph;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Objects;

/**
 * Records making up an extracted control-flow graph.
 * Component names use @SerializedName for the JSON snake_case mapping.
 */
public final class CfgModel {

    private CfgModel() {}

    public enum NodeKind {
        @SerializedName("entry")       ENTRY,
        @SerializedName("exit")        EXIT,
        @SerializedName("class")       CLASS,
        @SerializedName("function")    FUNCTION,
        @SerializedName("method")      METHOD,
        @SerializedName("constructor") CONSTRUCTOR,
        @SerializedName("condition")   CONDITION,
        @SerializedName("loop")        LOOP,
        @SerializedName("return")      RETURN,
        @SerializedName("throw")       THROW,
        @SerializedName("statement")   STATEMENT,
        @SerializedName("property")    PROPERTY;

        public boolean isTerminal() {
            return this == RETURN || this == THROW;
        }
    }

    public enum EdgeCondition {
        @SerializedName("true")      TRUE,
        @SerializedName("false")     FALSE,
        @SerializedName("call")      CALL,
        @SerializedName("contains")  CONTAINS,
        @SerializedName("inherits")  INHERITS,
        @SerializedName("iterate")   ITERATE,
        @SerializedName("break")     BREAK,
        @SerializedName("continue")  CONTINUE,
        @SerializedName("exception") EXCEPTION
    }

    public enum EdgeCategory {
        @SerializedName("hierarchy") HIERARCHY,
        @SerializedName("call")      CALL,
        @SerializedName("control")   CONTROL
    }

    /** Optional per-node details; absent flags are null so they drop out of the JSON. */
    public record NodeMetadata(
            @SerializedName("is_async")       Boolean async,
            @SerializedName("is_constructor") Boolean constructor,
            @SerializedName("parameters")     List<String> parameters,
            @SerializedName("class_name")     String className,
            @SerializedName("method_name")    String methodName
    ) {
        public NodeMetadata {
            parameters = parameters == null ? null : List.copyOf(parameters);
        }

        public static NodeMetadata forClass(String className) {
            return new NodeMetadata(null, null, null, className, null);
        }

        public static NodeMetadata forCall(String calledName) {
            return new NodeMetadata(null, null, null, null, calledName);
        }
    }

    public record CfgNode(
            @SerializedName("id")        String id,
            @SerializedName("kind")      NodeKind kind,
            @SerializedName("label")     String label,
            @SerializedName("line")      Integer line,
            @SerializedName("code")      String code,
            @SerializedName("parent_id") String parentId,
            @SerializedName("depth")     int depth,
            @SerializedName("group")     String group,
            @SerializedName("metadata")  NodeMetadata metadata,
            @SerializedName("children")  List<String> children
    ) {
        public CfgNode {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(kind, "kind");
            label = label == null ? "" : label;
            children = children == null ? List.of() : List.copyOf(children);
        }

        public CfgNode withChildren(List<String> childIds) {
            return new CfgNode(id, kind, label, line, code, parentId, depth, group, metadata, childIds);
        }
    }

    public record CfgEdge(
            @SerializedName("from")      String from,
            @SerializedName("to")        String to,
            @SerializedName("condition") EdgeCondition condition,
            @SerializedName("label")     String label,
            @SerializedName("category")  EdgeCategory category
    ) {
        public CfgEdge {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            category = category == null ? EdgeCategory.CONTROL : category;
        }

        public boolean isCall() {
            return condition == EdgeCondition.CALL;
        }
    }

    public record ClassDescriptor(
            @SerializedName("id")           String id,
            @SerializedName("name")         String name,
            @SerializedName("parent_class") String parentClass,
            @SerializedName("methods")      List<String> methods,     // entry node ids
            @SerializedName("properties")   List<String> properties,  // property node ids
            @SerializedName("node_id")      String nodeId
    ) {
        public ClassDescriptor {
            methods = List.copyOf(methods);
            properties = List.copyOf(properties);
        }
    }

    public record FunctionDescriptor(
            @SerializedName("id")           String id,
            @SerializedName("name")         String name,
            @SerializedName("class_name")   String className,
            @SerializedName("node_id")      String nodeId,
            @SerializedName("exit_node_id") String exitNodeId,
            @SerializedName("calls")        List<String> calls
    ) {
        public static final String ID_PREFIX = "func_";

        public FunctionDescriptor {
            calls = List.copyOf(calls);
        }

        /** The unique function key ({@code Class.method}, or the bare name) this descriptor was built from. */
        public String key() {
            return id.startsWith(ID_PREFIX) ? id.substring(ID_PREFIX.length()) : id;
        }
    }
}
