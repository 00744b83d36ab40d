package com.raditha.metaast.model;

import java.util.List;

/**
 * A call of a named function with positional arguments.
 */
public record FunctionCall(String name, List<MetaNode> arguments, NodeMeta meta) implements MetaNode {

    public FunctionCall {
        arguments = NodeLists.copy(arguments);
        meta = NodeMeta.orEmpty(meta);
    }

    public FunctionCall(String name, List<MetaNode> arguments) {
        this(name, arguments, NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_CALL;
    }

    @Override
    public List<MetaNode> children() {
        return arguments;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
