package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A named function or method definition.
 *
 * @param name       function name
 * @param params     declared parameters
 * @param visibility visibility, public when not given
 * @param guard      optional guard expression
 * @param body       body statements
 * @param meta       node metadata
 */
public record FunctionDef(
        String name,
        List<Param> params,
        Visibility visibility,
        @Nullable MetaNode guard,
        List<MetaNode> body,
        NodeMeta meta) implements MetaNode {

    public FunctionDef {
        params = NodeLists.copy(params);
        body = NodeLists.copy(body);
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
        meta = NodeMeta.orEmpty(meta);
    }

    public FunctionDef(String name, List<Param> params, List<MetaNode> body) {
        this(name, params, Visibility.PUBLIC, null, body, NodeMeta.EMPTY);
    }

    /**
     * The body as a single block.
     */
    public Block bodyBlock() {
        return new Block(body, meta);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_DEF;
    }

    @Override
    public List<MetaNode> children() {
        return NodeLists.of(params, guard, body);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }
}
