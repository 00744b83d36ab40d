package com.raditha.metaast.fingerprint;

import com.raditha.metaast.model.*;
import com.raditha.metaast.tree.TreeWalker;

import java.util.Map;

/**
 * Writes a tree as a flat pre-order sequence of node headers.
 * <p>
 * Each header names the node kind followed by every kind-specific attribute,
 * the sizes of its child lists and the presence of its optional children, so
 * the sequence determines the tree shape without closing markers.
 * <p>
 * In {@link Mode#NORMALIZED} mode identifier names and literal values are
 * replaced by placeholders for their role, and node metadata is left out.
 * Literal subtypes, operators and all structural tags are kept in both modes.
 */
public class TreeSerializer extends TreeWalker {

    public enum Mode {
        EXACT,
        NORMALIZED
    }

    static final String VARIABLE = "$var";
    static final String LITERAL = "$lit";
    static final String FUNCTION = "$fn";
    static final String PARAM = "$param";
    static final String CONTAINER = "$name";
    static final String ATTRIBUTE = "$attr";
    static final String PROPERTY = "$prop";
    static final String NATIVE = "$native";

    private final Mode mode;
    private final StringBuilder out = new StringBuilder();

    public TreeSerializer(Mode mode) {
        this.mode = mode;
    }

    /**
     * Serialize a tree in the given mode.
     */
    public static String serialize(MetaNode root, Mode mode) {
        TreeSerializer serializer = new TreeSerializer(mode);
        serializer.walk(root);
        return serializer.out.toString();
    }

    private boolean exact() {
        return mode == Mode.EXACT;
    }

    private String name(String value, String placeholder) {
        return exact() ? quote(value) : placeholder;
    }

    private static String quote(Object value) {
        if (value == null) {
            return "nil";
        }
        return "\"" + value.toString().replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String flag(Object child, String name) {
        return child == null ? "no_" + name : name;
    }

    private static String tag(Enum<?> value) {
        return value == null ? "nil" : value.name().toLowerCase(java.util.Locale.ROOT);
    }

    private Void header(MetaNode node, Object... attributes) {
        out.append(node.kind().tag()).append('(');
        for (int i = 0; i < attributes.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(attributes[i]);
        }
        out.append(')');
        if (exact()) {
            appendMeta(node.meta());
        }
        out.append(';');
        return descend(node);
    }

    private void appendMeta(NodeMeta meta) {
        boolean open = false;
        for (Map.Entry<String, Object> entry : meta.attributes().entrySet()) {
            if (NodeMeta.LOCATION_KEYS.contains(entry.getKey())) {
                continue;
            }
            out.append(open ? ',' : '{');
            open = true;
            out.append(entry.getKey()).append('=').append(quote(entry.getValue()));
        }
        if (open) {
            out.append('}');
        }
    }

    @Override
    public Void visitLiteral(Literal node) {
        return header(node, tag(node.type()), exact() ? node.render() : LITERAL);
    }

    @Override
    public Void visitVariable(Variable node) {
        return header(node, name(node.name(), VARIABLE));
    }

    @Override
    public Void visitList(ListExpr node) {
        return header(node, node.elements().size());
    }

    @Override
    public Void visitMap(MapExpr node) {
        return header(node, node.entries().size());
    }

    @Override
    public Void visitPair(PairExpr node) {
        return header(node);
    }

    @Override
    public Void visitTuple(TupleExpr node) {
        return header(node, node.elements().size());
    }

    @Override
    public Void visitBinaryOp(BinaryOp node) {
        return header(node, tag(node.category()), node.operator());
    }

    @Override
    public Void visitUnaryOp(UnaryOp node) {
        return header(node, tag(node.category()), node.operator());
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        return header(node, name(node.name(), FUNCTION), node.arguments().size());
    }

    @Override
    public Void visitConditional(Conditional node) {
        return header(node, flag(node.elseBranch(), "else"));
    }

    @Override
    public Void visitEarlyReturn(EarlyReturn node) {
        return header(node, flag(node.value(), "value"));
    }

    @Override
    public Void visitBlock(Block node) {
        return header(node, node.statements().size());
    }

    @Override
    public Void visitAssignment(Assignment node) {
        return header(node);
    }

    @Override
    public Void visitInlineMatch(InlineMatch node) {
        return header(node);
    }

    @Override
    public Void visitLoop(Loop node) {
        return header(node, tag(node.type()),
                flag(node.iterator(), "iterator"),
                flag(node.collection(), "collection"),
                flag(node.condition(), "condition"));
    }

    @Override
    public Void visitLambda(Lambda node) {
        return header(node, "params=" + node.params().size(), "body=" + node.body().size());
    }

    @Override
    public Void visitCollectionOp(CollectionOp node) {
        return header(node, tag(node.type()), flag(node.initial(), "initial"));
    }

    @Override
    public Void visitPatternMatch(PatternMatch node) {
        return header(node, "arms=" + node.arms().size());
    }

    @Override
    public Void visitMatchArm(MatchArm node) {
        return header(node, flag(node.pattern(), "pattern"), flag(node.guard(), "guard"),
                "body=" + node.body().size());
    }

    @Override
    public Void visitExceptionHandling(ExceptionHandling node) {
        return header(node, "handlers=" + node.handlers().size(), flag(node.elseBlock(), "else"));
    }

    @Override
    public Void visitAsyncOperation(AsyncOperation node) {
        return header(node, tag(node.type()));
    }

    @Override
    public Void visitContainer(Container node) {
        return header(node, tag(node.type()), name(node.name(), CONTAINER), "body=" + node.body().size());
    }

    @Override
    public Void visitFunctionDef(FunctionDef node) {
        return header(node, name(node.name(), FUNCTION), tag(node.visibility()),
                "params=" + node.params().size(), flag(node.guard(), "guard"), "body=" + node.body().size());
    }

    @Override
    public Void visitParam(Param node) {
        return header(node, name(node.name(), PARAM), flag(node.pattern(), "pattern"),
                flag(node.defaultValue(), "default"));
    }

    @Override
    public Void visitAttributeAccess(AttributeAccess node) {
        return header(node, name(node.attribute(), ATTRIBUTE));
    }

    @Override
    public Void visitAugmentedAssignment(AugmentedAssignment node) {
        return header(node, node.operator());
    }

    @Override
    public Void visitProperty(Property node) {
        return header(node, name(node.name(), PROPERTY), flag(node.getter(), "getter"), flag(node.setter(), "setter"));
    }

    @Override
    public Void visitLanguageSpecific(LanguageSpecific node) {
        if (exact()) {
            return header(node, quote(node.language()), quote(node.hint()), quote(node.payload()),
                    "body=" + node.body().size());
        }
        return header(node, quote(node.hint()), NATIVE, "body=" + node.body().size());
    }
}
