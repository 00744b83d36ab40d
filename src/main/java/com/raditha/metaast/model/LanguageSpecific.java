package com.raditha.metaast.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Escape hatch for constructs with no language-neutral form.
 * <p>
 * The payload is an opaque fragment of the originating language's tree and is
 * never interpreted by the analyses. The optional body lets an adapter expose
 * nested code that can still be analyzed.
 *
 * @param language originating language
 * @param hint     symbolic description of the construct, e.g. {@code decorator}
 * @param payload  opaque native fragment
 * @param body     analyzable children, possibly empty
 * @param meta     node metadata
 */
public record LanguageSpecific(
        String language,
        String hint,
        @Nullable Object payload,
        List<MetaNode> body,
        NodeMeta meta) implements MetaNode {

    public LanguageSpecific {
        body = NodeLists.copy(body);
        meta = NodeMeta.orEmpty(meta);
    }

    public LanguageSpecific(String language, String hint, @Nullable Object payload) {
        this(language, hint, payload, List.of(), NodeMeta.EMPTY);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LANGUAGE_SPECIFIC;
    }

    @Override
    public List<MetaNode> children() {
        return body;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLanguageSpecific(this);
    }
}
