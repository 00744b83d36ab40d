package com.raditha.metaast.fingerprint;

import com.raditha.metaast.model.*;
import com.raditha.metaast.tree.MetaTrees;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural fingerprints and token sequences of trees.
 * <p>
 * The exact fingerprint changes with any identifier name, literal value or
 * metadata attribute. The normalized fingerprint only changes with the shape
 * of the tree, so renamed copies of the same code share it.
 */
public class Fingerprinter {

    private static final String HASH_ALGORITHM = "SHA-256";

    /**
     * Digest of the full serialization.
     */
    public String exact(MetaNode tree) {
        return digest(TreeSerializer.serialize(tree, TreeSerializer.Mode.EXACT));
    }

    /**
     * Digest of the serialization with names and literal values replaced by placeholders.
     */
    public String normalized(MetaNode tree) {
        return digest(TreeSerializer.serialize(tree, TreeSerializer.Mode.NORMALIZED));
    }

    public Fingerprints fingerprints(MetaNode tree) {
        return new Fingerprints(exact(tree), normalized(tree));
    }

    /**
     * One token per node, in pre-order.
     */
    public List<Token> tokens(MetaNode tree) {
        return MetaTrees.preorder(tree).stream()
                .map(Token::of)
                .toList();
    }

    /**
     * Names and literal values in pre-order, each tagged with its role.
     * Two trees with equal normalized fingerprints yield lists of equal length
     * whose entries correspond position by position.
     */
    public List<Identifier> identifiers(MetaNode tree) {
        List<Identifier> result = new ArrayList<>();
        for (MetaNode node : MetaTrees.preorder(tree)) {
            if (node instanceof Variable variable) {
                result.add(new Identifier("variable", variable.name()));
            } else if (node instanceof Literal literal) {
                result.add(new Identifier("literal", literal.render()));
            } else if (node instanceof FunctionCall call) {
                result.add(new Identifier("function", call.name()));
            } else if (node instanceof FunctionDef def) {
                result.add(new Identifier("function", def.name()));
            } else if (node instanceof Param param) {
                result.add(new Identifier("parameter", param.name()));
            } else if (node instanceof Container container) {
                result.add(new Identifier("container", container.name()));
            } else if (node instanceof AttributeAccess access) {
                result.add(new Identifier("attribute", access.attribute()));
            } else if (node instanceof Property property) {
                result.add(new Identifier("property", property.name()));
            }
        }
        return result;
    }

    static String digest(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] bytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(bytes.length * 2);
            for (byte b : bytes) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
        }
    }
}
