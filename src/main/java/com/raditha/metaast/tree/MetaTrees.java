package com.raditha.metaast.tree;

import com.raditha.metaast.model.Layer;
import com.raditha.metaast.model.LanguageSpecific;
import com.raditha.metaast.model.MetaNode;
import com.raditha.metaast.model.Param;
import com.raditha.metaast.model.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Generic traversals over a tree. All of them use an explicit stack.
 */
public final class MetaTrees {

    private MetaTrees() {
    }

    /**
     * All nodes in pre-order.
     */
    public static List<MetaNode> preorder(MetaNode root) {
        List<MetaNode> result = new ArrayList<>();
        Deque<MetaNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            MetaNode node = stack.pop();
            result.add(node);
            List<MetaNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Distinct identifier names referenced anywhere in the tree: variables
     * (which covers loop iterators and pattern bindings) and declared parameters.
     */
    public static Set<String> variables(MetaNode root) {
        Set<String> names = new LinkedHashSet<>();
        for (MetaNode node : preorder(root)) {
            collectName(node, names);
        }
        return Collections.unmodifiableSet(names);
    }

    public static int nodeCount(MetaNode root) {
        return stats(root).nodeCount();
    }

    /**
     * Length of the longest root-to-leaf path. A single leaf has depth 1.
     */
    public static int depth(MetaNode root) {
        return stats(root).depth();
    }

    public static Layer layer(MetaNode root) {
        return stats(root).layer();
    }

    /**
     * Number of {@code language_specific} nodes in the tree.
     */
    public static int nativeCount(MetaNode root) {
        return stats(root).nativeCount();
    }

    /**
     * Compute node count, depth, layer, native node count and variables in one pass.
     */
    public static TreeStats stats(MetaNode root) {
        record Entry(MetaNode node, int depth) {
        }
        Deque<Entry> stack = new ArrayDeque<>();
        stack.push(new Entry(root, 1));

        int count = 0;
        int maxDepth = 0;
        int nativeCount = 0;
        Layer layer = Layer.CORE;
        Set<String> names = new LinkedHashSet<>();

        while (!stack.isEmpty()) {
            Entry entry = stack.pop();
            MetaNode node = entry.node();
            count++;
            maxDepth = Math.max(maxDepth, entry.depth());
            layer = layer.max(node.layer());
            if (node instanceof LanguageSpecific) {
                nativeCount++;
            }
            collectName(node, names);

            List<MetaNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Entry(children.get(i), entry.depth() + 1));
            }
        }
        return new TreeStats(count, maxDepth, layer, nativeCount, names);
    }

    private static void collectName(MetaNode node, Set<String> names) {
        if (node instanceof Variable variable && variable.name() != null) {
            names.add(variable.name());
        } else if (node instanceof Param param && param.name() != null) {
            names.add(param.name());
        }
    }
}
