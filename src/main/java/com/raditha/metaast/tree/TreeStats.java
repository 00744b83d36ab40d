package com.raditha.metaast.tree;

import com.raditha.metaast.model.Layer;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Shape statistics gathered in one pass over a tree.
 *
 * @param nodeCount   total number of nodes
 * @param depth       longest root-to-leaf path, counted in nodes
 * @param layer       highest conformance layer of any node
 * @param nativeCount number of language-specific nodes
 * @param variables   distinct identifier names in first-seen order
 */
public record TreeStats(int nodeCount, int depth, Layer layer, int nativeCount, Set<String> variables) {

    public TreeStats {
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
    }

    public int variableCount() {
        return variables.size();
    }
}
