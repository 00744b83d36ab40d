package com.raditha.metaast.cfg;

import com.raditha.metaast.model.MetaNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A node of a control flow graph.
 *
 * @param id           position in {@link ControlFlowGraph#nodes()}
 * @param kind         node kind
 * @param label        short description, usually the tree kind or construct keyword
 * @param fragment     tree fragment the node stands for; the condition of a branch,
 *                     the header of a loop, none for entry, exit and merge nodes
 * @param predecessors ids of nodes with an edge into this one
 * @param successors   ids of nodes this one has an edge to
 */
public record CfgNode(
        int id,
        CfgNodeKind kind,
        String label,
        @Nullable MetaNode fragment,
        List<Integer> predecessors,
        List<Integer> successors) {

    public CfgNode {
        predecessors = List.copyOf(predecessors);
        successors = List.copyOf(successors);
    }
}
