package com.raditha.metaast.cfg;

import java.util.List;
import java.util.Set;

/**
 * Summary of a control flow graph.
 *
 * @param graph            the analyzed graph
 * @param nodeCount        number of nodes
 * @param edgeCount        number of edges
 * @param entryNode        id of the entry node
 * @param exitNodes        ids of exit nodes
 * @param reachableNodes   ids reachable from the entry node, in ascending order
 * @param unreachableNodes the remaining ids, in ascending order
 * @param hasCycles        whether any path revisits a node
 */
public record ControlFlowResult(
        ControlFlowGraph graph,
        int nodeCount,
        int edgeCount,
        int entryNode,
        List<Integer> exitNodes,
        Set<Integer> reachableNodes,
        Set<Integer> unreachableNodes,
        boolean hasCycles) {

    public ControlFlowResult {
        exitNodes = List.copyOf(exitNodes);
    }

    public boolean hasDeadCode() {
        return !unreachableNodes.isEmpty();
    }
}
