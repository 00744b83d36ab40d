package com.raditha.metaast.cfg;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable control flow graph. Node ids are indexes into {@link #nodes()}.
 */
public record ControlFlowGraph(List<CfgNode> nodes, List<CfgEdge> edges, int entry, List<Integer> exits) {

    public ControlFlowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        exits = List.copyOf(exits);
    }

    public CfgNode node(int id) {
        return nodes.get(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Plain data export: {@code nodes} with id, kind, label and successors,
     * and {@code edges} with from, to and label.
     */
    public Map<String, Object> toMap() {
        List<Map<String, Object>> nodeList = new ArrayList<>();
        for (CfgNode node : nodes) {
            Map<String, Object> entryMap = new LinkedHashMap<>();
            entryMap.put("id", node.id());
            entryMap.put("kind", node.kind().tag());
            entryMap.put("label", node.label());
            entryMap.put("successors", node.successors());
            nodeList.add(entryMap);
        }
        List<Map<String, Object>> edgeList = new ArrayList<>();
        for (CfgEdge edge : edges) {
            Map<String, Object> edgeMap = new LinkedHashMap<>();
            edgeMap.put("from", edge.from());
            edgeMap.put("to", edge.to());
            edgeMap.put("label", edge.label().tag());
            edgeList.add(edgeMap);
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("entry", entry);
        map.put("exits", exits);
        map.put("nodes", nodeList);
        map.put("edges", edgeList);
        return map;
    }
}
