package com.raditha.metaast.report;

import com.raditha.metaast.cfg.CfgEdge;
import com.raditha.metaast.cfg.CfgNode;
import com.raditha.metaast.cfg.ControlFlowResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders control flow results.
 */
public class ControlFlowReporter {

    public String format(ControlFlowResult result, ReportFormat format) {
        return switch (format) {
            case TEXT -> formatText(result);
            case JSON -> JsonWriter.write(toMap(result));
            case DETAILED -> formatDetailed(result);
        };
    }

    private String formatText(ControlFlowResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Control Flow Analysis Results:\n\n");
        sb.append("Nodes: ").append(result.nodeCount()).append("\n");
        sb.append("Edges: ").append(result.edgeCount()).append("\n");
        sb.append("Entry Node: ").append(result.entryNode()).append("\n");
        sb.append("Exit Nodes: ").append(result.exitNodes()).append("\n");
        sb.append("Reachable Nodes: ").append(result.reachableNodes().size()).append("\n");
        sb.append("Unreachable Nodes: ").append(result.unreachableNodes().size());
        if (result.hasDeadCode()) {
            sb.append(" [WARNING]");
        }
        sb.append("\n");
        sb.append("Has Cycles: ").append(result.hasCycles() ? "yes" : "no");
        return sb.toString();
    }

    private String formatDetailed(ControlFlowResult result) {
        StringBuilder sb = new StringBuilder(formatText(result));
        sb.append("\n\nNodes:");
        for (CfgNode node : result.graph().nodes()) {
            sb.append(String.format("\n  %d %s (%s) -> %s",
                    node.id(), node.kind().tag(), node.label(), node.successors()));
            if (result.unreachableNodes().contains(node.id())) {
                sb.append(" [UNREACHABLE]");
            }
        }
        sb.append("\n\nEdges:");
        for (CfgEdge edge : result.graph().edges()) {
            sb.append(String.format("\n  %d -> %d [%s]", edge.from(), edge.to(), edge.label().tag()));
        }
        return sb.toString();
    }

    Map<String, Object> toMap(ControlFlowResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("node_count", result.nodeCount());
        map.put("edge_count", result.edgeCount());
        map.put("entry_node", result.entryNode());
        map.put("exit_nodes", result.exitNodes());
        map.put("reachable_nodes", result.reachableNodes());
        map.put("unreachable_nodes", result.unreachableNodes());
        map.put("has_cycles", result.hasCycles());
        map.put("graph", result.graph().toMap());
        return map;
    }
}
