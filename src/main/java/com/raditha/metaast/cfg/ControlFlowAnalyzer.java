package com.raditha.metaast.cfg;

import com.raditha.metaast.document.Document;
import com.raditha.metaast.document.DocumentAnalyzer;
import com.raditha.metaast.model.MetaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds control flow graphs and computes reachability and cycles.
 * Both traversals use explicit stacks.
 */
public class ControlFlowAnalyzer implements DocumentAnalyzer<ControlFlowResult> {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowAnalyzer.class);

    private final ControlFlowBuilder builder;

    public ControlFlowAnalyzer() {
        this(new ControlFlowBuilder());
    }

    public ControlFlowAnalyzer(ControlFlowBuilder builder) {
        this.builder = builder;
    }

    @Override
    public ControlFlowResult analyze(Document document) {
        return analyze(document.ast());
    }

    public ControlFlowResult analyze(MetaNode tree) {
        return analyze(builder.build(tree));
    }

    public ControlFlowResult analyze(ControlFlowGraph graph) {
        Set<Integer> reachable = reachable(graph);
        Set<Integer> unreachable = new TreeSet<>();
        for (CfgNode node : graph.nodes()) {
            if (!reachable.contains(node.id())) {
                unreachable.add(node.id());
            }
        }
        boolean cycles = hasCycles(graph);
        if (!unreachable.isEmpty()) {
            logger.debug("Unreachable nodes: {}", unreachable);
        }
        return new ControlFlowResult(
                graph,
                graph.nodeCount(),
                graph.edgeCount(),
                graph.entry(),
                graph.exits(),
                Collections.unmodifiableSet(reachable),
                Collections.unmodifiableSet(unreachable),
                cycles);
    }

    /**
     * Breadth-first search from the entry node.
     */
    public Set<Integer> reachable(ControlFlowGraph graph) {
        Set<Integer> visited = new TreeSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(graph.entry());
        visited.add(graph.entry());
        while (!queue.isEmpty()) {
            int id = queue.poll();
            for (int successor : graph.node(id).successors()) {
                if (visited.add(successor)) {
                    queue.add(successor);
                }
            }
        }
        return visited;
    }

    /**
     * Depth-first search over every node keeping the current path on a stack;
     * a successor already on the path closes a cycle.
     */
    public boolean hasCycles(ControlFlowGraph graph) {
        int n = graph.nodeCount();
        boolean[] visited = new boolean[n];
        boolean[] onPath = new boolean[n];

        for (int start = 0; start < n; start++) {
            if (visited[start]) {
                continue;
            }
            // each frame is {node, index of next successor to try}
            Deque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[]{start, 0});
            visited[start] = true;
            onPath[start] = true;

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<Integer> successors = graph.node(frame[0]).successors();
                if (frame[1] < successors.size()) {
                    int next = successors.get(frame[1]++);
                    if (onPath[next]) {
                        return true;
                    }
                    if (!visited[next]) {
                        visited[next] = true;
                        onPath[next] = true;
                        stack.push(new int[]{next, 0});
                    }
                } else {
                    onPath[frame[0]] = false;
                    stack.pop();
                }
            }
        }
        return false;
    }
}
