package com.raditha.metaast.cfg;

import com.raditha.metaast.model.*;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a control flow graph from a tree.
 * <p>
 * Construction threads a frontier through the statements: the list of
 * dangling exits that the next node is connected from. An early return
 * empties the frontier, so statements after it get no predecessors and show
 * up as unreachable. Every loop gets a back edge, so a loop always forms a
 * cycle.
 * <p>
 * A root function definition or container is built from its body. Nested
 * containers are built inline. Nested functions, lambdas and native constructs
 * with a body are code units: each one hangs off the statement that holds it,
 * keeps its own returns and ends in its own exit node.
 * <p>
 * Construction runs on an explicit stack of frames, one per statement being
 * built, and only follows statement nesting.
 */
public class ControlFlowBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowBuilder.class);

    public ControlFlowGraph build(MetaNode tree) {
        Construction construction = new Construction();
        ControlFlowGraph graph = construction.run(tree);
        logger.debug("Built control flow graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Functions, lambdas and native constructs with a body found in a fragment,
     * in pre-order. The search does not look inside the units it finds.
     */
    static List<MetaNode> nestedUnits(@Nullable MetaNode fragment) {
        List<MetaNode> units = new ArrayList<>();
        if (fragment == null) {
            return units;
        }
        Deque<MetaNode> stack = new ArrayDeque<>();
        stack.push(fragment);
        while (!stack.isEmpty()) {
            MetaNode node = stack.pop();
            if (isUnit(node)) {
                units.add(node);
                continue;
            }
            List<MetaNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return units;
    }

    private static boolean isUnit(MetaNode node) {
        return node instanceof FunctionDef
                || node instanceof Lambda
                || node instanceof LanguageSpecific specific && !specific.body().isEmpty();
    }

    private record Exit(int node, EdgeLabel label) {
    }

    private record Edge(int from, int to) {
    }

    private static final class PendingNode {
        private final CfgNodeKind kind;
        private final String label;
        private final @Nullable MetaNode fragment;
        private final List<Integer> predecessors = new ArrayList<>();
        private final List<Integer> successors = new ArrayList<>();
        // chained from a frontier holding a reached node; loop bodies count from their header
        private boolean reached;

        PendingNode(CfgNodeKind kind, String label, @Nullable MetaNode fragment) {
            this.kind = kind;
            this.label = label;
            this.fragment = fragment;
        }
    }

    /**
     * One pending piece of construction. The driver calls {@link #resume} with
     * {@code null} first and afterwards with the result of the child frame that
     * just finished.
     */
    private abstract static class Frame {
        int stage;
        List<Exit> result = List.of();

        /**
         * @return the next child frame to run, or {@code null} once {@link #result} is final
         */
        abstract @Nullable Frame resume(@Nullable List<Exit> childResult);
    }

    /**
     * State of one build.
     */
    private static final class Construction {
        private final List<PendingNode> nodes = new ArrayList<>();
        private final List<CfgEdge> edges = new ArrayList<>();
        private final Set<Edge> seen = new HashSet<>();
        private final List<Integer> unitExits = new ArrayList<>();
        private List<Integer> returns = new ArrayList<>();

        ControlFlowGraph run(MetaNode tree) {
            int entry = addNode(CfgNodeKind.ENTRY, "entry", null);
            nodes.get(entry).reached = true;
            List<Exit> frontier = List.of(new Exit(entry, EdgeLabel.SEQUENTIAL));

            Frame root;
            if (tree instanceof FunctionDef function) {
                root = new SequenceFrame(function.body(), frontier);
            } else if (tree instanceof Container container) {
                root = new SequenceFrame(container.body(), frontier);
            } else {
                root = statement(tree, frontier);
            }
            frontier = drive(root);

            int exit = addNode(CfgNodeKind.EXIT, "exit", null);
            connect(frontier, exit);
            for (int ret : returns) {
                connect(ret, exit, EdgeLabel.RETURN);
            }

            List<CfgNode> built = new ArrayList<>(nodes.size());
            for (int i = 0; i < nodes.size(); i++) {
                PendingNode node = nodes.get(i);
                built.add(new CfgNode(i, node.kind, node.label, node.fragment, node.predecessors, node.successors));
            }
            List<Integer> exits = new ArrayList<>();
            exits.add(exit);
            exits.addAll(unitExits);
            return new ControlFlowGraph(built, edges, entry, exits);
        }

        private List<Exit> drive(Frame root) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(root);
            List<Exit> last = null;
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                Frame child = frame.resume(last);
                if (child == null) {
                    stack.pop();
                    last = frame.result;
                } else {
                    stack.push(child);
                    last = null;
                }
            }
            return last;
        }

        private int addNode(CfgNodeKind kind, String label, @Nullable MetaNode fragment) {
            nodes.add(new PendingNode(kind, label, fragment));
            return nodes.size() - 1;
        }

        private void connect(int from, int to, EdgeLabel label) {
            if (seen.add(new Edge(from, to))) {
                edges.add(new CfgEdge(from, to, label));
                nodes.get(from).successors.add(to);
                nodes.get(to).predecessors.add(from);
            }
        }

        private void connect(List<Exit> frontier, int to) {
            for (Exit exit : frontier) {
                connect(exit.node(), to, exit.label());
            }
        }

        private int chain(List<Exit> frontier, CfgNodeKind kind, String label, @Nullable MetaNode fragment) {
            int id = addNode(kind, label, fragment);
            connect(frontier, id);
            for (Exit exit : frontier) {
                if (nodes.get(exit.node()).reached) {
                    nodes.get(id).reached = true;
                    break;
                }
            }
            return id;
        }

        private List<Exit> merge(List<Exit> joined) {
            if (joined.isEmpty()) {
                return List.of();
            }
            int merge = chain(joined, CfgNodeKind.STATEMENT, "merge", null);
            return List.of(new Exit(merge, EdgeLabel.SEQUENTIAL));
        }

        private Frame statement(@Nullable MetaNode node, List<Exit> frontier) {
            if (node == null) {
                return new DoneFrame(frontier);
            } else if (node instanceof Block block) {
                return new SequenceFrame(block.statements(), frontier);
            } else if (node instanceof Conditional conditional) {
                return new ConditionalFrame(conditional, frontier);
            } else if (node instanceof Loop loop) {
                return new LoopFrame(loop, frontier);
            } else if (node instanceof ExceptionHandling handling) {
                return new TryFrame(handling, frontier);
            } else if (node instanceof PatternMatch match) {
                return new MatchFrame(match, frontier);
            } else if (node instanceof Container container) {
                return new ContainerFrame(container, frontier);
            }
            return new SimpleFrame(node, frontier);
        }

        private final class DoneFrame extends Frame {
            DoneFrame(List<Exit> frontier) {
                result = frontier;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                return null;
            }
        }

        private final class SequenceFrame extends Frame {
            private final List<? extends MetaNode> statements;

            SequenceFrame(List<? extends MetaNode> statements, List<Exit> frontier) {
                this.statements = statements;
                this.result = frontier;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                if (childResult != null) {
                    result = childResult;
                }
                if (stage < statements.size()) {
                    return statement(statements.get(stage++), result);
                }
                return null;
            }
        }

        /**
         * Builds every code unit inside an expression fragment, each hanging off {@code from}.
         */
        private final class UnitsFrame extends Frame {
            private final List<MetaNode> units;
            private final int from;

            UnitsFrame(@Nullable MetaNode fragment, int from) {
                this.units = nestedUnits(fragment);
                this.from = from;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                return stage < units.size() ? new UnitFrame(units.get(stage++), from) : null;
            }
        }

        private final class UnitFrame extends Frame {
            private final MetaNode unit;
            private final int from;
            private List<Integer> outerReturns = List.of();

            UnitFrame(MetaNode unit, int from) {
                this.unit = unit;
                this.from = from;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                if (stage++ == 0) {
                    outerReturns = returns;
                    returns = new ArrayList<>();
                    return new SequenceFrame(body(), List.of(new Exit(from, EdgeLabel.BODY)));
                }
                int exit = addNode(CfgNodeKind.EXIT, "exit " + name(), unit);
                connect(childResult, exit);
                for (int ret : returns) {
                    connect(ret, exit, EdgeLabel.RETURN);
                }
                unitExits.add(exit);
                returns = outerReturns;
                return null;
            }

            private List<MetaNode> body() {
                if (unit instanceof FunctionDef function) {
                    return function.body();
                } else if (unit instanceof Lambda lambda) {
                    return lambda.body();
                }
                return ((LanguageSpecific) unit).body();
            }

            private String name() {
                if (unit instanceof FunctionDef function) {
                    return function.name();
                } else if (unit instanceof LanguageSpecific specific) {
                    return specific.hint();
                }
                return "lambda";
            }
        }

        private final class SimpleFrame extends Frame {
            private final MetaNode node;
            private final List<Exit> frontier;
            private int id;

            SimpleFrame(MetaNode node, List<Exit> frontier) {
                this.node = node;
                this.frontier = frontier;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                if (stage++ == 0) {
                    id = chain(frontier, CfgNodeKind.STATEMENT, node.kind().tag(), node);
                    return new UnitsFrame(node, id);
                }
                if (node instanceof EarlyReturn) {
                    returns.add(id);
                    result = List.of();
                } else {
                    result = List.of(new Exit(id, EdgeLabel.SEQUENTIAL));
                }
                return null;
            }
        }

        private final class ContainerFrame extends Frame {
            private final Container container;
            private final List<Exit> frontier;

            ContainerFrame(Container container, List<Exit> frontier) {
                this.container = container;
                this.frontier = frontier;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                if (stage++ == 0) {
                    int id = chain(frontier, CfgNodeKind.STATEMENT, container.kind().tag(), container);
                    return new SequenceFrame(container.body(), List.of(new Exit(id, EdgeLabel.SEQUENTIAL)));
                }
                result = childResult;
                return null;
            }
        }

        private final class ConditionalFrame extends Frame {
            private final Conditional conditional;
            private final List<Exit> frontier;
            private final List<Exit> joined = new ArrayList<>();
            private int branch;

            ConditionalFrame(Conditional conditional, List<Exit> frontier) {
                this.conditional = conditional;
                this.frontier = frontier;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                switch (stage++) {
                    case 0:
                        branch = chain(frontier, CfgNodeKind.CONDITIONAL, "if", conditional.condition());
                        return new UnitsFrame(conditional.condition(), branch);
                    case 1:
                        return statement(conditional.thenBranch(), List.of(new Exit(branch, EdgeLabel.THEN)));
                    case 2:
                        joined.addAll(childResult);
                        return statement(conditional.elseBranch(), List.of(new Exit(branch, EdgeLabel.ELSE)));
                    default:
                        joined.addAll(childResult);
                        result = merge(joined);
                        return null;
                }
            }
        }

        private final class LoopFrame extends Frame {
            private final Loop loop;
            private final List<Exit> frontier;
            private int header;
            private boolean headerReached;
            private int returnsBefore;

            LoopFrame(Loop loop, List<Exit> frontier) {
                this.loop = loop;
                this.frontier = frontier;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                switch (stage++) {
                    case 0:
                        header = chain(frontier, CfgNodeKind.LOOP, loop.type().tag(), loop.header());
                        return new UnitsFrame(loop.header(), header);
                    case 1:
                        headerReached = nodes.get(header).reached;
                        nodes.get(header).reached = true;
                        returnsBefore = returns.size();
                        return statement(loop.body(), List.of(new Exit(header, EdgeLabel.BODY)));
                    default:
                        boolean closed = false;
                        for (Exit exit : childResult) {
                            connect(exit.node(), header, EdgeLabel.LOOP_BACK);
                            closed |= nodes.get(exit.node()).reached;
                        }
                        if (!closed) {
                            // no path through the body falls off its end: loop back from a reached return
                            connect(firstReachedReturn(), header, EdgeLabel.LOOP_BACK);
                        }
                        nodes.get(header).reached = headerReached;
                        result = List.of(new Exit(header, EdgeLabel.EXIT));
                        return null;
                }
            }

            private int firstReachedReturn() {
                for (int i = returnsBefore; i < returns.size(); i++) {
                    if (nodes.get(returns.get(i)).reached) {
                        return returns.get(i);
                    }
                }
                return header;
            }
        }

        private final class TryFrame extends Frame {
            private final ExceptionHandling handling;
            private final List<Exit> frontier;
            private final List<Exit> raised = new ArrayList<>();
            private final List<Exit> joined = new ArrayList<>();
            private int tryNode;
            private int handler;

            TryFrame(ExceptionHandling handling, List<Exit> frontier) {
                this.handling = handling;
                this.frontier = frontier;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                switch (stage++) {
                    case 0:
                        tryNode = chain(frontier, CfgNodeKind.STATEMENT, "try", null);
                        return statement(handling.tryBlock(), List.of(new Exit(tryNode, EdgeLabel.SEQUENTIAL)));
                    case 1:
                        // handlers can be entered from the start or the end of the protected block
                        raised.add(new Exit(tryNode, EdgeLabel.EXCEPTION));
                        for (Exit exit : childResult) {
                            raised.add(new Exit(exit.node(), EdgeLabel.EXCEPTION));
                        }
                        return statement(handling.elseBlock(), childResult);
                    default:
                        joined.addAll(childResult);
                        if (handler < handling.handlers().size()) {
                            MatchArm arm = handling.handlers().get(handler++);
                            int entry = chain(raised, CfgNodeKind.STATEMENT, "catch", arm.pattern());
                            return new SequenceFrame(arm.body(), List.of(new Exit(entry, EdgeLabel.SEQUENTIAL)));
                        }
                        result = merge(joined);
                        return null;
                }
            }
        }

        private final class MatchFrame extends Frame {
            private final PatternMatch match;
            private final List<Exit> frontier;
            private final List<Exit> joined = new ArrayList<>();
            private int branch;
            private int arm;

            MatchFrame(PatternMatch match, List<Exit> frontier) {
                this.match = match;
                this.frontier = frontier;
            }

            @Override
            @Nullable Frame resume(@Nullable List<Exit> childResult) {
                if (stage++ == 0) {
                    branch = chain(frontier, CfgNodeKind.CONDITIONAL, "case", match.scrutinee());
                    return new UnitsFrame(match.scrutinee(), branch);
                }
                if (stage > 2) {
                    joined.addAll(childResult);
                }
                if (arm < match.arms().size()) {
                    List<MetaNode> body = match.arms().get(arm++).body();
                    return new SequenceFrame(body, List.of(new Exit(branch, EdgeLabel.ARM)));
                }
                if (match.arms().isEmpty()) {
                    joined.add(new Exit(branch, EdgeLabel.SEQUENTIAL));
                }
                result = merge(joined);
                return null;
            }
        }
    }
}
