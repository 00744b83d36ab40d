package com.raditha.metaast;

import com.raditha.metaast.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded tree generator for property tests.
 * <p>
 * The shape of a generated tree depends only on the seed, so two generators
 * with the same seed but different name prefixes or literal offsets produce
 * trees that differ only by a consistent renaming.
 */
public final class RandomTrees {

    private final Random random;
    private final String prefix;
    private final long literalOffset;
    private final boolean loops;
    private final boolean units;

    public RandomTrees(long seed, String prefix, long literalOffset, boolean loops) {
        this(seed, prefix, literalOffset, loops, false);
    }

    /**
     * @param units also wrap statements in nested functions, classes and lambdas
     */
    public RandomTrees(long seed, String prefix, long literalOffset, boolean loops, boolean units) {
        this.random = new Random(seed);
        this.prefix = prefix;
        this.literalOffset = literalOffset;
        this.loops = loops;
        this.units = units;
    }

    /**
     * Statement tree with loops.
     */
    public static MetaNode statement(long seed) {
        return new RandomTrees(seed, "v", 0, true).statement(4);
    }

    /**
     * Statement tree without any loop.
     */
    public static MetaNode loopFreeStatement(long seed) {
        return new RandomTrees(seed, "v", 0, false).statement(4);
    }

    /**
     * Statement tree with loops, nested functions, classes and lambdas.
     */
    public static MetaNode nestedStatement(long seed) {
        return new RandomTrees(seed, "v", 0, true, true).statement(4);
    }

    /**
     * Statement tree with nested functions, classes and lambdas but no loop.
     */
    public static MetaNode nestedLoopFreeStatement(long seed) {
        return new RandomTrees(seed, "v", 0, false, true).statement(4);
    }

    private String name() {
        return prefix + random.nextInt(4);
    }

    private Literal literal() {
        return Literal.integer(random.nextInt(10) + literalOffset);
    }

    public MetaNode expression(int depth) {
        int choice = depth <= 0 ? random.nextInt(2) : random.nextInt(6);
        return switch (choice) {
            case 0 -> new Variable(name());
            case 1 -> literal();
            case 2 -> BinaryOp.arithmetic(random.nextBoolean() ? "+" : "*", expression(depth - 1), expression(depth - 1));
            case 3 -> random.nextBoolean()
                    ? BinaryOp.and(expression(depth - 1), expression(depth - 1))
                    : BinaryOp.or(expression(depth - 1), expression(depth - 1));
            case 4 -> BinaryOp.comparison("<", expression(depth - 1), expression(depth - 1));
            default -> {
                int count = random.nextInt(3);
                List<MetaNode> args = new ArrayList<>();
                for (int i = 0; i < count; i++) {
                    args.add(expression(depth - 1));
                }
                yield new FunctionCall(prefix + "fn" + random.nextInt(3), args);
            }
        };
    }

    public MetaNode statement(int depth) {
        if (depth <= 0) {
            return new Assignment(new Variable(name()), expression(0));
        }
        int choice = random.nextInt(8 + (loops ? 1 : 0) + (units ? 3 : 0));
        if (choice >= 8 && !loops) {
            choice++;
        }
        return switch (choice) {
            case 0 -> new Assignment(new Variable(name()), expression(depth - 1));
            case 1 -> new AugmentedAssignment("+=", new Variable(name()), expression(depth - 1));
            case 2 -> new EarlyReturn(expression(depth - 1));
            case 3 -> new Conditional(expression(depth - 1), statement(depth - 1),
                    random.nextBoolean() ? statement(depth - 1) : null);
            case 4 -> {
                int count = 1 + random.nextInt(3);
                List<MetaNode> statements = new ArrayList<>();
                for (int i = 0; i < count; i++) {
                    statements.add(statement(depth - 1));
                }
                yield new Block(statements);
            }
            case 5 -> {
                int count = 1 + random.nextInt(2);
                List<MatchArm> handlers = new ArrayList<>();
                for (int i = 0; i < count; i++) {
                    handlers.add(new MatchArm(new Variable(name()), List.of(statement(depth - 1))));
                }
                yield new ExceptionHandling(statement(depth - 1), handlers,
                        random.nextBoolean() ? statement(depth - 1) : null);
            }
            case 6 -> {
                int count = 1 + random.nextInt(3);
                List<MatchArm> arms = new ArrayList<>();
                for (int i = 0; i < count; i++) {
                    arms.add(new MatchArm(literal(), List.of(statement(depth - 1))));
                }
                yield new PatternMatch(expression(depth - 1), arms);
            }
            case 7 -> new FunctionCall(prefix + "fn" + random.nextInt(3), List.of(expression(depth - 1)));
            case 8 -> random.nextBoolean()
                    ? Loop.whileLoop(expression(depth - 1), statement(depth - 1))
                    : Loop.forEach(new Variable(name()), new Variable(name()), statement(depth - 1));
            case 9 -> new FunctionDef(prefix + "f" + random.nextInt(3), List.of(new Param(name())),
                    List.of(statement(depth - 1)));
            case 10 -> new Container(ContainerType.CLASS, prefix + "C" + random.nextInt(3),
                    List.of(statement(depth - 1)));
            default -> new FunctionCall(prefix + "fn" + random.nextInt(3),
                    List.of(new Lambda(List.of(new Param(name())), List.of(statement(depth - 1)))));
        };
    }
}
