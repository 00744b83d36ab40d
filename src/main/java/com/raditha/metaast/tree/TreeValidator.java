package com.raditha.metaast.tree;

import com.raditha.metaast.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a tree is well formed and within configured limits.
 * <p>
 * Hard limits and shape violations throw {@link ValidationException}; soft
 * thresholds only attach warnings to the returned report.
 */
public class TreeValidator {

    private static final Logger logger = LoggerFactory.getLogger(TreeValidator.class);

    private final ValidationOptions options;

    public TreeValidator() {
        this(ValidationOptions.defaults());
    }

    public TreeValidator(ValidationOptions options) {
        this.options = options;
    }

    /**
     * Validate a tree.
     *
     * @param root tree to check
     * @return report with shape statistics and warnings
     * @throws ValidationException when the tree is malformed or exceeds a hard limit
     */
    public ValidationReport validate(MetaNode root) {
        if (root == null) {
            throw new ValidationException(ValidationError.INVALID_STRUCTURE, "Tree is null", null);
        }

        TreeStats stats = MetaTrees.stats(root);

        if (stats.depth() > options.maxDepth()) {
            throw ValidationException.maxDepthExceeded(stats.depth(), options.maxDepth());
        }
        if (stats.variableCount() > options.maxVariables()) {
            throw ValidationException.tooManyVariables(stats.variableCount(), options.maxVariables());
        }

        new ShapeChecker().walk(root);

        if (options.mode() == ValidationMode.STRICT && stats.nativeCount() > 0) {
            throw ValidationException.nativeConstructsNotAllowed(stats.nativeCount());
        }

        List<ValidationWarning> warnings = new ArrayList<>();
        if (stats.nativeCount() > 0) {
            warnings.add(new ValidationWarning(ValidationWarning.Type.NATIVE_CONSTRUCTS_PRESENT,
                    stats.nativeCount() + " language-specific construct(s) present"));
        }
        if (stats.depth() > options.deepNestingWarning()) {
            warnings.add(new ValidationWarning(ValidationWarning.Type.DEEP_NESTING,
                    String.format("Tree depth %d exceeds %d", stats.depth(), options.deepNestingWarning())));
        }
        if (stats.nodeCount() > options.largeTreeWarning()) {
            warnings.add(new ValidationWarning(ValidationWarning.Type.LARGE_AST,
                    String.format("Tree has %d nodes, more than %d", stats.nodeCount(), options.largeTreeWarning())));
        }

        logger.debug("Validated tree: layer={}, nodes={}, depth={}, warnings={}",
                stats.layer(), stats.nodeCount(), stats.depth(), warnings.size());

        return new ValidationReport(
                stats.layer(),
                stats.nativeCount(),
                warnings,
                stats.variables(),
                stats.depth(),
                stats.nodeCount());
    }

    /**
     * Returns true if the tree passes validation.
     */
    public boolean isValid(MetaNode root) {
        try {
            validate(root);
            return true;
        } catch (ValidationException e) {
            logger.debug("Tree rejected: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Per-node shape rules that the record types cannot express.
     */
    private static final class ShapeChecker extends TreeWalker {

        private static void require(MetaNode node, Object part, String name) {
            if (part == null) {
                throw ValidationException.invalidStructure(node, "missing " + name);
            }
        }

        private static void requireName(MetaNode node, String value, String name) {
            if (value == null || value.isBlank()) {
                throw ValidationException.invalidStructure(node, "blank " + name);
            }
        }

        private static void forbid(MetaNode node, Object part, String name) {
            if (part != null) {
                throw ValidationException.invalidStructure(node, "unexpected " + name);
            }
        }

        @Override
        public Void visitLiteral(Literal node) {
            require(node, node.type(), "subtype");
            if (!node.type().accepts(node.value())) {
                throw ValidationException.invalidStructure(node,
                        "value " + node.value() + " is not a valid " + node.type().tag());
            }
            return descend(node);
        }

        @Override
        public Void visitVariable(Variable node) {
            requireName(node, node.name(), "name");
            return descend(node);
        }

        @Override
        public Void visitPair(PairExpr node) {
            require(node, node.key(), "key");
            require(node, node.value(), "value");
            return descend(node);
        }

        @Override
        public Void visitBinaryOp(BinaryOp node) {
            require(node, node.category(), "category");
            requireName(node, node.operator(), "operator");
            require(node, node.left(), "left operand");
            require(node, node.right(), "right operand");
            return descend(node);
        }

        @Override
        public Void visitUnaryOp(UnaryOp node) {
            require(node, node.category(), "category");
            requireName(node, node.operator(), "operator");
            require(node, node.operand(), "operand");
            return descend(node);
        }

        @Override
        public Void visitFunctionCall(FunctionCall node) {
            requireName(node, node.name(), "name");
            return descend(node);
        }

        @Override
        public Void visitConditional(Conditional node) {
            require(node, node.condition(), "condition");
            require(node, node.thenBranch(), "then branch");
            return descend(node);
        }

        @Override
        public Void visitAssignment(Assignment node) {
            require(node, node.target(), "target");
            require(node, node.value(), "value");
            return descend(node);
        }

        @Override
        public Void visitInlineMatch(InlineMatch node) {
            require(node, node.pattern(), "pattern");
            require(node, node.value(), "value");
            return descend(node);
        }

        @Override
        public Void visitLoop(Loop node) {
            require(node, node.type(), "loop type");
            require(node, node.body(), "body");
            if (node.type().isConditional()) {
                require(node, node.condition(), "condition");
                forbid(node, node.iterator(), "iterator in while loop");
                forbid(node, node.collection(), "collection in while loop");
            } else {
                require(node, node.iterator(), "iterator");
                require(node, node.collection(), "collection");
                forbid(node, node.condition(), "condition in " + node.type().tag() + " loop");
            }
            return descend(node);
        }

        @Override
        public Void visitCollectionOp(CollectionOp node) {
            require(node, node.type(), "operation type");
            require(node, node.function(), "function");
            require(node, node.collection(), "collection");
            if (node.type().takesInitialValue()) {
                require(node, node.initial(), "initial value");
            } else {
                forbid(node, node.initial(), "initial value for " + node.type().tag());
            }
            return descend(node);
        }

        @Override
        public Void visitPatternMatch(PatternMatch node) {
            require(node, node.scrutinee(), "scrutinee");
            return descend(node);
        }

        @Override
        public Void visitExceptionHandling(ExceptionHandling node) {
            require(node, node.tryBlock(), "try block");
            return descend(node);
        }

        @Override
        public Void visitAsyncOperation(AsyncOperation node) {
            require(node, node.type(), "async type");
            require(node, node.operation(), "operation");
            return descend(node);
        }

        @Override
        public Void visitContainer(Container node) {
            require(node, node.type(), "container type");
            requireName(node, node.name(), "name");
            return descend(node);
        }

        @Override
        public Void visitFunctionDef(FunctionDef node) {
            requireName(node, node.name(), "name");
            return descend(node);
        }

        @Override
        public Void visitParam(Param node) {
            requireName(node, node.name(), "name");
            return descend(node);
        }

        @Override
        public Void visitAttributeAccess(AttributeAccess node) {
            require(node, node.receiver(), "receiver");
            requireName(node, node.attribute(), "attribute");
            return descend(node);
        }

        @Override
        public Void visitAugmentedAssignment(AugmentedAssignment node) {
            requireName(node, node.operator(), "operator");
            require(node, node.target(), "target");
            require(node, node.value(), "value");
            return descend(node);
        }

        @Override
        public Void visitProperty(Property node) {
            requireName(node, node.name(), "name");
            return descend(node);
        }

        @Override
        public Void visitLanguageSpecific(LanguageSpecific node) {
            requireName(node, node.language(), "language");
            requireName(node, node.hint(), "hint");
            return descend(node);
        }
    }
}
