package com.raditha.metaast.complexity;

import com.raditha.metaast.config.ComplexityThresholds;
import com.raditha.metaast.document.Document;
import com.raditha.metaast.document.DocumentAnalyzer;
import com.raditha.metaast.model.Block;
import com.raditha.metaast.model.Container;
import com.raditha.metaast.model.FunctionDef;
import com.raditha.metaast.model.MetaNode;
import com.raditha.metaast.tree.MetaTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Computes every complexity metric for a tree.
 * <p>
 * A root function definition is measured through its body so the function
 * itself does not add a nesting level. The variable count always covers the
 * whole tree, parameters included. Physical and comment line counts are taken
 * from the document metadata.
 */
public class ComplexityAnalyzer implements DocumentAnalyzer<ComplexityResult> {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final ComplexityThresholds thresholds;
    private final CyclomaticCalculator cyclomaticCalculator = new CyclomaticCalculator();
    private final CognitiveCalculator cognitiveCalculator = new CognitiveCalculator();
    private final NestingCalculator nestingCalculator = new NestingCalculator();
    private final HalsteadCalculator halsteadCalculator = new HalsteadCalculator();
    private final StatementCounter statementCounter = new StatementCounter();

    public ComplexityAnalyzer() {
        this(ComplexityThresholds.defaults());
    }

    public ComplexityAnalyzer(ComplexityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public ComplexityResult analyze(Document document) {
        return analyze(document.ast(), document.lineCount(), document.commentLines());
    }

    public ComplexityResult analyze(MetaNode tree) {
        return analyze(tree, OptionalInt.empty(), OptionalInt.empty());
    }

    private ComplexityResult analyze(MetaNode tree, OptionalInt physical, OptionalInt comments) {
        MetaNode target = tree instanceof FunctionDef function ? function.bodyBlock() : tree;

        int cyclomatic = cyclomaticCalculator.calculate(target);
        int cognitive = cognitiveCalculator.calculate(target);
        int nesting = nestingCalculator.calculate(target);
        HalsteadMetrics halstead = halsteadCalculator.calculate(target);
        StatementCounter.Counts counts = statementCounter.count(target);

        LocMetrics loc = LocMetrics.of(counts.statements(),
                physical.isPresent() ? physical.getAsInt() : null,
                comments.isPresent() ? comments.getAsInt() : null);
        FunctionMetrics functionMetrics = new FunctionMetrics(
                counts.statements(), counts.returnPoints(), MetaTrees.variables(tree).size());

        List<FunctionComplexity> perFunction = new ArrayList<>();
        for (FunctionDef function : topLevelFunctions(tree)) {
            perFunction.add(analyzeFunction(function));
        }

        ComplexityResult result = ComplexityResult.of(cyclomatic, cognitive, nesting, halstead, loc,
                functionMetrics, perFunction, thresholds);
        logger.debug("Complexity: cyclomatic={}, cognitive={}, nesting={}, logical={}, warnings={}",
                cyclomatic, cognitive, nesting, loc.logical(), result.warnings().size());
        return result;
    }

    /**
     * Measure a single function through its body.
     */
    public FunctionComplexity analyzeFunction(FunctionDef function) {
        Block body = function.bodyBlock();
        StatementCounter.Counts counts = statementCounter.count(body);
        return new FunctionComplexity(
                function.name(),
                cyclomaticCalculator.calculate(body),
                cognitiveCalculator.calculate(body),
                nestingCalculator.calculate(body),
                counts.statements(),
                counts.returnPoints(),
                MetaTrees.variables(function).size());
    }

    private static List<FunctionDef> topLevelFunctions(MetaNode tree) {
        List<MetaNode> candidates;
        if (tree instanceof FunctionDef function) {
            return List.of(function);
        } else if (tree instanceof Container container) {
            candidates = container.body();
        } else if (tree instanceof Block block) {
            candidates = block.statements();
        } else {
            return List.of();
        }
        List<FunctionDef> functions = new ArrayList<>();
        for (MetaNode candidate : candidates) {
            if (candidate instanceof FunctionDef function) {
                functions.add(function);
            }
        }
        return functions;
    }
}
