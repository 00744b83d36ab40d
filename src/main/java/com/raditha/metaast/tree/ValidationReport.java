package com.raditha.metaast.tree;

import com.raditha.metaast.model.Layer;

import java.util.List;
import java.util.Set;

/**
 * Outcome of a successful validation.
 *
 * @param layer           highest conformance layer present
 * @param nativeConstructs number of language-specific nodes
 * @param warnings        soft threshold warnings
 * @param variables       distinct variable names
 * @param depth           tree depth
 * @param nodeCount       total nodes
 */
public record ValidationReport(
        Layer layer,
        int nativeConstructs,
        List<ValidationWarning> warnings,
        Set<String> variables,
        int depth,
        int nodeCount) {

    public ValidationReport {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasWarning(ValidationWarning.Type type) {
        return warnings.stream().anyMatch(w -> w.type() == type);
    }
}
