package com.forge.engine.validator;

import java.util.List;

/**
 * Outcome of {@link DagValidator#validate}. {@code valid} is false iff {@code errors} is non-empty;
 * warnings never affect validity.
 */
public final class DagValidationResult {

    private final List<String> errors;
    private final List<String> warnings;
    private final List<List<String>> cycles;
    private final List<String> unreachableNodes;

    public DagValidationResult(List<String> errors, List<String> warnings, List<List<String>> cycles,
                               List<String> unreachableNodes) {
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
        this.cycles = cycles != null ? cycles.stream().map(List::copyOf).toList() : List.of();
        this.unreachableNodes = unreachableNodes != null ? List.copyOf(unreachableNodes) : List.of();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /** Each cycle as the node path from its first repeated node; empty when acyclic. */
    public List<List<String>> getCycles() {
        return cycles;
    }

    /** Nodes not reachable from any trigger node, in definition order. */
    public List<String> getUnreachableNodes() {
        return unreachableNodes;
    }

    @Override
    public String toString() {
        return "DagValidationResult{valid=" + isValid() + ", errors=" + errors + ", warnings=" + warnings + "}";
    }
}
