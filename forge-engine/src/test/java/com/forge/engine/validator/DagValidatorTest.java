package com.forge.engine.validator;

import com.forge.engine.TestWorkflows;
import com.forge.graph.model.NodeCategory;
import com.forge.graph.model.Workflow;
import com.forge.graph.model.WorkflowEdge;
import com.forge.graph.model.WorkflowNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DagValidatorTest {

    private final DagValidator validator = new DagValidator();

    @Test
    void validate_cycle_reportsPath() {
        DagValidationResult result = validator.validate(TestWorkflows.cyclic());

        assertFalse(result.isValid());
        assertEquals(List.of(List.of("A", "B", "C")), result.getCycles());
        assertEquals(List.of("Workflow contains cycles: A -> B -> C"), result.getErrors());
    }

    @Test
    void validate_independentCycles_eachRootStartsClean() {
        Workflow wf = TestWorkflows.graph("two-cycles", List.of("A", "B", "C", "D"), "A>B", "B>A", "C>D", "D>C");

        DagValidationResult result = validator.validate(wf);

        assertEquals(List.of(List.of("A", "B"), List.of("C", "D")), result.getCycles());
        assertEquals("Workflow contains cycles: A -> B, C -> D", result.getErrors().get(0));
    }

    @Test
    void validate_selfLoop_isCycle() {
        DagValidationResult result = validator.validate(TestWorkflows.graph("self", List.of("A"), "A>A"));

        assertEquals(List.of(List.of("A")), result.getCycles());
    }

    @Test
    void validate_emptyWorkflow_isInvalid() {
        DagValidationResult result = validator.validate(Workflow.of("empty", List.of(), List.of()));

        assertFalse(result.isValid());
        assertEquals(List.of("Workflow must have at least one node"), result.getErrors());
    }

    @Test
    void validate_diamond_isValidWithoutWarnings() {
        DagValidationResult result = validator.validate(TestWorkflows.diamond());

        assertTrue(result.isValid());
        assertTrue(result.getWarnings().isEmpty());
        assertTrue(result.getCycles().isEmpty());
    }

    @Test
    void validate_unreachableFromTrigger_isWarningOnly() {
        DagValidationResult result = validator.validate(TestWorkflows.disconnected());

        assertTrue(result.isValid());
        assertEquals(List.of("Found 1 unreachable nodes"), result.getWarnings());
        assertEquals(List.of("C"), result.getUnreachableNodes());
    }

    @Test
    void validate_noTriggerNodes_skipsReachability() {
        Workflow wf = Workflow.of("no-trigger",
                List.of(TestWorkflows.node("X"), TestWorkflows.node("Y")), List.of());

        DagValidationResult result = validator.validate(wf);

        assertTrue(result.isValid());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void validate_duplicateIdsAndDanglingEdges_areErrors() {
        Workflow wf = Workflow.of("broken",
                List.of(WorkflowNode.of("A", "t", NodeCategory.TRIGGER), TestWorkflows.node("A"), TestWorkflows.node("B")),
                List.of(WorkflowEdge.of("A", "B"), WorkflowEdge.of("ghost", "B"), WorkflowEdge.of("B", "nowhere")));

        DagValidationResult result = validator.validate(wf);

        assertFalse(result.isValid());
        assertEquals(List.of(
                "Duplicate node ID: A",
                "Edge 1: source node 'ghost' not found",
                "Edge 2: target node 'nowhere' not found"), result.getErrors());
    }

    @Test
    void validate_blankNodeId_isError() {
        Workflow wf = Workflow.of("blank", List.of(TestWorkflows.node(" ")), List.of());

        assertEquals(List.of("Node 0: id is required"), validator.validate(wf).getErrors());
    }
}
