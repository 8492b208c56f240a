package com.dwimerge.core.workflow;

import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link WorkflowGraph}.
 */
class WorkflowGraphTest {

    private static final NodeTask NOOP = inputs -> null;

    @Test
    void topologicalOrder_placesDependenciesFirst() {
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("report", List.of("merge", "qc"), true, NOOP)
            .node("qc", List.of("merge"), false, NOOP)
            .node("merge", List.of("load"), false, NOOP)
            .node("load", List.of(), false, NOOP)
            .build();

        List<String> order = graph.topologicalOrder();

        assertThat(order).containsExactly("load", "merge", "qc", "report");
    }

    @Test
    void dependentsOf_listsDirectDependentsOnly() {
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("a", List.of(), false, NOOP)
            .node("b", List.of("a"), false, NOOP)
            .node("c", List.of("b"), false, NOOP)
            .build();

        assertThat(graph.dependentsOf("a")).containsExactly("b");
    }

    @Test
    void validate_unknownDependency_throwsMissingInputException() {
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("series_qc", List.of("t1_dice_calc"), false, NOOP)
            .build();

        assertThatThrownBy(graph::validate)
            .isInstanceOf(MissingInputException.class)
            .hasMessageContaining("t1_dice_calc");
    }

    @Test
    void validate_cycle_throwsValidationException() {
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("a", List.of("b"), false, NOOP)
            .node("b", List.of("a"), false, NOOP)
            .node("c", List.of(), false, NOOP)
            .build();

        assertThatThrownBy(graph::validate)
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("[a, b]");
    }

    @Test
    void builder_duplicateId_throwsIllegalArgumentException() {
        WorkflowGraph.Builder builder = WorkflowGraph.builder().node("a", List.of(), false, NOOP);

        assertThatThrownBy(() -> builder.node("a", List.of(), true, NOOP))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void node_duplicateDependencies_areCollapsed() {
        WorkflowNode node = new WorkflowNode("b", List.of("a", "a"), false, NOOP);

        assertThat(node.dependencies()).containsExactly("a");
    }
}
