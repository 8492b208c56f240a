package com.dwimerge.core.workflow;

import com.dwimerge.core.error.MissingInputException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link WorkflowRunner}.
 */
class WorkflowRunnerTest {

    @Test
    void run_passesOutputsAlongEdges() {
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("load", List.of(), false, inputs -> 20)
            .node("double", List.of("load"), false, inputs -> inputs.get("load", Integer.class) * 2)
            .node("label", List.of("double"), true, inputs -> "value=" + inputs.get("double", Integer.class))
            .build();

        WorkflowRun run = new WorkflowRunner(2).run(graph);

        assertThat(run.isSuccessful()).isTrue();
        assertThat(run.output("label", String.class)).isEqualTo("value=40");
        assertThat(run.completed()).containsExactly("load", "double", "label");
    }

    @Test
    void run_independentNodes_runConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        NodeTask waitForOther = inputs -> {
            bothStarted.countDown();
            return bothStarted.await(5, TimeUnit.SECONDS);
        };
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("denoise_dir_AP", List.of(), false, waitForOther)
            .node("denoise_dir_PA", List.of(), false, waitForOther)
            .build();

        WorkflowRun run = new WorkflowRunner(2).run(graph);

        assertThat(run.output("denoise_dir_AP", Boolean.class)).isTrue();
        assertThat(run.output("denoise_dir_PA", Boolean.class)).isTrue();
    }

    @Test
    void run_failedNode_skipsDependentsButRunsIndependentBranches() {
        AtomicInteger independentRuns = new AtomicInteger();
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("merge", List.of(), false, inputs -> {
                throw new IllegalStateException("boom");
            })
            .node("qc", List.of("merge"), false, inputs -> "qc")
            .node("report", List.of("qc"), true, inputs -> "report")
            .node("confounds", List.of(), false, inputs -> independentRuns.incrementAndGet())
            .build();

        WorkflowRun run = new WorkflowRunner(1).run(graph);

        assertThat(run.isSuccessful()).isFalse();
        assertThat(run.failures()).containsOnlyKeys("merge");
        assertThat(run.skipped()).containsExactly("qc", "report");
        assertThat(independentRuns).hasValue(1);
        assertThatThrownBy(run::rethrowFirstFailure)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");
    }

    @Test
    void run_everyNodeRunsOnce() {
        AtomicInteger loads = new AtomicInteger();
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("load", List.of(), false, inputs -> loads.incrementAndGet())
            .node("a", List.of("load"), false, inputs -> 1)
            .node("b", List.of("load"), false, inputs -> 2)
            .node("join", List.of("a", "b", "load"), false, inputs -> 3)
            .build();

        WorkflowRun run = new WorkflowRunner(4).run(graph);

        assertThat(run.isSuccessful()).isTrue();
        assertThat(loads).hasValue(1);
        assertThat(run.completed()).hasSize(4);
    }

    @Test
    void run_checkedExceptionFromNode_isWrappedOnRethrow() {
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("read", List.of(), false, inputs -> {
                throw new java.io.IOException("disk gone");
            })
            .build();

        WorkflowRun run = new WorkflowRunner(1).run(graph);

        assertThatThrownBy(run::rethrowFirstFailure)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("read")
            .hasCauseInstanceOf(java.io.IOException.class);
    }

    @Test
    void run_undeclaredInput_failsNodeWithMissingInputException() {
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("a", List.of(), false, inputs -> 1)
            .node("b", List.of(), false, inputs -> inputs.get("a", Integer.class))
            .build();

        WorkflowRun run = new WorkflowRunner(1).run(graph);

        assertThat(run.failures().get("b")).isInstanceOf(MissingInputException.class);
    }

    @Test
    void run_unknownDependency_failsBeforeAnyNodeRuns() {
        AtomicInteger runs = new AtomicInteger();
        WorkflowGraph graph = WorkflowGraph.builder()
            .node("a", List.of(), false, inputs -> runs.incrementAndGet())
            .node("b", List.of("missing"), false, inputs -> 1)
            .build();

        assertThatThrownBy(() -> new WorkflowRunner(1).run(graph)).isInstanceOf(MissingInputException.class);
        assertThat(runs).hasValue(0);
    }

    @Test
    void output_ofFailedNode_throwsMissingInputException() {
        WorkflowRun run = new WorkflowRun(java.util.Map.of(), java.util.Map.of("x", new RuntimeException()),
            List.of(), List.of());

        assertThatThrownBy(() -> run.output("x", Object.class)).isInstanceOf(MissingInputException.class);
    }
}
