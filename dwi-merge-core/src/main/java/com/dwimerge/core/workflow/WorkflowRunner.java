package com.dwimerge.core.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executes a {@link WorkflowGraph} on a fixed pool of worker threads.
 *
 * <p>Scheduling rules:
 * <ul>
 *   <li>a node starts once all of its dependencies have succeeded</li>
 *   <li>independent ready nodes run concurrently, up to the pool size</li>
 *   <li>lightweight nodes run inline on the coordinating thread</li>
 *   <li>every node runs at most once, there are no retries</li>
 *   <li>when a node fails its dependents are skipped; independent branches still run</li>
 * </ul>
 *
 * <p>The coordinating thread is the only one touching scheduling state, so node outputs
 * are handed between threads through the completion queue only.
 */
public class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final int threads;

    public WorkflowRunner(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        this.threads = threads;
    }

    private record NodeOutcome(String id, Object output, Exception failure, long millis) {}

    /**
     * Validates and runs the graph.
     *
     * @param graph graph to run
     * @return outputs, failures and skipped nodes
     */
    public WorkflowRun run(WorkflowGraph graph) {
        graph.validate();

        Map<String, Integer> pending = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (WorkflowNode node : graph.nodes()) {
            pending.put(node.id(), node.dependencies().size());
            if (node.dependencies().isEmpty()) {
                ready.add(node.id());
            }
        }

        Map<String, Object> outputs = new LinkedHashMap<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        Set<String> skipped = new LinkedHashSet<>();
        List<String> completed = new ArrayList<>();
        Set<String> started = new HashSet<>();

        log.info("Running workflow of {} nodes on {} thread(s)", graph.size(), threads);
        ExecutorService workers = Executors.newFixedThreadPool(threads);
        CompletionService<NodeOutcome> completion = new ExecutorCompletionService<>(workers);
        int inFlight = 0;
        try {
            while (!ready.isEmpty() || inFlight > 0) {
                while (!ready.isEmpty()) {
                    WorkflowNode node = graph.node(ready.removeFirst());
                    if (!started.add(node.id())) {
                        throw new IllegalStateException("Node scheduled twice: " + node.id());
                    }
                    Optional<String> blocked = node.dependencies().stream()
                        .filter(dependency -> failures.containsKey(dependency) || skipped.contains(dependency))
                        .findFirst();
                    if (blocked.isPresent()) {
                        log.warn("Skipping node '{}': dependency '{}' did not complete", node.id(), blocked.get());
                        skipped.add(node.id());
                        release(graph, node.id(), pending, ready);
                        continue;
                    }
                    NodeInputs inputs = inputsFor(node, outputs);
                    if (node.lightweight()) {
                        record(execute(node, inputs), outputs, failures, completed);
                        release(graph, node.id(), pending, ready);
                    } else {
                        completion.submit(() -> execute(node, inputs));
                        inFlight++;
                    }
                }
                if (inFlight > 0) {
                    NodeOutcome outcome = completion.take().get();
                    inFlight--;
                    record(outcome, outputs, failures, completed);
                    release(graph, outcome.id(), pending, ready);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Workflow interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Worker thread failed outside a node", e.getCause());
        } finally {
            workers.shutdownNow();
        }

        WorkflowRun run = new WorkflowRun(outputs, failures, new ArrayList<>(skipped), completed);
        if (run.isSuccessful()) {
            log.info("Workflow finished: {} nodes completed", completed.size());
        } else {
            log.error("Workflow finished with {} failed and {} skipped node(s)", failures.size(), skipped.size());
        }
        return run;
    }

    private static NodeInputs inputsFor(WorkflowNode node, Map<String, Object> outputs) {
        Map<String, Object> visible = new HashMap<>();
        for (String dependency : node.dependencies()) {
            visible.put(dependency, outputs.get(dependency));
        }
        return new NodeInputs(node.id(), visible);
    }

    private static NodeOutcome execute(WorkflowNode node, NodeInputs inputs) {
        long start = System.nanoTime();
        log.debug("Starting node '{}'", node.id());
        try {
            Object output = node.task().run(inputs);
            return new NodeOutcome(node.id(), output, null, (System.nanoTime() - start) / 1_000_000);
        } catch (Exception e) {
            return new NodeOutcome(node.id(), null, e, (System.nanoTime() - start) / 1_000_000);
        }
    }

    private static void record(NodeOutcome outcome, Map<String, Object> outputs,
                               Map<String, Throwable> failures, List<String> completed) {
        if (outcome.failure() != null) {
            log.error("Node '{}' failed after {} ms: {}", outcome.id(), outcome.millis(), outcome.failure().getMessage());
            failures.put(outcome.id(), outcome.failure());
        } else {
            log.debug("Node '{}' completed in {} ms", outcome.id(), outcome.millis());
            outputs.put(outcome.id(), outcome.output());
            completed.add(outcome.id());
        }
    }

    private static void release(WorkflowGraph graph, String id, Map<String, Integer> pending, Deque<String> ready) {
        for (String dependent : graph.dependentsOf(id)) {
            if (pending.merge(dependent, -1, Integer::sum) == 0) {
                ready.addLast(dependent);
            }
        }
    }
}
