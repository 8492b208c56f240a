package com.dwimerge.core.workflow;

import com.dwimerge.core.error.MissingInputException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@link WorkflowRunner#run(WorkflowGraph)} call.
 *
 * @param outputs outputs of the nodes that succeeded, by node id
 * @param failures failures by node id, in the order they were observed
 * @param skipped nodes not run because a dependency failed or was skipped
 * @param completed nodes that succeeded, in completion order
 */
public record WorkflowRun(
    Map<String, Object> outputs,
    Map<String, Throwable> failures,
    List<String> skipped,
    List<String> completed
) {
    /**
     * Compact constructor; node outputs may be {@code null}.
     */
    public WorkflowRun {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        skipped = List.copyOf(skipped);
        completed = List.copyOf(completed);
    }

    public boolean isSuccessful() {
        return failures.isEmpty() && skipped.isEmpty();
    }

    /**
     * Returns the output of a node that succeeded.
     *
     * @param nodeId node id
     * @param type expected type
     * @param <T> output type
     * @return the output
     * @throws MissingInputException if the node did not succeed or produced nothing
     */
    public <T> T output(String nodeId, Class<T> type) {
        Object value = outputs.get(nodeId);
        if (value == null) {
            throw new MissingInputException(nodeId, "Node '" + nodeId + "' produced no output");
        }
        return type.cast(value);
    }

    /**
     * Rethrows the first recorded failure. Unchecked exceptions are rethrown as they are,
     * checked ones wrapped in {@link IllegalStateException}.
     */
    public void rethrowFirstFailure() {
        if (failures.isEmpty()) {
            return;
        }
        Map.Entry<String, Throwable> first = failures.entrySet().iterator().next();
        Throwable failure = first.getValue();
        if (failure instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Node '" + first.getKey() + "' failed: " + failure.getMessage(), failure);
    }
}
