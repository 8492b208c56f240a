package com.dwimerge.core.workflow;

import com.dwimerge.core.error.MissingInputException;

import java.util.Collections;
import java.util.Map;

/**
 * Read access to the outputs of a node's declared dependencies.
 */
public final class NodeInputs {

    private final String nodeId;
    private final Map<String, Object> outputs;

    NodeInputs(String nodeId, Map<String, Object> outputs) {
        this.nodeId = nodeId;
        this.outputs = Collections.unmodifiableMap(outputs);
    }

    /**
     * Returns the output of a dependency.
     *
     * @param dependency id of a declared dependency
     * @param type expected output type
     * @param <T> output type
     * @return the output
     * @throws MissingInputException if the dependency is not declared or produced nothing
     */
    public <T> T get(String dependency, Class<T> type) {
        if (!outputs.containsKey(dependency)) {
            throw new MissingInputException(nodeId, "Node '" + nodeId + "' does not depend on '" + dependency + "'");
        }
        Object value = outputs.get(dependency);
        if (value == null) {
            throw new MissingInputException(nodeId, "Dependency '" + dependency + "' of node '" + nodeId + "' produced no output");
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException(String.format("Output of '%s' is %s, node '%s' expects %s",
                dependency, value.getClass().getSimpleName(), nodeId, type.getSimpleName()));
        }
        return type.cast(value);
    }

    /**
     * Returns the output of a dependency if it is declared and produced a value.
     *
     * @param dependency dependency id
     * @param type expected output type
     * @param <T> output type
     * @return the output, or {@code null}
     */
    public <T> T find(String dependency, Class<T> type) {
        Object value = outputs.get(dependency);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    public boolean has(String dependency) {
        return outputs.get(dependency) != null;
    }
}
