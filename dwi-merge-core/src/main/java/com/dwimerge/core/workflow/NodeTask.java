package com.dwimerge.core.workflow;

/**
 * Work performed by one workflow node.
 */
@FunctionalInterface
public interface NodeTask {

    /**
     * Runs the node.
     *
     * @param inputs outputs of the node's declared dependencies
     * @return the node's output, may be {@code null} for side-effect-only nodes
     * @throws Exception any failure; the runner records it and skips the node's dependents
     */
    Object run(NodeInputs inputs) throws Exception;
}
