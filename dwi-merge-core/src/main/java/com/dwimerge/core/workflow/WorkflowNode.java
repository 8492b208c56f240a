package com.dwimerge.core.workflow;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A node of a {@link WorkflowGraph}.
 *
 * @param id unique node identifier
 * @param dependencies ids of the nodes whose outputs this node reads, duplicates dropped
 * @param lightweight whether the node is cheap enough to run inline on the coordinating thread
 * @param task work to perform
 */
public record WorkflowNode(String id, List<String> dependencies, boolean lightweight, NodeTask task) {

    /**
     * Compact constructor with validation.
     */
    public WorkflowNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(task, "task must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependencies));
    }
}
