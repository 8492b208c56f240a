package com.dwimerge.core.workflow;

import com.dwimerge.core.error.MissingInputException;
import com.dwimerge.core.error.ValidationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed acyclic graph of workflow nodes, edges being data dependencies.
 *
 * <p>The graph is immutable once built. {@link #validate()} checks the structure before
 * anything runs: every dependency must name a node of the graph and there must be no cycle.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * WorkflowGraph graph = WorkflowGraph.builder()
 *     .node("collect_groups", List.of(), false, inputs -> loader.load(groups))
 *     .node("merge", List.of("collect_groups"), false,
 *         inputs -> strategy.merge(inputs.get("collect_groups", AcquisitionGroupSet.class), context))
 *     .build();
 * graph.validate();
 * }</pre>
 */
public final class WorkflowGraph {

    private final Map<String, WorkflowNode> nodes;

    private WorkflowGraph(Map<String, WorkflowNode> nodes) {
        this.nodes = nodes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<WorkflowNode> nodes() {
        return nodes.values();
    }

    public WorkflowNode node(String id) {
        WorkflowNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Ids of the nodes that declare {@code id} as a dependency, in insertion order.
     *
     * @param id node id
     * @return direct dependents
     */
    public List<String> dependentsOf(String id) {
        List<String> dependents = new ArrayList<>();
        for (WorkflowNode node : nodes.values()) {
            if (node.dependencies().contains(id)) {
                dependents.add(node.id());
            }
        }
        return dependents;
    }

    /**
     * Checks the graph structure.
     *
     * @throws MissingInputException if a node depends on a node that is not in the graph
     * @throws ValidationException if the dependencies form a cycle
     */
    public void validate() {
        for (WorkflowNode node : nodes.values()) {
            for (String dependency : node.dependencies()) {
                if (!nodes.containsKey(dependency)) {
                    throw new MissingInputException(node.id(),
                        "Node '" + node.id() + "' depends on '" + dependency + "', which no node produces");
                }
            }
        }
        topologicalOrder();
    }

    /**
     * Orders nodes so that every node follows its dependencies. Ties keep insertion order.
     *
     * @return node ids in execution order
     * @throws ValidationException if the dependencies form a cycle
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> pending = new HashMap<>();
        for (WorkflowNode node : nodes.values()) {
            pending.put(node.id(), (int) node.dependencies().stream().filter(nodes::containsKey).count());
        }
        Deque<String> ready = new ArrayDeque<>();
        nodes.keySet().stream().filter(id -> pending.get(id) == 0).forEach(ready::add);

        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String id = ready.removeFirst();
            order.add(id);
            for (String dependent : dependentsOf(id)) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.addLast(dependent);
                }
            }
        }
        if (order.size() != nodes.size()) {
            List<String> cyclic = nodes.keySet().stream().filter(id -> !order.contains(id)).toList();
            throw new ValidationException("workflow", "Dependency cycle among nodes " + cyclic);
        }
        return order;
    }

    /**
     * Collects nodes; ids must be unique.
     */
    public static final class Builder {

        private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder node(WorkflowNode node) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
            return this;
        }

        public Builder node(String id, List<String> dependencies, boolean lightweight, NodeTask task) {
            return node(new WorkflowNode(id, dependencies, lightweight, task));
        }

        public WorkflowGraph build() {
            return new WorkflowGraph(new LinkedHashMap<>(nodes));
        }
    }
}
