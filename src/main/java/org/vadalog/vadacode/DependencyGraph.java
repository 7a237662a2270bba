package org.vadalog.vadacode;

import java.util.*;

/**
 * Directed graph over names, where an edge {@code a -> b} means that
 * {@code b} depends on {@code a}. Used for atom dependencies (body atom to
 * head atom) and for dependencies between condition variables.
 */
public class DependencyGraph {
    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();
    private final Set<String> temporal = new LinkedHashSet<>();

    public void addNode(String node) {
        successors.computeIfAbsent(node, k -> new LinkedHashSet<>());
        predecessors.computeIfAbsent(node, k -> new LinkedHashSet<>());
    }

    /**
     * Records that {@code dependent} depends on {@code dependency}.
     */
    public void addDependency(String dependency, String dependent) {
        addNode(dependency);
        addNode(dependent);
        successors.get(dependency).add(dependent);
        predecessors.get(dependent).add(dependency);
    }

    public boolean hasNode(String node) { return successors.containsKey(node); }

    public Set<String> getNodes() { return Collections.unmodifiableSet(successors.keySet()); }

    public Set<String> getDependents(String node) {
        return successors.getOrDefault(node, Collections.emptySet());
    }

    public void markTemporal(String node) {
        addNode(node);
        temporal.add(node);
    }

    /**
     * Nodes marked temporal plus every node depending on them, directly or not.
     */
    public Set<String> getTemporalNodes() {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(temporal);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            if (result.add(node)) {
                queue.addAll(getDependents(node));
            }
        }
        return result;
    }

    /**
     * Nodes with an edge to themselves.
     */
    public Set<String> getSelfDependentNodes() {
        Set<String> result = new LinkedHashSet<>();
        successors.forEach((node, next) -> {
            if (next.contains(node)) {
                result.add(node);
            }
        });
        return result;
    }

    /**
     * Weakly connected components, in node insertion order.
     */
    public List<List<String>> getConnectedComponents() {
        List<List<String>> components = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : successors.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            List<String> component = new ArrayList<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            visited.add(start);
            while (!stack.isEmpty()) {
                String node = stack.pop();
                component.add(node);
                for (String neighbour : neighbours(node)) {
                    if (visited.add(neighbour)) {
                        stack.push(neighbour);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    private Set<String> neighbours(String node) {
        Set<String> result = new LinkedHashSet<>(successors.get(node));
        result.addAll(predecessors.get(node));
        return result;
    }

    /**
     * Whether the subgraph induced by the given nodes has a directed cycle.
     * Self loops count.
     */
    public boolean hasCycle(Collection<String> nodes) {
        Set<String> scope = new HashSet<>(nodes);
        Map<String, Integer> state = new HashMap<>();
        for (String node : nodes) {
            if (!state.containsKey(node) && hasCycleFrom(node, scope, state)) {
                return true;
            }
        }
        return false;
    }

    // 1 = on the current path, 2 = done
    private boolean hasCycleFrom(String node, Set<String> scope, Map<String, Integer> state) {
        state.put(node, 1);
        for (String next : getDependents(node)) {
            if (!scope.contains(next)) {
                continue;
            }
            Integer nextState = state.get(next);
            if (nextState == null) {
                if (hasCycleFrom(next, scope, state)) {
                    return true;
                }
            } else if (nextState == 1) {
                return true;
            }
        }
        state.put(node, 2);
        return false;
    }
}
