package com.lidm.core.scheduler;

import com.lidm.core.model.SubTask;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validation and ordering of subtask dependencies.
 */
public final class DependencyGraph {

    private DependencyGraph() {}

    /**
     * Kahn's algorithm. Among subtasks that become ready at the same time the
     * original list order is kept, so the result is deterministic.
     *
     * @return subtask ids, every id after all of its dependencies
     * @throws InvalidDecompositionException on duplicate ids or unknown dependency ids
     * @throws CyclicDependencyException     if the dependencies contain a cycle
     */
    public static List<String> topologicalOrder(List<SubTask> subtasks) {
        Map<String, SubTask> byId = index(subtasks);
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (SubTask subtask : subtasks) {
            inDegree.put(subtask.id(), 0);
            dependents.put(subtask.id(), new ArrayList<>());
        }
        for (SubTask subtask : subtasks) {
            Set<String> seen = new HashSet<>();
            for (String dep : subtask.dependsOn()) {
                if (!byId.containsKey(dep)) {
                    throw new InvalidDecompositionException(
                            "Subtask " + subtask.id() + " depends on unknown subtask " + dep);
                }
                if (seen.add(dep)) {
                    inDegree.merge(subtask.id(), 1, Integer::sum);
                    dependents.get(dep).add(subtask.id());
                }
            }
        }

        var ready = new ArrayDeque<String>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        var order = new ArrayList<String>(subtasks.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependents.get(id)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < subtasks.size()) {
            List<String> involved = subtasks.stream()
                    .map(SubTask::id)
                    .filter(id -> !order.contains(id))
                    .toList();
            throw new CyclicDependencyException(involved);
        }
        return order;
    }

    /** Throws if the subtasks cannot be scheduled; see {@link #topologicalOrder(List)}. */
    public static void validate(List<SubTask> subtasks) {
        topologicalOrder(subtasks);
    }

    private static Map<String, SubTask> index(List<SubTask> subtasks) {
        Map<String, SubTask> byId = new LinkedHashMap<>();
        for (SubTask subtask : subtasks) {
            if (byId.putIfAbsent(subtask.id(), subtask) != null) {
                throw new InvalidDecompositionException("Duplicate subtask id " + subtask.id());
            }
        }
        return byId;
    }
}
