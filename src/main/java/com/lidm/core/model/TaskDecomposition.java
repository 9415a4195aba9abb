package com.lidm.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * A query split into subtasks whose {@code dependsOn} links must form a DAG.
 * A direct answer is a decomposition with a single subtask and strategy {@link DecompositionStrategy#DIRECT}.
 */
public record TaskDecomposition(
    String query,
    List<SubTask> subtasks,
    DecompositionStrategy strategy,
    String taskType,
    double complexity,
    List<String> requiredCapabilities
) implements Serializable {

    public TaskDecomposition {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
        requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
        strategy = strategy == null ? DecompositionStrategy.DIRECT : strategy;
    }

    /** Single-subtask decomposition that sends the whole query to one backend. */
    public static TaskDecomposition direct(String query, Classification classification) {
        var subtask = SubTask.pending("st_1", query, classification.capabilities(), List.of());
        return new TaskDecomposition(query, List.of(subtask), DecompositionStrategy.DIRECT,
                classification.taskType(), classification.complexity(), classification.capabilities());
    }

    public TaskDecomposition withSubtasks(List<SubTask> updated) {
        return new TaskDecomposition(query, updated, strategy, taskType, complexity, requiredCapabilities);
    }

    public Optional<SubTask> subtask(String id) {
        return subtasks.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    public List<SubTask> completed() {
        return subtasks.stream().filter(SubTask::isCompleted).toList();
    }

    public List<SubTask> failed() {
        return subtasks.stream().filter(SubTask::isFailed).toList();
    }

    public boolean isDecomposed() {
        return strategy == DecompositionStrategy.DECOMPOSE;
    }
}
