package com.lidm.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * One unit of work inside a {@link TaskDecomposition}, routed to a single backend.
 *
 * @param id                   identifier unique within its decomposition (e.g. "st_1")
 * @param instruction          what the backend is asked to do
 * @param requiredCapabilities capabilities used to pick the tier
 * @param dependsOn            ids of subtasks whose results feed this one, in declaration order
 * @param status               current execution status
 * @param prompt               the full prompt last dispatched (instruction plus dependency context)
 * @param result               backend output once completed
 * @param tierUsed             tier that produced the result
 * @param attemptCount         number of dispatch attempts made so far
 * @param durationMs           wall time of the successful attempt
 * @param error                last failure reason, if any
 */
public record SubTask(
    String id,
    String instruction,
    List<String> requiredCapabilities,
    List<String> dependsOn,
    SubTaskStatus status,
    String prompt,
    String result,
    Tier tierUsed,
    int attemptCount,
    Long durationMs,
    String error
) implements Serializable {

    public SubTask {
        Objects.requireNonNull(id, "id");
        instruction = instruction == null ? "" : instruction;
        requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        status = status == null ? SubTaskStatus.PENDING : status;
    }

    public static SubTask pending(String id, String instruction, List<String> capabilities, List<String> dependsOn) {
        return new SubTask(id, instruction, capabilities, dependsOn,
                SubTaskStatus.PENDING, null, null, null, 0, null, null);
    }

    public SubTask withStatus(SubTaskStatus newStatus) {
        return new SubTask(id, instruction, requiredCapabilities, dependsOn,
                newStatus, prompt, result, tierUsed, attemptCount, durationMs, error);
    }

    /** A new dispatch attempt has started with the given prompt. */
    public SubTask running(String dispatchedPrompt) {
        return new SubTask(id, instruction, requiredCapabilities, dependsOn,
                SubTaskStatus.RUNNING, dispatchedPrompt, result, tierUsed, attemptCount + 1, durationMs, error);
    }

    public SubTask completed(String output, Tier tier, long elapsedMs) {
        return new SubTask(id, instruction, requiredCapabilities, dependsOn,
                SubTaskStatus.COMPLETED, prompt, output, tier, attemptCount, elapsedMs, null);
    }

    /** Attempt failed but more attempts remain; goes back to the pending pool. */
    public SubTask retrying(String reason) {
        return new SubTask(id, instruction, requiredCapabilities, dependsOn,
                SubTaskStatus.PENDING, prompt, null, tierUsed, attemptCount, durationMs, reason);
    }

    public SubTask failed(String reason) {
        return new SubTask(id, instruction, requiredCapabilities, dependsOn,
                SubTaskStatus.FAILED, prompt, null, tierUsed, attemptCount, durationMs, reason);
    }

    public SubTask withResult(String output) {
        return new SubTask(id, instruction, requiredCapabilities, dependsOn,
                status, prompt, output, tierUsed, attemptCount, durationMs, error);
    }

    public boolean isCompleted() {
        return status == SubTaskStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == SubTaskStatus.FAILED;
    }
}
