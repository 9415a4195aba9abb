package com.lidm.core.scheduler;

import com.lidm.core.backend.BackendHandle;
import com.lidm.core.backend.DispatchRequest;
import com.lidm.core.backend.DispatchResult;
import com.lidm.core.backend.GuardedDispatcher;
import com.lidm.core.events.EventBus;
import com.lidm.core.events.LidmEvent;
import com.lidm.core.logging.MdcContext;
import com.lidm.core.metrics.LidmMetrics;
import com.lidm.core.model.DispatchOutcome;
import com.lidm.core.model.ExecutionTrace;
import com.lidm.core.model.SubTask;
import com.lidm.core.model.SubTaskStatus;
import com.lidm.core.model.TaskDecomposition;
import com.lidm.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;

/**
 * Runs the subtasks of a decomposition as soon as their dependencies complete.
 * <p>
 * A single coordinator (the calling thread) owns every status change: it
 * computes the ready set, hands attempts to the shared executor, and applies
 * their results one at a time as they finish. At most {@code maxInFlight}
 * attempts run at once. A failed attempt is retried on the next tier of the
 * fallback chain until {@code maxAttempts} is reached; subtasks that depend on
 * a failed subtask fail without being dispatched.
 */
public class SubtaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(SubtaskScheduler.class);

    private final GuardedDispatcher dispatcher;
    private final CapabilityTierResolver tierResolver;
    private final ExecutorService executor;
    private final SchedulerSettings settings;
    private final EventBus eventBus;
    private final LidmMetrics metrics;

    public SubtaskScheduler(GuardedDispatcher dispatcher, CapabilityTierResolver tierResolver,
                            ExecutorService executor, SchedulerSettings settings,
                            EventBus eventBus, LidmMetrics metrics) {
        this.dispatcher = dispatcher;
        this.tierResolver = tierResolver;
        this.executor = executor;
        this.settings = settings;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public CapabilityTierResolver tierResolver() {
        return tierResolver;
    }

    /**
     * Executes every subtask to a terminal status.
     *
     * @return the decomposition with updated subtasks, in their original order
     * @throws InvalidDecompositionException if the dependency graph is invalid or cyclic;
     *                                       nothing is dispatched in that case
     */
    public TaskDecomposition execute(String queryId, TaskDecomposition decomposition, ExecutionTrace trace) {
        List<String> order = DependencyGraph.topologicalOrder(decomposition.subtasks());
        Map<String, SubTask> current = new LinkedHashMap<>();
        for (String id : order) {
            current.put(id, decomposition.subtask(id).orElseThrow());
        }
        log.info("Executing {} subtask(s) in order {} (max in flight {})",
                order.size(), order, settings.maxInFlight());

        CompletionService<AttemptResult> completion = new ExecutorCompletionService<>(executor);
        int inFlight = 0;
        try {
            while (true) {
                failBlockedDependents(queryId, current);
                List<String> ready = computeReadySet(new ArrayList<>(current.values()));
                int slots = settings.maxInFlight() - inFlight;
                for (int i = 0; i < ready.size(); i++) {
                    SubTask subtask = current.get(ready.get(i));
                    if (i >= slots) {
                        current.put(subtask.id(), subtask.withStatus(SubTaskStatus.READY));
                        continue;
                    }
                    Tier tier = tierForAttempt(subtask);
                    SubTask running = subtask.running(buildPrompt(subtask, current));
                    current.put(running.id(), running);
                    completion.submit(MdcContext.propagate(() -> attempt(queryId, running, tier, trace)));
                    inFlight++;
                }
                if (inFlight == 0) {
                    break;
                }
                AttemptResult finished = completion.take().get();
                inFlight--;
                apply(queryId, current, finished);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while executing subtasks; failing unfinished subtasks");
            current.replaceAll((id, s) -> s.status().isTerminal() ? s : s.failed("interrupted"));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Subtask attempt crashed", e.getCause());
        }

        var updated = decomposition.subtasks().stream()
                .map(s -> current.get(s.id()))
                .toList();
        long completedCount = updated.stream().filter(SubTask::isCompleted).count();
        log.info("Subtasks finished: {} completed, {} failed", completedCount, updated.size() - completedCount);
        return decomposition.withSubtasks(updated);
    }

    /**
     * Ids of subtasks that are waiting (PENDING or READY) and whose dependencies
     * have all completed, in the order given.
     */
    public List<String> computeReadySet(List<SubTask> subtasks) {
        Map<String, SubTask> byId = new LinkedHashMap<>();
        subtasks.forEach(s -> byId.put(s.id(), s));
        var ready = new ArrayList<String>();
        for (SubTask subtask : subtasks) {
            if (subtask.status() != SubTaskStatus.PENDING && subtask.status() != SubTaskStatus.READY) {
                continue;
            }
            boolean satisfied = subtask.dependsOn().stream()
                    .allMatch(dep -> byId.containsKey(dep) && byId.get(dep).isCompleted());
            if (satisfied) {
                ready.add(subtask.id());
            } else {
                log.debug("  {} waiting on {}", subtask.id(), subtask.dependsOn());
            }
        }
        return ready;
    }

    /**
     * Dependency results, in execution order, followed by the subtask's own instruction.
     */
    String buildPrompt(SubTask subtask, Map<String, SubTask> inOrder) {
        if (subtask.dependsOn().isEmpty()) {
            return subtask.instruction();
        }
        var prompt = new StringBuilder();
        for (SubTask candidate : inOrder.values()) {
            if (subtask.dependsOn().contains(candidate.id()) && candidate.isCompleted()) {
                prompt.append("[Result of ").append(candidate.id()).append("]: ")
                        .append(candidate.result()).append("\n\n");
            }
        }
        return prompt.append(subtask.instruction()).toString();
    }

    /**
     * First attempt targets the tier resolved from capabilities; each retry moves
     * one step further along that tier's fallback chain.
     */
    Tier tierForAttempt(SubTask subtask) {
        Tier resolved = tierResolver.resolve(subtask.requiredCapabilities());
        List<BackendHandle> chain = dispatcher.pool().fallbackChain(resolved);
        if (chain.isEmpty()) {
            return resolved;
        }
        return chain.get(Math.min(subtask.attemptCount(), chain.size() - 1)).tier();
    }

    private AttemptResult attempt(String queryId, SubTask subtask, Tier tier, ExecutionTrace trace) {
        MdcContext.setSubtask(queryId, subtask.id(), tier.key());
        log.info("Dispatching subtask {} (attempt {}/{}) to {}", subtask.id(),
                subtask.attemptCount(), settings.maxAttempts(), tier);
        var request = new DispatchRequest(tier, subtask.prompt(), settings.options(), "execute", subtask.id());
        return new AttemptResult(subtask.id(), dispatcher.generate(request, trace));
    }

    private void apply(String queryId, Map<String, SubTask> current, AttemptResult finished) {
        SubTask subtask = current.get(finished.subtaskId());
        DispatchResult<String> result = finished.result();
        if (result.succeeded()) {
            SubTask done = subtask.completed(result.value(), result.tier(), result.latencyMs());
            current.put(done.id(), done);
            log.info("Subtask {} completed on {} in {}ms", done.id(), result.tier(), result.latencyMs());
            publish("subtask.completed", queryId, done, Map.of(
                    "tier", result.tier().key(),
                    "attempts", done.attemptCount(),
                    "durationMs", result.latencyMs()));
            recordResult(done);
            return;
        }

        boolean exhausted = subtask.attemptCount() >= settings.maxAttempts();
        boolean nothingLeft = result.outcome() == DispatchOutcome.UNAVAILABLE && !dispatcher.pool().hasLiveBackend();
        String reason = result.outcome() + ": " + result.error();
        if (exhausted || nothingLeft) {
            SubTask failed = subtask.failed(reason);
            current.put(failed.id(), failed);
            log.warn("Subtask {} failed after {} attempt(s): {}", failed.id(), failed.attemptCount(), reason);
            publish("subtask.failed", queryId, failed, Map.of(
                    "attempts", failed.attemptCount(),
                    "error", reason));
            recordResult(failed);
        } else {
            current.put(subtask.id(), subtask.retrying(reason));
            log.info("Subtask {} attempt {} failed ({}), retrying", subtask.id(), subtask.attemptCount(), reason);
        }
    }

    private void failBlockedDependents(String queryId, Map<String, SubTask> current) {
        for (SubTask subtask : current.values()) {
            if (subtask.status().isTerminal() || subtask.status() == SubTaskStatus.RUNNING) {
                continue;
            }
            subtask.dependsOn().stream()
                    .filter(dep -> current.get(dep).isFailed())
                    .findFirst()
                    .ifPresent(dep -> {
                        SubTask failed = subtask.failed("dependency " + dep + " failed");
                        current.put(failed.id(), failed);
                        log.warn("Subtask {} skipped: dependency {} failed", failed.id(), dep);
                        publish("subtask.failed", queryId, failed, Map.of("error", failed.error()));
                        recordResult(failed);
                    });
        }
    }

    private void publish(String eventType, String queryId, SubTask subtask, Map<String, Object> payload) {
        if (eventBus != null && queryId != null) {
            eventBus.publish(LidmEvent.of(eventType, queryId, subtask.id(), payload));
        }
    }

    private void recordResult(SubTask subtask) {
        if (metrics != null) {
            metrics.recordSubtaskResult(subtask.isCompleted(), subtask.attemptCount());
        }
    }

    private record AttemptResult(String subtaskId, DispatchResult<String> result) {}
}
