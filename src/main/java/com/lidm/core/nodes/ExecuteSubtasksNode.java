package com.lidm.core.nodes;

import com.lidm.core.model.Classification;
import com.lidm.core.model.ExecutionTrace;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.model.TaskDecomposition;
import com.lidm.core.scheduler.InvalidDecompositionException;
import com.lidm.core.scheduler.SubtaskScheduler;
import com.lidm.core.state.DelegationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every subtask of the decomposition through the {@link SubtaskScheduler}.
 * An unschedulable decomposition is downgraded to a single subtask.
 */
@Component
public class ExecuteSubtasksNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteSubtasksNode.class);

    private final SubtaskScheduler scheduler;

    public ExecuteSubtasksNode(SubtaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Map<String, Object> apply(DelegationState state) {
        var trace = new ExecutionTrace();
        var errors = new ArrayList<String>();
        Classification classification = state.classification().orElseGet(Classification::defaults);
        TaskDecomposition decomposition = state.decomposition()
                .orElseGet(() -> TaskDecomposition.direct(state.query(), classification));

        TaskDecomposition executed;
        try {
            executed = scheduler.execute(state.queryId(), decomposition, trace);
        } catch (InvalidDecompositionException e) {
            log.warn("Decomposition rejected by scheduler, running the query as one subtask: {}", e.getMessage());
            errors.add("Decomposition fell back to direct execution: " + e.getMessage());
            executed = scheduler.execute(state.queryId(),
                    TaskDecomposition.direct(state.query(), classification), trace);
        }

        executed.failed().forEach(s -> errors.add("Subtask " + s.id() + " failed: " + s.error()));

        var updates = new HashMap<String, Object>();
        updates.put("decomposition", executed);
        updates.put("status", QueryStatus.AGGREGATING.name());
        updates.put("trace", trace.entries());
        updates.put("errors", List.copyOf(errors));
        return updates;
    }
}
