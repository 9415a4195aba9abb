package com.lidm.core.nodes;

import com.lidm.core.model.Classification;
import com.lidm.core.model.QueryStatus;
import com.lidm.core.model.TaskDecomposition;
import com.lidm.core.state.DelegationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Wraps a simple query into a single-subtask decomposition so it takes the
 * same execution path as decomposed queries.
 */
@Component
public class RouteDirectNode {

    private static final Logger log = LoggerFactory.getLogger(RouteDirectNode.class);

    public Map<String, Object> apply(DelegationState state) {
        Classification classification = state.classification().orElseGet(Classification::defaults);
        log.info("Routing query directly (complexity {})", String.format("%.2f", classification.complexity()));
        return Map.of(
                "decomposition", TaskDecomposition.direct(state.query(), classification),
                "status", QueryStatus.DIRECT.name());
    }
}
