package com.lidm.dispatch.api;

import com.lidm.core.engine.DelegationManager;
import com.lidm.core.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for answering queries synchronously.
 */
@RestController
@RequestMapping("/api/v1/query")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private final DelegationManager delegationManager;

    public QueryController(DelegationManager delegationManager) {
        this.delegationManager = delegationManager;
    }

    /**
     * POST /api/v1/query: Answer a query.
     * Returns 200 with the answer, 400 for a blank query, 503 when no answer could be produced.
     */
    @PostMapping
    public ResponseEntity<?> query(@RequestBody QueryRequest request) {
        if (request == null || request.query() == null || request.query().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "query is required"));
        }
        String queryId = request.queryId() != null && !request.queryId().isBlank()
                ? request.queryId()
                : delegationManager.generateQueryId();
        log.info("Received query {} via API", queryId);

        QueryResult result = delegationManager.handleQuery(queryId, request.query());
        QueryResponse body = QueryResponse.from(result);
        return result.succeeded() ? ResponseEntity.ok(body) : ResponseEntity.status(503).body(body);
    }
}
