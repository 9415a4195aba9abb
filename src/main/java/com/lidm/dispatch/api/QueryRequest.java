package com.lidm.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/query.
 *
 * @param query   natural-language query
 * @param queryId caller-chosen id; nullable, generated when absent
 */
public record QueryRequest(
    String query,
    @JsonProperty("query_id") String queryId
) {}
