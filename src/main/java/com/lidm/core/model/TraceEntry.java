package com.lidm.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One backend interaction (or refusal to interact) recorded while answering a query.
 *
 * @param phase     pipeline phase: classify, decompose, execute, aggregate or verify
 * @param subtaskId subtask this call served, null for query-level calls
 * @param tier      tier the attempt targeted, null when no backend was available
 * @param backend   backend name, null when no backend was available
 * @param latencyMs time spent on the attempt
 * @param outcome   what happened
 * @param detail    error message or rejection reason
 * @param timestamp when the attempt finished
 */
public record TraceEntry(
    String phase,
    String subtaskId,
    Tier tier,
    String backend,
    long latencyMs,
    DispatchOutcome outcome,
    String detail,
    Instant timestamp
) implements Serializable {}
