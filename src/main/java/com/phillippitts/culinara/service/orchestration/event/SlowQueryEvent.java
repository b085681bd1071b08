package com.phillippitts.culinara.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when answering a query overran the soft deadline. The response is still returned.
 *
 * @param queryPreview truncated query text
 * @param elapsedMs    time spent answering
 * @param deadlineMs   configured soft deadline
 * @param at           when the query finished
 */
public record SlowQueryEvent(
        String queryPreview,
        long elapsedMs,
        long deadlineMs,
        Instant at
) {}
