package com.basketgov.execution;

import com.basketgov.timeline.TimelineOrigin;

/**
 * Who is applying a batch, and where.
 */
public record ExecutionScope(
    String basketId,
    String workspaceId,
    String proposalId,
    String actorId,
    TimelineOrigin origin
) {
}
