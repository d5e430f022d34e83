package com.basketgov.timeline;

/**
 * Result of a best-effort timeline emission. A {@link Dropped} outcome is
 * logged by the emitter and never escalated to the caller's mutation.
 */
public sealed interface EmitOutcome {

    record Recorded(TimelineEvent event) implements EmitOutcome {}

    record Dropped(String kind, String reason) implements EmitOutcome {}

    default boolean isRecorded() {
        return this instanceof Recorded;
    }
}
