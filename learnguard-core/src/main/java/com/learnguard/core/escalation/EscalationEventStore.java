package com.learnguard.core.escalation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only escalation history with an index of unresolved events.
 */
public interface EscalationEventStore {

    void append(EscalationEvent event);

    Optional<EscalationEvent> findActive(String eventId);

    /**
     * Replaces the stored event with its resolved copy and drops it from the active index.
     */
    void markResolved(EscalationEvent resolved);

    /** Newest first; {@code limit <= 0} returns everything. */
    List<EscalationEvent> history(String userId, int limit);

    List<EscalationEvent> active();

    /** Events created within [from, to]; either bound may be null. */
    List<EscalationEvent> between(Instant from, Instant to);
}
