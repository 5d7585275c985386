package org.carma.bilateral.event;

import org.carma.bilateral.model.Expert;
import org.carma.bilateral.model.Phase;
import org.carma.bilateral.model.PriceBounds;
import org.carma.bilateral.model.RoundOutcome;

import java.time.Instant;

/**
 * Base interface for all mechanism events.
 * Events provide an audit trail of a run and feed the metrics collector.
 */
public sealed interface Event permits
        Event.RoundCompletedEvent,
        Event.ActionRescaledEvent,
        Event.PhaseTransitionEvent,
        Event.RunCompletedEvent {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * A round finished its full update sequence.
     */
    record RoundCompletedEvent(
            Instant timestamp,
            RoundOutcome outcome
    ) implements Event {
        public String eventType() { return "ROUND_COMPLETED"; }
    }

    /**
     * The learner's action violated the round's bounds and was rescaled.
     */
    record ActionRescaledEvent(
            Instant timestamp,
            int round,
            Expert rawAction,
            Expert rescaledAction,
            PriceBounds bounds
    ) implements Event {
        public String eventType() { return "ACTION_RESCALED"; }
    }

    /**
     * The mechanism moved from one phase to the next.
     */
    record PhaseTransitionEvent(
            Instant timestamp,
            int round,
            Phase from,
            Phase to,
            double budget
    ) implements Event {
        public String eventType() { return "PHASE_TRANSITION"; }
    }

    /**
     * All rounds of a run have been played.
     */
    record RunCompletedEvent(
            Instant timestamp,
            int rounds,
            Phase finalPhase,
            double budget,
            double gft
    ) implements Event {
        public String eventType() { return "RUN_COMPLETED"; }
    }
}
