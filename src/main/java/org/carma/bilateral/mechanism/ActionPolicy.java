package org.carma.bilateral.mechanism;

import org.carma.bilateral.environment.Environment;
import org.carma.bilateral.model.Expert;
import org.carma.bilateral.model.PriceBounds;

/**
 * Decides which price pair a mechanism actually posts for a round and how
 * the learners must account for that choice.
 *
 * The unconstrained mechanism posts the learner's action unchanged; the
 * constrained one rescales actions that fall outside the round's bounds.
 */
public interface ActionPolicy {

    /**
     * How learners are updated after a decision.
     */
    enum UpdateMode {
        /** Experts are evaluated at their raw prices. */
        DIRECT,
        /** Experts are evaluated after the same rescaling as the posted action. */
        RESCALED
    }

    /**
     * Posted action plus the update mode; {@code bounds} is set only for
     * {@link UpdateMode#RESCALED}.
     */
    record Decision(Expert action, UpdateMode updateMode, PriceBounds bounds) {

        public static Decision direct(Expert action) {
            return new Decision(action, UpdateMode.DIRECT, null);
        }

        public static Decision rescaled(Expert action, PriceBounds bounds) {
            return new Decision(action, UpdateMode.RESCALED, bounds);
        }

        public boolean isRescaled() {
            return updateMode == UpdateMode.RESCALED;
        }
    }

    Decision decide(Expert rawAction, int round, Environment environment);

    /**
     * Posts every action as proposed.
     */
    static ActionPolicy unconstrained() {
        return (rawAction, round, environment) -> Decision.direct(rawAction);
    }
}
