package org.carma.bilateral.safety;

/**
 * Thrown when an environment breaks its contract for a round: the round
 * index is outside the horizon, a valuation or bound is not finite, or the
 * lower bound exceeds the upper bound.
 */
public class EnvironmentContractViolationException extends IllegalStateException {

    private final int round;

    public EnvironmentContractViolationException(int round, String message) {
        super("Round " + round + ": " + message);
        this.round = round;
    }

    public int getRound() {
        return round;
    }
}
